package com.pricelens.engine.ingest;

import com.pricelens.engine.error.EmptyInputException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CsvParserTest {

    private final CsvParser parser = new CsvParser();

    @Test
    public void readsHeadersAndRowsWithCrLfAndBlankLines() {
        CsvTable t = parser.parse("name,sku,price\r\n\r\nWidget,W1,10\r\n  \nGadget,G1,20\n");
        assertEquals(List.of("name", "sku", "price"), t.getHeaders());
        assertEquals(2, t.getRows().size());
        assertEquals("Widget", t.getRows().get(0).get("name").orElseThrow());
        assertEquals("20", t.getRows().get(1).get("price").orElseThrow());
        assertTrue(t.getWarnings().isEmpty());
    }

    @Test
    public void quotedFieldsKeepCommasEscapedQuotesAndNewlines() {
        String csv = "name,sku,price\n"
                + "\"Cable, 2m \"\"braided\"\"\",C2,9.99\n"
                + "\"Lamp\nwith shade\",L1,30\n";
        CsvTable t = parser.parse(csv);
        assertEquals(2, t.getRows().size());
        assertEquals("Cable, 2m \"braided\"", t.getRows().get(0).get("name").orElseThrow());
        assertEquals("Lamp\nwith shade", t.getRows().get(1).get("name").orElseThrow());
        assertEquals("L1", t.getRows().get(1).get("sku").orElseThrow());
    }

    @Test
    public void trimsHeadersAndValuesPadsShortRowsIgnoresExtraFields() {
        CsvTable t = parser.parse(" name , sku ,price\n  Widget , W1 \nGadget,G1,20,extra,fields\n");
        assertEquals(List.of("name", "sku", "price"), t.getHeaders());
        CsvRow first = t.getRows().get(0);
        assertEquals("Widget", first.get("name").orElseThrow());
        assertEquals("W1", first.get("sku").orElseThrow());
        assertEquals("", first.get("price").orElseThrow());
        assertTrue(first.nonBlank("price").isEmpty());
        assertTrue(first.get("cost").isEmpty(), "unknown header is absent, not empty");
        assertEquals(3, t.getRows().get(1).asMap().size());
    }

    @Test
    public void unbalancedQuoteSkipsOnlyThatRow() {
        String csv = "name,sku,price\n"
                + "Widget,W1,10\n"
                + "\"Broken,W2,20\n"
                + "Gadget,G1,30\n";
        CsvTable t = parser.parse(csv);

        assertEquals(2, t.getRows().size());
        assertEquals("Widget", t.getRows().get(0).get("name").orElseThrow());
        assertEquals("Gadget", t.getRows().get(1).get("name").orElseThrow());
        assertEquals(4, t.getRows().get(1).getLine());
        assertEquals(1, t.getWarnings().size());
        assertEquals("ROW_PARSE", t.getWarnings().get(0).getCode());
        assertEquals("line 3", t.getWarnings().get(0).getRef());
    }

    @Test
    public void emptyInputIsRejected() {
        assertThrows(EmptyInputException.class, () -> parser.parse(""));
        assertThrows(EmptyInputException.class, () -> parser.parse("\n\r\n   \n"));
        assertThrows(EmptyInputException.class, () -> parser.parse(null));
    }

    @Test
    public void headerOnlyFileHasNoRows() {
        CsvTable t = parser.parse("name,sku,price\n");
        assertEquals(3, t.getHeaders().size());
        assertTrue(t.getRows().isEmpty());
    }
}
