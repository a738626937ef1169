package com.pricelens.engine.ingest;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ColumnMapperTest {

    private final ColumnMapper mapper = new ColumnMapper();

    @Test
    public void mapsDisplayStyleHeaders() {
        ColumnMapping m = mapper.autoMap(List.of("Product Name", "SKU", "Price"));
        assertEquals(Map.of("name", "Product Name", "sku", "SKU", "price", "Price"), m.asMap());
        assertTrue(mapper.validate(m).valid());
    }

    @Test
    public void exactMatchesWinOverSubstrings() {
        // product_id is a sku alias too, but "sku" comes first in alias order
        ColumnMapping m = mapper.autoMap(List.of("product_id", "sku", "title", "current_price", "buy_price", "stock"));
        assertEquals("sku", m.get(CatalogField.SKU).orElseThrow());
        assertEquals("title", m.get(CatalogField.NAME).orElseThrow());
        assertEquals("current_price", m.get(CatalogField.PRICE).orElseThrow());
        assertEquals("buy_price", m.get(CatalogField.COST).orElseThrow());
        assertEquals("stock", m.get(CatalogField.INVENTORY).orElseThrow());
    }

    @Test
    public void aHeaderIsClaimedByOneFieldOnly() {
        ColumnMapping m = mapper.autoMap(List.of("name", "price"));
        assertEquals("name", m.get(CatalogField.NAME).orElseThrow());
        assertEquals("price", m.get(CatalogField.PRICE).orElseThrow());
        assertTrue(m.get(CatalogField.SKU).isEmpty());
        assertEquals(List.of("sku"), mapper.validate(m).missing());
    }

    @Test
    public void reportsAllMissingRequiredFields() {
        MappingValidation v = mapper.validate(mapper.autoMap(List.of("colour", "weight")));
        assertFalse(v.valid());
        assertEquals(List.of("name", "sku", "price"), v.missing());
    }

    @Test
    public void overridesApplyBeforeValidation() {
        ColumnMapping m = mapper.autoMap(List.of("Artikel", "Nr", "Price")).override(CatalogField.NAME, "Artikel")
                .override(CatalogField.SKU, "Nr");
        assertTrue(mapper.validate(m).valid());
        assertTrue(mapper.validate(m.override(CatalogField.SKU, " ")).missing().contains("sku"));
    }

    @Test
    public void isDeterministic() {
        List<List<String>> headerSets = List.of(
                List.of("Product Name", "SKU", "Price"),
                List.of("title", "code", "our_price", "purchase_price", "qty"),
                List.of("Name", "Name", "Price with VAT", "ID"),
                List.of("", " ", "x", "Cena"),
                List.of());
        for (List<String> headers : headerSets) {
            assertEquals(mapper.autoMap(headers), mapper.autoMap(headers));
            assertEquals(mapper.autoMap(headers).asMap(), mapper.autoMap(List.copyOf(headers)).asMap());
        }
    }
}
