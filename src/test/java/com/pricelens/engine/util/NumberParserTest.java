package com.pricelens.engine.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NumberParserTest {

    @Test
    public void parsesPlainAndSymbolDecoratedNumbers() {
        assertEquals(19.99, NumberParser.parseDecimal("19.99"));
        assertEquals(19.99, NumberParser.parseDecimal("$19.99"));
        assertEquals(1299.90, NumberParser.parseDecimal("€ 1 299,90"), 1e-9);
        assertEquals(1299.90, NumberParser.parseDecimal("1,299.90"), 1e-9);
        assertEquals(1299.90, NumberParser.parseDecimal("1.299,90"), 1e-9);
    }

    @Test
    public void loneCommaWithThreeDigitsIsThousandsSeparator() {
        assertEquals(1299.0, NumberParser.parseDecimal("1,299"));
        assertEquals(12.5, NumberParser.parseDecimal("12,5"));
    }

    @Test
    public void returnsNullForGarbage() {
        assertNull(NumberParser.parseDecimal(null));
        assertNull(NumberParser.parseDecimal(""));
        assertNull(NumberParser.parseDecimal("n/a"));
        assertNull(NumberParser.parseDecimal("-"));
        assertNull(NumberParser.parseDecimal("1.2.3"));
    }

    @Test
    public void integersRejectFractions() {
        assertEquals(12, NumberParser.parseInteger("12"));
        assertEquals(1200, NumberParser.parseInteger("1,200"));
        assertNull(NumberParser.parseInteger("12.5"));
        assertNull(NumberParser.parseInteger("many"));
    }
}
