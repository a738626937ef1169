package com.pricelens.engine.matching;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TitleSimilarityTest {

    @Test
    public void identicalCanonicalNamesScoreOne() {
        assertEquals(1.0, TitleSimilarity.of("USB-C Cable", "usb c cable"));
        assertEquals(1.0, TitleSimilarity.of("Café Noir", "CAFE   NOIR!"));
    }

    @Test
    public void tokenOrderDoesNotMatter() {
        assertEquals(1.0, TitleSimilarity.of("cable usb c", "usb c cable"));
    }

    @Test
    public void jaccardOfTokenSets() {
        // {whey, protein, 2kg} vs {whey, protein, 1kg}: 2 shared of 4 distinct
        assertEquals(0.5, TitleSimilarity.of("Whey Protein 2kg", "whey protein 1kg"), 1e-9);
        assertEquals(0.0, TitleSimilarity.of("Lamp", "Kettle"));
    }

    @Test
    public void blankNamesNeverMatch() {
        assertEquals(0.0, TitleSimilarity.of("", ""));
        assertEquals(0.0, TitleSimilarity.of("!!!", "???"));
        assertEquals(0.0, TitleSimilarity.of(null, "Lamp"));
    }

    @Test
    public void alwaysWithinUnitInterval() {
        List<String> names = List.of("USB-C Cable", "usb c cable 2m", "Lamp", "", "a a a b", "Crème brûlée", "b");
        for (String a : names) {
            for (String b : names) {
                double s = TitleSimilarity.of(a, b);
                assertTrue(s >= 0.0 && s <= 1.0, a + " / " + b + " -> " + s);
                assertEquals(s, TitleSimilarity.of(b, a), 1e-12);
            }
        }
    }
}
