package com.pricelens.engine.matching;

import com.pricelens.engine.config.AppProperties;
import com.pricelens.engine.model.ListingRef;
import com.pricelens.engine.model.Match;
import com.pricelens.engine.model.MatchStatus;
import com.pricelens.engine.model.Product;
import com.pricelens.engine.model.RawListing;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MatcherTest {

    private final Matcher matcher = new Matcher(new AppProperties());

    private static Product product(String id, String name) {
        Product p = new Product(id, name, null, 10.0, "USD", null);
        p.setStoreId("s1");
        return p;
    }

    private static RawListing listing(String cpid, String name) {
        return new RawListing("shop-a", cpid, "https://shop-a.example/" + cpid, name, 9.0, "USD");
    }

    @Test
    public void identicalCanonicalNameIsAutoMatchedWithFullConfidence() {
        MatchResult r = matcher.match("s1", List.of(product("p1", "USB-C Cable")),
                List.of(listing("l1", "usb c cable")), List.of());

        assertEquals(1, r.createdCount());
        Match m = r.matches().get(0);
        assertEquals(1.0, m.getConfidence());
        assertEquals(MatchStatus.AUTO_MATCHED, m.getStatus());
        assertEquals("p1", m.getProductId());
        assertEquals(new ListingRef("shop-a", "l1"), m.getListingRef());
        assertEquals(1L, m.getSequence());
    }

    @Test
    public void thresholdsDecideStatus() {
        List<Product> products = List.of(product("p1", "Whey Protein Vanilla 2kg"));
        List<RawListing> listings = List.of(
                listing("half", "Whey Protein Chocolate 1kg"),   // 2/6 = 0.33 -> none
                listing("review", "Whey Protein Vanilla 1kg"),   // 3/5 = 0.6  -> PENDING
                listing("auto", "whey protein vanilla 2kg"));    // 1.0        -> AUTO_MATCHED
        MatchResult r = matcher.match("s1", products, listings, List.of());

        assertEquals(2, r.createdCount());
        assertEquals(MatchStatus.PENDING, r.matches().get(0).getStatus());
        assertEquals(0.6, r.matches().get(0).getConfidence(), 1e-9);
        assertEquals("review", r.matches().get(0).getListingRef().competitorProductId());
        assertEquals(MatchStatus.AUTO_MATCHED, r.matches().get(1).getStatus());
    }

    @Test
    public void tiesGoToLowestProductId() {
        List<Product> products = List.of(product("p2", "Desk Lamp"), product("p1", "desk lamp"));
        MatchResult r = matcher.match("s1", products, List.of(listing("l1", "Desk Lamp")), List.of());
        assertEquals("p1", r.matches().get(0).getProductId());
    }

    @Test
    public void sameSkuLiftsWeakTitleToAutoMatch() {
        Product p = product("p1", "Kettle 1.7l steel");
        p.setSku("KT-17");
        RawListing l = listing("l1", "Electric kettle");
        l.setSku("kt-17");
        MatchResult r = matcher.match("s1", List.of(p), List.of(l), List.of());
        assertEquals(0.9, r.matches().get(0).getConfidence(), 1e-9);
        assertEquals(MatchStatus.AUTO_MATCHED, r.matches().get(0).getStatus());
    }

    @Test
    public void reviewedMatchesSurviveRematching() {
        Product p1 = product("p1", "Desk Lamp");
        Product p2 = product("p2", "Floor Lamp");
        RawListing l1 = listing("l1", "Desk Lamp");
        RawListing l2 = listing("l2", "Floor Lamp");
        List<Match> existing = List.of(
                new Match("m1", "s1", "p2", l1.getRef(), 0.33, MatchStatus.CONFIRMED, 1),
                new Match("m2", "s1", "p2", l2.getRef(), 1.0, MatchStatus.REJECTED, 2));

        MatchResult r = matcher.match("s1", List.of(p1, p2), List.of(l1, l2), existing);

        assertEquals(0, r.createdCount());
        assertEquals(0, r.updatedCount());
        assertEquals(2, r.preserved());
        assertEquals(MatchStatus.CONFIRMED, r.matches().get(0).getStatus());
        assertEquals("p2", r.matches().get(0).getProductId());
        assertEquals(0.33, r.matches().get(0).getConfidence());
        assertEquals(MatchStatus.REJECTED, r.matches().get(1).getStatus());
    }

    @Test
    public void unreviewedMatchesAreRescoredButKeepStatus() {
        Product p1 = product("p1", "Desk Lamp Black");
        RawListing l1 = listing("l1", "Desk Lamp Black");
        Match stale = new Match("m1", "s1", "p1", l1.getRef(), 0.5, MatchStatus.PENDING, 7);

        MatchResult r = matcher.match("s1", List.of(p1), List.of(l1, listing("l2", "desk lamp black")), List.of(stale));

        assertEquals(1, r.updatedCount());
        Match rescored = r.matches().get(0);
        assertEquals("m1", rescored.getId());
        assertEquals(1.0, rescored.getConfidence());
        assertEquals(MatchStatus.PENDING, rescored.getStatus());
        assertEquals(0.5, stale.getConfidence(), "input match is not mutated");

        Match created = r.matches().get(1);
        assertEquals(8L, created.getSequence());
        assertEquals(MatchStatus.AUTO_MATCHED, created.getStatus());
    }

    @Test
    public void isDeterministicAndBounded() {
        List<Product> products = new ArrayList<>();
        List<RawListing> listings = new ArrayList<>();
        String[] words = {"usb", "cable", "lamp", "desk", "black", "2m", "steel", "kettle"};
        for (int i = 0; i < 8; i++) {
            products.add(product("p" + i, words[i] + " " + words[(i + 1) % 8] + " " + words[(i + 3) % 8]));
            listings.add(listing("l" + i, words[(i + 1) % 8] + " " + words[i] + " " + words[(i + 5) % 8]));
        }
        MatchResult a = matcher.match("s1", products, listings, List.of());
        MatchResult b = matcher.match("s1", products, listings, List.of());

        assertEquals(a.matches().size(), b.matches().size());
        for (int i = 0; i < a.matches().size(); i++) {
            Match x = a.matches().get(i);
            Match y = b.matches().get(i);
            assertEquals(x.getId(), y.getId());
            assertEquals(x.getProductId(), y.getProductId());
            assertEquals(x.getConfidence(), y.getConfidence());
            assertTrue(x.getConfidence() >= 0.0 && x.getConfidence() <= 1.0);
        }
    }
}
