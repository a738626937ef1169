package com.pricelens.engine.service;

import com.pricelens.engine.dto.ListingDtos;
import com.pricelens.engine.error.NotFoundException;
import com.pricelens.engine.model.Product;
import com.pricelens.engine.model.RawListing;
import com.pricelens.engine.model.UrlCompetitor;
import com.pricelens.engine.repository.InMemoryCatalogRepository;
import com.pricelens.engine.repository.InMemoryListingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ListingIntakeServiceTest {

    private InMemoryListingRepository listings;
    private ListingIntakeService service;

    @BeforeEach
    public void setUp() {
        listings = new InMemoryListingRepository();
        InMemoryCatalogRepository catalog = new InMemoryCatalogRepository();
        catalog.saveAll("s1", List.of(new Product("p1", "Desk Lamp", "L-1", 100.0, "USD", null)));
        service = new ListingIntakeService(listings, catalog);
    }

    @Test
    public void snapshotDropsUnusableListings() {
        List<RawListing> snapshot = Arrays.asList(
                new RawListing("shop-a", "a1", "https://shop-a.example/a1", "Desk Lamp", 90.0, "USD"),
                new RawListing("shop-a", null, "https://shop-a.example/a2", "Desk Lamp XL", 95.0, "USD"),
                new RawListing("shop-a", "a3", null, " ", 10.0, "USD"),
                new RawListing(null, "a4", null, "Desk Lamp", 10.0, "USD"),
                null);

        ListingDtos.ListingSnapshotResponse resp = service.replaceListings("s1", snapshot);

        assertEquals(2, resp.getAccepted());
        assertEquals(3, resp.getDropped());
        assertEquals("shop-a:https://shop-a.example/a2", listings.findListings("s1").get(1).getRef().key());
    }

    @Test
    public void snapshotReplacesPreviousOne() {
        service.replaceListings("s1", List.of(new RawListing("shop-a", "a1", null, "Desk Lamp", 90.0, "USD")));
        service.replaceListings("s1", List.of(new RawListing("shop-b", "b1", null, "Desk Lamp", 85.0, "USD")));
        assertEquals(1, listings.findListings("s1").size());
        assertEquals("shop-b", listings.findListings("s1").get(0).getCompetitorStoreId());
    }

    @Test
    public void urlCompetitorIsAttachedToKnownProduct() {
        ListingDtos.UrlCompetitorRequest req = new ListingDtos.UrlCompetitorRequest();
        req.setProduct_id("p1");
        req.setCompetitor_name("Corner Shop");
        req.setUrl(" https://corner.example/lamp ");
        req.setLast_price(88.0);
        req.setCurrency("usd");

        UrlCompetitor saved = service.attachUrlCompetitor("s1", req);
        assertEquals("https://corner.example/lamp", saved.getUrl());
        assertEquals("USD", saved.getCurrency());

        req.setLast_price(86.0);
        service.attachUrlCompetitor("s1", req);
        List<UrlCompetitor> stored = listings.findUrlCompetitors("s1");
        assertEquals(1, stored.size());
        assertEquals(86.0, stored.get(0).getLastPrice());
    }

    @Test
    public void urlCompetitorForForeignProductIsRejected() {
        ListingDtos.UrlCompetitorRequest req = new ListingDtos.UrlCompetitorRequest();
        req.setProduct_id("p1");
        req.setUrl("https://corner.example/lamp");
        req.setLast_price(88.0);
        assertThrows(NotFoundException.class, () -> service.attachUrlCompetitor("s2", req));
    }
}
