package com.pricelens.engine.repository;

import com.pricelens.engine.model.RawListing;
import com.pricelens.engine.model.UrlCompetitor;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryListingRepository implements ListingRepository {
    private final Map<String, List<RawListing>> listings = new ConcurrentHashMap<>();
    private final Map<String, List<UrlCompetitor>> urlCompetitors = new ConcurrentHashMap<>();

    @Override
    public void replaceListings(String storeId, List<RawListing> snapshot) {
        listings.put(storeId, List.copyOf(snapshot));
    }

    @Override
    public List<RawListing> findListings(String storeId) {
        return listings.getOrDefault(storeId, List.of());
    }

    @Override
    public void saveUrlCompetitor(String storeId, UrlCompetitor competitor) {
        urlCompetitors.compute(storeId, (k, current) -> {
            List<UrlCompetitor> next = current == null ? new ArrayList<>() : new ArrayList<>(current);
            for (int i = 0; i < next.size(); i++) {
                UrlCompetitor c = next.get(i);
                if (c.getProductId().equals(competitor.getProductId()) && c.getUrl().equals(competitor.getUrl())) {
                    next.set(i, competitor);
                    return next;
                }
            }
            next.add(competitor);
            return next;
        });
    }

    @Override
    public List<UrlCompetitor> findUrlCompetitors(String storeId) {
        return List.copyOf(urlCompetitors.getOrDefault(storeId, List.of()));
    }
}
