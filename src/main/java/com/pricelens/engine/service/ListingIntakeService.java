package com.pricelens.engine.service;

import com.pricelens.engine.dto.ListingDtos;
import com.pricelens.engine.error.NotFoundException;
import com.pricelens.engine.model.ListingRef;
import com.pricelens.engine.model.RawListing;
import com.pricelens.engine.model.UrlCompetitor;
import com.pricelens.engine.repository.CatalogRepository;
import com.pricelens.engine.repository.ListingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Accepts scraper output for a store. Listings without a name or without an identity
 * (competitor store plus product id or url) cannot be matched and are dropped.
 */
@Service
public class ListingIntakeService {
    private static final Logger log = LoggerFactory.getLogger(ListingIntakeService.class);

    private final ListingRepository listingRepository;
    private final CatalogRepository catalogRepository;

    public ListingIntakeService(ListingRepository listingRepository, CatalogRepository catalogRepository) {
        this.listingRepository = listingRepository;
        this.catalogRepository = catalogRepository;
    }

    public ListingDtos.ListingSnapshotResponse replaceListings(String storeId, List<RawListing> listings) {
        List<RawListing> accepted = new ArrayList<>();
        for (RawListing l : listings) {
            if (l == null || isBlank(l.getName()) || isBlank(l.getCompetitorStoreId())) continue;
            ListingRef ref = l.getRef();
            if (ref.competitorProductId().isBlank()) continue;
            accepted.add(l);
        }
        listingRepository.replaceListings(storeId, accepted);

        ListingDtos.ListingSnapshotResponse resp = new ListingDtos.ListingSnapshotResponse();
        resp.setStore_id(storeId);
        resp.setAccepted(accepted.size());
        resp.setDropped(listings.size() - accepted.size());
        log.info("Listing snapshot stored: store={} accepted={} dropped={}", storeId, resp.getAccepted(), resp.getDropped());
        return resp;
    }

    public UrlCompetitor attachUrlCompetitor(String storeId, ListingDtos.UrlCompetitorRequest request) {
        catalogRepository.findById(request.getProduct_id())
                .filter(p -> storeId.equals(p.getStoreId()))
                .orElseThrow(() -> new NotFoundException("product", request.getProduct_id()));
        String currency = request.getCurrency() != null ? request.getCurrency().trim().toUpperCase(Locale.ROOT) : null;
        UrlCompetitor competitor = new UrlCompetitor(request.getProduct_id(), request.getCompetitor_name(),
                request.getUrl().trim(), request.getLast_price(), currency);
        listingRepository.saveUrlCompetitor(storeId, competitor);
        log.info("URL competitor attached: store={} product={} url={} price={}",
                storeId, competitor.getProductId(), competitor.getUrl(), competitor.getLastPrice());
        return competitor;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
