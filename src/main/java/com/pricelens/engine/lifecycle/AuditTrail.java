package com.pricelens.engine.lifecycle;

import com.pricelens.engine.model.AuditEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only log of lifecycle actions that bypass the normal transitions (resets and manual
 * matches), written to the application log at WARN with an {@code AUDIT} prefix, and of prices
 * sent to the catalog, logged at INFO.
 */
@Component
public class AuditTrail {
    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    private final Map<String, List<AuditEntry>> byStore = new ConcurrentHashMap<>();

    public AuditEntry record(String storeId, String recordType, String recordId, String action,
                             String fromStatus, String toStatus, String actor) {
        AuditEntry entry = new AuditEntry(Instant.now(), storeId, recordType, recordId, action, fromStatus, toStatus, actor,
                null, null, null);
        append(entry);
        log.warn("AUDIT {} {} {} in store {}: {} -> {} by {}",
                action, recordType, recordId, storeId, fromStatus, toStatus, actor);
        return entry;
    }

    /** Records a price written to the catalog on behalf of a recommendation. */
    public AuditEntry recordPriceUpdate(String storeId, String recommendationId, String productId,
                                        Double oldPrice, double newPrice, String actor) {
        AuditEntry entry = new AuditEntry(Instant.now(), storeId, "recommendation", recommendationId, "price_updated",
                null, null, actor, productId, oldPrice, newPrice);
        append(entry);
        log.info("AUDIT price_updated product {} in store {}: {} -> {} by {} (recommendation {})",
                productId, storeId, oldPrice, newPrice, actor, recommendationId);
        return entry;
    }

    private void append(AuditEntry entry) {
        byStore.computeIfAbsent(entry.storeId(), k -> Collections.synchronizedList(new ArrayList<>())).add(entry);
    }

    /** Entries of a store, oldest first. */
    public List<AuditEntry> forStore(String storeId) {
        List<AuditEntry> entries = byStore.get(storeId);
        if (entries == null) return List.of();
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }
}
