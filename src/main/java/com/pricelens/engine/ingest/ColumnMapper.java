package com.pricelens.engine.ingest;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps arbitrary CSV headers onto catalog fields.
 *
 * <p>Two passes over the fields in {@link CatalogField} order:
 * <ol>
 *   <li>exact: the first alias equal to a header (case-insensitive, trimmed) wins the field</li>
 *   <li>substring, for fields still unmapped: the first alias contained in a header, or containing it</li>
 * </ol>
 * A header is claimed by at most one field; the first claim wins and is never revisited.
 */
@Component
public class ColumnMapper {

    public ColumnMapping autoMap(List<String> headers) {
        List<String> normalized = new ArrayList<>(headers.size());
        for (String h : headers) {
            normalized.add(h == null ? "" : h.trim().toLowerCase(Locale.ROOT));
        }
        Map<CatalogField, String> mapping = new EnumMap<>(CatalogField.class);
        Set<Integer> claimed = new HashSet<>();

        for (CatalogField field : CatalogField.values()) {
            for (String alias : field.aliases()) {
                int idx = findUnclaimed(normalized, claimed, h -> h.equals(alias));
                if (idx >= 0) {
                    claim(mapping, claimed, field, headers.get(idx), idx);
                    break;
                }
            }
        }

        for (CatalogField field : CatalogField.values()) {
            if (mapping.containsKey(field)) continue;
            for (String alias : field.aliases()) {
                int idx = findUnclaimed(normalized, claimed, h -> h.contains(alias) || alias.contains(h));
                if (idx >= 0) {
                    claim(mapping, claimed, field, headers.get(idx), idx);
                    break;
                }
            }
        }
        return new ColumnMapping(mapping);
    }

    public MappingValidation validate(ColumnMapping mapping) {
        List<String> missing = new ArrayList<>();
        for (CatalogField field : CatalogField.values()) {
            if (field.isRequired() && mapping.get(field).isEmpty()) {
                missing.add(field.key());
            }
        }
        return new MappingValidation(missing.isEmpty(), missing);
    }

    private static int findUnclaimed(List<String> normalized, Set<Integer> claimed,
                                     java.util.function.Predicate<String> test) {
        for (int i = 0; i < normalized.size(); i++) {
            String h = normalized.get(i);
            if (h.isEmpty() || claimed.contains(i)) continue;
            if (test.test(h)) return i;
        }
        return -1;
    }

    private static void claim(Map<CatalogField, String> mapping, Set<Integer> claimed,
                              CatalogField field, String header, int idx) {
        mapping.put(field, header.trim());
        claimed.add(idx);
    }
}
