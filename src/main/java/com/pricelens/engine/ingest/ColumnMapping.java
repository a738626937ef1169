package com.pricelens.engine.ingest;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Which CSV header feeds which catalog field. Unmapped fields are absent.
 */
public final class ColumnMapping {
    private final Map<CatalogField, String> columns;

    public ColumnMapping(Map<CatalogField, String> columns) {
        EnumMap<CatalogField, String> copy = new EnumMap<>(CatalogField.class);
        copy.putAll(columns);
        this.columns = Collections.unmodifiableMap(copy);
    }

    public Optional<String> get(CatalogField field) {
        return Optional.ofNullable(columns.get(field));
    }

    /**
     * Returns a mapping where {@code field} reads from {@code header}; a blank header unmaps the field.
     */
    public ColumnMapping override(CatalogField field, String header) {
        EnumMap<CatalogField, String> copy = new EnumMap<>(CatalogField.class);
        copy.putAll(columns);
        if (header == null || header.isBlank()) {
            copy.remove(field);
        } else {
            copy.put(field, header);
        }
        return new ColumnMapping(copy);
    }

    public ColumnMapping withOverrides(Map<CatalogField, String> overrides) {
        ColumnMapping m = this;
        if (overrides == null) return m;
        for (Map.Entry<CatalogField, String> e : overrides.entrySet()) {
            m = m.override(e.getKey(), e.getValue());
        }
        return m;
    }

    /** Field key to header, e.g. {@code {"name": "Product Name"}}. */
    @JsonValue
    public Map<String, String> asMap() {
        Map<String, String> out = new LinkedHashMap<>();
        columns.forEach((f, h) -> out.put(f.key(), h));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnMapping other)) return false;
        return columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
