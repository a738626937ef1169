package com.pricelens.engine.ingest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One data row of a CSV file, keyed by header.
 *
 * <p>A header that is not part of the file is absent ({@link Optional#empty()}); a header that
 * is part of the file but has no value in this row maps to the empty string. Callers never see
 * {@code null}.
 */
public final class CsvRow {
    private final int line;
    private final Map<String, String> values;

    public CsvRow(int line, Map<String, String> values) {
        this.line = line;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** 1-based physical line where the record starts. */
    public int getLine() {
        return line;
    }

    public Optional<String> get(String header) {
        if (header == null) return Optional.empty();
        return Optional.ofNullable(values.get(header));
    }

    /** Same as {@link #get(String)} but treats blank values as absent. */
    public Optional<String> nonBlank(String header) {
        return get(header).filter(v -> !v.isBlank());
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "CsvRow{line=" + line + ", values=" + values + "}";
    }
}
