package com.pricelens.engine.ingest;

import com.pricelens.engine.error.Warn;

import java.util.List;

/**
 * Parsed CSV: ordered headers, the rows that tokenized cleanly, and warnings for the rows that did not.
 */
public final class CsvTable {
    private final List<String> headers;
    private final List<CsvRow> rows;
    private final List<Warn> warnings;

    public CsvTable(List<String> headers, List<CsvRow> rows, List<Warn> warnings) {
        this.headers = List.copyOf(headers);
        this.rows = List.copyOf(rows);
        this.warnings = List.copyOf(warnings);
    }

    public List<String> getHeaders() { return headers; }
    public List<CsvRow> getRows() { return rows; }
    public List<Warn> getWarnings() { return warnings; }
}
