package com.pricelens.engine.ingest;

import com.pricelens.engine.error.EmptyInputException;
import com.pricelens.engine.error.Warn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Comma-delimited CSV reader with double-quote quoting.
 *
 * <p>Records are split on {@code \n} or {@code \r\n}; blank lines between records are dropped.
 * A quoted field may contain commas and line breaks, and {@code ""} inside quotes is a literal quote.
 * Rows are associated with the header by position: missing trailing fields become empty strings,
 * extra fields are ignored.
 *
 * <p>A record whose quote never closes before the end of input is skipped with a {@code ROW_PARSE}
 * warning and reading resumes on the physical line after the one where it started, so one bad row
 * never loses the rest of the file.
 */
@Component
public class CsvParser {
    private static final Logger log = LoggerFactory.getLogger(CsvParser.class);

    public CsvTable parse(String text) {
        if (text == null) throw new EmptyInputException();
        String[] lines = text.split("\r?\n", -1);

        int i = 0;
        while (i < lines.length && lines[i].trim().isEmpty()) i++;
        if (i >= lines.length) throw new EmptyInputException();

        List<Warn> warnings = new ArrayList<>();

        Record header = readRecord(lines, i);
        List<String> rawHeaders;
        if (header.closed) {
            rawHeaders = header.fields;
            i = header.next;
        } else {
            warnings.add(Warn.headerParse(lines[i]));
            rawHeaders = tokenizeLine(lines[i]);
            i++;
        }
        List<String> headers = new ArrayList<>(rawHeaders.size());
        for (String h : rawHeaders) headers.add(h.trim());

        List<CsvRow> rows = new ArrayList<>();
        while (i < lines.length) {
            if (lines[i].trim().isEmpty()) {
                i++;
                continue;
            }
            Record rec = readRecord(lines, i);
            if (!rec.closed) {
                log.debug("Skipping malformed CSV record at line {}", i + 1);
                warnings.add(Warn.rowParse(i + 1, lines[i]));
                i++;
                continue;
            }
            rows.add(toRow(i + 1, headers, rec.fields));
            i = rec.next;
        }

        log.debug("Parsed CSV: headers={} rows={} warnings={}", headers.size(), rows.size(), warnings.size());
        return new CsvTable(headers, rows, warnings);
    }

    private CsvRow toRow(int line, List<String> headers, List<String> fields) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int idx = 0; idx < headers.size(); idx++) {
            String v = idx < fields.size() ? fields.get(idx).trim() : "";
            // duplicate header names: first column wins
            values.putIfAbsent(headers.get(idx), v);
        }
        return new CsvRow(line, values);
    }

    /**
     * Reads one logical record starting at {@code start}, continuing onto following lines while
     * a quoted field is open.
     */
    private Record readRecord(String[] lines, int start) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        for (int j = start; j < lines.length; j++) {
            String line = lines[j];
            int k = 0;
            while (k < line.length()) {
                char c = line.charAt(k);
                if (c == '"') {
                    if (inQuotes && k + 1 < line.length() && line.charAt(k + 1) == '"') {
                        current.append('"');
                        k += 2;
                        continue;
                    }
                    inQuotes = !inQuotes;
                } else if (c == ',' && !inQuotes) {
                    fields.add(current.toString());
                    current.setLength(0);
                } else {
                    current.append(c);
                }
                k++;
            }
            if (!inQuotes) {
                fields.add(current.toString());
                return new Record(fields, j + 1, true);
            }
            current.append('\n');
        }
        return new Record(fields, lines.length, false);
    }

    /** Single-line tokenization that closes any open quote at end of line. */
    private List<String> tokenizeLine(String line) {
        return readRecord(new String[]{line + "\""}, 0).fields;
    }

    private static final class Record {
        final List<String> fields;
        final int next;
        final boolean closed;

        Record(List<String> fields, int next, boolean closed) {
            this.fields = fields;
            this.next = next;
            this.closed = closed;
        }
    }
}
