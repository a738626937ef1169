package com.pricelens.engine.dto;

import com.pricelens.engine.error.Warn;

import java.util.List;
import java.util.Map;

public class ImportDtos {

    /** Result of column auto-mapping for a header line, before any rows are read. */
    public static class AutoMapResponse {
        private Map<String, String> mapping; // field -> header
        private boolean valid;
        private List<String> missing; // required fields without a column

        public Map<String, String> getMapping() { return mapping; }
        public void setMapping(Map<String, String> mapping) { this.mapping = mapping; }
        public boolean isValid() { return valid; }
        public void setValid(boolean valid) { this.valid = valid; }
        public List<String> getMissing() { return missing; }
        public void setMissing(List<String> missing) { this.missing = missing; }
    }

    /** Report returned by a CSV catalog import */
    public static class ImportReport {
        private String store_id;
        private int rows_total; // data rows that tokenized, plus rows skipped as malformed
        private int imported; // products written to the catalog
        private int skipped; // rows not imported for any reason
        private Map<String, String> mapping; // effective field -> header mapping
        private int warnings_total;
        private List<Warn> warnings; // first N warnings, N = app.run.warning-sample-size

        public String getStore_id() { return store_id; }
        public void setStore_id(String store_id) { this.store_id = store_id; }
        public int getRows_total() { return rows_total; }
        public void setRows_total(int rows_total) { this.rows_total = rows_total; }
        public int getImported() { return imported; }
        public void setImported(int imported) { this.imported = imported; }
        public int getSkipped() { return skipped; }
        public void setSkipped(int skipped) { this.skipped = skipped; }
        public Map<String, String> getMapping() { return mapping; }
        public void setMapping(Map<String, String> mapping) { this.mapping = mapping; }
        public int getWarnings_total() { return warnings_total; }
        public void setWarnings_total(int warnings_total) { this.warnings_total = warnings_total; }
        public List<Warn> getWarnings() { return warnings; }
        public void setWarnings(List<Warn> warnings) { this.warnings = warnings; }
    }
}
