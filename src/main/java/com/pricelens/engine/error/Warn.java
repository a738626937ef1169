package com.pricelens.engine.error;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A non-fatal issue collected during an import or a pricing run.
 *
 * <p>Warnings never abort the batch. They are counted and sampled into the
 * import/run report so the caller can surface them to the merchant.
 *
 * <h3>Warning Codes</h3>
 * <ul>
 *   <li><strong>ROW_PARSE</strong> - CSV row could not be tokenized (e.g. unbalanced quote); row skipped</li>
 *   <li><strong>HEADER_PARSE</strong> - header line was malformed and parsed best-effort</li>
 *   <li><strong>MISSING_VALUE</strong> - a required value (name/sku/price) is blank; row skipped</li>
 *   <li><strong>BAD_NUMBER</strong> - a numeric cell could not be parsed</li>
 *   <li><strong>DUPLICATE_SKU</strong> - SKU repeated in one file; last row wins</li>
 *   <li><strong>CURRENCY_MISMATCH</strong> - competitor price in another currency than the product; excluded</li>
 *   <li><strong>INVALID_PRICE</strong> - product price not positive; no recommendation possible</li>
 *   <li><strong>PRODUCT_FAILED</strong> - unexpected failure while pricing one product; product skipped</li>
 * </ul>
 *
 * @see com.pricelens.engine.dto.ImportDtos.ImportReport
 * @see com.pricelens.engine.dto.RunDtos.RunReport
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Warn {
    /** Row reference ("line 7") or product id the warning is about */
    private String ref;

    /** Warning code for categorization */
    private String code;

    /** Field name if the warning is field-specific */
    private String field;

    /** Human-readable warning message */
    private String message;

    /** Offending input, truncated */
    private String evidence;

    public Warn() {}

    public Warn(String ref, String code, String field, String message, String evidence) {
        this.ref = ref;
        this.code = code;
        this.field = field;
        this.message = message;
        this.evidence = truncate(evidence);
    }

    public String getRef() { return ref; }
    public void setRef(String ref) { this.ref = ref; }
    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }
    public String getField() { return field; }
    public void setField(String field) { this.field = field; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public String getEvidence() { return evidence; }
    public void setEvidence(String evidence) { this.evidence = evidence; }

    /**
     * Creates a row parse warning: the physical line starting the record could not be tokenized.
     *
     * @param line 1-based physical line number of the record start
     * @param evidence the raw line
     */
    public static Warn rowParse(int line, String evidence) {
        return new Warn("line " + line, "ROW_PARSE", null,
            "Unbalanced quote; row skipped", evidence);
    }

    public static Warn headerParse(String evidence) {
        return new Warn("line 1", "HEADER_PARSE", null,
            "Header has an unbalanced quote; parsed best-effort", evidence);
    }

    public static Warn missingValue(int line, String field) {
        return new Warn("line " + line, "MISSING_VALUE", field,
            String.format("Required value '%s' is empty; row skipped", field), null);
    }

    public static Warn badNumber(int line, String field, String value, boolean rowSkipped) {
        return new Warn("line " + line, "BAD_NUMBER", field,
            String.format("Value for '%s' is not a number%s", field, rowSkipped ? "; row skipped" : "; value dropped"), value);
    }

    public static Warn duplicateSku(int line, String sku) {
        return new Warn("line " + line, "DUPLICATE_SKU", "sku",
            String.format("SKU '%s' appears more than once; last row wins", sku), null);
    }

    public static Warn currencyMismatch(String productId, String competitorKey, String productCurrency, String competitorCurrency) {
        return new Warn(productId, "CURRENCY_MISMATCH", "currency",
            String.format("Competitor %s is priced in %s, product in %s; excluded from average",
                competitorKey, competitorCurrency, productCurrency), null);
    }

    public static Warn invalidPrice(String productId, Double price) {
        return new Warn(productId, "INVALID_PRICE", "currentPrice",
            "Product price must be positive to compute a recommendation", String.valueOf(price));
    }

    public static Warn productFailed(String productId, Throwable cause) {
        return new Warn(productId, "PRODUCT_FAILED", null,
            "Recommendation skipped after an unexpected error", cause.toString());
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= 200) return s;
        return s.substring(0, 200) + "...";
    }

    @Override
    public String toString() {
        return code + (ref != null ? " [" + ref + "]" : "") + ": " + message;
    }
}
