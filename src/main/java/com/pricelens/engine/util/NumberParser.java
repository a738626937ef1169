package com.pricelens.engine.util;

/**
 * Lenient parsing of numbers typed into spreadsheets: "€ 1 299,90", "1,299.90", "$19.99".
 */
public final class NumberParser {
    private NumberParser() {}

    /**
     * Returns the decimal value or {@code null} when the text holds no parsable number.
     *
     * <p>When both ',' and '.' occur, the one appearing last is the decimal separator. A lone ','
     * followed by one or two digits is a decimal comma, otherwise a thousands separator.
     */
    public static Double parseDecimal(String text) {
        if (text == null) return null;
        String s = text.replaceAll("[^0-9,.\\-]", "");
        if (s.isEmpty() || s.equals("-")) return null;
        int lastComma = s.lastIndexOf(',');
        int lastDot = s.lastIndexOf('.');
        if (lastComma >= 0 && lastDot >= 0) {
            if (lastComma > lastDot) {
                s = s.replace(".", "").replace(',', '.');
            } else {
                s = s.replace(",", "");
            }
        } else if (lastComma >= 0) {
            int decimals = s.length() - lastComma - 1;
            boolean single = s.indexOf(',') == lastComma;
            s = single && decimals > 0 && decimals <= 2 ? s.replace(',', '.') : s.replace(",", "");
        }
        try {
            double v = Double.parseDouble(s);
            return Double.isFinite(v) ? v : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Whole number, or {@code null} when absent, unparsable or fractional. */
    public static Integer parseInteger(String text) {
        Double d = parseDecimal(text);
        if (d == null || d != Math.rint(d) || Math.abs(d) > Integer.MAX_VALUE) return null;
        return d.intValue();
    }
}
