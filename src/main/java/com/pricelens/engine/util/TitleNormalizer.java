package com.pricelens.engine.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes product titles for comparison.
 *
 * <p>The canonical form is only ever compared, never displayed. It is lowercase ASCII
 * letters, digits and single spaces, so "Café   Noir!!" and "cafe noir" are equal, and so are
 * "USB-C Cable" and "usb c cable".
 */
public final class TitleNormalizer {
    private TitleNormalizer() {}

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_CANONICAL = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Returns the canonical form of the given title.
     *
     * <p>Rules applied in order:
     * <ol>
     *   <li>Null or empty input yields the empty string</li>
     *   <li>Lowercase</li>
     *   <li>NFD decomposition, combining marks removed (accented letters reduce to base letter)</li>
     *   <li>Everything outside {@code [a-z0-9]} and whitespace replaced by a space, so punctuation
     *       between words separates tokens instead of gluing them</li>
     *   <li>Whitespace runs collapsed to one space, then trimmed</li>
     * </ol>
     *
     * <p>Total and idempotent.
     */
    public static String normalize(String input) {
        if (input == null || input.isEmpty()) return "";
        String s = input.toLowerCase(Locale.ROOT);
        s = Normalizer.normalize(s, Normalizer.Form.NFD);
        s = COMBINING_MARKS.matcher(s).replaceAll("");
        s = NON_CANONICAL.matcher(s).replaceAll(" ");
        s = WHITESPACE.matcher(s).replaceAll(" ").trim();
        return s;
    }
}
