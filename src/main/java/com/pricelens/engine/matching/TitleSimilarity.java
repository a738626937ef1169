package com.pricelens.engine.matching;

import com.pricelens.engine.util.TitleNormalizer;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Title similarity on canonical names.
 *
 * <p>Equal canonical names score 1.0; otherwise the score is the Jaccard index of the two token
 * sets. A blank canonical name (nothing left after normalization) scores 0 against anything,
 * including another blank name.
 */
public final class TitleSimilarity {
    private TitleSimilarity() {}

    public static double of(String a, String b) {
        return ofCanonical(TitleNormalizer.normalize(a), TitleNormalizer.normalize(b));
    }

    /** Same as {@link #of} for names that are already canonical. */
    public static double ofCanonical(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        if (a.equals(b)) return 1.0;
        return jaccard(tokens(a), tokens(b));
    }

    static Set<String> tokens(String canonical) {
        if (canonical.isEmpty()) return Set.of();
        return new HashSet<>(Arrays.asList(canonical.split(" ")));
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) return 0.0;
        int intersection = 0;
        for (String t : a) {
            if (b.contains(t)) intersection++;
        }
        int union = a.size() + b.size() - intersection;
        return (double) intersection / union;
    }
}
