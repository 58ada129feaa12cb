package com.marketrouter.common.mapping;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Name similarity heuristics used when a column has no exact or custom match.
 *
 * <p>{@link #bestMatch} tries three measures in order and returns the best candidate of
 * the first measure that clears its cutoff:
 * <pre>
 *   sequence ratio   1 - levenshtein(a, b) / max(|a|, |b|)     cutoff 0.6
 *   token Jaccard    |A ∩ B| / |A ∪ B|                          cutoff 0.3
 *   containment      |shorter| / |longer| when one contains    cutoff 0.5
 * </pre>
 * Comparison is case-insensitive. Tokens split on {@code _ - . space} and camelCase;
 * CJK text is tokenised per character so "开盘" and "开盘价" share tokens.
 *
 * <p>Stateless and thread-safe.
 */
public final class FuzzyMatcher {

    public static final double SEQUENCE_CUTOFF    = 0.6;
    public static final double JACCARD_CUTOFF     = 0.3;
    public static final double CONTAINMENT_CUTOFF = 0.5;

    /** Candidates shorter than this are single-letter abbreviations; too noisy to fuzz. */
    static final int MIN_CANDIDATE_LENGTH = 2;

    public record Match(String candidate, double similarity) {}

    private FuzzyMatcher() {}

    public static Optional<Match> bestMatch(String name, Collection<String> candidates) {
        if (name == null || name.length() < MIN_CANDIDATE_LENGTH) {
            return Optional.empty();
        }
        Optional<Match> m = best(name, candidates, Measure.SEQUENCE, SEQUENCE_CUTOFF);
        if (m.isPresent()) {
            return m;
        }
        m = best(name, candidates, Measure.JACCARD, JACCARD_CUTOFF);
        if (m.isPresent()) {
            return m;
        }
        return best(name, candidates, Measure.CONTAINMENT, CONTAINMENT_CUTOFF);
    }

    private enum Measure { SEQUENCE, JACCARD, CONTAINMENT }

    private static Optional<Match> best(String name, Collection<String> candidates, Measure measure, double cutoff) {
        Match best = null;
        for (String candidate : candidates) {
            if (candidate.length() < MIN_CANDIDATE_LENGTH) {
                continue;
            }
            double score = switch (measure) {
                case SEQUENCE    -> sequenceRatio(name, candidate);
                case JACCARD     -> tokenJaccard(name, candidate);
                case CONTAINMENT -> containmentRatio(name, candidate);
            };
            if (score >= cutoff && (best == null || score > best.similarity())) {
                best = new Match(candidate, score);
            }
        }
        return Optional.ofNullable(best);
    }

    // ── measures ──────────────────────────────────────────────────────────────

    public static double sequenceRatio(String a, String b) {
        String x = a.toLowerCase(Locale.ROOT);
        String y = b.toLowerCase(Locale.ROOT);
        int max = Math.max(x.length(), y.length());
        if (max == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(x, y) / max;
    }

    public static double tokenJaccard(String a, String b) {
        Set<String> ta = tokens(a);
        Set<String> tb = tokens(b);
        if (ta.isEmpty() || tb.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(ta);
        intersection.retainAll(tb);
        Set<String> union = new HashSet<>(ta);
        union.addAll(tb);
        return (double) intersection.size() / union.size();
    }

    public static double containmentRatio(String a, String b) {
        String x = a.toLowerCase(Locale.ROOT);
        String y = b.toLowerCase(Locale.ROOT);
        if (x.isEmpty() || y.isEmpty()) {
            return 0.0;
        }
        String shorter = x.length() <= y.length() ? x : y;
        String longer  = x.length() <= y.length() ? y : x;
        return longer.contains(shorter) ? (double) shorter.length() / longer.length() : 0.0;
    }

    static Set<String> tokens(String s) {
        Set<String> out = new HashSet<>();
        String spaced = s.replaceAll("([a-z0-9])([A-Z])", "$1 $2");
        for (String part : spaced.split("[_\\-.\\s]+")) {
            if (part.isEmpty()) {
                continue;
            }
            StringBuilder latin = new StringBuilder();
            for (int i = 0; i < part.length(); i++) {
                char c = part.charAt(i);
                if (Character.UnicodeScript.of(c) == Character.UnicodeScript.HAN) {
                    if (latin.length() > 0) {
                        out.add(latin.toString().toLowerCase(Locale.ROOT));
                        latin.setLength(0);
                    }
                    out.add(String.valueOf(c));
                } else {
                    latin.append(c);
                }
            }
            if (latin.length() > 0) {
                out.add(latin.toString().toLowerCase(Locale.ROOT));
            }
        }
        return out;
    }

    static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }
}
