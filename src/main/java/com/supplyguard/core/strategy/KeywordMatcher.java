package com.supplyguard.core.strategy;

import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case-insensitive substring matching shared by keyword scoring and intent classification.
 */
public final class KeywordMatcher {

    private KeywordMatcher() {}

    public static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    /**
     * Counts non-overlapping occurrences of {@code term} in {@code text}.
     * Both are compared lower-cased.
     */
    public static int countOccurrences(String text, String term) {
        if (text == null || term == null || term.isBlank()) {
            return 0;
        }
        String haystack = normalize(text);
        String needle = normalize(term);
        int count = 0;
        int from = 0;
        while (true) {
            int idx = haystack.indexOf(needle, from);
            if (idx < 0) {
                return count;
            }
            count++;
            from = idx + needle.length();
        }
    }

    public static boolean contains(String text, String term) {
        return countOccurrences(text, term) > 0;
    }

    /**
     * Like {@link #contains} but the term must start at a word boundary, so
     * "port" does not match inside "export" while "ports" still matches.
     * Terms written in CJK ideographs have no word boundaries and match as substrings.
     */
    public static boolean containsWord(String text, String term) {
        if (text == null || term == null || term.isBlank()) {
            return false;
        }
        if (isIdeographic(term)) {
            return contains(text, term);
        }
        return Pattern.compile("\\b" + Pattern.quote(normalize(term))).matcher(normalize(text)).find();
    }

    /** True when {@code term} starts with a CJK ideograph. */
    public static boolean isIdeographic(String term) {
        return term != null && !term.isEmpty() && Character.isIdeographic(term.codePointAt(0));
    }

    /** Total occurrences of every term in {@code terms}. */
    public static int countAll(String text, Collection<String> terms) {
        int total = 0;
        for (String term : terms) {
            total += countOccurrences(text, term);
        }
        return total;
    }
}
