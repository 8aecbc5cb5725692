package ru.tigran.dialoguesimulator.util;

import java.util.Collection;

/**
 * Exact-substring matching helpers for phrase lexicons.
 * No normalization is applied: Hebrew lexicon entries must match the transcript text as written.
 */
public final class TextMatchUtils {

    private TextMatchUtils() {
        // Private constructor to prevent instantiation
    }

    /**
     * Counts how many lexicon phrases occur in the text, each phrase counted at most once.
     *
     * Example: text "אני מבין, זה מובן" against ["אני מבין", "זה מובן", "אני מזדהה"] gives 2.
     *
     * @param text text to scan
     * @param phrases lexicon
     * @return number of distinct lexicon entries contained in the text
     */
    public static int countContainedPhrases(String text, Collection<String> phrases) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (String phrase : phrases) {
            if (text.contains(phrase)) {
                count++;
            }
        }
        return count;
    }

    public static boolean containsAny(String text, Collection<String> phrases) {
        return countContainedPhrases(text, phrases) > 0;
    }

    /**
     * Counts non-overlapping occurrences of a marker, scanning left to right.
     * "!!!" contains one "!!" and three "!".
     */
    public static int countOccurrences(String text, String marker) {
        if (text == null || text.isEmpty() || marker == null || marker.isEmpty()) {
            return 0;
        }
        int count = 0;
        int from = text.indexOf(marker);
        while (from >= 0) {
            count++;
            from = text.indexOf(marker, from + marker.length());
        }
        return count;
    }
}
