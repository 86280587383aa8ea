package com.guildsentinel.core.detection;

/**
 * Normalized edit-distance similarity.
 *
 * <p>
 * {@code ratio(a, b) = 1 - levenshtein(a, b) / max(|a|, |b|)}, so identical
 * strings score 1.0 and strings with nothing in common score 0.0. Two empty
 * strings score 1.0.
 * </p>
 *
 * @since 1.0.0
 */
public final class Similarity {

    private Similarity() {
        // utility class, not instantiable
    }

    /**
     * @param a first string
     * @param b second string
     * @return similarity in [0, 1]
     */
    public static double ratio(String a, String b) {
        if (a.equals(b)) {
            return 1.0;
        }
        int maxLen = Math.max(a.length(), b.length());
        if (maxLen == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(a, b) / maxLen;
    }

    /**
     * Two-row Levenshtein distance.
     *
     * @param a first string
     * @param b second string
     * @return number of single-character edits
     */
    public static int levenshtein(String a, String b) {
        if (a.isEmpty()) {
            return b.length();
        }
        if (b.isEmpty()) {
            return a.length();
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                        Math.min(current[j - 1] + 1, previous[j] + 1),
                        previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
