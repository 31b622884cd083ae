package dev.campfire.catalog;

/**
 * Levenshtein-based similarity of two names, used to recognise the same session across
 * extraction runs when its title changed slightly ("Lego Camp" vs "LEGO Camp!").
 */
public final class NameSimilarity {

    /** Names scoring above this are considered the same session. */
    public static final double MATCH_THRESHOLD = 0.8;

    private NameSimilarity() {
        // utility class
    }

    /**
     * Similarity in [0, 1]: 1 minus the edit distance over the longer length, computed on
     * {@link NameNormalizer#normalize normalized} names. Two empty names are identical.
     */
    public static double similarity(String a, String b) {
        String left = NameNormalizer.normalize(a);
        String right = NameNormalizer.normalize(b);
        int longer = Math.max(left.length(), right.length());
        if (longer == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(left, right) / longer;
    }

    public static boolean matches(String a, String b) {
        return similarity(a, b) > MATCH_THRESHOLD;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
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
