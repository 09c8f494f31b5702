package com.track.resolution.similarity;

/**
 * Edit-distance similarity.
 *
 * <p>With the default substitution cost of 2 a substitution counts as a deletion plus an
 * insertion, and the distance is normalized by the combined length of both strings. This
 * is the indel ratio {@code 2 * LCS / (len1 + len2)}, which is less harsh on strings of
 * different length than the classic {@code 1 - d / maxLength}. A substitution cost of 1
 * gives classic Levenshtein normalized by the longer string.</p>
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    private final int substitutionCost;

    public LevenshteinSimilarity() {
        this(2);
    }

    public LevenshteinSimilarity(int substitutionCost) {
        if (substitutionCost != 1 && substitutionCost != 2) {
            throw new IllegalArgumentException("substitutionCost must be 1 or 2");
        }
        this.substitutionCost = substitutionCost;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return s1.isEmpty() ? 0.0 : 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        int distance = distance(s1, s2);
        int norm = substitutionCost == 2
                ? s1.length() + s2.length()
                : Math.max(s1.length(), s2.length());
        return 1.0 - ((double) distance / norm);
    }

    @Override
    public String getName() {
        return substitutionCost == 2 ? "Indel" : "Levenshtein";
    }

    /**
     * Weighted edit distance, two-row Wagner-Fischer.
     */
    int distance(String s1, String s2) {
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }
        int m = s1.length();
        int n = s2.length();

        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];
        for (int i = 0; i <= m; i++) {
            previousRow[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            currentRow[0] = j;
            char c = s2.charAt(j - 1);
            for (int i = 1; i <= m; i++) {
                int cost = s1.charAt(i - 1) == c ? 0 : substitutionCost;
                currentRow[i] = Math.min(
                        Math.min(currentRow[i - 1] + 1, previousRow[i] + 1),
                        previousRow[i - 1] + cost
                );
            }
            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }
        return previousRow[m];
    }
}
