package com.orgchart.resolution.similarity;

/**
 * Normalized edit distance: {@code 1 - distance / longer length}.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        int distance = distance(s1, s2);
        int maxLength = Math.max(s1.length(), s2.length());
        return 1.0 - ((double) distance / maxLength);
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Edit distance with unit costs for insertion, deletion and substitution.
     * {@code null} counts as the empty string. Keeps a single row sized to the shorter input.
     */
    public int distance(String s1, String s2) {
        String shorter = s1 != null ? s1 : "";
        String longer = s2 != null ? s2 : "";
        if (shorter.length() > longer.length()) {
            String swap = shorter;
            shorter = longer;
            longer = swap;
        }
        if (shorter.isEmpty() || shorter.equals(longer)) {
            return longer.length() - shorter.length();
        }

        int[] row = new int[shorter.length() + 1];
        for (int i = 0; i < row.length; i++) {
            row[i] = i;
        }
        for (int j = 1; j <= longer.length(); j++) {
            int diagonal = row[0];
            row[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i < row.length; i++) {
                int above = row[i];
                int substitution = diagonal + (shorter.charAt(i - 1) == c ? 0 : 1);
                row[i] = Math.min(substitution, Math.min(above, row[i - 1]) + 1);
                diagonal = above;
            }
        }
        return row[shorter.length()];
    }
}
