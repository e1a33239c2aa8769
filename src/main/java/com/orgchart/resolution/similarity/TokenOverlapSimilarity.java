package com.orgchart.resolution.similarity;

import java.util.regex.Pattern;

/**
 * Position-weighted word overlap.
 * Earlier words of the first string weigh more; a word that is a prefix of another
 * (both longer than three letters, e.g. "admin" and "administration") earns partial credit.
 * Strings sharing many words are boosted to at least 0.8.
 */
public class TokenOverlapSimilarity implements SimilarityAlgorithm {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final double PARTIAL_CREDIT = 0.8;
    private static final double BOOST = 0.2;
    private static final double BOOST_FLOOR = 0.8;

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isBlank() || s2.isBlank()) {
            return 0.0;
        }

        String[] words1 = WHITESPACE.split(s1.trim());
        String[] words2 = WHITESPACE.split(s2.trim());

        double matched = 0;
        double totalWeight = 0;
        for (int i = 0; i < words1.length; i++) {
            String word1 = words1[i];
            double weight = 1 + (0.5 * (words1.length - i - 1) / words1.length);
            totalWeight += weight;

            for (String word2 : words2) {
                if (word1.equals(word2)) {
                    matched += weight;
                    break;
                }
                if (word1.length() > 3 && word2.length() > 3
                        && (word1.startsWith(word2) || word2.startsWith(word1))) {
                    matched += weight * PARTIAL_CREDIT;
                    break;
                }
            }
        }

        double score = matched / totalWeight;
        int minWords = Math.min(words1.length, words2.length);
        if (matched >= Math.max(3, minWords * 0.5)) {
            return Math.min(1.0, Math.max(score + BOOST, BOOST_FLOOR));
        }
        return score;
    }

    @Override
    public String getName() {
        return "Token-Overlap";
    }
}
