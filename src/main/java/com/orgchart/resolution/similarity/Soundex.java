package com.orgchart.resolution.similarity;

import java.util.Locale;

/**
 * Soundex phonetic code: the first letter followed by three digits.
 * Consecutive letters of the same class collapse to one digit. Any uncoded letter,
 * H and W included, separates repeated classes, so "Ashcraft" encodes to {@code A226}.
 */
public class Soundex implements SimilarityAlgorithm {

    private static final int CODE_LENGTH = 4;
    private static final String EMPTY_CODE = "0000";
    //                                    ABCDEFGHIJKLMNOPQRSTUVWXYZ
    private static final String CLASSES = "01230120022455012623010202";

    /**
     * Encodes a string. Non-letters are ignored; input without letters encodes to {@code 0000}.
     */
    public String encode(String input) {
        if (input == null) {
            return EMPTY_CODE;
        }
        String letters = input.toUpperCase(Locale.ROOT).replaceAll("[^A-Z]", "");
        if (letters.isEmpty()) {
            return EMPTY_CODE;
        }

        StringBuilder code = new StringBuilder(CODE_LENGTH);
        char first = letters.charAt(0);
        code.append(first);
        char previous = classOf(first);

        for (int i = 1; i < letters.length() && code.length() < CODE_LENGTH; i++) {
            char digit = classOf(letters.charAt(i));
            if (digit != '0' && digit != previous) {
                code.append(digit);
            }
            previous = digit;
        }

        while (code.length() < CODE_LENGTH) {
            code.append('0');
        }
        return code.toString();
    }

    /**
     * Returns true when both strings share a Soundex code, {@code 0000} included.
     */
    public boolean sounds(String s1, String s2) {
        return encode(s1).equals(encode(s2));
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return sounds(s1, s2) ? 1.0 : 0.0;
    }

    @Override
    public String getName() {
        return "Soundex";
    }

    private static char classOf(char letter) {
        return CLASSES.charAt(letter - 'A');
    }
}
