package com.orgchart.resolution.rules;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Generates comparison variants of a normalized entity name, so that
 * "department motor vehicles" can meet "motor vehicles" or "vehicles department motor".
 */
public final class NameVariations {

    private static final List<String> LEADING_TYPE_WORDS =
            List.of("department", "office", "board", "commission", "bureau", "division", "agency");
    private static final List<String> TRAILING_TYPE_WORDS =
            List.of("commission", "board", "authority", "agency", "office", "department", "council", "panel", "court");
    private static final Pattern ARTICLES = Pattern.compile("\\b(a|an|the)\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private NameVariations() {
        // Utility class
    }

    /**
     * Returns the distinct, non-empty variants of a normalized name, the name itself first.
     */
    public static List<String> of(String normalized) {
        Set<String> variations = new LinkedHashSet<>();
        if (normalized == null || normalized.isBlank()) {
            return List.of();
        }
        String base = collapse(normalized);
        variations.add(base);

        for (String word : LEADING_TYPE_WORDS) {
            if (base.startsWith(word + " ")) {
                variations.add(base.substring(word.length() + 1));
            }
        }
        for (String word : TRAILING_TYPE_WORDS) {
            if (base.endsWith(" " + word)) {
                variations.add(base.substring(0, base.length() - word.length() - 1));
            }
        }

        if (base.contains(" and ")) {
            variations.add(base.replace(" and ", " & "));
        }
        if (base.contains("&")) {
            variations.add(collapse(base.replace("&", " and ")));
        }

        variations.add(collapse(ARTICLES.matcher(base).replaceAll("")));

        String[] words = base.split(" ");
        if (words.length > 2) {
            List<String> rotated = new ArrayList<>(List.of(words).subList(1, words.length));
            rotated.add(words[0]);
            variations.add(String.join(" ", rotated));
        }

        variations.removeIf(String::isEmpty);
        return List.copyOf(variations);
    }

    private static String collapse(String value) {
        return WHITESPACE.matcher(value.trim()).replaceAll(" ");
    }
}
