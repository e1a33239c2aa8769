package com.orgchart.resolution.rules;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Built-in normalization rules for government entity names.
 */
public final class DefaultNormalizationRules {

    /**
     * Jurisdiction prefixes stripped by default, longest first.
     */
    public static final List<String> DEFAULT_JURISDICTION_PREFIXES =
            List.of("state of california", "california state", "california", "ca");

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        return createEngine(DEFAULT_JURISDICTION_PREFIXES);
    }

    /**
     * Creates a NormalizationEngine with the default rules and the given jurisdiction prefixes.
     */
    public static NormalizationEngine createEngine(List<String> jurisdictionPrefixes) {
        NormalizationEngine engine = new NormalizationEngine();
        if (!jurisdictionPrefixes.isEmpty()) {
            engine.addRule(jurisdictionRule(jurisdictionPrefixes));
        }
        engine.addRules(getCommonRules());
        return engine;
    }

    /**
     * Creates an engine without rules: lower-case, trim and whitespace collapse only.
     */
    public static NormalizationEngine createBasicEngine() {
        return new NormalizationEngine();
    }

    /**
     * Rule stripping a leading jurisdiction prefix such as "California" or "State of California".
     */
    public static NormalizationRule jurisdictionRule(List<String> prefixes) {
        List<String> ordered = new ArrayList<>(prefixes);
        ordered.sort(Comparator.comparingInt(String::length).reversed());
        String alternatives = ordered.stream()
                .map(p -> Pattern.quote(p.trim()).replace(" ", "\\E\\s+\\Q"))
                .collect(Collectors.joining("|"));
        return NormalizationRule.builder()
                .name("jurisdiction-prefix")
                .pattern("^\\s*(?:" + alternatives + ")\\b[\\s,:\\-]*")
                .replacement("")
                .priority(10)
                .build();
    }

    /**
     * Rules applied regardless of jurisdiction.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("apostrophe")
                        .pattern("['’`]")
                        .replacement("")
                        .priority(5)
                        .build(),

                NormalizationRule.builder()
                        .name("ampersand")
                        .pattern("\\s*&\\s*")
                        .replacement(" and ")
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("dept-abbreviation")
                        .pattern("\\bdeptt?\\b\\.?")
                        .replacement("department")
                        .priority(30)
                        .build(),

                // "Department of the Interior" -> "department interior"
                NormalizationRule.builder()
                        .name("type-of-infix")
                        .pattern("\\b(department|office|board|commission|bureau|division)\\s+of\\s+(?:the\\s+)?")
                        .replacement("$1 ")
                        .priority(40)
                        .build(),

                NormalizationRule.builder()
                        .name("punctuation")
                        .pattern("[^\\p{L}\\p{N}\\s]")
                        .replacement(" ")
                        .priority(50)
                        .build()
        );
    }
}
