package com.orgchart.resolution.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Engine for applying normalization rules to entity names.
 * Rules are applied in priority order (lower priority number = higher precedence),
 * followed by lower-casing, trimming and whitespace collapse.
 *
 * <p>The output is for comparison only, never for display. Normalization is total:
 * {@code null} or blank input yields the empty string.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    /**
     * Adds a rule to the engine.
     */
    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    /**
     * Adds multiple rules to the engine.
     */
    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    /**
     * Gets all rules currently in the engine.
     */
    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes the given name.
     * If the rules strip everything (a name consisting only of a jurisdiction prefix, say),
     * the plainly cleaned input is returned instead.
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = name;
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.name(), before, result);
            }
        }

        String cleaned = clean(result);
        return cleaned.isEmpty() ? clean(name) : cleaned;
    }

    /**
     * Checks if two names are equivalent after normalization.
     */
    public boolean areEquivalent(String name1, String name2) {
        return normalize(name1).equals(normalize(name2));
    }

    private static String clean(String value) {
        return WHITESPACE.matcher(value.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::priority));
    }
}
