package com.orgchart.resolution.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A named regex substitution applied to entity names before comparison.
 * Patterns are compiled case-insensitively; lower priority values run first.
 *
 * @param name        rule identifier, used to remove the rule from an engine
 * @param pattern     compiled pattern
 * @param replacement replacement text, may reference groups ({@code $1})
 * @param priority    position in the rule chain
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, int priority) {

    private static final int DEFAULT_PRIORITY = 100;

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
    }

    /**
     * Replaces every match of the pattern in {@code input}.
     */
    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String regex;
        private String replacement;
        private int priority = DEFAULT_PRIORITY;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String regex) {
            this.regex = regex;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(regex, "pattern is required");
            return new NormalizationRule(name,
                    Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                    replacement, priority);
        }
    }

    @Override
    public String toString() {
        return "NormalizationRule{name='" + name + "', pattern=" + pattern.pattern() + ", priority=" + priority + '}';
    }
}
