package com.orgchart.resolution.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * One organizational entity (department, agency, office) from a snapshot.
 * The parent is referenced only by free text, which may be misspelled or stale.
 *
 * @param name                the entity's name as published
 * @param canonicalName       the official name; defaults to {@code name}
 * @param aliases             alternative names (abbreviations, historical names)
 * @param orgLevel            depth in the organization, 0 for the root
 * @param parentName          free-text reference to the parent's name or alias, may be null
 * @param budgetCode          structured organization code, may be null
 * @param metricsByYear       yearly scalars per metric kind
 * @param distributionsByYear yearly histograms per distribution kind
 */
public record EntityRecord(
        String name,
        String canonicalName,
        Set<String> aliases,
        int orgLevel,
        String parentName,
        String budgetCode,
        Map<MetricKind, Map<String, Double>> metricsByYear,
        Map<DistributionKind, Map<String, List<DistributionBucket>>> distributionsByYear
) {
    public EntityRecord {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (orgLevel < 0) {
            throw new IllegalArgumentException("orgLevel must be non-negative, got " + orgLevel);
        }
        canonicalName = canonicalName == null || canonicalName.isBlank() ? name : canonicalName;
        aliases = aliases == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(aliases));
        parentName = parentName == null || parentName.isBlank() ? null : parentName;
        budgetCode = budgetCode == null || budgetCode.isBlank() ? null : budgetCode.trim();
        metricsByYear = copyMetrics(metricsByYear);
        distributionsByYear = copyDistributions(distributionsByYear);
    }

    public Optional<String> parent() {
        return Optional.ofNullable(parentName);
    }

    public Optional<String> code() {
        return Optional.ofNullable(budgetCode);
    }

    public boolean isRoot() {
        return orgLevel == 0;
    }

    /**
     * Own value of a metric for a year, or 0 when absent.
     */
    public double metric(MetricKind kind, String year) {
        Double value = metricsByYear.getOrDefault(kind, Map.of()).get(year);
        return value != null ? value : 0.0;
    }

    /**
     * Own histogram for a year, or an empty list when absent.
     */
    public List<DistributionBucket> distribution(DistributionKind kind, String year) {
        return distributionsByYear.getOrDefault(kind, Map.of()).getOrDefault(year, List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder pre-populated with this record's values.
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .name(name)
                .canonicalName(canonicalName)
                .aliases(aliases)
                .orgLevel(orgLevel)
                .parentName(parentName)
                .budgetCode(budgetCode);
        metricsByYear.forEach((kind, years) -> years.forEach((year, value) -> builder.metric(kind, year, value)));
        distributionsByYear.forEach((kind, years) ->
                years.forEach((year, buckets) -> builder.distribution(kind, year, buckets)));
        return builder;
    }

    private static Map<MetricKind, Map<String, Double>> copyMetrics(Map<MetricKind, Map<String, Double>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        EnumMap<MetricKind, Map<String, Double>> copy = new EnumMap<>(MetricKind.class);
        source.forEach((kind, years) -> {
            TreeMap<String, Double> sorted = new TreeMap<>();
            years.forEach((year, value) -> {
                if (year != null && value != null) {
                    sorted.put(year, value);
                }
            });
            copy.put(kind, Collections.unmodifiableSortedMap(sorted));
        });
        return Collections.unmodifiableMap(copy);
    }

    private static Map<DistributionKind, Map<String, List<DistributionBucket>>> copyDistributions(
            Map<DistributionKind, Map<String, List<DistributionBucket>>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        EnumMap<DistributionKind, Map<String, List<DistributionBucket>>> copy = new EnumMap<>(DistributionKind.class);
        source.forEach((kind, years) -> {
            TreeMap<String, List<DistributionBucket>> sorted = new TreeMap<>();
            years.forEach((year, buckets) -> {
                if (year != null && buckets != null) {
                    sorted.put(year, List.copyOf(buckets));
                }
            });
            copy.put(kind, Collections.unmodifiableSortedMap(sorted));
        });
        return Collections.unmodifiableMap(copy);
    }

    public static class Builder {
        private String name;
        private String canonicalName;
        private final Set<String> aliases = new LinkedHashSet<>();
        private int orgLevel;
        private String parentName;
        private String budgetCode;
        private final Map<MetricKind, Map<String, Double>> metrics = new EnumMap<>(MetricKind.class);
        private final Map<DistributionKind, Map<String, List<DistributionBucket>>> distributions =
                new EnumMap<>(DistributionKind.class);

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder canonicalName(String canonicalName) {
            this.canonicalName = canonicalName;
            return this;
        }

        public Builder alias(String alias) {
            if (alias != null && !alias.isBlank()) {
                this.aliases.add(alias);
            }
            return this;
        }

        public Builder aliases(Iterable<String> aliases) {
            if (aliases != null) {
                aliases.forEach(this::alias);
            }
            return this;
        }

        public Builder aliases(String... aliases) {
            return aliases(List.of(aliases));
        }

        public Builder orgLevel(int orgLevel) {
            this.orgLevel = orgLevel;
            return this;
        }

        public Builder parentName(String parentName) {
            this.parentName = parentName;
            return this;
        }

        public Builder budgetCode(String budgetCode) {
            this.budgetCode = budgetCode;
            return this;
        }

        public Builder metric(MetricKind kind, String year, double value) {
            metrics.computeIfAbsent(kind, k -> new TreeMap<>()).put(year, value);
            return this;
        }

        public Builder headCount(String year, double value) {
            return metric(MetricKind.HEADCOUNT, year, value);
        }

        public Builder wages(String year, double value) {
            return metric(MetricKind.WAGES, year, value);
        }

        public Builder distribution(DistributionKind kind, String year, List<DistributionBucket> buckets) {
            distributions.computeIfAbsent(kind, k -> new TreeMap<>())
                    .computeIfAbsent(year, y -> new ArrayList<>())
                    .addAll(buckets);
            return this;
        }

        public Builder bucket(DistributionKind kind, String year, double low, double high, long count) {
            return distribution(kind, year, List.of(DistributionBucket.of(low, high, count)));
        }

        public EntityRecord build() {
            Objects.requireNonNull(name, "name is required");
            return new EntityRecord(name, canonicalName, aliases, orgLevel, parentName, budgetCode,
                    metrics, distributions);
        }
    }
}
