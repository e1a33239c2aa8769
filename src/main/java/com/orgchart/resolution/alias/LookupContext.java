package com.orgchart.resolution.alias;

import com.orgchart.resolution.core.model.EntityRecord;
import com.orgchart.resolution.diagnostics.Diagnostic;
import com.orgchart.resolution.diagnostics.DiagnosticsCollector;
import com.orgchart.resolution.rules.DefaultNormalizationRules;
import com.orgchart.resolution.rules.NormalizationEngine;
import com.orgchart.resolution.similarity.FuzzyMatcher;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a lookup needs, constructed once by the caller and passed by reference:
 * the normalization engine, the alias index over a snapshot and the fuzzy matcher.
 * Immutable after construction.
 */
public final class LookupContext {

    private final NormalizationEngine normalizationEngine;
    private final FuzzyMatcher fuzzyMatcher;
    private final AliasIndex aliasIndex;
    private final List<Diagnostic> diagnostics;

    private LookupContext(Builder builder, AliasIndex aliasIndex, List<Diagnostic> diagnostics) {
        this.normalizationEngine = builder.normalizationEngine;
        this.fuzzyMatcher = builder.fuzzyMatcher;
        this.aliasIndex = aliasIndex;
        this.diagnostics = diagnostics;
    }

    /**
     * Creates a context over the given records with the default government rules.
     */
    public static LookupContext create(List<EntityRecord> records) {
        return builder().records(records).build();
    }

    public NormalizationEngine getNormalizationEngine() {
        return normalizationEngine;
    }

    public FuzzyMatcher getFuzzyMatcher() {
        return fuzzyMatcher;
    }

    public AliasIndex getAliasIndex() {
        return aliasIndex;
    }

    /**
     * Data-quality events raised while indexing (duplicate names and aliases).
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * Finds an entity by exact name, canonical name or alias.
     */
    public Optional<EntityRecord> find(String name) {
        return aliasIndex.lookup(name).map(AliasIndex.Entry::record);
    }

    public String normalize(String name) {
        return normalizationEngine.normalize(name);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private NormalizationEngine normalizationEngine;
        private FuzzyMatcher fuzzyMatcher;
        private List<EntityRecord> records = List.of();
        private DiagnosticsCollector diagnostics;

        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        public Builder fuzzyMatcher(FuzzyMatcher fuzzyMatcher) {
            this.fuzzyMatcher = fuzzyMatcher;
            return this;
        }

        public Builder records(List<EntityRecord> records) {
            this.records = Objects.requireNonNull(records, "records");
            return this;
        }

        /**
         * Collector that receives indexing events; a private one is used when not set.
         */
        public Builder diagnostics(DiagnosticsCollector diagnostics) {
            this.diagnostics = diagnostics;
            return this;
        }

        public LookupContext build() {
            if (normalizationEngine == null) {
                normalizationEngine = DefaultNormalizationRules.createDefaultEngine();
            }
            if (fuzzyMatcher == null) {
                fuzzyMatcher = new FuzzyMatcher();
            }
            DiagnosticsCollector collector = diagnostics != null ? diagnostics : new DiagnosticsCollector();
            int before = collector.size();
            AliasIndex index = AliasIndex.build(records, normalizationEngine, collector);
            List<Diagnostic> all = collector.getDiagnostics();
            return new LookupContext(this, index, List.copyOf(all.subList(before, all.size())));
        }
    }
}
