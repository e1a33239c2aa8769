package com.orgchart.resolution.api;

import com.orgchart.resolution.aggregation.AggregationResult;
import com.orgchart.resolution.aggregation.DistributionAggregator;
import com.orgchart.resolution.alias.LookupContext;
import com.orgchart.resolution.bulk.EntityRecordImporter;
import com.orgchart.resolution.bulk.ImportResult;
import com.orgchart.resolution.bulk.JsonEntityRecordImporter;
import com.orgchart.resolution.cache.CacheConfig;
import com.orgchart.resolution.cache.CacheStats;
import com.orgchart.resolution.cache.CaffeineMatchCache;
import com.orgchart.resolution.cache.MatchCache;
import com.orgchart.resolution.cache.NoOpMatchCache;
import com.orgchart.resolution.core.model.EntityRecord;
import com.orgchart.resolution.core.model.ForeignRecord;
import com.orgchart.resolution.core.model.MatchResult;
import com.orgchart.resolution.diagnostics.DiagnosticsCollector;
import com.orgchart.resolution.hierarchy.BuildResult;
import com.orgchart.resolution.hierarchy.HierarchyBuilder;
import com.orgchart.resolution.hierarchy.HierarchyOptions;
import com.orgchart.resolution.logging.LogContext;
import com.orgchart.resolution.matching.CrossDatasetMatchResolver;
import com.orgchart.resolution.matching.EntityMatchReport;
import com.orgchart.resolution.matching.EntityNameMatcher;
import com.orgchart.resolution.matching.ResolutionOptions;
import com.orgchart.resolution.rules.DefaultNormalizationRules;
import com.orgchart.resolution.rules.NormalizationEngine;
import com.orgchart.resolution.similarity.FuzzyMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point: builds the organization from a snapshot and resolves records of other
 * datasets against it.
 *
 * <pre>
 * OrgHierarchyService service = OrgHierarchyService.builder()
 *         .cache(CacheConfig.defaults())
 *         .build();
 * OrgHierarchy org = service.build(records);
 * Optional&lt;MatchResult&gt; match = service.resolveMatch("Air Resources Board", spendingRecord);
 * </pre>
 *
 * <p>Each build replaces the lookup context used for matching and clears the match cache.</p>
 */
public class OrgHierarchyService {
    private static final Logger log = LoggerFactory.getLogger(OrgHierarchyService.class);

    private final NormalizationEngine normalizationEngine;
    private final FuzzyMatcher fuzzyMatcher;
    private final HierarchyOptions hierarchyOptions;
    private final ResolutionOptions resolutionOptions;
    private final MatchCache cache;
    private final EntityRecordImporter importer;
    private final DistributionAggregator aggregator = new DistributionAggregator();
    private final EntityNameMatcher nameMatcher;

    private volatile Snapshot snapshot;

    private OrgHierarchyService(Builder builder) {
        this.normalizationEngine = builder.normalizationEngine;
        this.fuzzyMatcher = builder.fuzzyMatcher;
        this.hierarchyOptions = builder.hierarchyOptions;
        this.resolutionOptions = builder.resolutionOptions;
        this.cache = builder.cache;
        this.importer = builder.importer;
        this.nameMatcher = new EntityNameMatcher(normalizationEngine);
    }

    /**
     * Builds the tree and its aggregates, and makes the records available for matching.
     */
    public OrgHierarchy build(List<EntityRecord> records) {
        return build(records, new DiagnosticsCollector());
    }

    /**
     * Imports a JSON snapshot and builds it. Import events are included in the result's diagnostics.
     */
    public OrgHierarchy buildFromJson(InputStream input) {
        ImportResult imported;
        try (LogContext ctx = LogContext.forImport(importer.getFormat())) {
            imported = importer.importRecords(input, null);
        }
        if (imported.hasErrors()) {
            log.warn("import.errors count={} first='{}'", imported.errorCount(), imported.errors().get(0).message());
        }
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();
        diagnostics.addAll(imported.diagnostics());
        return build(imported.records(), diagnostics);
    }

    private OrgHierarchy build(List<EntityRecord> records, DiagnosticsCollector diagnostics) {
        Objects.requireNonNull(records, "records");
        String buildId = LogContext.generateCorrelationId();
        try (LogContext ctx = LogContext.forBuild(buildId)) {
            log.info("Building hierarchy from {} records", records.size());
            HierarchyBuilder hierarchyBuilder = new HierarchyBuilder(normalizationEngine, fuzzyMatcher, hierarchyOptions);
            BuildResult result = hierarchyBuilder.build(records, diagnostics);
            AggregationResult aggregation = aggregator.aggregate(result.tree(), diagnostics);

            snapshot = new Snapshot(records, result.context(),
                    new CrossDatasetMatchResolver(result.context(), cache));
            cache.invalidateAll();

            OrgHierarchy hierarchy = new OrgHierarchy(buildId, result.tree(), aggregation,
                    result.unattached(), diagnostics.getDiagnostics());
            log.info("build.completed nodes={} unattached={} diagnostics={}",
                    hierarchy.tree().size(), hierarchy.unattached().size(), hierarchy.diagnostics().size());
            return hierarchy;
        }
    }

    public Optional<MatchResult> resolveMatch(String targetName, ForeignRecord record) {
        return resolveMatch(targetName, record, resolutionOptions);
    }

    /**
     * Resolves a foreign record against a target entity of the last build.
     *
     * @throws IllegalStateException when nothing has been built yet
     */
    public Optional<MatchResult> resolveMatch(String targetName, ForeignRecord record, ResolutionOptions options) {
        Snapshot current = requireSnapshot();
        try (LogContext ctx = LogContext.forMatch(LogContext.generateCorrelationId(), targetName)) {
            Optional<MatchResult> result = current.resolver().resolveMatch(targetName, record, options);
            log.debug("match.resolved target='{}' result={}", targetName, result.map(MatchResult::format).orElse("none"));
            return result;
        }
    }

    /**
     * Ties a free-text name, and optionally an organization code, to records of the last build.
     */
    public EntityMatchReport findMatches(String name, String entityCode) {
        return nameMatcher.findMatches(name, entityCode, requireSnapshot().records());
    }

    /**
     * Lookup context of the last build, empty before the first build.
     */
    public Optional<LookupContext> getLookupContext() {
        Snapshot current = snapshot;
        return current == null ? Optional.empty() : Optional.of(current.context());
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    private Snapshot requireSnapshot() {
        Snapshot current = snapshot;
        if (current == null) {
            throw new IllegalStateException("build() must be called before matching");
        }
        return current;
    }

    private record Snapshot(List<EntityRecord> records, LookupContext context, CrossDatasetMatchResolver resolver) {
        Snapshot {
            records = List.copyOf(records);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private NormalizationEngine normalizationEngine = DefaultNormalizationRules.createDefaultEngine();
        private FuzzyMatcher fuzzyMatcher = new FuzzyMatcher();
        private HierarchyOptions hierarchyOptions = HierarchyOptions.defaults();
        private ResolutionOptions resolutionOptions = ResolutionOptions.defaults();
        private MatchCache cache = new NoOpMatchCache();
        private EntityRecordImporter importer = new JsonEntityRecordImporter();

        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = Objects.requireNonNull(normalizationEngine, "normalizationEngine");
            return this;
        }

        public Builder fuzzyMatcher(FuzzyMatcher fuzzyMatcher) {
            this.fuzzyMatcher = Objects.requireNonNull(fuzzyMatcher, "fuzzyMatcher");
            return this;
        }

        public Builder hierarchyOptions(HierarchyOptions hierarchyOptions) {
            this.hierarchyOptions = Objects.requireNonNull(hierarchyOptions, "hierarchyOptions");
            return this;
        }

        public Builder resolutionOptions(ResolutionOptions resolutionOptions) {
            this.resolutionOptions = Objects.requireNonNull(resolutionOptions, "resolutionOptions");
            return this;
        }

        public Builder cache(MatchCache cache) {
            this.cache = Objects.requireNonNull(cache, "cache");
            return this;
        }

        /**
         * Uses a Caffeine cache with the given configuration, or no cache when it is disabled.
         */
        public Builder cache(CacheConfig config) {
            this.cache = config.enabled() ? new CaffeineMatchCache(config) : new NoOpMatchCache();
            return this;
        }

        public Builder importer(EntityRecordImporter importer) {
            this.importer = Objects.requireNonNull(importer, "importer");
            return this;
        }

        public OrgHierarchyService build() {
            return new OrgHierarchyService(this);
        }
    }
}
