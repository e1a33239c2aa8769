package com.orgchart.resolution.matching;

import com.orgchart.resolution.alias.LookupContext;
import com.orgchart.resolution.cache.CachedMatch;
import com.orgchart.resolution.cache.MatchCache;
import com.orgchart.resolution.cache.MatchCacheKey;
import com.orgchart.resolution.cache.NoOpMatchCache;
import com.orgchart.resolution.core.model.CandidateField;
import com.orgchart.resolution.core.model.EntityRecord;
import com.orgchart.resolution.core.model.ForeignRecord;
import com.orgchart.resolution.core.model.MatchAlgorithm;
import com.orgchart.resolution.core.model.MatchConfidence;
import com.orgchart.resolution.core.model.MatchResult;
import com.orgchart.resolution.similarity.FuzzyMatchOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a record from another dataset refers to a target entity.
 *
 * <p>Evidence is considered in this order:</p>
 * <ol>
 *   <li>organization code equal to the target's code and a name field equal to the target's
 *       name or one of its aliases: 1.0, field {@code code & name}</li>
 *   <li>code only: 1.0, field {@code code}</li>
 *   <li>name field only: the exact-name score (0.8), field {@code name}</li>
 *   <li>each remaining field in priority order, exact text scoring the exact-name score and
 *       fuzzy evidence scoring {@code fuzzy × weight}, capped below the exact-name score</li>
 * </ol>
 * A best score under the minimum yields {@link Optional#empty()}, the expected outcome when
 * nothing plausibly identifies the target.
 */
public class CrossDatasetMatchResolver {
    private static final Logger log = LoggerFactory.getLogger(CrossDatasetMatchResolver.class);

    public static final String FIELD_CODE_AND_NAME = "code & name";
    public static final String FIELD_CODE = "code";
    public static final String FIELD_NAME = "name";

    private final LookupContext context;
    private final MatchCache cache;

    public CrossDatasetMatchResolver(LookupContext context) {
        this(context, new NoOpMatchCache());
    }

    public CrossDatasetMatchResolver(LookupContext context, MatchCache cache) {
        this.context = Objects.requireNonNull(context, "context");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public Optional<MatchResult> resolveMatch(String targetName, ForeignRecord record) {
        return resolveMatch(targetName, record, ResolutionOptions.defaults());
    }

    /**
     * Resolves the best identification of {@code targetName} in {@code record}.
     *
     * @param targetName the entity's name; its code and aliases come from the lookup context
     * @param record     the foreign record
     * @param options    resolution options
     * @return the best match, or empty when no evidence reaches the minimum score
     */
    public Optional<MatchResult> resolveMatch(String targetName, ForeignRecord record, ResolutionOptions options) {
        Objects.requireNonNull(targetName, "targetName");
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(options, "options");

        MatchCacheKey key = new MatchCacheKey(targetName, record, options);
        Optional<CachedMatch> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Cache hit for target '{}'", targetName);
            return cached.get().asOptional();
        }

        Optional<MatchResult> result = resolve(targetName, record, options);
        cache.put(key, CachedMatch.of(result));
        return result;
    }

    private Optional<MatchResult> resolve(String targetName, ForeignRecord record, ResolutionOptions options) {
        Optional<EntityRecord> target = context.find(targetName);
        Set<String> knownNames = knownNames(targetName, target);
        if (knownNames.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> targetCode = target.flatMap(EntityRecord::code);

        boolean codeMatches = record.getOrganizationCode().isPresent()
                && targetCode.isPresent()
                && record.getOrganizationCode().get().equalsIgnoreCase(targetCode.get());
        Optional<String> matchingName = matchingNameField(record, knownNames);

        if (codeMatches && matchingName.isPresent()) {
            return Optional.of(exact(1.0, FIELD_CODE_AND_NAME, matchingName.get()));
        }
        if (codeMatches) {
            return Optional.of(exact(1.0, FIELD_CODE, record.getOrganizationCode().get()));
        }
        if (matchingName.isPresent()) {
            return Optional.of(exact(options.getExactNameScore(), FIELD_NAME, matchingName.get()));
        }

        FuzzyMatchOptions fuzzyOptions = options.toFuzzyMatchOptions();
        MatchResult best = null;
        for (Map.Entry<CandidateField, String> entry : record.getFields().entrySet()) {
            CandidateField field = entry.getKey();
            String value = entry.getValue();
            MatchResult candidate = knownNames.contains(fold(value))
                    ? exact(options.getExactNameScore(), field.label(), value)
                    : weightedFuzzy(knownNames, field, value, fuzzyOptions, options.getFuzzyCap());

            log.debug("match.field target='{}' field={} score={}", targetName, field.label(), candidate.score());
            // strictly greater, so an equal score keeps the higher-priority field
            if (best == null || candidate.score() > best.score()) {
                best = candidate;
            }
        }

        if (best == null || best.score() < options.getMinimumScore()) {
            log.debug("match.none target='{}' best={}", targetName, best != null ? best.score() : 0.0);
            return Optional.empty();
        }
        return Optional.of(best);
    }

    private MatchResult weightedFuzzy(Set<String> knownNames, CandidateField field, String value,
                                      FuzzyMatchOptions fuzzyOptions, double fuzzyCap) {
        MatchResult raw = null;
        for (String name : knownNames) {
            MatchResult result = context.getFuzzyMatcher().match(name, value, fuzzyOptions);
            if (raw == null || result.score() > raw.score()) {
                raw = result;
            }
        }
        double weighted = Math.min(raw.score() * field.weight(), fuzzyCap);
        return new MatchResult(weighted, MatchConfidence.fromScore(weighted), MatchAlgorithm.FIELD_WEIGHTED,
                field.label(), value, raw.distance());
    }

    private static Optional<String> matchingNameField(ForeignRecord record, Set<String> knownNames) {
        return record.getFields().entrySet().stream()
                .filter(e -> e.getKey().isNameField())
                .map(Map.Entry::getValue)
                .filter(value -> knownNames.contains(fold(value)))
                .findFirst();
    }

    private static Set<String> knownNames(String targetName, Optional<EntityRecord> target) {
        Set<String> names = new LinkedHashSet<>();
        names.add(fold(targetName));
        target.ifPresent(entity -> {
            names.add(fold(entity.name()));
            names.add(fold(entity.canonicalName()));
            entity.aliases().forEach(alias -> names.add(fold(alias)));
        });
        names.remove("");
        return names;
    }

    private static MatchResult exact(double score, String field, String text) {
        return new MatchResult(score, MatchConfidence.HIGH, MatchAlgorithm.EXACT, field, text, 0);
    }

    private static String fold(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
