package com.orgchart.resolution.matching;

import com.orgchart.resolution.core.model.EntityRecord;
import com.orgchart.resolution.rules.DefaultNormalizationRules;
import com.orgchart.resolution.rules.NameVariations;
import com.orgchart.resolution.rules.NormalizationEngine;
import com.orgchart.resolution.similarity.TokenOverlapSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Ties a free-text name from an external file (for example a CSV row) to one of the known
 * entities, listing every plausible candidate for review.
 */
public class EntityNameMatcher {
    private static final Logger log = LoggerFactory.getLogger(EntityNameMatcher.class);

    static final double CODE_MISMATCH_PENALTY = 0.5;
    static final double BEST_MATCH_THRESHOLD = 0.8;

    private final NormalizationEngine normalizationEngine;
    private final TokenOverlapSimilarity tokenOverlap = new TokenOverlapSimilarity();

    public EntityNameMatcher() {
        this(DefaultNormalizationRules.createDefaultEngine());
    }

    public EntityNameMatcher(NormalizationEngine normalizationEngine) {
        this.normalizationEngine = Objects.requireNonNull(normalizationEngine, "normalizationEngine");
    }

    /**
     * Finds the records matching a name.
     *
     * @param name       the name to look up
     * @param entityCode optional organization code, may be null
     * @param records    the known entities
     */
    public EntityMatchReport findMatches(String name, String entityCode, List<EntityRecord> records) {
        Objects.requireNonNull(records, "records");
        String folded = fold(name);
        if (folded.isEmpty()) {
            return EntityMatchReport.empty();
        }
        String code = entityCode == null || entityCode.isBlank() ? null : entityCode.trim();

        if (code != null) {
            Optional<EntityRecord> byCode = records.stream()
                    .filter(r -> r.code().map(code::equals).orElse(false))
                    .findFirst();
            if (byCode.isPresent()) {
                return single(new ScoredEntity(byCode.get(), 1.0, EntityMatchType.ENTITY_CODE));
            }
        }

        for (EntityRecord record : records) {
            Optional<EntityMatchType> exactType = exactMatchType(folded, record);
            if (exactType.isPresent()) {
                return single(new ScoredEntity(record, 1.0, exactType.get()));
            }
        }

        List<String> nameVariations = NameVariations.of(normalizationEngine.normalize(name));
        List<ScoredEntity> potential = new ArrayList<>();
        for (EntityRecord record : records) {
            ScoredEntity scored = partialScore(nameVariations, record);
            double score = scored.score();
            if (code != null && record.code().isPresent() && !record.code().get().equals(code)) {
                score = Math.max(0.0, score - CODE_MISMATCH_PENALTY);
            }
            if (score > 0) {
                potential.add(new ScoredEntity(record, score, scored.matchType()));
            }
        }
        potential.sort(Comparator.comparingDouble(ScoredEntity::score).reversed());

        ScoredEntity best = potential.stream()
                .filter(m -> m.score() > BEST_MATCH_THRESHOLD)
                .findFirst()
                .orElse(null);
        log.debug("name.match name='{}' candidates={} best={}",
                name, potential.size(), best != null ? best.record().name() : null);
        return new EntityMatchReport(best, potential);
    }

    private static Optional<EntityMatchType> exactMatchType(String folded, EntityRecord record) {
        if (fold(record.name()).equals(folded)) {
            return Optional.of(EntityMatchType.EXACT_NAME);
        }
        if (fold(record.canonicalName()).equals(folded)) {
            return Optional.of(EntityMatchType.CANONICAL_NAME);
        }
        if (record.aliases().stream().anyMatch(a -> fold(a).equals(folded))) {
            return Optional.of(EntityMatchType.ALIAS);
        }
        return Optional.empty();
    }

    private ScoredEntity partialScore(List<String> nameVariations, EntityRecord record) {
        List<String> recordVariations = new ArrayList<>(
                NameVariations.of(normalizationEngine.normalize(record.name())));
        recordVariations.addAll(NameVariations.of(normalizationEngine.normalize(record.canonicalName())));

        double best = 0.0;
        for (String variation : nameVariations) {
            for (String candidate : recordVariations) {
                best = Math.max(best, tokenOverlap.compute(variation, candidate));
            }
        }
        return new ScoredEntity(record, Math.min(1.0, best), EntityMatchType.PARTIAL);
    }

    private static EntityMatchReport single(ScoredEntity match) {
        return new EntityMatchReport(match, List.of(match));
    }

    private static String fold(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
