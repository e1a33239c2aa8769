package com.orgchart.resolution.similarity;

import com.orgchart.resolution.core.model.MatchAlgorithm;
import com.orgchart.resolution.core.model.MatchConfidence;
import com.orgchart.resolution.core.model.MatchResult;
import com.orgchart.resolution.rules.DefaultNormalizationRules;
import com.orgchart.resolution.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Combines exact, substring, Jaro-Winkler, Levenshtein and Soundex evidence into one score.
 *
 * <ol>
 *   <li>Equal normalized strings, two empty ones included, score 1.0 ({@code exact}).</li>
 *   <li>With {@code preferExact}, containment scores shorter/longer length and returns
 *       ({@code substring}) when that reaches the threshold.</li>
 *   <li>Otherwise the better of Jaro-Winkler and normalized Levenshtein wins.</li>
 *   <li>With {@code usePhonetic}, equal Soundex codes lift the score to at least 0.7. Strings
 *       without letters share the code {@code 0000}.</li>
 * </ol>
 *
 * <p>Stateless and thread-safe.</p>
 */
public class FuzzyMatcher {
    private static final Logger log = LoggerFactory.getLogger(FuzzyMatcher.class);

    static final double SOUNDEX_FLOOR = 0.7;

    private final NormalizationEngine normalizationEngine;
    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();
    private final JaroWinklerSimilarity jaroWinkler = new JaroWinklerSimilarity();
    private final Soundex soundex = new Soundex();

    /**
     * Creates a matcher comparing lower-cased, trimmed, whitespace-collapsed strings.
     */
    public FuzzyMatcher() {
        this(DefaultNormalizationRules.createBasicEngine());
    }

    public FuzzyMatcher(NormalizationEngine normalizationEngine) {
        this.normalizationEngine = Objects.requireNonNull(normalizationEngine, "normalizationEngine");
    }

    public MatchResult match(String target, String candidate) {
        return match(target, candidate, FuzzyMatchOptions.defaults());
    }

    /**
     * Compares two strings. Never returns null; a candidate with nothing in common scores 0.0.
     */
    public MatchResult match(String target, String candidate, FuzzyMatchOptions options) {
        Objects.requireNonNull(options, "options");
        return matchNormalized(normalizationEngine.normalize(target),
                normalizationEngine.normalize(candidate), candidate, options);
    }

    /**
     * Scores every candidate against the target and returns those at or above the threshold,
     * best first, at most {@code limit}. Equal scores keep the candidates' original order.
     */
    public List<RankedMatch> findBestMatch(String target, List<String> candidates, FuzzyMatchOptions options) {
        Objects.requireNonNull(options, "options");
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        String normalizedTarget = normalizationEngine.normalize(target);
        List<RankedMatch> matches = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            String candidate = candidates.get(i);
            MatchResult result = matchNormalized(normalizedTarget,
                    normalizationEngine.normalize(candidate), candidate, options);
            if (result.score() >= options.getThreshold()) {
                matches.add(new RankedMatch(candidate, i, result));
            }
        }

        // List.sort is stable, so ties stay in input order
        matches.sort(Comparator.comparingDouble(RankedMatch::score).reversed());
        return matches.size() > options.getLimit()
                ? List.copyOf(matches.subList(0, options.getLimit()))
                : List.copyOf(matches);
    }

    public List<RankedMatch> findBestMatch(String target, List<String> candidates) {
        return findBestMatch(target, candidates, FuzzyMatchOptions.defaults());
    }

    public NormalizationEngine getNormalizationEngine() {
        return normalizationEngine;
    }

    private MatchResult matchNormalized(String s1, String s2, String candidate, FuzzyMatchOptions options) {
        if (s1.equals(s2)) {
            return new MatchResult(1.0, MatchConfidence.HIGH, MatchAlgorithm.EXACT, null, candidate, 0);
        }

        if (options.isPreferExact() && !s1.isEmpty() && !s2.isEmpty()
                && (s1.contains(s2) || s2.contains(s1))) {
            int longer = Math.max(s1.length(), s2.length());
            int shorter = Math.min(s1.length(), s2.length());
            double score = (double) shorter / longer;
            if (score >= options.getThreshold()) {
                return MatchResult.of(score, MatchAlgorithm.SUBSTRING, candidate, longer - shorter);
            }
        }

        double jaroWinklerScore = jaroWinkler.compute(s1, s2);
        int distance = levenshtein.distance(s1, s2);
        int maxLength = Math.max(s1.length(), s2.length());
        double levenshteinScore = maxLength > 0 ? 1.0 - ((double) distance / maxLength) : 0.0;

        double bestScore = Math.max(jaroWinklerScore, levenshteinScore);
        MatchAlgorithm bestAlgorithm = jaroWinklerScore > levenshteinScore
                ? MatchAlgorithm.JARO_WINKLER
                : MatchAlgorithm.LEVENSHTEIN;

        if (options.isUsePhonetic() && bestScore <= SOUNDEX_FLOOR && soundex.sounds(s1, s2)) {
            bestScore = SOUNDEX_FLOOR;
            bestAlgorithm = MatchAlgorithm.SOUNDEX;
        }

        log.debug("Fuzzy scores for '{}' vs '{}': Jaro-Winkler={}, Levenshtein={}, best={} ({})",
                s1, s2, jaroWinklerScore, levenshteinScore, bestScore, bestAlgorithm);

        return MatchResult.of(bestScore, bestAlgorithm, candidate, distance);
    }
}
