package guraa.refcompare.core;

import guraa.refcompare.model.FuzzyMatchResult;
import guraa.refcompare.model.MatchConfidence;
import guraa.refcompare.model.MatchedPair;
import guraa.refcompare.model.RecordField;
import guraa.refcompare.model.ReferenceRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Recovers near-duplicate titles among references that failed exact matching.
 *
 * <p>Matching is greedy: list A is walked in order and each reference takes the
 * first not yet consumed reference of list B whose year agrees and whose
 * normalized title is similar enough. The result depends on input order and is
 * not an optimal assignment.</p>
 */
@Slf4j
public class FuzzyMatcher {

    public static final double DEFAULT_THRESHOLD = 0.90;

    private final ConfidenceScorer confidenceScorer;
    private final double threshold;
    private final int maxResidualSize;

    public FuzzyMatcher(ConfidenceScorer confidenceScorer) {
        this(confidenceScorer, DEFAULT_THRESHOLD, 0);
    }

    /**
     * @param confidenceScorer Scorer used to rate accepted pairs
     * @param threshold Minimum title similarity for a match
     * @param maxResidualSize Largest residual list the pass will scan, 0 for no limit
     */
    public FuzzyMatcher(ConfidenceScorer confidenceScorer, double threshold, int maxResidualSize) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Fuzzy threshold must be between 0.0 and 1.0, got " + threshold);
        }
        this.confidenceScorer = confidenceScorer;
        this.threshold = threshold;
        this.maxResidualSize = maxResidualSize;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * Match the residual lists using the configured threshold.
     */
    public FuzzyMatchResult fuzzyMatch(List<ReferenceRecord> uniqueA, List<ReferenceRecord> uniqueB) {
        return fuzzyMatch(uniqueA, uniqueB, threshold);
    }

    /**
     * Match the residual lists.
     *
     * @param uniqueA References only in list A
     * @param uniqueB References only in list B
     * @param threshold Minimum title similarity, inclusive
     * @return New matches and the references that are still unmatched, in original order
     */
    public FuzzyMatchResult fuzzyMatch(List<ReferenceRecord> uniqueA, List<ReferenceRecord> uniqueB,
                                       double threshold) {
        if (exceedsResidualLimit(uniqueA, uniqueB)) {
            log.warn("Skipping fuzzy pass: residual sizes {} x {} exceed limit {}",
                    uniqueA.size(), uniqueB.size(), maxResidualSize);
            return new FuzzyMatchResult(Collections.emptyList(), uniqueA, uniqueB);
        }

        List<MatchedPair> matches = new ArrayList<>();
        boolean[] matchedA = new boolean[uniqueA.size()];
        boolean[] matchedB = new boolean[uniqueB.size()];

        // Normalize B titles once, the inner loop visits them repeatedly
        List<String> titlesB = new ArrayList<>(uniqueB.size());
        List<String> yearsB = new ArrayList<>(uniqueB.size());
        for (ReferenceRecord itemB : uniqueB) {
            titlesB.add(TitleNormalizer.normalize(itemB.resolve(RecordField.TITLE)));
            yearsB.add(KeyGenerator.truncatedYear(itemB));
        }

        for (int i = 0; i < uniqueA.size(); i++) {
            ReferenceRecord itemA = uniqueA.get(i);
            String titleA = TitleNormalizer.normalize(itemA.resolve(RecordField.TITLE));
            if (titleA.isEmpty()) {
                continue;
            }
            String yearA = KeyGenerator.truncatedYear(itemA);

            for (int j = 0; j < uniqueB.size(); j++) {
                if (matchedB[j] || titlesB.get(j).isEmpty()) {
                    continue;
                }

                // Year must agree, both missing counts as agreement
                if (!yearA.equals(yearsB.get(j))) {
                    continue;
                }

                double similarity = SequenceMatcher.ratio(titleA, titlesB.get(j));
                if (similarity >= threshold) {
                    ReferenceRecord itemB = uniqueB.get(j);
                    MatchConfidence confidence = confidenceScorer.score(itemA, itemB);
                    matches.add(new MatchedPair(itemA, itemB,
                            confidence.getConfidence(), confidence.getReason(), true));
                    matchedA[i] = true;
                    matchedB[j] = true;
                    log.debug("Fuzzy match: A[{}] and B[{}], similarity: {}",
                            i, j, String.format("%.4f", similarity));
                    break;
                }
            }
        }

        return new FuzzyMatchResult(matches, unmatched(uniqueA, matchedA), unmatched(uniqueB, matchedB));
    }

    private boolean exceedsResidualLimit(List<ReferenceRecord> uniqueA, List<ReferenceRecord> uniqueB) {
        return maxResidualSize > 0 && (uniqueA.size() > maxResidualSize || uniqueB.size() > maxResidualSize);
    }

    private static List<ReferenceRecord> unmatched(List<ReferenceRecord> records, boolean[] matched) {
        List<ReferenceRecord> remaining = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            if (!matched[i]) {
                remaining.add(records.get(i));
            }
        }
        return remaining;
    }
}
