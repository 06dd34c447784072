package guraa.refcompare.core;

import guraa.refcompare.model.ComparisonResult;
import guraa.refcompare.model.ExactPartition;
import guraa.refcompare.model.FuzzyMatchResult;
import guraa.refcompare.model.MatchedPair;
import guraa.refcompare.model.ReferenceRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Entry point of reference comparison: exact key matching, then an optional
 * fuzzy pass over what is left, then cleanup of the output records.
 *
 * <p>A fuzzy match contributes only its A-side record, flagged with
 * {@value #FUZZY_MATCH_FIELD}, to the overlap list. The B-side record is not
 * listed anywhere in the three record lists; it remains available through
 * {@link ComparisonResult#getFuzzyPairs()}.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class ReferenceComparisonEngine {

    public static final String FUZZY_MATCH_FIELD = "fuzzy_match";
    public static final String TEMP_KEY_FIELD = "temp_key";

    private static final Set<String> INTERNAL_FIELDS = Set.of(TEMP_KEY_FIELD);

    private final ExactMatcher exactMatcher;
    private final FuzzyMatcher fuzzyMatcher;

    /**
     * Compare two reference lists with fuzzy matching enabled.
     */
    public ComparisonResult compare(List<?> recordsA, List<?> recordsB) {
        return compare(recordsA, recordsB, true);
    }

    /**
     * Compare two reference lists.
     *
     * @param recordsA References from list A, each a map of field names to values
     * @param recordsB References from list B, each a map of field names to values
     * @param useFuzzy Whether to run the fuzzy pass over unmatched references
     * @return Overlap, unique to A and unique to B, in input order
     * @throws guraa.refcompare.model.InvalidRecordShapeException if an element is not a mapping
     */
    public ComparisonResult compare(List<?> recordsA, List<?> recordsB, boolean useFuzzy) {
        List<ReferenceRecord> listA = toRecords(recordsA);
        List<ReferenceRecord> listB = toRecords(recordsB);

        if (listA.isEmpty() || listB.isEmpty()) {
            return ComparisonResult.builder()
                    .uniqueA(cleanup(listA))
                    .uniqueB(cleanup(listB))
                    .build();
        }

        ExactPartition partition = exactMatcher.partition(listA, listB);

        List<ReferenceRecord> overlap = new ArrayList<>(partition.getOverlap());
        List<ReferenceRecord> uniqueA = partition.getUniqueA();
        List<ReferenceRecord> uniqueB = partition.getUniqueB();
        List<MatchedPair> fuzzyPairs = Collections.emptyList();

        if (useFuzzy && !uniqueA.isEmpty() && !uniqueB.isEmpty()) {
            FuzzyMatchResult fuzzy = fuzzyMatcher.fuzzyMatch(uniqueA, uniqueB);
            fuzzyPairs = fuzzy.getMatches();
            for (MatchedPair pair : fuzzyPairs) {
                overlap.add(pair.getRecordA().withField(FUZZY_MATCH_FIELD, Boolean.TRUE));
            }
            uniqueA = fuzzy.getRemainingA();
            uniqueB = fuzzy.getRemainingB();
        }

        log.debug("Compared {} and {} references: {} overlap ({} fuzzy), {} only in A, {} only in B",
                listA.size(), listB.size(), overlap.size(), fuzzyPairs.size(), uniqueA.size(), uniqueB.size());

        return ComparisonResult.builder()
                .overlap(cleanup(overlap))
                .uniqueA(cleanup(uniqueA))
                .uniqueB(cleanup(uniqueB))
                .fuzzyPairs(new ArrayList<>(fuzzyPairs))
                .build();
    }

    private static List<ReferenceRecord> toRecords(List<?> candidates) {
        if (candidates == null) {
            return Collections.emptyList();
        }
        List<ReferenceRecord> records = new ArrayList<>(candidates.size());
        for (Object candidate : candidates) {
            records.add(ReferenceRecord.from(candidate));
        }
        return records;
    }

    private static List<ReferenceRecord> cleanup(List<ReferenceRecord> records) {
        List<ReferenceRecord> cleaned = new ArrayList<>(records.size());
        for (ReferenceRecord record : records) {
            cleaned.add(record.withoutFields(INTERNAL_FIELDS));
        }
        return cleaned;
    }
}
