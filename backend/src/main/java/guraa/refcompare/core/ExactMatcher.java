package guraa.refcompare.core;

import guraa.refcompare.model.ExactPartition;
import guraa.refcompare.model.ReferenceRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits two reference lists into overlap, unique to A and unique to B by
 * set operations over their matching keys.
 *
 * <p>References sharing a key within the same list are not collapsed: every
 * one of them ends up in the partition its key belongs to.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class ExactMatcher {

    private final KeyGenerator keyGenerator;

    /**
     * Partition two reference lists by key.
     *
     * @param recordsA References from list A
     * @param recordsB References from list B
     * @return The partition; overlap records are taken from list A
     */
    public ExactPartition partition(List<ReferenceRecord> recordsA, List<ReferenceRecord> recordsB) {
        if (recordsA.isEmpty() || recordsB.isEmpty()) {
            return new ExactPartition(Collections.emptySet(), Collections.emptySet(), Collections.emptySet(),
                    Collections.emptyList(), recordsA, recordsB);
        }

        // Keys live only for this call, aligned by index with their records
        List<String> keysA = generateKeys(recordsA);
        List<String> keysB = generateKeys(recordsB);

        Set<String> keySetA = new LinkedHashSet<>(keysA);
        Set<String> keySetB = new LinkedHashSet<>(keysB);

        Set<String> overlapKeys = new LinkedHashSet<>(keySetA);
        overlapKeys.retainAll(keySetB);

        Set<String> uniqueAKeys = new LinkedHashSet<>(keySetA);
        uniqueAKeys.removeAll(keySetB);

        Set<String> uniqueBKeys = new LinkedHashSet<>(keySetB);
        uniqueBKeys.removeAll(keySetA);

        List<ReferenceRecord> overlap = new ArrayList<>();
        List<ReferenceRecord> uniqueA = new ArrayList<>();
        for (int i = 0; i < recordsA.size(); i++) {
            if (overlapKeys.contains(keysA.get(i))) {
                overlap.add(recordsA.get(i));
            } else {
                uniqueA.add(recordsA.get(i));
            }
        }

        List<ReferenceRecord> uniqueB = new ArrayList<>();
        for (int j = 0; j < recordsB.size(); j++) {
            if (uniqueBKeys.contains(keysB.get(j))) {
                uniqueB.add(recordsB.get(j));
            }
        }

        log.debug("Exact keys: {} shared, {} only in A, {} only in B",
                overlapKeys.size(), uniqueAKeys.size(), uniqueBKeys.size());

        return new ExactPartition(overlapKeys, uniqueAKeys, uniqueBKeys, overlap, uniqueA, uniqueB);
    }

    private List<String> generateKeys(List<ReferenceRecord> records) {
        List<String> keys = new ArrayList<>(records.size());
        for (ReferenceRecord record : records) {
            keys.add(keyGenerator.generateKey(record));
        }
        return keys;
    }
}
