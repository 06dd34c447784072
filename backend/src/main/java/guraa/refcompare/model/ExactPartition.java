package guraa.refcompare.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Set;

/**
 * Outcome of exact key matching: the key sets and the records filtered back
 * from their origin list. Overlap records are taken from list A.
 */
@Getter
@ToString
public class ExactPartition {
    private final Set<String> overlapKeys;
    private final Set<String> uniqueAKeys;
    private final Set<String> uniqueBKeys;
    private final List<ReferenceRecord> overlap;
    private final List<ReferenceRecord> uniqueA;
    private final List<ReferenceRecord> uniqueB;

    public ExactPartition(Set<String> overlapKeys, Set<String> uniqueAKeys, Set<String> uniqueBKeys,
                          List<ReferenceRecord> overlap, List<ReferenceRecord> uniqueA,
                          List<ReferenceRecord> uniqueB) {
        this.overlapKeys = Set.copyOf(overlapKeys);
        this.uniqueAKeys = Set.copyOf(uniqueAKeys);
        this.uniqueBKeys = Set.copyOf(uniqueBKeys);
        this.overlap = List.copyOf(overlap);
        this.uniqueA = List.copyOf(uniqueA);
        this.uniqueB = List.copyOf(uniqueB);
    }
}
