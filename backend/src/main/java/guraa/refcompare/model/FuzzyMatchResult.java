package guraa.refcompare.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Outcome of the fuzzy pass over the residual lists.
 */
@Getter
@ToString
public class FuzzyMatchResult {
    private final List<MatchedPair> matches;
    private final List<ReferenceRecord> remainingA;
    private final List<ReferenceRecord> remainingB;

    /**
     * @param matches Accepted pairs in the order they were found
     * @param remainingA Unmatched records of A in their original order
     * @param remainingB Unmatched records of B in their original order
     */
    public FuzzyMatchResult(List<MatchedPair> matches, List<ReferenceRecord> remainingA,
                            List<ReferenceRecord> remainingB) {
        this.matches = List.copyOf(matches);
        this.remainingA = List.copyOf(remainingA);
        this.remainingB = List.copyOf(remainingB);
    }

    public int getMatchCount() {
        return matches.size();
    }
}
