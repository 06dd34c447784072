package guraa.refcompare.model;

import lombok.Getter;
import lombok.ToString;

/**
 * A pair of references from the two compared lists that were judged to be the same work.
 */
@Getter
@ToString
public class MatchedPair {
    private final ReferenceRecord recordA;
    private final ReferenceRecord recordB;
    private final double confidence;
    private final String reason;
    private final boolean fuzzy;

    /**
     * Constructor for a matched pair.
     *
     * @param recordA The reference from list A
     * @param recordB The reference from list B
     * @param confidence Confidence score between 0.0 and 1.0
     * @param reason Explanation of the confidence score
     * @param fuzzy Whether the pair was accepted by title similarity rather than key equality
     */
    public MatchedPair(ReferenceRecord recordA, ReferenceRecord recordB,
                       double confidence, String reason, boolean fuzzy) {
        this.recordA = recordA;
        this.recordB = recordB;
        this.confidence = confidence;
        this.reason = reason;
        this.fuzzy = fuzzy;
    }
}
