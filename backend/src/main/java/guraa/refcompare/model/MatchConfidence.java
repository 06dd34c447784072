package guraa.refcompare.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Advisory rating of how strongly two references are believed to be the same work.
 */
@Getter
@ToString
@EqualsAndHashCode
public class MatchConfidence {
    private final double confidence;
    private final String reason;

    /**
     * @param confidence Score between 0.0 and 1.0
     * @param reason Human readable explanation of the score
     */
    public MatchConfidence(double confidence, String reason) {
        this.confidence = confidence;
        this.reason = reason;
    }
}
