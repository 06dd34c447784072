package guraa.refcompare.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of comparing two reference lists.
 * The three record lists are the presentation projection: fuzzy matches
 * contribute only their A-side record to {@code overlap}. The full pairs,
 * B side included, are kept in {@code fuzzyPairs}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComparisonResult {

    /**
     * References present in both lists, taken from list A.
     */
    @Builder.Default
    private List<ReferenceRecord> overlap = new ArrayList<>();

    /**
     * References only in list A.
     */
    @Builder.Default
    private List<ReferenceRecord> uniqueA = new ArrayList<>();

    /**
     * References only in list B.
     */
    @Builder.Default
    private List<ReferenceRecord> uniqueB = new ArrayList<>();

    /**
     * Pairs accepted by the fuzzy pass, with both sides and a confidence score.
     */
    @Builder.Default
    private List<MatchedPair> fuzzyPairs = new ArrayList<>();

    /**
     * Counts for the comparison; filled in by the service layer.
     */
    private ComparisonStatistics statistics;

    public int getFuzzyMatchCount() {
        return fuzzyPairs.size();
    }
}
