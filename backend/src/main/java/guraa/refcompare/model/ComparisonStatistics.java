package guraa.refcompare.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counts describing a comparison, as shown next to the result lists.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComparisonStatistics {

    @JsonProperty("overlap_count")
    private int overlapCount;

    @JsonProperty("unique_a_count")
    private int uniqueACount;

    @JsonProperty("unique_b_count")
    private int uniqueBCount;

    @JsonProperty("total_a")
    private int totalA;

    @JsonProperty("total_b")
    private int totalB;

    @JsonProperty("fuzzy_count")
    private int fuzzyCount;
}
