package guraa.refcompare.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary of a single reference list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReferenceAnalysis {

    @JsonProperty("total_records")
    private int totalRecords;

    @JsonProperty("with_doi")
    private int withDoi;

    @JsonProperty("with_abstract")
    private int withAbstract;

    @JsonProperty("without_year")
    private int withoutYear;

    /**
     * References whose matching key repeats one seen earlier in the list.
     */
    @JsonProperty("duplicate_count")
    private int duplicateCount;

    /**
     * Year to count, oldest first.
     */
    @Builder.Default
    @JsonProperty("records_by_year")
    private Map<String, Integer> recordsByYear = new LinkedHashMap<>();

    /**
     * Reference type to count, most frequent first.
     */
    @Builder.Default
    @JsonProperty("records_by_type")
    private Map<String, Integer> recordsByType = new LinkedHashMap<>();

    @Builder.Default
    @JsonProperty("top_journals")
    private Map<String, Integer> topJournals = new LinkedHashMap<>();
}
