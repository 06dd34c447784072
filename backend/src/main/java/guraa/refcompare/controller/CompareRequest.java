package guraa.refcompare.controller;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body for comparing two lists of already parsed references.
 * Elements are kept untyped so that malformed entries can be reported
 * instead of failing JSON binding.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompareRequest {

    @Builder.Default
    private List<Object> recordsA = new ArrayList<>();

    @Builder.Default
    private List<Object> recordsB = new ArrayList<>();

    /**
     * Null falls back to {@code app.matching.fuzzy-enabled}.
     */
    private Boolean useFuzzy;
}
