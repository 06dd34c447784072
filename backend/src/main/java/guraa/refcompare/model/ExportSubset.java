package guraa.refcompare.model;

import java.util.Arrays;

/**
 * The result list a RIS export is taken from.
 */
public enum ExportSubset {
    OVERLAP("overlap"),
    UNIQUE_A("unique_a"),
    UNIQUE_B("unique_b");

    private final String value;

    ExportSubset(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Look up a subset by its request value.
     *
     * @param value One of {@code overlap}, {@code unique_a}, {@code unique_b}
     * @return The subset
     * @throws IllegalArgumentException for any other value
     */
    public static ExportSubset fromValue(String value) {
        return Arrays.stream(values())
                .filter(subset -> subset.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown export subset: " + value));
    }
}
