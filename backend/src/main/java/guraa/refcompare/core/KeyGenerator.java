package guraa.refcompare.core;

import guraa.refcompare.model.RecordField;
import guraa.refcompare.model.ReferenceRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Derives the exact-match key of a reference.
 *
 * <p>Priority:</p>
 * <ol>
 *   <li>DOI, trimmed and lowercased: {@code DOI:10.1234/x}</li>
 *   <li>Normalized title plus the first four characters of the year:
 *       {@code TY:machinelearning_2023}. Without a year the normalized title
 *       length stands in, {@code TY:machinelearning_NOYEAR_15}, so that two
 *       undated references only collide when their titles are identical.</li>
 * </ol>
 */
@Slf4j
public class KeyGenerator {

    public static final String DOI_PREFIX = "DOI:";
    public static final String TITLE_YEAR_PREFIX = "TY:";
    public static final String NO_YEAR_PREFIX = "NOYEAR_";

    private static final int YEAR_LENGTH = 4;

    /**
     * Generate the matching key for a reference. Never returns an empty key.
     *
     * @param record The reference
     * @return The key
     */
    public String generateKey(ReferenceRecord record) {
        String doi = normalizedDoi(record);
        if (!doi.isEmpty()) {
            return DOI_PREFIX + doi;
        }

        String title = TitleNormalizer.normalize(record.resolve(RecordField.TITLE));
        String year = truncatedYear(record);
        String yearComponent = year.isEmpty() ? NO_YEAR_PREFIX + title.length() : year;

        return TITLE_YEAR_PREFIX + title + "_" + yearComponent;
    }

    /**
     * DOI of a reference, trimmed and lowercased, or an empty string.
     *
     * @param record The reference
     * @return The normalized DOI
     */
    public static String normalizedDoi(ReferenceRecord record) {
        return record.resolveText(RecordField.DOI).strip().toLowerCase(Locale.ROOT);
    }

    /**
     * First four characters of the stringified year, or an empty string when
     * the year is absent or of a type that has no year reading.
     *
     * @param record The reference
     * @return The truncated year
     */
    public static String truncatedYear(ReferenceRecord record) {
        Object value = record.resolve(RecordField.YEAR);
        String year = ReferenceRecord.asText(value);
        if (year.isEmpty() && value != null) {
            log.debug("Ignoring year of unsupported type {}", value.getClass().getSimpleName());
        }
        return year.length() > YEAR_LENGTH ? year.substring(0, YEAR_LENGTH) : year;
    }
}
