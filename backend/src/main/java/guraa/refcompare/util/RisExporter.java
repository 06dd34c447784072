package guraa.refcompare.util;

import guraa.refcompare.model.RecordField;
import guraa.refcompare.model.ReferenceRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Writes reference records as RIS text.
 * Only the fields shown in comparison results are written: type, title,
 * authors, year, journal, DOI and abstract.
 */
public class RisExporter {

    // Tag-style title before primary_title, unlike the matching lookup order
    private static final List<String> TITLE_NAMES = List.of("title", "ti", "primary_title");

    private final String defaultReferenceType;

    public RisExporter(String defaultReferenceType) {
        this.defaultReferenceType = defaultReferenceType;
    }

    /**
     * Convert records to a RIS formatted string.
     *
     * @param records The records to export
     * @return RIS text, one block per record
     */
    public String export(List<ReferenceRecord> records) {
        List<String> lines = new ArrayList<>();

        for (ReferenceRecord record : records) {
            String type = record.resolveText(RecordField.REFERENCE_TYPE);
            if (!(record.resolve(RecordField.REFERENCE_TYPE) instanceof String) || type.isBlank()) {
                type = defaultReferenceType;
            }
            lines.add(line("TY", type));

            addIfPresent(lines, "TI", ReferenceRecord.asText(record.resolve(TITLE_NAMES)));

            for (String author : authors(record.resolve(RecordField.AUTHORS))) {
                lines.add(line("AU", author));
            }

            addIfPresent(lines, "PY", record.resolveText(RecordField.YEAR));
            addIfPresent(lines, "JO", record.resolveText(RecordField.JOURNAL));
            addIfPresent(lines, "DO", record.resolveText(RecordField.DOI));
            addIfPresent(lines, "AB", record.resolveText(RecordField.ABSTRACT));

            lines.add("ER  - \n");
        }

        return String.join("\n", lines);
    }

    private static List<String> authors(Object value) {
        List<String> authors = new ArrayList<>();
        if (value instanceof String) {
            authors.add((String) value);
        } else if (value instanceof Collection) {
            for (Object author : (Collection<?>) value) {
                if (author instanceof String && !((String) author).isBlank()) {
                    authors.add((String) author);
                }
            }
        }
        return authors;
    }

    private static void addIfPresent(List<String> lines, String tag, String value) {
        if (!value.isBlank()) {
            lines.add(line(tag, value));
        }
    }

    private static String line(String tag, String value) {
        return tag + "  - " + value;
    }
}
