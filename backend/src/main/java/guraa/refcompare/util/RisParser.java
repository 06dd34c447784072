package guraa.refcompare.util;

import guraa.refcompare.model.RecordField;
import guraa.refcompare.model.ReferenceRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads RIS text into reference records.
 *
 * <p>Each line has the form {@code TAG  - value}. {@code TY} opens a record and
 * {@code ER} closes it. Well known tags are stored under readable field names,
 * every other tag under its lowercase form. Lines without a tag continue the
 * value of the previous tag.</p>
 */
@Slf4j
public class RisParser {

    private static final Pattern TAG_LINE = Pattern.compile("^([A-Z][A-Z0-9]) {1,2}-(?: (.*))?$");

    private static final String START_TAG = "TY";
    private static final String END_TAG = "ER";

    private static final Map<String, String> FIELD_NAMES = Map.ofEntries(
            Map.entry("TY", RecordField.REFERENCE_TYPE.canonicalName()),
            Map.entry("TI", RecordField.TITLE.canonicalName()),
            Map.entry("T1", "primary_title"),
            Map.entry("AU", RecordField.AUTHORS.canonicalName()),
            Map.entry("A1", RecordField.AUTHORS.canonicalName()),
            Map.entry("PY", RecordField.YEAR.canonicalName()),
            Map.entry("JO", RecordField.JOURNAL.canonicalName()),
            Map.entry("JF", RecordField.JOURNAL.canonicalName()),
            Map.entry("DO", RecordField.DOI.canonicalName()),
            Map.entry("AB", RecordField.ABSTRACT.canonicalName()),
            Map.entry("KW", "keywords"),
            Map.entry("UR", "urls")
    );

    private static final Set<String> LIST_FIELDS = Set.of("authors", "keywords", "urls");

    /**
     * Parse RIS text.
     *
     * @param text The RIS content
     * @return The records in file order
     */
    public List<ReferenceRecord> parse(String text) {
        List<ReferenceRecord> records = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return records;
        }

        Map<String, Object> current = null;
        String lastField = null;
        int lineNumber = 0;

        for (String rawLine : stripBom(text).split("\\r?\\n|\\r")) {
            lineNumber++;
            String line = rawLine.stripTrailing();
            if (line.isEmpty()) {
                continue;
            }

            Matcher matcher = TAG_LINE.matcher(line);
            if (!matcher.matches()) {
                if (current != null && lastField != null) {
                    appendContinuation(current, lastField, line.strip());
                } else {
                    log.warn("Ignoring line {} outside of a record: {}", lineNumber, line);
                }
                continue;
            }

            String tag = matcher.group(1);
            String value = matcher.group(2) == null ? "" : matcher.group(2).strip();

            if (START_TAG.equals(tag)) {
                if (current != null) {
                    log.warn("Record opened at line {} before the previous one was closed", lineNumber);
                    records.add(ReferenceRecord.of(current));
                }
                current = new LinkedHashMap<>();
                lastField = null;
            } else if (END_TAG.equals(tag)) {
                if (current != null) {
                    records.add(ReferenceRecord.of(current));
                }
                current = null;
                lastField = null;
                continue;
            } else if (current == null) {
                log.warn("Ignoring tag {} at line {} outside of a record", tag, lineNumber);
                continue;
            }

            if (value.isEmpty()) {
                continue;
            }
            lastField = fieldName(tag);
            putValue(current, lastField, value);
        }

        if (current != null && !current.isEmpty()) {
            log.warn("Last record is missing its ER line, keeping it");
            records.add(ReferenceRecord.of(current));
        }

        log.debug("Parsed {} RIS records", records.size());
        return records;
    }

    /**
     * Field name a tag is stored under.
     */
    static String fieldName(String tag) {
        return FIELD_NAMES.getOrDefault(tag, tag.toLowerCase(Locale.ROOT));
    }

    @SuppressWarnings("unchecked")
    private static void putValue(Map<String, Object> record, String field, String value) {
        if (LIST_FIELDS.contains(field)) {
            ((List<String>) record.computeIfAbsent(field, key -> new ArrayList<String>())).add(value);
        } else if (!record.containsKey(field)) {
            record.put(field, value);
        } else {
            log.debug("Ignoring repeated value for field {}", field);
        }
    }

    @SuppressWarnings("unchecked")
    private static void appendContinuation(Map<String, Object> record, String field, String text) {
        Object existing = record.get(field);
        if (existing instanceof List) {
            List<String> values = (List<String>) existing;
            int last = values.size() - 1;
            values.set(last, values.get(last) + " " + text);
        } else if (existing instanceof String) {
            record.put(field, existing + " " + text);
        }
    }

    private static String stripBom(String text) {
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }
}
