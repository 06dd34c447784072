package guraa.refcompare.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable bibliographic reference: an insertion-ordered mapping from
 * field name to value. Values are strings, numbers, lists of strings or absent.
 * Derived copies are produced with {@link #withField(String, Object)} and
 * {@link #withoutFields(Set)}; the original is never changed.
 */
public final class ReferenceRecord {

    private final Map<String, Object> fields;

    private ReferenceRecord(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    /**
     * Create a record from a field map. Entries with a null key are ignored.
     *
     * @param fields The fields
     * @return The record
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ReferenceRecord of(Map<String, ?> fields) {
        if (fields == null) {
            throw new InvalidRecordShapeException("Record must be a mapping of field names to values, got null");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((key, value) -> {
            if (key != null) {
                copy.put(key, value);
            }
        });
        return new ReferenceRecord(copy);
    }

    /**
     * Create a record from an arbitrary object, which must be a map or a record.
     *
     * @param candidate The candidate object
     * @return The record
     * @throws InvalidRecordShapeException if the candidate is not a mapping
     */
    public static ReferenceRecord from(Object candidate) {
        if (candidate instanceof ReferenceRecord) {
            return (ReferenceRecord) candidate;
        }
        if (!(candidate instanceof Map)) {
            String type = candidate == null ? "null" : candidate.getClass().getSimpleName();
            throw new InvalidRecordShapeException("Record must be a mapping of field names to values, got " + type);
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        ((Map<?, ?>) candidate).forEach((key, value) -> {
            if (key != null) {
                copy.put(key.toString(), value);
            }
        });
        return new ReferenceRecord(copy);
    }

    /**
     * Raw value stored under the exact field name.
     */
    public Object get(String name) {
        return fields.get(name);
    }

    public boolean has(String name) {
        return fields.containsKey(name);
    }

    /**
     * Resolve a logical field by walking its names in order.
     *
     * @param field The logical field
     * @return The first non-empty value, or null when every name is absent or empty
     */
    public Object resolve(RecordField field) {
        return resolve(field.names());
    }

    /**
     * Resolve the first non-empty value among the given field names.
     *
     * @param names Field names in lookup order
     * @return The first non-empty value, or null
     */
    public Object resolve(List<String> names) {
        for (String name : names) {
            Object value = fields.get(name);
            if (!isEmptyValue(value)) {
                return value;
            }
        }
        return null;
    }

    /**
     * Resolve a logical field as text. Strings are returned as is, numbers are
     * rendered without a fractional part when integral. Anything else is absent.
     *
     * @param field The logical field
     * @return The text value, or an empty string
     */
    public String resolveText(RecordField field) {
        return asText(resolve(field));
    }

    /**
     * Copy of this record with one field set.
     */
    public ReferenceRecord withField(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(name, value);
        return new ReferenceRecord(copy);
    }

    /**
     * Copy of this record without the given fields. Returns this instance when
     * none of them is present.
     */
    public ReferenceRecord withoutFields(Set<String> names) {
        if (names.stream().noneMatch(fields::containsKey)) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.keySet().removeAll(names);
        return new ReferenceRecord(copy);
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return fields;
    }

    /**
     * Text form of a field value: strings unchanged, integral numbers without
     * decimals, other numbers via {@link Double#toString(double)}. Collections,
     * maps, booleans and null yield an empty string.
     */
    public static String asText(Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Number && !isEmptyValue(value)) {
            double number = ((Number) value).doubleValue();
            if (number == Math.rint(number) && !Double.isInfinite(number)) {
                return Long.toString(((Number) value).longValue());
            }
            return Double.toString(number);
        }
        return "";
    }

    static boolean isEmptyValue(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String) {
            return ((String) value).isBlank();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        if (value instanceof Double) {
            return ((Double) value).isNaN();
        }
        if (value instanceof Float) {
            return ((Float) value).isNaN();
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReferenceRecord)) return false;
        return fields.equals(((ReferenceRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "ReferenceRecord" + fields;
    }
}
