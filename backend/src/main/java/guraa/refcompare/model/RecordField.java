package guraa.refcompare.model;

import java.util.List;

/**
 * Logical fields of a bibliographic reference together with the field names
 * they may appear under. Parsers emit either the canonical name or one of the
 * tag-style aliases, so lookups walk the names in order and take the first
 * non-empty value.
 */
public enum RecordField {

    DOI("doi", "do"),
    TITLE("title", "primary_title", "ti"),
    YEAR("year", "py", "y1"),
    JOURNAL("journal_name", "jo", "t2"),
    ABSTRACT("abstract", "ab", "n2"),
    AUTHORS("authors", "au"),
    REFERENCE_TYPE("type_of_reference");

    private final List<String> names;

    RecordField(String... names) {
        this.names = List.of(names);
    }

    /**
     * @return the canonical field name
     */
    public String canonicalName() {
        return names.get(0);
    }

    /**
     * @return canonical name followed by its aliases, in lookup order
     */
    public List<String> names() {
        return names;
    }
}
