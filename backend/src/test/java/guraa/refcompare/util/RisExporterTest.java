package guraa.refcompare.util;

import guraa.refcompare.model.ReferenceRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static guraa.refcompare.RecordFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;

class RisExporterTest {

    private final RisExporter exporter = new RisExporter("JOUR");

    @Test
    void export_shouldWriteKnownFieldsInOrder() {
        ReferenceRecord reference = record(
                "type_of_reference", "BOOK",
                "title", "Graph Theory",
                "authors", List.of("Smith, J.", "Doe, A."),
                "year", "2001",
                "journal_name", "Discrete Math",
                "doi", "10.1/gt",
                "abstract", "About graphs.",
                "keywords", List.of("graphs"));

        String ris = exporter.export(List.of(reference));

        assertThat(ris).isEqualTo(String.join("\n",
                "TY  - BOOK",
                "TI  - Graph Theory",
                "AU  - Smith, J.",
                "AU  - Doe, A.",
                "PY  - 2001",
                "JO  - Discrete Math",
                "DO  - 10.1/gt",
                "AB  - About graphs.",
                "ER  - \n"));
    }

    @Test
    void export_shouldFallBackToDefaultTypeAndSkipMissingValues() {
        ReferenceRecord reference = record(
                "type_of_reference", Double.NaN,
                "title", Double.NaN,
                "authors", "Single Author",
                "year", 2023.0);

        String ris = exporter.export(List.of(reference));

        assertThat(ris).isEqualTo("TY  - JOUR\nAU  - Single Author\nPY  - 2023\nER  - \n");
    }

    @Test
    void export_shouldUseAliasFields() {
        String ris = exporter.export(List.of(record("ti", "Tagged", "au", List.of("X"), "py", "1999",
                "t2", "Journal", "do", "10.2/x", "n2", "Notes")));

        assertThat(ris).contains("TI  - Tagged", "AU  - X", "PY  - 1999", "JO  - Journal", "DO  - 10.2/x", "AB  - Notes");
    }

    @Test
    void export_shouldPreferTaggedTitleOverPrimaryTitle() {
        String ris = exporter.export(List.of(record("primary_title", "Primary", "ti", "Tagged")));

        assertThat(ris).contains("TI  - Tagged").doesNotContain("Primary");
    }

    @Test
    void export_shouldFallBackToPrimaryTitle() {
        String ris = exporter.export(List.of(record("primary_title", "Primary", "ti", " ")));

        assertThat(ris).contains("TI  - Primary");
    }

    @Test
    void export_shouldSeparateRecordsWithBlankLine() {
        String ris = exporter.export(List.of(record("title", "One"), record("title", "Two")));

        assertThat(ris).isEqualTo("TY  - JOUR\nTI  - One\nER  - \n\nTY  - JOUR\nTI  - Two\nER  - \n");
    }

    @Test
    void export_shouldReturnEmptyStringForNoRecords() {
        assertThat(exporter.export(List.of())).isEmpty();
    }
}
