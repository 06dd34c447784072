package guraa.refcompare.core;

import guraa.refcompare.model.RecordField;
import guraa.refcompare.model.ReferenceAnalysis;
import guraa.refcompare.model.ReferenceRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Computes summary counts for one reference list: identifiers present, years,
 * reference types, journals and in-list duplicates.
 */
@Slf4j
public class ReferenceAnalyzer {

    public static final String UNKNOWN_TYPE = "UNKNOWN";

    private final KeyGenerator keyGenerator;
    private final int topJournalLimit;

    /**
     * @param keyGenerator Key generator used to spot duplicates within the list
     * @param topJournalLimit Number of journals to report, at least 1
     */
    public ReferenceAnalyzer(KeyGenerator keyGenerator, int topJournalLimit) {
        if (topJournalLimit < 1) {
            throw new IllegalArgumentException("Top journal limit must be at least 1, got " + topJournalLimit);
        }
        this.keyGenerator = keyGenerator;
        this.topJournalLimit = topJournalLimit;
    }

    /**
     * Analyze a reference list.
     *
     * @param records The references
     * @return The summary
     */
    public ReferenceAnalysis analyze(List<ReferenceRecord> records) {
        int withDoi = 0;
        int withAbstract = 0;
        int withoutYear = 0;
        int duplicates = 0;

        Map<String, Integer> byYear = new TreeMap<>();
        Map<String, Integer> byType = new HashMap<>();
        Map<String, Integer> byJournal = new HashMap<>();
        Set<String> seenKeys = new HashSet<>();

        for (ReferenceRecord record : records) {
            boolean hasDoi = !KeyGenerator.normalizedDoi(record).isEmpty();
            if (hasDoi) {
                withDoi++;
            }
            if (!record.resolveText(RecordField.ABSTRACT).isBlank()) {
                withAbstract++;
            }

            String year = KeyGenerator.truncatedYear(record);
            if (year.isBlank()) {
                withoutYear++;
            } else {
                byYear.merge(year, 1, Integer::sum);
            }

            String type = record.resolveText(RecordField.REFERENCE_TYPE).strip();
            byType.merge(type.isEmpty() ? UNKNOWN_TYPE : type, 1, Integer::sum);

            String journal = record.resolveText(RecordField.JOURNAL).strip();
            if (!journal.isEmpty()) {
                byJournal.merge(journal, 1, Integer::sum);
            }

            // Untitled references without a DOI share a key but are not duplicates
            boolean identifiable = hasDoi || !TitleNormalizer.normalize(record.resolve(RecordField.TITLE)).isEmpty();
            if (identifiable && !seenKeys.add(keyGenerator.generateKey(record))) {
                duplicates++;
            }
        }

        log.debug("Analyzed {} references: {} with DOI, {} duplicates", records.size(), withDoi, duplicates);

        return ReferenceAnalysis.builder()
                .totalRecords(records.size())
                .withDoi(withDoi)
                .withAbstract(withAbstract)
                .withoutYear(withoutYear)
                .duplicateCount(duplicates)
                .recordsByYear(new LinkedHashMap<>(byYear))
                .recordsByType(byCountDescending(byType, Integer.MAX_VALUE))
                .topJournals(byCountDescending(byJournal, topJournalLimit))
                .build();
    }

    private static Map<String, Integer> byCountDescending(Map<String, Integer> counts, int limit) {
        Map<String, Integer> sorted = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(limit)
                .forEach(entry -> sorted.put(entry.getKey(), entry.getValue()));
        return sorted;
    }
}
