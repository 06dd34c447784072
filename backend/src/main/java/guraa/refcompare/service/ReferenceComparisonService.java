package guraa.refcompare.service;

import guraa.refcompare.config.AppProperties;
import guraa.refcompare.core.ConfidenceScorer;
import guraa.refcompare.core.ReferenceComparisonEngine;
import guraa.refcompare.model.ComparisonResult;
import guraa.refcompare.model.ComparisonStatistics;
import guraa.refcompare.model.ExportSubset;
import guraa.refcompare.model.MatchConfidence;
import guraa.refcompare.model.ReferenceRecord;
import guraa.refcompare.util.RisExporter;
import guraa.refcompare.util.RisParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Service for comparing reference lists, from parsed records or RIS uploads,
 * and exporting result subsets as RIS.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReferenceComparisonService {

    private static final String RIS_EXTENSION = ".ris";

    private final ReferenceComparisonEngine comparisonEngine;
    private final ConfidenceScorer confidenceScorer;
    private final RisParser risParser;
    private final RisExporter risExporter;
    private final AppProperties properties;

    /**
     * Compare two lists of records.
     *
     * @param recordsA Records of list A
     * @param recordsB Records of list B
     * @param useFuzzy Whether to run the fuzzy pass; null uses the configured default
     * @return The comparison result with statistics
     */
    public ComparisonResult compare(List<?> recordsA, List<?> recordsB, Boolean useFuzzy) {
        boolean fuzzy = useFuzzy != null ? useFuzzy : properties.getMatching().isFuzzyEnabled();
        int totalA = recordsA == null ? 0 : recordsA.size();
        int totalB = recordsB == null ? 0 : recordsB.size();

        ComparisonResult result = comparisonEngine.compare(recordsA, recordsB, fuzzy);
        result.setStatistics(ComparisonStatistics.builder()
                .overlapCount(result.getOverlap().size())
                .uniqueACount(result.getUniqueA().size())
                .uniqueBCount(result.getUniqueB().size())
                .totalA(totalA)
                .totalB(totalB)
                .fuzzyCount(result.getFuzzyMatchCount())
                .build());

        log.info("Compared {} references with {}: {} overlap ({} fuzzy), {} only in A, {} only in B",
                totalA, totalB, result.getOverlap().size(), result.getFuzzyMatchCount(),
                result.getUniqueA().size(), result.getUniqueB().size());
        return result;
    }

    /**
     * Compare two RIS documents.
     */
    public ComparisonResult compareRis(String risA, String risB, Boolean useFuzzy) {
        return compare(risParser.parse(risA), risParser.parse(risB), useFuzzy);
    }

    /**
     * Compare two uploaded RIS files.
     *
     * @throws IOException If a file cannot be read
     */
    public ComparisonResult compareFiles(MultipartFile fileA, MultipartFile fileB, Boolean useFuzzy)
            throws IOException {
        log.info("Comparing uploaded files {} ({} bytes) and {} ({} bytes)",
                fileA.getOriginalFilename(), fileA.getSize(), fileB.getOriginalFilename(), fileB.getSize());
        return compareRis(readText(fileA), readText(fileB), useFuzzy);
    }

    /**
     * Render one list of a comparison as RIS.
     *
     * @param result The comparison result
     * @param subset The list to export
     * @return RIS text
     */
    public String exportSubset(ComparisonResult result, ExportSubset subset) {
        List<ReferenceRecord> records;
        switch (subset) {
            case UNIQUE_A:
                records = result.getUniqueA();
                break;
            case UNIQUE_B:
                records = result.getUniqueB();
                break;
            case OVERLAP:
            default:
                records = result.getOverlap();
                break;
        }
        log.debug("Exporting {} records of subset {}", records.size(), subset.getValue());
        return risExporter.export(records);
    }

    /**
     * File name for an exported subset, always ending in {@code .ris}.
     */
    public String exportFileName(ExportSubset subset, String fileNameA, String fileNameB) {
        String nameA = StringUtils.hasText(fileNameA) ? fileNameA : "a";
        String nameB = StringUtils.hasText(fileNameB) ? fileNameB : "b";

        String fileName;
        switch (subset) {
            case UNIQUE_A:
                fileName = "unique_to_" + nameA;
                break;
            case UNIQUE_B:
                fileName = "unique_to_" + nameB;
                break;
            case OVERLAP:
            default:
                fileName = "overlap_" + nameA + "_" + nameB + RIS_EXTENSION;
                break;
        }
        return fileName.endsWith(RIS_EXTENSION) ? fileName : fileName + RIS_EXTENSION;
    }

    /**
     * Rate a single pair of records.
     */
    public MatchConfidence score(Object recordA, Object recordB) {
        return confidenceScorer.score(ReferenceRecord.from(recordA), ReferenceRecord.from(recordB));
    }

    private static String readText(MultipartFile file) throws IOException {
        try (InputStream in = file.getInputStream()) {
            return IOUtils.toString(in, StandardCharsets.UTF_8);
        }
    }
}
