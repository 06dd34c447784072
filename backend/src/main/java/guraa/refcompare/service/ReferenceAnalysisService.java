package guraa.refcompare.service;

import guraa.refcompare.core.ReferenceAnalyzer;
import guraa.refcompare.model.ReferenceAnalysis;
import guraa.refcompare.model.ReferenceRecord;
import guraa.refcompare.util.RisParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Service for summarizing a single reference list.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReferenceAnalysisService {

    private final ReferenceAnalyzer referenceAnalyzer;
    private final RisParser risParser;

    /**
     * Parse an uploaded RIS file.
     *
     * @param file The RIS upload
     * @return The parsed references
     * @throws IOException If the file cannot be read
     */
    public List<ReferenceRecord> parseFile(MultipartFile file) throws IOException {
        log.info("Parsing uploaded file {} ({} bytes)", file.getOriginalFilename(), file.getSize());
        try (InputStream in = file.getInputStream()) {
            return risParser.parse(IOUtils.toString(in, StandardCharsets.UTF_8));
        }
    }

    /**
     * Summarize references given as records or field maps.
     *
     * @throws guraa.refcompare.model.InvalidRecordShapeException if an element is not a mapping
     */
    public ReferenceAnalysis analyze(List<?> records) {
        List<ReferenceRecord> parsed = new ArrayList<>();
        if (records != null) {
            for (Object candidate : records) {
                parsed.add(ReferenceRecord.from(candidate));
            }
        }

        ReferenceAnalysis analysis = referenceAnalyzer.analyze(parsed);
        log.info("Analyzed {} references: {} with DOI, {} without year, {} duplicates",
                analysis.getTotalRecords(), analysis.getWithDoi(), analysis.getWithoutYear(),
                analysis.getDuplicateCount());
        return analysis;
    }
}
