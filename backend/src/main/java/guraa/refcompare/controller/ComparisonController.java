package guraa.refcompare.controller;

import guraa.refcompare.model.ComparisonResult;
import guraa.refcompare.model.ExportSubset;
import guraa.refcompare.model.MatchConfidence;
import guraa.refcompare.service.ReferenceComparisonService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import javax.annotation.PostConstruct;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Controller for reference list comparison and export.
 */
@Slf4j
@RestController
@RequestMapping("/api/references")
@RequiredArgsConstructor
public class ComparisonController {

    static final String RIS_MEDIA_TYPE = "application/x-research-info-systems";

    private final ReferenceComparisonService comparisonService;

    @PostConstruct
    public void init() {
        log.info("ComparisonController initialized with base path: /api/references");
    }

    /**
     * Compare two lists of parsed references.
     *
     * @param request The comparison request
     * @return Overlap, unique lists, fuzzy pairs and statistics
     */
    @PostMapping("/compare")
    public ResponseEntity<?> compare(@RequestBody CompareRequest request) {
        log.info("Received comparison request: {} and {} references",
                sizeOf(request.getRecordsA()), sizeOf(request.getRecordsB()));

        ComparisonResult result = comparisonService.compare(
                request.getRecordsA(), request.getRecordsB(), request.getUseFuzzy());
        return ResponseEntity.ok(toResponse(result));
    }

    /**
     * Compare two uploaded RIS files.
     *
     * @param fileA RIS file A
     * @param fileB RIS file B
     * @param useFuzzy Whether to run the fuzzy pass
     * @return Overlap, unique lists, fuzzy pairs and statistics
     * @throws IOException If a file cannot be read
     */
    @PostMapping(value = "/compare/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> compareFiles(@RequestParam("fileA") MultipartFile fileA,
                                          @RequestParam("fileB") MultipartFile fileB,
                                          @RequestParam(value = "useFuzzy", required = false) Boolean useFuzzy)
            throws IOException {
        if (fileA.isEmpty() || fileB.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Both fileA and fileB are required"));
        }

        ComparisonResult result = comparisonService.compareFiles(fileA, fileB, useFuzzy);

        Map<String, Object> response = toResponse(result);
        response.put("filenameA", fileA.getOriginalFilename());
        response.put("filenameB", fileB.getOriginalFilename());
        return ResponseEntity.ok(response);
    }

    /**
     * Compare two uploaded RIS files and download one result list as RIS.
     *
     * @param fileA RIS file A
     * @param fileB RIS file B
     * @param subset One of overlap, unique_a, unique_b
     * @return RIS attachment
     * @throws IOException If a file cannot be read
     */
    @PostMapping(value = "/export", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> export(@RequestParam("fileA") MultipartFile fileA,
                                    @RequestParam("fileB") MultipartFile fileB,
                                    @RequestParam("subset") String subset) throws IOException {
        if (fileA.isEmpty() || fileB.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Both fileA and fileB are required"));
        }

        ExportSubset exportSubset = ExportSubset.fromValue(subset);
        ComparisonResult result = comparisonService.compareFiles(fileA, fileB, null);

        String content = comparisonService.exportSubset(result, exportSubset);
        String fileName = comparisonService.exportFileName(exportSubset,
                fileA.getOriginalFilename(), fileB.getOriginalFilename());

        log.info("Exporting subset {} as {}", exportSubset.getValue(), fileName);
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(fileName, StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(MediaType.parseMediaType(RIS_MEDIA_TYPE))
                .body(content);
    }

    /**
     * Rate how likely two references are the same work.
     *
     * @param request The pair of references
     * @return Confidence and reason
     */
    @PostMapping("/confidence")
    public ResponseEntity<?> confidence(@RequestBody ConfidenceRequest request) {
        MatchConfidence confidence = comparisonService.score(request.getRecordA(), request.getRecordB());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("confidence", confidence.getConfidence());
        response.put("reason", confidence.getReason());
        return ResponseEntity.ok(response);
    }

    private static Map<String, Object> toResponse(ComparisonResult result) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("overlap", result.getOverlap());
        response.put("uniqueA", result.getUniqueA());
        response.put("uniqueB", result.getUniqueB());
        response.put("fuzzyPairs", result.getFuzzyPairs());
        response.put("statistics", result.getStatistics());
        response.put("comparedAt", LocalDateTime.now());
        return response;
    }

    private static int sizeOf(List<?> records) {
        return records == null ? 0 : records.size();
    }
}
