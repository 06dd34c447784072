package guraa.refcompare.controller;

import guraa.refcompare.model.ReferenceAnalysis;
import guraa.refcompare.model.ReferenceRecord;
import guraa.refcompare.service.ReferenceAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Controller for summarizing a single reference list.
 */
@Slf4j
@RestController
@RequestMapping("/api/references/analyze")
@RequiredArgsConstructor
public class AnalysisController {

    private final ReferenceAnalysisService analysisService;

    /**
     * Parse an uploaded RIS file and summarize it.
     *
     * @param file The RIS file
     * @return Statistics and the parsed references
     * @throws IOException If the file cannot be read
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> analyzeFile(@RequestParam("file") MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "A non-empty RIS file is required"));
        }

        List<ReferenceRecord> records = analysisService.parseFile(file);
        ReferenceAnalysis analysis = analysisService.analyze(records);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("filename", file.getOriginalFilename());
        response.put("statistics", analysis);
        response.put("records", records);
        response.put("analyzedAt", LocalDateTime.now());
        return ResponseEntity.ok(response);
    }

    /**
     * Summarize a list of already parsed references.
     *
     * @param records The references, each a map of field names to values
     * @return Statistics
     */
    @PostMapping(value = "/records", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> analyzeRecords(@RequestBody List<Object> records) {
        log.info("Received analysis request for {} references", records.size());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("statistics", analysisService.analyze(records));
        response.put("analyzedAt", LocalDateTime.now());
        return ResponseEntity.ok(response);
    }
}
