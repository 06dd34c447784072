package guraa.refcompare.controller;

import guraa.refcompare.model.InvalidRecordShapeException;
import guraa.refcompare.model.ReferenceAnalysis;
import guraa.refcompare.model.ReferenceRecord;
import guraa.refcompare.service.ReferenceAnalysisService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static guraa.refcompare.RecordFixtures.record;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnalysisController.class)
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReferenceAnalysisService analysisService;

    private static ReferenceAnalysis sampleAnalysis() {
        return ReferenceAnalysis.builder()
                .totalRecords(2)
                .withDoi(1)
                .recordsByYear(Map.of("2020", 2))
                .build();
    }

    @Test
    void analyzeFile_shouldReturnStatisticsAndRecords() throws Exception {
        List<ReferenceRecord> records = List.of(record("title", "First"), record("title", "Second"));
        when(analysisService.parseFile(any())).thenReturn(records);
        when(analysisService.analyze(records)).thenReturn(sampleAnalysis());

        mockMvc.perform(multipart("/api/references/analyze")
                        .file(new MockMultipartFile("file", "library.ris", "text/plain",
                                "TY  - JOUR\nER  - ".getBytes(StandardCharsets.UTF_8))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.filename").value("library.ris"))
                .andExpect(jsonPath("$.statistics.total_records").value(2))
                .andExpect(jsonPath("$.statistics.with_doi").value(1))
                .andExpect(jsonPath("$.statistics.records_by_year['2020']").value(2))
                .andExpect(jsonPath("$.records[1].title").value("Second"))
                .andExpect(jsonPath("$.analyzedAt").exists());
    }

    @Test
    void analyzeFile_shouldRejectEmptyUpload() throws Exception {
        mockMvc.perform(multipart("/api/references/analyze")
                        .file(new MockMultipartFile("file", "empty.ris", "text/plain", new byte[0])))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("A non-empty RIS file is required"));

        verify(analysisService, never()).parseFile(any());
    }

    @Test
    void analyzeRecords_shouldSummarizeJsonRecords() throws Exception {
        when(analysisService.analyze(anyList())).thenReturn(sampleAnalysis());

        mockMvc.perform(post("/api/references/analyze/records")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"title\":\"First\"},{\"title\":\"Second\"}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.statistics.total_records").value(2));
    }

    @Test
    void analyzeRecords_shouldRejectMalformedRecord() throws Exception {
        when(analysisService.analyze(anyList()))
                .thenThrow(new InvalidRecordShapeException("Record must be a mapping of field names to values, got Integer"));

        mockMvc.perform(post("/api/references/analyze/records")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[1]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(
                        "Invalid record: Record must be a mapping of field names to values, got Integer"));
    }
}
