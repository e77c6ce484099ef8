package com.flamingo.ai.sectionranker.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.sectionranker.exception.CollectionNotFoundException;
import com.flamingo.ai.sectionranker.exception.DocumentProcessingException;
import com.flamingo.ai.sectionranker.exception.EmbeddingException;
import com.flamingo.ai.sectionranker.exception.GlobalExceptionHandler;
import com.flamingo.ai.sectionranker.service.analysis.CollectionAnalysisService;
import com.flamingo.ai.sectionranker.service.analysis.model.AnalysisOutput;
import com.flamingo.ai.sectionranker.service.analysis.model.TaskInput;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("AnalysisController Tests")
class AnalysisControllerTest {

  private static final String TASK_JSON =
      """
      {"persona": {"role": "Travel Planner"}, "job_to_be_done": {"task": "Plan a trip"}}
      """;

  @Mock private CollectionAnalysisService analysisService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new AnalysisController(analysisService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should return the analysis of uploaded PDFs as snake_case JSON")
  void shouldAnalyseUploads() throws Exception {
    when(analysisService.analyze(any(TaskInput.class), anyMap())).thenReturn(sampleOutput());

    mockMvc
        .perform(multipart("/api/analysis").file(taskPart(TASK_JSON)).file(pdfPart("a.pdf")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.metadata.persona").value("Travel Planner"))
        .andExpect(jsonPath("$.extracted_sections[0].section_title").value("Beaches"))
        .andExpect(jsonPath("$.extracted_sections[0].importance_rank").value(1))
        .andExpect(jsonPath("$.subsection_analysis[0].refined_text").value("Sand and sun."));

    verify(analysisService)
        .analyze(
            argThat(task -> task.persona().role().equals("Travel Planner")),
            argThat(pdfs -> pdfs.containsKey("a.pdf")));
  }

  @Test
  @DisplayName("Should reject a task without a persona with 400")
  void shouldRejectInvalidTask() throws Exception {
    mockMvc
        .perform(
            multipart("/api/analysis")
                .file(taskPart("{\"job_to_be_done\": {\"task\": \"Plan a trip\"}}"))
                .file(pdfPart("a.pdf")))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));

    verify(analysisService, never()).analyze(any(), anyMap());
  }

  @Test
  @DisplayName("Should reject a request without files with 400")
  void shouldRejectMissingFiles() throws Exception {
    mockMvc
        .perform(multipart("/api/analysis").file(taskPart(TASK_JSON)))
        .andExpect(status().isBadRequest());
  }

  @Test
  @DisplayName("Should map an unreadable PDF to 422")
  void shouldMapDocumentFailure() throws Exception {
    when(analysisService.analyze(any(TaskInput.class), anyMap()))
        .thenThrow(new DocumentProcessingException("a.pdf", "bad xref"));

    mockMvc
        .perform(multipart("/api/analysis").file(taskPart(TASK_JSON)).file(pdfPart("a.pdf")))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("DOCUMENT_001"))
        .andExpect(jsonPath("$.errorId").exists());
  }

  @Test
  @DisplayName("Should map a focus query embedding failure to 503")
  void shouldMapEmbeddingFailure() throws Exception {
    when(analysisService.analyze(any(TaskInput.class), anyMap()))
        .thenThrow(new EmbeddingException("model down", new RuntimeException("timeout")));

    mockMvc
        .perform(multipart("/api/analysis").file(taskPart(TASK_JSON)).file(pdfPart("a.pdf")))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("EMBEDDING_001"));
  }

  @Test
  @DisplayName("Should analyse a named collection")
  void shouldAnalyseCollection() throws Exception {
    Path dir = Path.of("collections", "Collection_1");
    when(analysisService.resolveCollection("Collection_1")).thenReturn(dir);
    when(analysisService.analyzeCollection(eq(dir))).thenReturn(sampleOutput());

    mockMvc
        .perform(post("/api/collections/{name}/analysis", "Collection_1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.metadata.input_documents[0]").value("a.pdf"));
  }

  @Test
  @DisplayName("Should map an unknown collection to 404")
  void shouldMapUnknownCollection() throws Exception {
    when(analysisService.resolveCollection("Nope"))
        .thenThrow(new CollectionNotFoundException("Nope", "Collection not found: Nope"));

    mockMvc
        .perform(post("/api/collections/{name}/analysis", "Nope"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("COLLECTION_001"));
  }

  private static MockMultipartFile taskPart(String json) {
    return new MockMultipartFile(
        "task", "", MediaType.APPLICATION_JSON_VALUE, json.getBytes(StandardCharsets.UTF_8));
  }

  private static MockMultipartFile pdfPart(String name) {
    return new MockMultipartFile(
        "files",
        name,
        MediaType.APPLICATION_PDF_VALUE,
        "%PDF-1.4".getBytes(StandardCharsets.UTF_8));
  }

  private static AnalysisOutput sampleOutput() {
    return new AnalysisOutput(
        new AnalysisOutput.Metadata(
            List.of("a.pdf"), "Travel Planner", "Plan a trip", "2026-10-18T10:15:30"),
        List.of(new AnalysisOutput.ExtractedSection("a.pdf", "Beaches", 1, 3)),
        List.of(new AnalysisOutput.SubsectionAnalysis("a.pdf", "Sand and sun.", 3)));
  }
}
