package com.flamingo.ai.sectionranker.api.rest;

import com.flamingo.ai.sectionranker.exception.DocumentProcessingException;
import com.flamingo.ai.sectionranker.service.analysis.CollectionAnalysisService;
import com.flamingo.ai.sectionranker.service.analysis.model.AnalysisOutput;
import com.flamingo.ai.sectionranker.service.analysis.model.TaskInput;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for persona-driven section analysis. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AnalysisController {

  private final CollectionAnalysisService analysisService;

  /** Analyses uploaded PDFs against a task; nothing is written to disk. */
  @PostMapping(value = "/analysis", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<AnalysisOutput> analyze(
      @Valid @RequestPart("task") TaskInput task,
      @RequestPart("files") List<MultipartFile> files) {
    Map<String, byte[]> pdfs = new LinkedHashMap<>();
    for (MultipartFile file : files) {
      String name = file.getOriginalFilename();
      try {
        pdfs.put(name, file.getBytes());
      } catch (IOException e) {
        throw new DocumentProcessingException(
            name, "Failed to read upload " + name + ": " + e.getMessage(), e);
      }
    }
    log.info("Analysing {} uploaded documents", pdfs.size());
    return ResponseEntity.ok(analysisService.analyze(task, pdfs));
  }

  /** Analyses a collection under the configured base directory and writes its output file. */
  @PostMapping("/collections/{name}/analysis")
  public ResponseEntity<AnalysisOutput> analyzeCollection(@PathVariable String name) {
    Path collectionDir = analysisService.resolveCollection(name);
    return ResponseEntity.ok(analysisService.analyzeCollection(collectionDir));
  }
}
