package com.flamingo.ai.sectionranker.service.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.sectionranker.exception.AnalysisOutputException;
import com.flamingo.ai.sectionranker.service.analysis.model.AnalysisOutput;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Writes the analysis output as pretty-printed JSON, replacing any previous file whole. */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnalysisOutputWriter {

  private final ObjectMapper objectMapper;

  public void write(AnalysisOutput output, Path target) {
    Path directory = target.toAbsolutePath().getParent();
    Path temp = null;
    try {
      temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), output);
      move(temp, target);
      log.info(
          "Wrote {} ranked sections to {}", output.extractedSections().size(), target);
    } catch (IOException e) {
      deleteQuietly(temp);
      throw new AnalysisOutputException("Failed to write " + target + ": " + e.getMessage(), e);
    }
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.warn("Could not delete temporary output {}: {}", temp, e.getMessage());
    }
  }
}
