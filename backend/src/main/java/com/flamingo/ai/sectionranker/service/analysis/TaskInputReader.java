package com.flamingo.ai.sectionranker.service.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.sectionranker.exception.MalformedTaskDescriptorException;
import com.flamingo.ai.sectionranker.service.analysis.model.TaskInput;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads a collection's task input JSON.
 *
 * <p>The persona role and task are checked eagerly, so a malformed file fails here rather than
 * after every PDF has been parsed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskInputReader {

  private final ObjectMapper objectMapper;

  public TaskInput read(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      return read(in);
    } catch (IOException e) {
      throw new MalformedTaskDescriptorException(
          "Cannot read task input " + path + ": " + e.getMessage(), e);
    }
  }

  public TaskInput read(InputStream inputStream) {
    TaskInput input;
    try {
      input = objectMapper.readValue(inputStream, TaskInput.class);
    } catch (JsonProcessingException e) {
      throw new MalformedTaskDescriptorException(
          "Task input is not valid JSON: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new MalformedTaskDescriptorException(
          "Cannot read task input: " + e.getMessage(), e);
    }
    if (input == null) {
      throw new MalformedTaskDescriptorException("Task input is empty");
    }
    input.toTaskDescriptor();
    log.debug(
        "Read task input: {} documents, persona '{}'",
        input.documents().size(),
        input.persona().role());
    return input;
  }
}
