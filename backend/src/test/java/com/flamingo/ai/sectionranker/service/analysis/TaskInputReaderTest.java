package com.flamingo.ai.sectionranker.service.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.sectionranker.exception.MalformedTaskDescriptorException;
import com.flamingo.ai.sectionranker.service.analysis.model.TaskInput;
import com.flamingo.ai.sectionranker.service.ranking.model.TaskDescriptor;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("TaskInputReader Tests")
class TaskInputReaderTest {

  private final TaskInputReader reader = new TaskInputReader(new ObjectMapper());

  @Test
  @DisplayName("Should read documents, persona, task and constraints")
  void shouldReadFullInput() {
    TaskInput input =
        read(
            """
            {
              "challenge_info": {"challenge_id": "round_1b_002"},
              "documents": [
                {"filename": "South of France - Cities.pdf", "title": "Cities"},
                {"filename": "South of France - Cuisine.pdf", "title": "Cuisine"}
              ],
              "persona": {"role": "Travel Planner"},
              "job_to_be_done": {
                "task": "Plan a trip of 4 days for a group of 10 college friends.",
                "constraints": {"include_keywords": ["beach"], "exclude_keywords": ["casino"]}
              }
            }
            """);

    assertThat(input.documentFilenames())
        .containsExactly("South of France - Cities.pdf", "South of France - Cuisine.pdf");

    TaskDescriptor task = input.toTaskDescriptor();
    assertThat(task.personaRole()).isEqualTo("Travel Planner");
    assertThat(task.includeKeywords()).containsExactly("beach");
    assertThat(task.excludeKeywords()).containsExactly("casino");
    assertThat(task.focusQuery())
        .isEqualTo("Travel Planner: Plan a trip of 4 days for a group of 10 college friends.");
  }

  @Test
  @DisplayName("Should default missing documents and constraints to empty")
  void shouldDefaultOptionalParts() {
    TaskInput input =
        read(
            """
            {"persona": {"role": "Chef"}, "job_to_be_done": {"task": "Plan a menu"}}
            """);

    assertThat(input.documents()).isEmpty();
    assertThat(input.toTaskDescriptor().includeKeywords()).isEmpty();
    assertThat(input.toTaskDescriptor().excludeKeywords()).isEmpty();
  }

  @Test
  @DisplayName("Should skip null document entries")
  void shouldSkipNullDocuments() {
    TaskInput input =
        read(
            """
            {"documents": [null, {"filename": "a.pdf"}, {"title": "No file"}],
             "persona": {"role": "Chef"}, "job_to_be_done": {"task": "Plan a menu"}}
            """);

    assertThat(input.documents()).hasSize(2);
    assertThat(input.documentFilenames()).containsExactly("a.pdf");
  }

  @Test
  @DisplayName("Should reject input without a persona")
  void shouldRejectMissingPersona() {
    assertThatThrownBy(() -> read("{\"job_to_be_done\": {\"task\": \"Plan a menu\"}}"))
        .isInstanceOf(MalformedTaskDescriptorException.class)
        .hasMessageContaining("persona");
  }

  @Test
  @DisplayName("Should reject input with a blank task")
  void shouldRejectBlankTask() {
    String json = "{\"persona\": {\"role\": \"Chef\"}, \"job_to_be_done\": {\"task\": \" \"}}";

    assertThatThrownBy(() -> read(json))
        .isInstanceOf(MalformedTaskDescriptorException.class)
        .hasMessageContaining("task");
  }

  @Test
  @DisplayName("Should reject invalid JSON")
  void shouldRejectInvalidJson() {
    assertThatThrownBy(() -> read("{not json"))
        .isInstanceOf(MalformedTaskDescriptorException.class);
  }

  @Test
  @DisplayName("Should read from a file path")
  void shouldReadFromPath(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("challenge1b_input.json");
    Files.writeString(
        file, "{\"persona\": {\"role\": \"HR\"}, \"job_to_be_done\": {\"task\": \"Onboard\"}}");

    assertThat(reader.read(file).persona().role()).isEqualTo("HR");
  }

  @Test
  @DisplayName("Should report a missing file as malformed input")
  void shouldRejectMissingFile(@TempDir Path dir) {
    assertThatThrownBy(() -> reader.read(dir.resolve("absent.json")))
        .isInstanceOf(MalformedTaskDescriptorException.class);
  }

  private TaskInput read(String json) {
    return reader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
  }
}
