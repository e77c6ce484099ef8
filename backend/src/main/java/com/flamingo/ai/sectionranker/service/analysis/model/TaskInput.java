package com.flamingo.ai.sectionranker.service.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.sectionranker.exception.MalformedTaskDescriptorException;
import com.flamingo.ai.sectionranker.service.ranking.model.TaskDescriptor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Objects;

/**
 * Collection input file ({@code challenge1b_input.json}): the documents to analyse, the persona
 * and the job to be done.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskInput(
    List<DocumentRef> documents,
    @Valid @NotNull Persona persona,
    @Valid @NotNull @JsonProperty("job_to_be_done") JobToBeDone jobToBeDone) {

  public TaskInput {
    documents =
        documents == null
            ? List.of()
            : documents.stream().filter(Objects::nonNull).toList();
  }

  /**
   * Converts to the ranking-side descriptor.
   *
   * @throws MalformedTaskDescriptorException if the persona role or the task is missing
   */
  public TaskDescriptor toTaskDescriptor() {
    if (persona == null) {
      throw new MalformedTaskDescriptorException("Task input is missing the persona");
    }
    if (jobToBeDone == null) {
      throw new MalformedTaskDescriptorException("Task input is missing the job to be done");
    }
    Constraints constraints =
        jobToBeDone.constraints() == null ? Constraints.NONE : jobToBeDone.constraints();
    return new TaskDescriptor(
        persona.role(),
        jobToBeDone.task(),
        constraints.includeKeywords(),
        constraints.excludeKeywords());
  }

  /** Listed file names, in input order, skipping entries without one. */
  public List<String> documentFilenames() {
    return documents.stream()
        .map(DocumentRef::filename)
        .filter(name -> name != null && !name.isBlank())
        .toList();
  }

  // ---- inner types ----

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record DocumentRef(String filename, String title) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Persona(@NotBlank String role) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record JobToBeDone(@NotBlank String task, Constraints constraints) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Constraints(
      @JsonProperty("include_keywords") List<String> includeKeywords,
      @JsonProperty("exclude_keywords") List<String> excludeKeywords) {

    static final Constraints NONE = new Constraints(List.of(), List.of());

    public Constraints {
      includeKeywords = includeKeywords == null ? List.of() : includeKeywords;
      excludeKeywords = excludeKeywords == null ? List.of() : excludeKeywords;
    }
  }
}
