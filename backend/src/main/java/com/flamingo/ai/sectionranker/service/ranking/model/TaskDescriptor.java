package com.flamingo.ai.sectionranker.service.ranking.model;

import com.flamingo.ai.sectionranker.exception.MalformedTaskDescriptorException;
import java.util.List;
import java.util.Objects;

/**
 * What the user wants: who they are, what they need to do, and hard keyword constraints.
 *
 * @param personaRole persona role, e.g. "Travel Planner"
 * @param task task statement
 * @param includeKeywords at least one must appear in a section, unless empty
 * @param excludeKeywords none may appear in a section
 */
public record TaskDescriptor(
    String personaRole, String task, List<String> includeKeywords, List<String> excludeKeywords) {

  public TaskDescriptor {
    if (personaRole == null || personaRole.isBlank()) {
      throw new MalformedTaskDescriptorException("Task input is missing the persona role");
    }
    if (task == null || task.isBlank()) {
      throw new MalformedTaskDescriptorException("Task input is missing the task statement");
    }
    includeKeywords = sanitize(includeKeywords);
    excludeKeywords = sanitize(excludeKeywords);
  }

  public TaskDescriptor(String personaRole, String task) {
    this(personaRole, task, List.of(), List.of());
  }

  /** The intent anchor every section is scored against: {@code "role: task"}. */
  public String focusQuery() {
    return personaRole.strip() + ": " + task.strip();
  }

  private static List<String> sanitize(List<String> keywords) {
    if (keywords == null) {
      return List.of();
    }
    return keywords.stream()
        .filter(Objects::nonNull)
        .map(String::strip)
        .filter(keyword -> !keyword.isEmpty())
        .toList();
  }
}
