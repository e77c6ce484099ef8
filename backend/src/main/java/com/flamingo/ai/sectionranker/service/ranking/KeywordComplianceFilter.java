package com.flamingo.ai.sectionranker.service.ranking;

import com.flamingo.ai.sectionranker.service.extraction.model.Section;
import com.flamingo.ai.sectionranker.service.ranking.model.TaskDescriptor;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Applies a task's include/exclude keyword constraints to sections.
 *
 * <p>Keywords match as whole words, case-insensitively, anywhere in the section title or body:
 * excluding "test" drops a section mentioning "test" but keeps one mentioning only "latest".
 */
@Component
public class KeywordComplianceFilter {

  /**
   * Compiles the task's constraints once into a reusable predicate.
   *
   * @param task task whose keywords are applied
   * @return predicate that is {@code true} for compliant sections
   */
  public Predicate<Section> forTask(TaskDescriptor task) {
    List<Pattern> include = compile(task.includeKeywords());
    List<Pattern> exclude = compile(task.excludeKeywords());
    return section -> {
      String text = section.title() + " " + section.body();
      if (exclude.stream().anyMatch(pattern -> pattern.matcher(text).find())) {
        return false;
      }
      return include.isEmpty()
          || include.stream().anyMatch(pattern -> pattern.matcher(text).find());
    };
  }

  public boolean isCompliant(Section section, TaskDescriptor task) {
    return forTask(task).test(section);
  }

  private List<Pattern> compile(List<String> keywords) {
    return keywords.stream()
        .map(
            keyword ->
                Pattern.compile(
                    "\\b" + Pattern.quote(keyword) + "\\b",
                    Pattern.CASE_INSENSITIVE
                        | Pattern.UNICODE_CASE
                        | Pattern.UNICODE_CHARACTER_CLASS))
        .toList();
  }
}
