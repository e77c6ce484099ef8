package com.flamingo.ai.sectionranker.service.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Collection output file ({@code challenge1b_output.json}).
 *
 * @param metadata what was analysed and when
 * @param extractedSections top-ranked sections, best first
 * @param subsectionAnalysis refined text of the same sections, in the same order
 */
public record AnalysisOutput(
    Metadata metadata,
    @JsonProperty("extracted_sections") List<ExtractedSection> extractedSections,
    @JsonProperty("subsection_analysis") List<SubsectionAnalysis> subsectionAnalysis) {

  public record Metadata(
      @JsonProperty("input_documents") List<String> inputDocuments,
      String persona,
      @JsonProperty("job_to_be_done") String jobToBeDone,
      @JsonProperty("processing_timestamp") String processingTimestamp) {}

  public record ExtractedSection(
      String document,
      @JsonProperty("section_title") String sectionTitle,
      @JsonProperty("importance_rank") int importanceRank,
      @JsonProperty("page_number") int pageNumber) {}

  public record SubsectionAnalysis(
      String document,
      @JsonProperty("refined_text") String refinedText,
      @JsonProperty("page_number") int pageNumber) {}
}
