package com.flamingo.ai.sectionranker.service.analysis;

import com.flamingo.ai.sectionranker.config.AsyncConfig;
import com.flamingo.ai.sectionranker.config.RankingConfig;
import com.flamingo.ai.sectionranker.exception.CollectionNotFoundException;
import com.flamingo.ai.sectionranker.exception.DocumentProcessingException;
import com.flamingo.ai.sectionranker.service.analysis.model.AnalysisOutput;
import com.flamingo.ai.sectionranker.service.analysis.model.TaskInput;
import com.flamingo.ai.sectionranker.service.extraction.PdfBoxLayoutReader;
import com.flamingo.ai.sectionranker.service.extraction.StructureExtractor;
import com.flamingo.ai.sectionranker.service.extraction.model.DocumentLayout;
import com.flamingo.ai.sectionranker.service.extraction.model.Section;
import com.flamingo.ai.sectionranker.service.ranking.RelevanceRanker;
import com.flamingo.ai.sectionranker.service.ranking.model.ScoredSection;
import com.flamingo.ai.sectionranker.service.ranking.model.TaskDescriptor;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the full pipeline for one collection: read task input, parse PDFs, extract sections, rank
 * the pooled sections and assemble the output.
 */
@Service
@Slf4j
public class CollectionAnalysisService {

  private final TaskInputReader taskInputReader;
  private final AnalysisOutputWriter outputWriter;
  private final PdfBoxLayoutReader layoutReader;
  private final StructureExtractor structureExtractor;
  private final RelevanceRanker relevanceRanker;
  private final RankingConfig rankingConfig;
  private final MeterRegistry meterRegistry;
  private final Executor executor;

  public CollectionAnalysisService(
      TaskInputReader taskInputReader,
      AnalysisOutputWriter outputWriter,
      PdfBoxLayoutReader layoutReader,
      StructureExtractor structureExtractor,
      RelevanceRanker relevanceRanker,
      RankingConfig rankingConfig,
      MeterRegistry meterRegistry,
      @Qualifier(AsyncConfig.RANKING_EXECUTOR) Executor executor) {
    this.taskInputReader = taskInputReader;
    this.outputWriter = outputWriter;
    this.layoutReader = layoutReader;
    this.structureExtractor = structureExtractor;
    this.relevanceRanker = relevanceRanker;
    this.rankingConfig = rankingConfig;
    this.meterRegistry = meterRegistry;
    this.executor = executor;
  }

  /**
   * Resolves a collection name against the configured base directory.
   *
   * @throws CollectionNotFoundException if the name escapes the base directory or the collection
   *     has no task input file
   */
  public Path resolveCollection(String name) {
    Path baseDir = Paths.get(rankingConfig.getRunner().getBaseDir()).toAbsolutePath().normalize();
    Path collectionDir = baseDir.resolve(name).normalize();
    if (!collectionDir.startsWith(baseDir) || collectionDir.equals(baseDir)) {
      throw new CollectionNotFoundException(name, "Invalid collection name: " + name);
    }
    if (!Files.isRegularFile(collectionDir.resolve(rankingConfig.getCollection().getInputFile()))) {
      throw new CollectionNotFoundException(name, "Collection not found: " + collectionDir);
    }
    return collectionDir;
  }

  /**
   * Analyses a collection directory and writes its output file next to the input file.
   *
   * <p>Listed PDFs that are missing or unreadable are logged and skipped; they still appear in the
   * output metadata.
   *
   * @return the output that was written
   */
  @Timed(value = "collection.analysis", description = "Time to analyse a document collection")
  public AnalysisOutput analyzeCollection(Path collectionDir) {
    RankingConfig.Collection layout = rankingConfig.getCollection();
    Path inputFile = collectionDir.resolve(layout.getInputFile());
    if (!Files.isRegularFile(inputFile)) {
      throw new CollectionNotFoundException(
          collectionDir.getFileName().toString(), "Task input not found: " + inputFile);
    }
    log.info("Starting analysis for collection {}", collectionDir);

    TaskInput input = taskInputReader.read(inputFile);
    Path pdfDir = collectionDir.resolve(layout.getPdfDir());

    AnalysisOutput output =
        run(input, input.documentFilenames(), name -> readPdf(pdfDir.resolve(name)), true);
    outputWriter.write(output, collectionDir.resolve(layout.getOutputFile()));
    return output;
  }

  /**
   * Analyses uploaded PDFs without touching disk.
   *
   * <p>Documents are processed in the order the task input lists them, or in upload order when it
   * lists none. Listed documents that were not uploaded are skipped; an unreadable upload fails the
   * request.
   *
   * @param input task input
   * @param pdfs PDF bytes keyed by file name
   * @throws DocumentProcessingException if an uploaded PDF cannot be parsed
   */
  @Timed(value = "upload.analysis", description = "Time to analyse uploaded documents")
  public AnalysisOutput analyze(TaskInput input, Map<String, byte[]> pdfs) {
    List<String> names =
        input.documentFilenames().isEmpty()
            ? List.copyOf(pdfs.keySet())
            : input.documentFilenames();
    return run(input, names, pdfs::get, false);
  }

  private AnalysisOutput run(
      TaskInput input,
      List<String> documentNames,
      Function<String, byte[]> loader,
      boolean skipUnreadable) {
    TaskDescriptor task = input.toTaskDescriptor();

    List<Section> pooled = new ArrayList<>();
    for (List<Section> sections : extractAll(documentNames, loader, skipUnreadable)) {
      pooled.addAll(sections);
    }
    log.info("Extracted {} sections from {} documents", pooled.size(), documentNames.size());

    List<ScoredSection> ranked = relevanceRanker.rank(pooled, task);
    List<ScoredSection> top = RelevanceRanker.topK(ranked, rankingConfig.getTopK());
    log.info("Ranking complete: {} compliant sections, keeping {}", ranked.size(), top.size());

    return assemble(documentNames, task, top);
  }

  private List<List<Section>> extractAll(
      List<String> documentNames, Function<String, byte[]> loader, boolean skipUnreadable) {
    if (!rankingConfig.getParallelism().isEnabled() || documentNames.size() <= 1) {
      return documentNames.stream()
          .map(name -> extractDocument(name, loader, skipUnreadable))
          .toList();
    }

    List<CompletableFuture<List<Section>>> futures =
        documentNames.stream()
            .map(
                name ->
                    CompletableFuture.supplyAsync(
                        () -> extractDocument(name, loader, skipUnreadable), executor))
            .toList();
    try {
      return futures.stream().map(CompletableFuture::join).toList();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }

  private List<Section> extractDocument(
      String name, Function<String, byte[]> loader, boolean skipUnreadable) {
    try {
      byte[] bytes = loader.apply(name);
      if (bytes == null) {
        log.warn("PDF file not found, skipping: {}", name);
        meterRegistry.counter("documents.skipped", "reason", "missing").increment();
        return List.of();
      }
      DocumentLayout layout = layoutReader.read(name, bytes);
      List<Section> sections = structureExtractor.extract(layout);
      log.info("Parsed {} sections from {}", sections.size(), name);
      meterRegistry.counter("documents.processed").increment();
      return sections;
    } catch (DocumentProcessingException e) {
      if (!skipUnreadable) {
        throw e;
      }
      log.warn("Unreadable PDF, skipping {}: {}", name, e.getMessage());
      meterRegistry.counter("documents.skipped", "reason", "unreadable").increment();
      return List.of();
    }
  }

  private byte[] readPdf(Path path) {
    if (!Files.isRegularFile(path)) {
      return null;
    }
    try {
      return Files.readAllBytes(path);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          path.getFileName().toString(), "Cannot read " + path + ": " + e.getMessage(), e);
    }
  }

  private static AnalysisOutput assemble(
      List<String> documentNames, TaskDescriptor task, List<ScoredSection> top) {
    AnalysisOutput.Metadata metadata =
        new AnalysisOutput.Metadata(
            List.copyOf(documentNames),
            task.personaRole(),
            task.task(),
            LocalDateTime.now().toString());

    List<AnalysisOutput.ExtractedSection> extracted =
        top.stream()
            .map(
                s ->
                    new AnalysisOutput.ExtractedSection(
                        s.documentId(), s.title(), s.rank(), s.pageIndex()))
            .toList();
    List<AnalysisOutput.SubsectionAnalysis> subsections =
        top.stream()
            .map(
                s ->
                    new AnalysisOutput.SubsectionAnalysis(
                        s.documentId(), s.body().strip(), s.pageIndex()))
            .toList();

    return new AnalysisOutput(metadata, extracted, subsections);
  }
}
