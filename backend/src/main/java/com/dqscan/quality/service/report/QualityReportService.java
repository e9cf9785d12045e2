package com.dqscan.quality.service.report;

import java.nio.file.Path;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.dqscan.quality.config.ApplicationProperties;
import com.dqscan.quality.dto.dataset.Column;
import com.dqscan.quality.dto.dataset.Dataset;
import com.dqscan.quality.dto.report.AnalysisOutcome;
import com.dqscan.quality.dto.report.AnalysisReason;
import com.dqscan.quality.dto.report.DatasetColumnsResponse;
import com.dqscan.quality.dto.report.DuplicateReport;
import com.dqscan.quality.dto.report.ExternalProfileStats;
import com.dqscan.quality.dto.report.LabelIssueReport;
import com.dqscan.quality.dto.report.MissingReport;
import com.dqscan.quality.dto.report.OutlierFilter;
import com.dqscan.quality.dto.report.OutlierIndexSets;
import com.dqscan.quality.dto.report.QualityReport;
import com.dqscan.quality.dto.report.TargetSelection;
import com.dqscan.quality.service.analysis.duplicate.DuplicateRowAnalyzer;
import com.dqscan.quality.service.analysis.label.LabelIssueAnalyzer;
import com.dqscan.quality.service.analysis.missing.MissingValueAnalyzer;
import com.dqscan.quality.service.analysis.outlier.OutlierAnalysisService;
import com.dqscan.quality.service.analysis.profile.ExternalProfileStatsExtractor;
import com.dqscan.quality.service.analysis.target.TargetColumnInferenceService;

import lombok.extern.slf4j.Slf4j;

/**
 * Produces the quality report for one dataset. Analyzers run concurrently on the analysis executor;
 * label-issue detection waits for target inference. The result is the same as running them one
 * after another.
 */
@Slf4j
@Service
public class QualityReportService {

  static final String DATASET_MDC_KEY = "datasetName";

  private final MissingValueAnalyzer missingValueAnalyzer;
  private final DuplicateRowAnalyzer duplicateRowAnalyzer;
  private final OutlierAnalysisService outlierAnalysisService;
  private final TargetColumnInferenceService targetColumnInferenceService;
  private final LabelIssueAnalyzer labelIssueAnalyzer;
  private final ExternalProfileStatsExtractor externalProfileStatsExtractor;
  private final QualityReportAggregator aggregator;
  private final ApplicationProperties properties;
  private final Executor analysisExecutor;

  public QualityReportService(
      MissingValueAnalyzer missingValueAnalyzer,
      DuplicateRowAnalyzer duplicateRowAnalyzer,
      OutlierAnalysisService outlierAnalysisService,
      TargetColumnInferenceService targetColumnInferenceService,
      LabelIssueAnalyzer labelIssueAnalyzer,
      ExternalProfileStatsExtractor externalProfileStatsExtractor,
      QualityReportAggregator aggregator,
      ApplicationProperties properties,
      @Qualifier("analysisExecutor") Executor analysisExecutor) {
    this.missingValueAnalyzer = missingValueAnalyzer;
    this.duplicateRowAnalyzer = duplicateRowAnalyzer;
    this.outlierAnalysisService = outlierAnalysisService;
    this.targetColumnInferenceService = targetColumnInferenceService;
    this.labelIssueAnalyzer = labelIssueAnalyzer;
    this.externalProfileStatsExtractor = externalProfileStatsExtractor;
    this.aggregator = aggregator;
    this.properties = properties;
    this.analysisExecutor = analysisExecutor;
  }

  /**
   * Builds the full report.
   *
   * @param dataset the loaded dataset
   * @param targetOverride optional manual target column, ignored when it names no column
   * @param overviewDocument optional HTML overview document
   * @param filter category selector for the outlier rows in the report
   */
  public QualityReport generateReport(
      Dataset dataset, String targetOverride, Path overviewDocument, OutlierFilter filter) {
    MDC.put(DATASET_MDC_KEY, dataset.getName());
    long started = System.currentTimeMillis();
    try {
      log.info(
          "Generating quality report for '{}' ({} rows, {} columns)",
          dataset.getName(),
          dataset.getRowCount(),
          dataset.getColumnCount());
      long timeout = properties.getExecution().getTimeoutSeconds();

      CompletableFuture<MissingReport> missing =
          start("missing values", () -> missingValueAnalyzer.analyze(dataset));
      CompletableFuture<DuplicateReport> duplicates =
          start("duplicate rows", () -> duplicateRowAnalyzer.analyze(dataset));
      CompletableFuture<AnalysisOutcome<SortedSet<Integer>>> structural =
          start("structural outliers", () -> outlierAnalysisService.runStructural(dataset));
      CompletableFuture<AnalysisOutcome<SortedSet<Integer>>> statistical =
          start("statistical outliers", () -> outlierAnalysisService.runStatistical(dataset));
      CompletableFuture<AnalysisOutcome<SortedSet<Integer>>> semantic =
          startBounded(
              "semantic outliers",
              () -> outlierAnalysisService.runSemantic(dataset),
              AnalysisOutcome.unavailable(
                  new TreeSet<>(),
                  AnalysisReason.TIMEOUT,
                  "semantic outlier detection timed out after " + timeout + "s"),
              timeout);
      CompletableFuture<TargetSelection> target =
          start(
              "target inference",
              () -> targetColumnInferenceService.resolve(dataset, targetOverride));
      CompletableFuture<LabelIssueReport> labelIssues =
          target
              .thenCompose(
                  selection ->
                      startBounded(
                          "label issues",
                          () -> labelIssueAnalyzer.analyze(dataset, selection.getColumn()),
                          LabelIssueReport.skipped(
                              AnalysisReason.TIMEOUT,
                              LabelIssueAnalyzer.NOTE_UNAVAILABLE_PREFIX
                                  + "timed out after "
                                  + timeout
                                  + "s"),
                          timeout))
              .exceptionally(
                  e -> {
                    Throwable cause = unwrap(e);
                    log.error("Label-issue detection failed: {}", cause.getMessage(), cause);
                    return LabelIssueReport.skipped(
                        AnalysisReason.DETECTOR_FAILURE,
                        LabelIssueAnalyzer.NOTE_UNAVAILABLE_PREFIX + cause.getMessage());
                  });
      CompletableFuture<ExternalProfileStats> overview =
          start(
                  "overview extraction",
                  () -> externalProfileStatsExtractor.extract(overviewDocument))
              .exceptionally(
                  e -> {
                    log.warn("Overview extraction failed: {}", unwrap(e).getMessage());
                    return ExternalProfileStats.allUnavailable();
                  });

      OutlierIndexSets outliers =
          OutlierIndexSets.builder()
              .structural(await(structural))
              .statistical(await(statistical))
              .semantic(await(semantic))
              .build();

      QualityReport report =
          aggregator.aggregate(
              dataset,
              await(target),
              await(missing),
              await(duplicates),
              outliers,
              await(labelIssues),
              await(overview),
              filter);
      log.info(
          "Quality report for '{}' ready in {} ms: {} missing cells, {} duplicates,"
              + " {} outlier rows, {} label issues",
          dataset.getName(),
          System.currentTimeMillis() - started,
          report.getMissingReport().getTotalMissingCells(),
          report.getDuplicateReport().getDuplicateRowsCount(),
          report.getOutlierReport().getTotalUniqueOutliers(),
          report.getLabelIssueReport().getLabelIssueCount());
      return report;
    } finally {
      MDC.remove(DATASET_MDC_KEY);
    }
  }

  /** Column names, types and the inferred target, without running the analyzers. */
  public DatasetColumnsResponse describeColumns(Dataset dataset) {
    return DatasetColumnsResponse.builder()
        .datasetName(dataset.getName())
        .rowCount(dataset.getRowCount())
        .columns(
            dataset.getColumns().stream()
                .map(QualityReportService::columnInfo)
                .collect(Collectors.toList()))
        .inferredTarget(targetColumnInferenceService.resolve(dataset, null))
        .build();
  }

  private static DatasetColumnsResponse.ColumnInfo columnInfo(Column column) {
    return DatasetColumnsResponse.ColumnInfo.builder()
        .name(column.getName())
        .type(column.getType())
        .missingCount(column.missingCount())
        .distinctCount(column.distinctValues().size())
        .build();
  }

  private <T> CompletableFuture<T> start(String step, Supplier<T> work) {
    return submit(step, work).result;
  }

  /** As {@link #start}, completing with {@code onTimeout} and interrupting the step when late. */
  private <T> CompletableFuture<T> startBounded(
      String step, Supplier<T> work, T onTimeout, long timeoutSeconds) {
    AnalysisTask<T> task = submit(step, work);
    return task.result
        .completeOnTimeout(onTimeout, timeoutSeconds, TimeUnit.SECONDS)
        .whenComplete(
            (value, error) -> {
              if (task.cancel(true)) {
                log.warn("{} did not finish within {}s and was cancelled", step, timeoutSeconds);
              }
            });
  }

  /**
   * Hands one step to the analysis executor. A rejected step runs on the calling thread, so a
   * saturated pool slows a report down but never fails it.
   */
  private <T> AnalysisTask<T> submit(String step, Supplier<T> work) {
    AnalysisTask<T> task = new AnalysisTask<>(work);
    try {
      analysisExecutor.execute(task);
    } catch (RejectedExecutionException e) {
      log.warn("Analysis executor rejected {}, running it on the calling thread", step);
      task.run();
    }
    return task;
  }

  private static <T> T await(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      Throwable cause = unwrap(e);
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new IllegalStateException("Analysis failed: " + cause.getMessage(), cause);
    }
  }

  private static Throwable unwrap(Throwable throwable) {
    Throwable current = throwable;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /** Future task that also publishes its outcome as a {@link CompletableFuture}. */
  private static final class AnalysisTask<T> extends FutureTask<T> {

    private final CompletableFuture<T> result = new CompletableFuture<>();

    AnalysisTask(Supplier<T> work) {
      super(work::get);
    }

    @Override
    protected void done() {
      // a cancelled task's result has already been completed with the timeout value
      if (isCancelled()) {
        return;
      }
      try {
        result.complete(get());
      } catch (ExecutionException e) {
        result.completeExceptionally(e.getCause());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        result.completeExceptionally(e);
      }
    }
  }
}
