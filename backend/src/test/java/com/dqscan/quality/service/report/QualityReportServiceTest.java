package com.dqscan.quality.service.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.dqscan.quality.config.ApplicationProperties;
import com.dqscan.quality.dto.dataset.ColumnType;
import com.dqscan.quality.dto.dataset.Dataset;
import com.dqscan.quality.dto.report.AnalysisReason;
import com.dqscan.quality.dto.report.AnalysisStatus;
import com.dqscan.quality.dto.report.DatasetColumnsResponse;
import com.dqscan.quality.dto.report.OutlierFilter;
import com.dqscan.quality.dto.report.QualityReport;
import com.dqscan.quality.dto.report.TaggedOutlierRow;
import com.dqscan.quality.dto.report.TargetSource;
import com.dqscan.quality.fixtures.DatasetFixtures;
import com.dqscan.quality.service.analysis.duplicate.DuplicateRowAnalyzer;
import com.dqscan.quality.service.analysis.label.LabelIssueAnalyzer;
import com.dqscan.quality.service.analysis.missing.MissingValueAnalyzer;
import com.dqscan.quality.service.analysis.ml.WekaDatasetEncoder;
import com.dqscan.quality.service.analysis.outlier.OutlierAnalysisService;
import com.dqscan.quality.service.analysis.outlier.SemanticOutlierDetector;
import com.dqscan.quality.service.analysis.outlier.StatisticalOutlierDetector;
import com.dqscan.quality.service.analysis.outlier.StructuralOutlierDetector;
import com.dqscan.quality.service.analysis.profile.ExternalProfileStatsExtractor;
import com.dqscan.quality.service.analysis.target.TargetColumnInferenceService;
import com.dqscan.quality.service.data_processing.ColumnTypeInferenceService;
import com.dqscan.quality.service.data_processing.DatasetLoaderService;
import com.dqscan.quality.util.MdcTaskDecorator;

@DisplayName("QualityReportService Tests")
class QualityReportServiceTest {

  private ApplicationProperties properties;
  private ThreadPoolTaskExecutor executor;
  private WekaDatasetEncoder encoder;

  @BeforeEach
  void setUp() {
    properties = new ApplicationProperties();
    encoder = new WekaDatasetEncoder();
    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setThreadNamePrefix("test-analysis-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
  }

  @Test
  @DisplayName("Should produce the expected report for the five-row example")
  void endToEndExample() {
    Dataset data = DatasetFixtures.agesWithLabel();

    QualityReport report = service(labelAnalyzer()).generateReport(data, null, null, null);

    assertThat(report.getDatasetName()).isEqualTo("patients");
    assertThat(report.getRowCount()).isEqualTo(5);
    assertThat(report.getColumns()).containsExactly("age", "label");
    assertThat(report.getMissingReport().hasMissingValues()).isFalse();
    assertThat(report.getDuplicateReport().getDuplicateRowsCount()).isZero();
    assertThat(report.getOutlierReport().getStatisticalCount()).isEqualTo(1);
    assertThat(report.getOutlierReport().getRows())
        .extracting(TaggedOutlierRow::getRowIndex)
        .containsExactly(4);
    assertThat(report.getTargetColumn()).isEqualTo("label");
    assertThat(report.getTargetSelection().getSource()).isEqualTo(TargetSource.INFERRED);
    assertThat(report.getLabelIssueReport().getNote()).isNull();
    assertThat(report.getLabelIssueReport().getLabelIssueCount()).isGreaterThanOrEqualTo(0);
    assertThat(report.getExternalOverview().getMissingCells().isAvailable()).isFalse();
    assertThat(report.getOutlierReport().getDetectors().get("AI-Based").getStatus())
        .isEqualTo(AnalysisStatus.UNAVAILABLE);
  }

  @Test
  @DisplayName("Should honour a manual target and the outlier filter")
  void manualTargetAndFilter() {
    Dataset data = DatasetFixtures.agesWithLabel();

    QualityReport report =
        service(labelAnalyzer()).generateReport(data, "age", null, OutlierFilter.STRUCTURAL);

    assertThat(report.getTargetColumn()).isEqualTo("age");
    assertThat(report.getTargetSelection().getSource()).isEqualTo(TargetSource.MANUAL);
    assertThat(report.getOutlierReport().getRows()).isEmpty();
    assertThat(report.getOutlierReport().getTaggedOutlierRows()).isEqualTo(1);
  }

  @Test
  @DisplayName("A slow label analysis should time out into a note and be interrupted")
  void labelAnalysisTimesOut() throws Exception {
    properties.getExecution().setTimeoutSeconds(1);
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch interrupted = new CountDownLatch(1);
    LabelIssueAnalyzer slow = mock(LabelIssueAnalyzer.class);
    when(slow.analyze(any(Dataset.class), anyString()))
        .thenAnswer(
            invocation -> {
              try {
                release.await(10, TimeUnit.SECONDS);
              } catch (InterruptedException e) {
                interrupted.countDown();
              }
              return null;
            });

    try {
      QualityReport report =
          service(slow).generateReport(DatasetFixtures.agesWithLabel(), null, null, null);

      assertThat(report.getLabelIssueReport().getReason()).isEqualTo(AnalysisReason.TIMEOUT);
      assertThat(report.getLabelIssueReport().getNote())
          .startsWith(LabelIssueAnalyzer.NOTE_UNAVAILABLE_PREFIX);
      assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    } finally {
      release.countDown();
    }
  }

  @Test
  @DisplayName("A saturated executor should still yield a complete report")
  void saturatedExecutorStillCompletes() throws Exception {
    ThreadPoolTaskExecutor busy = new ThreadPoolTaskExecutor();
    busy.setCorePoolSize(1);
    busy.setMaxPoolSize(1);
    busy.setQueueCapacity(0);
    busy.initialize();
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch occupied = new CountDownLatch(1);
    busy.execute(
        () -> {
          occupied.countDown();
          try {
            release.await(10, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
        });
    assertThat(occupied.await(5, TimeUnit.SECONDS)).isTrue();

    try {
      QualityReport report =
          service(labelAnalyzer(), busy)
              .generateReport(DatasetFixtures.agesWithLabel(), null, null, null);

      assertThat(report.getOutlierReport().getStatisticalCount()).isEqualTo(1);
      assertThat(report.getTargetColumn()).isEqualTo("label");
      assertThat(report.getLabelIssueReport().getNote()).isNull();
    } finally {
      release.countDown();
      busy.shutdown();
    }
  }

  @Test
  @DisplayName("The five-row example loaded from CSV should match the hand-built report")
  void endToEndFromCsv(@TempDir Path tempDir) throws Exception {
    Path csv = tempDir.resolve("upload.csv");
    Files.write(
        csv, "age,label\n25,0\n26,0\n24,1\n27,0\n1000,1\n".getBytes(StandardCharsets.UTF_8));
    Dataset data =
        new DatasetLoaderService(new ColumnTypeInferenceService(properties))
            .load(csv, "patients.csv");

    QualityReport report = service(labelAnalyzer()).generateReport(data, null, null, null);

    assertThat(report.getColumnTypes()).containsEntry("age", ColumnType.NUMERIC);
    assertThat(report.getMissingReport().hasMissingValues()).isFalse();
    assertThat(report.getDuplicateReport().getDuplicateRowsCount()).isZero();
    assertThat(report.getOutlierReport().getStatisticalCount()).isEqualTo(1);
    assertThat(report.getOutlierReport().getStructuralCount()).isZero();
    assertThat(report.getOutlierReport().getRows())
        .extracting(TaggedOutlierRow::getRowIndex)
        .containsExactly(4);
    assertThat(report.getTargetColumn()).isEqualTo("label");
    assertThat(report.getLabelIssueReport().getNote()).isNull();
    assertThat(report.getLabelIssueReport().getReason()).isNull();
    assertThat(report.getLabelIssueReport().getLabelIssueCount()).isGreaterThanOrEqualTo(0);
  }

  @Test
  @DisplayName("Should describe columns with the inferred target")
  void describeColumns() {
    DatasetColumnsResponse response =
        service(labelAnalyzer()).describeColumns(DatasetFixtures.agesWithLabel());

    assertThat(response.getColumns()).hasSize(2);
    assertThat(response.getColumns().get(1).getDistinctCount()).isEqualTo(2);
    assertThat(response.getInferredTarget().getColumn()).isEqualTo("label");
  }

  private LabelIssueAnalyzer labelAnalyzer() {
    return new LabelIssueAnalyzer(properties, encoder);
  }

  private QualityReportService service(LabelIssueAnalyzer labelIssueAnalyzer) {
    return service(labelIssueAnalyzer, executor);
  }

  private QualityReportService service(
      LabelIssueAnalyzer labelIssueAnalyzer, Executor analysisExecutor) {
    OutlierAnalysisService outliers =
        new OutlierAnalysisService(
            new StructuralOutlierDetector(properties),
            new StatisticalOutlierDetector(properties),
            new SemanticOutlierDetector(properties, encoder));
    return new QualityReportService(
        new MissingValueAnalyzer(),
        new DuplicateRowAnalyzer(properties),
        outliers,
        new TargetColumnInferenceService(properties),
        labelIssueAnalyzer,
        new ExternalProfileStatsExtractor(),
        new QualityReportAggregator(),
        properties,
        analysisExecutor);
  }
}
