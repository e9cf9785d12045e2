package com.dqscan.quality.controller;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.dqscan.quality.dto.dataset.Dataset;
import com.dqscan.quality.dto.report.DatasetColumnsResponse;
import com.dqscan.quality.dto.report.OutlierFilter;
import com.dqscan.quality.dto.report.QualityReport;
import com.dqscan.quality.exception.DatasetLoadException;
import com.dqscan.quality.service.data_processing.DatasetLoaderService;
import com.dqscan.quality.service.report.QualityReportService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Quality Report", description = "Dataset quality analysis endpoints")
public class QualityReportController {

  @Value("${app.upload.max-file-size:52428800}")
  private long maxFileSize;

  @Value("${app.upload.allowed-extensions:csv,xlsx,xls}")
  private Set<String> allowedExtensions;

  private final DatasetLoaderService datasetLoaderService;
  private final QualityReportService qualityReportService;

  @PostMapping(
      value = "/quality/report",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Generate a quality report",
      description =
          "Analyze an uploaded CSV or Excel file for missing values, duplicates, outliers and"
              + " label issues")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Report generated",
            content = @Content(schema = @Schema(implementation = QualityReport.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid or unreadable file",
            content = @Content),
        @ApiResponse(
            responseCode = "500",
            description = "Internal server error",
            content = @Content)
      })
  public ResponseEntity<QualityReport> generateReport(
      @Parameter(description = "Dataset to analyze (CSV, XLSX or XLS)", required = true)
          @RequestParam("file")
          MultipartFile file,
      @Parameter(description = "HTML profiling report whose overview numbers are echoed back")
          @RequestParam(value = "overview", required = false)
          MultipartFile overview,
      @Parameter(description = "Column to use as the label instead of the inferred one")
          @RequestParam(value = "targetColumn", required = false)
          String targetColumn,
      @Parameter(description = "Outlier rows to include: all, statistical, ai or structural")
          @RequestParam(value = "filter", required = false, defaultValue = "all")
          String filter) {

    validateFile(file);
    Path datasetFile = null;
    Path overviewFile = null;
    try {
      datasetFile = writeTempFile(file, extractFileExtension(file.getOriginalFilename()));
      if (overview != null && !overview.isEmpty()) {
        overviewFile = writeTempFile(overview, "html");
      }
      Dataset dataset = datasetLoaderService.load(datasetFile, file.getOriginalFilename());
      QualityReport report =
          qualityReportService.generateReport(
              dataset, targetColumn, overviewFile, OutlierFilter.fromParameter(filter));
      return ResponseEntity.ok(report);
    } finally {
      deleteQuietly(datasetFile);
      deleteQuietly(overviewFile);
    }
  }

  @PostMapping(
      value = "/quality/columns",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "List dataset columns",
      description = "Return column names, inferred types and the inferred target column")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Columns listed",
            content = @Content(schema = @Schema(implementation = DatasetColumnsResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid or unreadable file",
            content = @Content)
      })
  public ResponseEntity<DatasetColumnsResponse> describeColumns(
      @Parameter(description = "Dataset to inspect (CSV, XLSX or XLS)", required = true)
          @RequestParam("file")
          MultipartFile file) {
    validateFile(file);
    Path datasetFile = null;
    try {
      datasetFile = writeTempFile(file, extractFileExtension(file.getOriginalFilename()));
      Dataset dataset = datasetLoaderService.load(datasetFile, file.getOriginalFilename());
      return ResponseEntity.ok(qualityReportService.describeColumns(dataset));
    } finally {
      deleteQuietly(datasetFile);
    }
  }

  @GetMapping("/health")
  @Operation(summary = "Health check", description = "Check if the quality service is up")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Service is healthy")})
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of("status", "UP", "timestamp", System.currentTimeMillis()));
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("File is empty");
    }

    if (file.getSize() > maxFileSize) {
      throw new IllegalArgumentException(
          "File size exceeds maximum allowed size of " + maxFileSize + " bytes");
    }

    String fileName = file.getOriginalFilename();
    if (fileName == null || fileName.isEmpty()) {
      throw new IllegalArgumentException("File name is empty");
    }

    String extension = extractFileExtension(fileName);
    if (!allowedExtensions.contains(extension)) {
      throw new IllegalArgumentException(
          "File type not supported. Allowed types: " + allowedExtensions);
    }
  }

  private static String extractFileExtension(String fileName) {
    if (fileName == null) {
      return "";
    }
    int lastDotIndex = fileName.lastIndexOf('.');
    return (lastDotIndex == -1 || lastDotIndex == fileName.length() - 1)
        ? ""
        : fileName.substring(lastDotIndex + 1).toLowerCase(Locale.ROOT);
  }

  private static Path writeTempFile(MultipartFile upload, String extension) {
    try {
      Path temp = Files.createTempFile("dqscan-upload-", "." + extension);
      try (InputStream in = upload.getInputStream()) {
        Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
      }
      return temp;
    } catch (IOException e) {
      throw new DatasetLoadException("Failed to store upload: " + e.getMessage(), e);
    }
  }

  private static void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Could not delete temporary file {}: {}", path, e.getMessage());
    }
  }
}
