package com.dqscan.quality.service.data_processing;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Service;

import com.dqscan.quality.dto.dataset.Dataset;
import com.dqscan.quality.exception.DatasetLoadException;
import com.dqscan.quality.exception.UnsupportedFormatException;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Reads CSV and Excel uploads into a typed {@link Dataset}. */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetLoaderService {

  public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("csv", "xlsx", "xls");

  private static final char BOM = '\uFEFF';

  private final ColumnTypeInferenceService typeInferenceService;

  /**
   * Loads a dataset. The format is chosen from the original file name, since stored uploads may
   * carry a generated name.
   *
   * @throws UnsupportedFormatException for any extension other than csv, xlsx or xls
   * @throws DatasetLoadException when the file cannot be read or has no header row
   */
  public Dataset load(Path file, String originalFilename) {
    String extension = extractFileExtension(originalFilename);
    String datasetName = extractDatasetName(originalFilename);

    RawTable table;
    switch (extension) {
      case "csv":
        table = readCsv(file);
        break;
      case "xlsx":
      case "xls":
        table = readExcel(file);
        break;
      default:
        throw new UnsupportedFormatException(extension);
    }

    log.info(
        "Loaded '{}' ({}): {} columns, {} rows",
        originalFilename,
        extension,
        table.headers.size(),
        table.rows.size());
    return typeInferenceService.buildDataset(datasetName, table.headers, table.rows);
  }

  private RawTable readCsv(Path file) {
    try {
      return readCsv(file, StandardCharsets.UTF_8);
    } catch (CharacterCodingException e) {
      log.info("File is not valid UTF-8, retrying as ISO-8859-1: {}", e.getMessage());
      try {
        return readCsv(file, StandardCharsets.ISO_8859_1);
      } catch (IOException retryFailure) {
        throw new DatasetLoadException("Unable to read CSV file", retryFailure);
      }
    } catch (IOException e) {
      throw new DatasetLoadException("Unable to read CSV file", e);
    }
  }

  private RawTable readCsv(Path file, Charset charset) throws IOException {
    CharsetDecoder decoder =
        charset
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);

    try (InputStream in = Files.newInputStream(file);
        CSVReader reader = new CSVReader(new InputStreamReader(in, decoder))) {
      String[] headers = reader.readNext();
      if (headers == null || headers.length == 0 || (headers.length == 1 && headers[0].isBlank())) {
        throw new DatasetLoadException("CSV file has no header row");
      }
      if (!headers[0].isEmpty() && headers[0].charAt(0) == BOM) {
        headers[0] = headers[0].substring(1);
      }

      List<String> columns = normalizeHeaders(Arrays.asList(headers));
      List<String[]> rows = new ArrayList<>();
      String[] row;
      int lineNumber = 1;
      while ((row = reader.readNext()) != null) {
        lineNumber++;
        if (row.length == 1 && row[0].isEmpty() && columns.size() > 1) {
          continue;
        }
        rows.add(alignRow(row, columns.size(), lineNumber));
      }
      return new RawTable(columns, rows);
    } catch (CsvValidationException e) {
      throw new DatasetLoadException("Malformed CSV content: " + e.getMessage(), e);
    } catch (IOException e) {
      CharacterCodingException decodingFailure = findDecodingFailure(e);
      if (decodingFailure != null) {
        throw decodingFailure;
      }
      throw e;
    }
  }

  private RawTable readExcel(Path file) {
    try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
      if (workbook.getNumberOfSheets() == 0) {
        throw new DatasetLoadException("Workbook has no sheets");
      }
      Sheet sheet = workbook.getSheetAt(0);
      DataFormatter formatter = new DataFormatter();
      FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

      Row headerRow = sheet.getRow(sheet.getFirstRowNum());
      if (headerRow == null || headerRow.getLastCellNum() <= 0) {
        throw new DatasetLoadException("Excel sheet has no header row");
      }
      int width = headerRow.getLastCellNum();
      List<String> headers = new ArrayList<>(width);
      for (int c = 0; c < width; c++) {
        headers.add(cellText(headerRow.getCell(c), formatter, evaluator));
      }
      List<String> columns = normalizeHeaders(headers);

      List<String[]> rows = new ArrayList<>();
      for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
        Row row = sheet.getRow(r);
        if (row == null) {
          continue;
        }
        String[] values = new String[width];
        boolean blank = true;
        for (int c = 0; c < width; c++) {
          values[c] = cellText(row.getCell(c), formatter, evaluator);
          blank &= values[c].isEmpty();
        }
        if (!blank) {
          rows.add(values);
        }
      }
      return new RawTable(columns, rows);
    } catch (DatasetLoadException e) {
      throw e;
    } catch (IOException | RuntimeException e) {
      throw new DatasetLoadException("Unable to read Excel file: " + e.getMessage(), e);
    }
  }

  private static String cellText(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
    if (cell == null) {
      return "";
    }
    return formatter.formatCellValue(cell, evaluator);
  }

  /** Blank names become {@code Unnamed: i}; repeated names get {@code .1}, {@code .2} suffixes. */
  static List<String> normalizeHeaders(List<String> rawHeaders) {
    List<String> result = new ArrayList<>(rawHeaders.size());
    Set<String> used = new HashSet<>();
    Map<String, Integer> repeats = new HashMap<>();
    for (int i = 0; i < rawHeaders.size(); i++) {
      String header = rawHeaders.get(i) == null ? "" : rawHeaders.get(i).trim();
      if (header.isEmpty()) {
        header = "Unnamed: " + i;
      }
      String candidate = header;
      while (!used.add(candidate)) {
        int next = repeats.merge(header, 1, Integer::sum);
        candidate = header + "." + next;
      }
      result.add(candidate);
    }
    return result;
  }

  private static String[] alignRow(String[] row, int width, int lineNumber) {
    if (row.length == width) {
      return row;
    }
    log.debug("Line {} has {} fields, expected {}", lineNumber, row.length, width);
    return Arrays.copyOf(row, width);
  }

  private static CharacterCodingException findDecodingFailure(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof CharacterCodingException) {
        return (CharacterCodingException) current;
      }
      current = current.getCause();
    }
    return null;
  }

  static String extractFileExtension(String fileName) {
    if (fileName == null) {
      return "";
    }
    int lastDotIndex = fileName.lastIndexOf('.');
    return (lastDotIndex == -1 || lastDotIndex == fileName.length() - 1)
        ? ""
        : fileName.substring(lastDotIndex + 1).toLowerCase(Locale.ROOT);
  }

  static String extractDatasetName(String fileName) {
    if (fileName == null || fileName.isEmpty()) {
      return "unnamed_dataset";
    }
    int lastDotIndex = fileName.lastIndexOf('.');
    return lastDotIndex > 0 ? fileName.substring(0, lastDotIndex) : fileName;
  }

  private static final class RawTable {
    private final List<String> headers;
    private final List<String[]> rows;

    private RawTable(List<String> headers, List<String[]> rows) {
      this.headers = headers;
      this.rows = rows;
    }
  }
}
