package com.dqscan.quality.service.analysis.ml;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.springframework.stereotype.Component;

import com.dqscan.quality.dto.dataset.Column;
import com.dqscan.quality.dto.dataset.ColumnType;
import com.dqscan.quality.dto.dataset.Dataset;

import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.Utils;
import weka.filters.Filter;
import weka.filters.unsupervised.attribute.NominalToBinary;
import weka.filters.unsupervised.attribute.ReplaceMissingValues;
import weka.filters.unsupervised.attribute.Standardize;

/**
 * Turns dataset columns into Weka {@link Instances}. Numeric, boolean and datetime columns become
 * numeric attributes; categorical columns with a bounded number of distinct values become nominal
 * attributes. Missing and malformed cells become Weka missing values.
 */
@Component
public class WekaDatasetEncoder {

  static final String ANOMALY_CLASS = "__anomaly__";

  /**
   * Columns that carry usable signal: typed columns with at least one parsed value, and categorical
   * columns with between 2 and {@code maxCategories} distinct values.
   */
  public List<Column> featureColumns(Dataset dataset, String excludedColumn, int maxCategories) {
    List<Column> features = new ArrayList<>();
    for (Column column : dataset.getColumns()) {
      if (column.getName().equals(excludedColumn)) {
        continue;
      }
      if (column.getType() == ColumnType.CATEGORICAL) {
        int distinct = column.distinctValues().size();
        if (distinct >= 2 && distinct <= maxCategories) {
          features.add(column);
        }
      } else if (hasParsedValue(column)) {
        features.add(column);
      }
    }
    return features;
  }

  /**
   * Builds instances for the given rows. When {@code classColumn} is non-null a nominal class
   * attribute over {@code classLabels} is appended and set as the class index.
   */
  public Instances encode(
      String relation,
      List<Column> features,
      List<Integer> rows,
      Column classColumn,
      List<String> classLabels) {
    ArrayList<Attribute> attributes = new ArrayList<>();
    for (Column column : features) {
      if (column.getType() == ColumnType.CATEGORICAL) {
        attributes.add(new Attribute(column.getName(), nominalValues(column)));
      } else {
        attributes.add(new Attribute(column.getName()));
      }
    }
    if (classColumn != null) {
      attributes.add(new Attribute(classColumn.getName(), new ArrayList<>(classLabels)));
    }

    Instances instances = new Instances(relation, attributes, rows.size());
    for (int row : rows) {
      double[] values = new double[attributes.size()];
      for (int a = 0; a < features.size(); a++) {
        values[a] = cellValue(features.get(a), attributes.get(a), row);
      }
      if (classColumn != null) {
        String label = labelOf(classColumn, row);
        int index = label == null ? -1 : classLabels.indexOf(label);
        values[features.size()] = index < 0 ? Utils.missingValue() : index;
      }
      instances.add(new DenseInstance(1.0, values));
    }
    if (classColumn != null) {
      instances.setClassIndex(instances.numAttributes() - 1);
    }
    return instances;
  }

  /** Mean/mode imputation, binary indicators for nominal attributes, then standardization. */
  public Instances preprocess(Instances data) throws Exception {
    ReplaceMissingValues replaceMissing = new ReplaceMissingValues();
    replaceMissing.setInputFormat(data);
    Instances imputed = Filter.useFilter(data, replaceMissing);

    NominalToBinary toBinary = new NominalToBinary();
    toBinary.setInputFormat(imputed);
    Instances binary = Filter.useFilter(imputed, toBinary);

    Standardize standardize = new Standardize();
    standardize.setInputFormat(binary);
    return Filter.useFilter(binary, standardize);
  }

  /**
   * Copy of preprocessed rows in the shape the isolation forest trains on: non-finite values set to
   * 0 and a placeholder two-value class attribute appended, which the forest ignores.
   */
  public static Instances forAnomalyScoring(Instances preprocessed) {
    Instances data = new Instances(preprocessed);
    int classIndex = data.numAttributes();
    data.insertAttributeAt(
        new Attribute(ANOMALY_CLASS, List.of("inlier", "outlier")), classIndex);
    data.setClassIndex(classIndex);
    for (int i = 0; i < data.numInstances(); i++) {
      Instance row = data.instance(i);
      for (int a = 0; a < classIndex; a++) {
        if (!Double.isFinite(row.value(a))) {
          row.setValue(a, 0.0);
        }
      }
      row.setValue(classIndex, 0.0);
    }
    return data;
  }

  /**
   * Class label of a row as text: booleans as {@code true}/{@code false}, integral numbers without
   * a fraction, anything else as its text. Null for a missing or malformed cell.
   */
  public static String labelOf(Column column, int row) {
    if (column.isMissing(row) || column.isMalformed(row)) {
      return null;
    }
    switch (column.getType()) {
      case BOOLEAN:
        return column.booleanAt(row).toString();
      case NUMERIC:
        double value = column.numericAt(row);
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
          return Long.toString((long) value);
        }
        return Double.toString(value);
      default:
        return column.textAt(row);
    }
  }

  /** Seconds since the epoch, UTC for local values. A bare time of day maps to seconds of day. */
  public static double epochSeconds(Temporal temporal) {
    if (temporal instanceof ZonedDateTime) {
      return ((ZonedDateTime) temporal).toEpochSecond();
    }
    if (temporal instanceof OffsetDateTime) {
      return ((OffsetDateTime) temporal).toEpochSecond();
    }
    if (temporal instanceof LocalDateTime) {
      return ((LocalDateTime) temporal).toEpochSecond(ZoneOffset.UTC);
    }
    if (temporal instanceof LocalDate) {
      return ((LocalDate) temporal).atStartOfDay().toEpochSecond(ZoneOffset.UTC);
    }
    if (temporal instanceof LocalTime) {
      return ((LocalTime) temporal).toSecondOfDay();
    }
    throw new IllegalArgumentException("Unsupported temporal type: " + temporal.getClass());
  }

  private static double cellValue(Column column, Attribute attribute, int row) {
    switch (column.getType()) {
      case NUMERIC:
        Double number = column.numericAt(row);
        return number != null && Double.isFinite(number) ? number : Utils.missingValue();
      case BOOLEAN:
        Boolean flag = column.booleanAt(row);
        return flag == null ? Utils.missingValue() : (flag ? 1.0 : 0.0);
      case DATETIME:
        Temporal temporal = column.temporalAt(row);
        return temporal == null ? Utils.missingValue() : epochSeconds(temporal);
      default:
        if (column.isMissing(row)) {
          return Utils.missingValue();
        }
        int index = attribute.indexOfValue(column.textAt(row));
        return index < 0 ? Utils.missingValue() : index;
    }
  }

  private static List<String> nominalValues(Column column) {
    Set<String> values = new TreeSet<>();
    for (int row = 0; row < column.size(); row++) {
      if (!column.isMissing(row)) {
        values.add(column.textAt(row));
      }
    }
    return new ArrayList<>(values);
  }

  private static boolean hasParsedValue(Column column) {
    for (int row = 0; row < column.size(); row++) {
      if (column.valueAt(row) != null) {
        return true;
      }
    }
    return false;
  }
}
