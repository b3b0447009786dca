package com.example.reports.export;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a CSV report: quoted preface lines (title, subtitle), a blank line, then one
 * comma-separated data block whose header row is taken from the row keys in first-seen order.
 *
 * <p>CSV has no notion of styling or totals; callers include totals as ordinary rows.
 */
public class CsvReportBuilder {

  private static final String LINE_END = "\n";

  private final List<String> sections = new ArrayList<>();
  private final List<Map<String, Object>> data = new ArrayList<>();

  /** Queues a preface line written above the data block. */
  public void addSection(String title) {
    sections.add(title == null ? "" : title);
  }

  /** Appends data rows. Each map's iteration order defines its column order. */
  public void addData(List<? extends Map<String, ?>> rows) {
    for (Map<String, ?> row : rows) {
      data.add(new LinkedHashMap<>(row));
    }
  }

  public byte[] toByteArray() {
    StringBuilder csv = new StringBuilder();

    if (!sections.isEmpty()) {
      for (String section : sections) {
        csv.append('"').append(section.replace("\"", "\"\"")).append('"').append(LINE_END);
      }
      csv.append(LINE_END);
    }

    if (!data.isEmpty()) {
      Set<String> columns = new LinkedHashSet<>();
      for (Map<String, Object> row : data) {
        columns.addAll(row.keySet());
      }

      csv.append(joinFields(new ArrayList<>(columns)));
      for (Map<String, Object> row : data) {
        List<String> fields = new ArrayList<>(columns.size());
        for (String column : columns) {
          fields.add(ReportFormatter.plainText(row.get(column)));
        }
        csv.append(LINE_END).append(joinFields(fields));
      }
    }

    return csv.toString().getBytes(StandardCharsets.UTF_8);
  }

  private static String joinFields(List<String> fields) {
    StringBuilder line = new StringBuilder();
    for (int i = 0; i < fields.size(); i++) {
      if (i > 0) {
        line.append(',');
      }
      line.append(escapeCsvField(fields.get(i)));
    }
    return line.toString();
  }

  /**
   * Escapes a field value for CSV output. Fields containing commas, quotes, line breaks or
   * surrounding whitespace are wrapped in quotes, and embedded quotes are doubled.
   */
  static String escapeCsvField(String value) {
    if (value == null) return "";
    if (value.contains(",")
        || value.contains("\"")
        || value.contains("\n")
        || value.contains("\r")
        || (!value.isEmpty() && (value.charAt(0) == ' ' || value.charAt(value.length() - 1) == ' '))) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }
}
