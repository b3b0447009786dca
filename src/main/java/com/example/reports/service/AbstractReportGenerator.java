package com.example.reports.service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import com.example.reports.domain.ReportFormat;
import com.example.reports.domain.ReportParameters;
import com.example.reports.domain.ReportRow;
import com.example.reports.domain.SectionedRow;
import com.example.reports.export.CsvReportBuilder;
import com.example.reports.export.CurrencyAmount;
import com.example.reports.export.PdfOptions;
import com.example.reports.export.PdfReportBuilder;
import com.example.reports.export.RenderSurface;
import com.example.reports.export.ReportFormatter;
import com.example.reports.export.TableOptions;
import com.example.reports.export.XlsxReportBuilder;

/**
 * Common layout steps for report generators. Each subclass renders all three formats; the title
 * and subtitle lead every document regardless of format.
 */
abstract class AbstractReportGenerator<R extends ReportRow> implements ReportGenerator<R> {

  protected final RenderSettings settings;

  protected AbstractReportGenerator(RenderSettings settings) {
    this.settings = settings;
  }

  @Override
  public final byte[] generate(List<R> rows, ReportFormat format, ReportParameters parameters) {
    return switch (format) {
      case PDF -> renderPdf(rows, parameters);
      case CSV -> renderCsv(rows, parameters);
      case XLSX -> renderXlsx(rows, parameters);
    };
  }

  protected abstract String title();

  protected abstract byte[] renderPdf(List<R> rows, ReportParameters parameters);

  protected abstract byte[] renderCsv(List<R> rows, ReportParameters parameters);

  protected abstract byte[] renderXlsx(List<R> rows, ReportParameters parameters);

  /** "Period: Jan 1, 2025 - Jan 31, 2025". */
  protected String subtitle(ReportParameters parameters) {
    return "Period: "
        + ReportFormatter.formatDate(parameters.startDate())
        + " - "
        + ReportFormatter.formatDate(parameters.endDate());
  }

  // ==================== BACKEND SETUP ====================

  protected PdfReportBuilder newPdf(ReportParameters parameters, PdfOptions.Orientation orientation) {
    LocalDateTime generatedAt =
        settings.includeTimestamp() ? LocalDateTime.now(settings.clock()) : null;
    return new PdfReportBuilder(
        new PdfOptions(title(), subtitle(parameters), orientation, generatedAt),
        settings.style(),
        settings.clock());
  }

  protected CsvReportBuilder newCsv(ReportParameters parameters) {
    CsvReportBuilder csv = new CsvReportBuilder();
    csv.addSection(title());
    csv.addSection(subtitle(parameters));
    return csv;
  }

  /** A workbook whose first sheet starts with the title, the subtitle and an empty row. */
  protected XlsxReportBuilder newXlsx(ReportParameters parameters) {
    XlsxReportBuilder xlsx = new XlsxReportBuilder(settings.style(), settings.clock());
    xlsx.addRow(List.of(title()));
    xlsx.addRow(List.of(subtitle(parameters)));
    xlsx.addEmptyRow();
    return xlsx;
  }

  // ==================== SECTION HELPERS ====================

  /** Rows tagged with exactly the given section, in input order. */
  protected static <S extends SectionedRow> List<S> inSection(List<S> rows, Enum<?> section) {
    return rows.stream().filter(row -> row.isIn(section)).toList();
  }

  /** The first row tagged with the given section, typically a totals or net figure row. */
  protected static <S extends SectionedRow> Optional<S> firstInSection(List<S> rows, Enum<?> section) {
    return rows.stream().filter(row -> row.isIn(section)).findFirst();
  }

  /**
   * Layout of one amount-and-percentage section table.
   *
   * @param heading       section heading above the table
   * @param lines         tag of the body rows
   * @param total         tag of the row shown as the footer, when present
   * @param labelHeader   header of the first column
   * @param percentHeader header of the percentage column
   * @param totalLabel    first footer cell
   * @param emptyText     line written instead of the table when the section has no body rows
   */
  protected record SectionTable(
      String heading,
      Enum<?> lines,
      Enum<?> total,
      String labelHeader,
      String percentHeader,
      String totalLabel,
      String emptyText) {}

  /**
   * Writes the section's rows as a label, amount and percentage table. The totals row only ever
   * feeds the footer; without one the table has no footer.
   */
  protected static <S extends SectionedRow> void addSectionTable(
      PdfReportBuilder pdf, List<S> rows, SectionTable table, Function<S, List<String>> toCells) {
    pdf.addSection(table.heading());
    List<S> items = inSection(rows, table.lines());
    if (items.isEmpty()) {
      pdf.addText(table.emptyText());
      return;
    }

    TableOptions options = TableOptions.rightAligned(1, 2);
    Optional<S> totalRow = firstInSection(rows, table.total());
    if (totalRow.isPresent()) {
      List<String> footer = new ArrayList<>(toCells.apply(totalRow.get()));
      footer.set(0, table.totalLabel());
      options = options.withFooterRow(footer);
    }

    pdf.addTable(
        List.of(table.labelHeader(), "Amount", table.percentHeader()),
        items.stream().map(toCells).toList(),
        options);
  }

  /** Groups rows by key in first-seen order. */
  protected static <T> Map<String, List<T>> groupBy(List<T> rows, Function<T, String> key) {
    Map<String, List<T>> groups = new LinkedHashMap<>();
    for (T row : rows) {
      String name = key.apply(row);
      groups.computeIfAbsent(name == null ? "" : name, k -> new ArrayList<>()).add(row);
    }
    return groups;
  }

  // ==================== CELL HELPERS ====================

  /** Currency text for the PDF surface. */
  protected static String pdfMoney(BigDecimal amount, ReportParameters parameters) {
    return ReportFormatter.formatCurrency(amount, parameters.currency(), RenderSurface.PDF);
  }

  protected static CurrencyAmount money(BigDecimal amount, ReportParameters parameters) {
    return CurrencyAmount.of(amount, parameters.currency());
  }

  protected static String percent(BigDecimal value) {
    return ReportFormatter.formatPercentage(value);
  }

  /** A table row with {@code null} values rendered as empty cells. */
  protected static List<String> cells(String... values) {
    return Arrays.stream(values).map(value -> value == null ? "" : value).toList();
  }

  /** A spreadsheet row; unlike {@link List#of}, it accepts {@code null} cells. */
  protected static List<Object> values(Object... values) {
    return Arrays.asList(values);
  }

  /** An ordered CSV record built from alternating column names and values. */
  protected static Map<String, Object> csvRecord(Object... columnsAndValues) {
    Map<String, Object> csvRecord = new LinkedHashMap<>();
    for (int i = 0; i + 1 < columnsAndValues.length; i += 2) {
      csvRecord.put((String) columnsAndValues[i], columnsAndValues[i + 1]);
    }
    return csvRecord;
  }
}
