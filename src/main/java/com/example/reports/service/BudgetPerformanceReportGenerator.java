package com.example.reports.service;

import java.util.List;
import java.util.Map;

import com.example.reports.domain.BudgetPerformanceRow;
import com.example.reports.domain.ReportParameters;
import com.example.reports.export.ColumnAlignment;
import com.example.reports.export.CsvReportBuilder;
import com.example.reports.export.PdfOptions;
import com.example.reports.export.PdfReportBuilder;
import com.example.reports.export.ReportFormatter;
import com.example.reports.export.TableOptions;
import com.example.reports.export.XlsxReportBuilder;

/**
 * Budget performance: one block per budget, each listing its categories with allocated, spent and
 * remaining amounts. In the PDF every budget after the first starts on a new page.
 */
class BudgetPerformanceReportGenerator extends AbstractReportGenerator<BudgetPerformanceRow> {

  private static final List<String> HEADERS =
      List.of(
          "Budget",
          "Category",
          "Allocated",
          "Spent",
          "Remaining",
          "% Used",
          "Status",
          "Period Start",
          "Period End");

  BudgetPerformanceReportGenerator(RenderSettings settings) {
    super(settings);
  }

  @Override
  protected String title() {
    return "Budget Performance Report";
  }

  @Override
  protected byte[] renderPdf(List<BudgetPerformanceRow> rows, ReportParameters parameters) {
    PdfReportBuilder pdf = newPdf(parameters, PdfOptions.Orientation.LANDSCAPE);

    Map<String, List<BudgetPerformanceRow>> budgets = groupBy(rows, BudgetPerformanceRow::budgetName);
    if (budgets.isEmpty()) {
      pdf.addText("No budgets found for this period");
    }

    TableOptions options =
        TableOptions.rightAligned(1, 2, 3, 4).withAlignment(5, ColumnAlignment.CENTER);
    boolean first = true;
    for (Map.Entry<String, List<BudgetPerformanceRow>> budget : budgets.entrySet()) {
      if (!first) {
        pdf.addPageBreak();
      }
      first = false;

      BudgetPerformanceRow firstItem = budget.getValue().get(0);
      pdf.addSection(
          budget.getKey()
              + " ("
              + ReportFormatter.formatDate(firstItem.periodStart())
              + " - "
              + ReportFormatter.formatDate(firstItem.periodEnd())
              + ")");
      pdf.addTable(
          List.of("Category", "Allocated", "Spent", "Remaining", "% Used", "Status"),
          budget.getValue().stream()
              .map(item ->
                  cells(
                      item.categoryName(),
                      pdfMoney(item.allocated(), parameters),
                      pdfMoney(item.spent(), parameters),
                      pdfMoney(item.remaining(), parameters),
                      percent(item.percentageUsed()),
                      item.status()))
              .toList(),
          options);
    }

    return pdf.toByteArray();
  }

  @Override
  protected byte[] renderCsv(List<BudgetPerformanceRow> rows, ReportParameters parameters) {
    CsvReportBuilder csv = newCsv(parameters);
    csv.addData(
        rows.stream()
            .map(item ->
                csvRecord(
                    "Budget", item.budgetName(),
                    "Category", item.categoryName(),
                    "Allocated", item.allocated(),
                    "Spent", item.spent(),
                    "Remaining", item.remaining(),
                    "Percentage Used", item.percentageUsed(),
                    "Status", item.status(),
                    "Period Start", item.periodStart(),
                    "Period End", item.periodEnd()))
            .toList());
    return csv.toByteArray();
  }

  /** One header row per budget, each followed by that budget's rows and a spacer row. */
  @Override
  protected byte[] renderXlsx(List<BudgetPerformanceRow> rows, ReportParameters parameters) {
    XlsxReportBuilder xlsx = newXlsx(parameters);
    boolean first = true;
    for (List<BudgetPerformanceRow> budget : groupBy(rows, BudgetPerformanceRow::budgetName).values()) {
      if (!first) {
        xlsx.addEmptyRow();
      }
      first = false;
      xlsx.addHeaderRow(HEADERS);
      xlsx.addDataRows(
          budget.stream()
              .map(item ->
                  values(
                      item.budgetName(),
                      item.categoryName(),
                      money(item.allocated(), parameters),
                      money(item.spent(), parameters),
                      money(item.remaining(), parameters),
                      item.percentageUsed(),
                      item.status(),
                      item.periodStart(),
                      item.periodEnd()))
              .toList());
    }
    return xlsx.toByteArray();
  }
}
