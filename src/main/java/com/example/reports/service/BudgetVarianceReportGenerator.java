package com.example.reports.service;

import java.util.List;
import java.util.Map;

import com.example.reports.domain.BudgetVarianceRow;
import com.example.reports.domain.ReportParameters;
import com.example.reports.export.ColumnAlignment;
import com.example.reports.export.CsvReportBuilder;
import com.example.reports.export.PdfOptions;
import com.example.reports.export.PdfReportBuilder;
import com.example.reports.export.TableOptions;
import com.example.reports.export.XlsxReportBuilder;

/** Budget variance: allocated against actual per category, grouped by budget. */
class BudgetVarianceReportGenerator extends AbstractReportGenerator<BudgetVarianceRow> {

  private static final List<String> HEADERS =
      List.of(
          "Budget",
          "Category",
          "Period",
          "Allocated",
          "Actual",
          "Variance",
          "Variance %",
          "Favorable");

  BudgetVarianceReportGenerator(RenderSettings settings) {
    super(settings);
  }

  @Override
  protected String title() {
    return "Budget Variance Analysis";
  }

  @Override
  protected byte[] renderPdf(List<BudgetVarianceRow> rows, ReportParameters parameters) {
    PdfReportBuilder pdf = newPdf(parameters, PdfOptions.Orientation.LANDSCAPE);

    Map<String, List<BudgetVarianceRow>> budgets = groupBy(rows, BudgetVarianceRow::budgetName);
    if (budgets.isEmpty()) {
      pdf.addText("No budget variances found for this period");
    }

    TableOptions options =
        TableOptions.rightAligned(2, 3, 4, 5).withAlignment(6, ColumnAlignment.CENTER);
    for (Map.Entry<String, List<BudgetVarianceRow>> budget : budgets.entrySet()) {
      pdf.addSection(budget.getKey());
      pdf.addTable(
          List.of("Category", "Period", "Allocated", "Actual", "Variance", "Variance %", "Status"),
          budget.getValue().stream()
              .map(item ->
                  cells(
                      item.categoryName(),
                      item.period(),
                      pdfMoney(item.allocated(), parameters),
                      pdfMoney(item.actual(), parameters),
                      pdfMoney(item.variance(), parameters),
                      percent(item.variancePercentage()),
                      item.favorable() ? "✓ Favorable" : "✗ Unfavorable"))
              .toList(),
          options);
    }

    return pdf.toByteArray();
  }

  @Override
  protected byte[] renderCsv(List<BudgetVarianceRow> rows, ReportParameters parameters) {
    CsvReportBuilder csv = newCsv(parameters);
    csv.addData(
        rows.stream()
            .map(item ->
                csvRecord(
                    "Budget", item.budgetName(),
                    "Category", item.categoryName(),
                    "Period", item.period(),
                    "Allocated", item.allocated(),
                    "Actual", item.actual(),
                    "Variance", item.variance(),
                    "Variance %", item.variancePercentage(),
                    "Favorable", yesNo(item.favorable())))
            .toList());
    return csv.toByteArray();
  }

  /** One header row per budget, each followed by that budget's rows and a spacer row. */
  @Override
  protected byte[] renderXlsx(List<BudgetVarianceRow> rows, ReportParameters parameters) {
    XlsxReportBuilder xlsx = newXlsx(parameters);
    boolean first = true;
    for (List<BudgetVarianceRow> budget : groupBy(rows, BudgetVarianceRow::budgetName).values()) {
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
                      item.period(),
                      money(item.allocated(), parameters),
                      money(item.actual(), parameters),
                      money(item.variance(), parameters),
                      item.variancePercentage(),
                      yesNo(item.favorable())))
              .toList());
    }
    return xlsx.toByteArray();
  }

  private static String yesNo(boolean favorable) {
    return favorable ? "Yes" : "No";
  }
}
