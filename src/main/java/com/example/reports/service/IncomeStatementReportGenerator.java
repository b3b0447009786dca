package com.example.reports.service;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import com.example.reports.domain.IncomeStatementRow;
import com.example.reports.domain.IncomeStatementRow.Section;
import com.example.reports.domain.ReportParameters;
import com.example.reports.export.CsvReportBuilder;
import com.example.reports.export.PdfOptions;
import com.example.reports.export.PdfReportBuilder;
import com.example.reports.export.TextOptions;
import com.example.reports.export.XlsxReportBuilder;

/** Income statement: income and expense tables with their totals, then net income. */
class IncomeStatementReportGenerator extends AbstractReportGenerator<IncomeStatementRow> {

  IncomeStatementReportGenerator(RenderSettings settings) {
    super(settings);
  }

  @Override
  protected String title() {
    return "Income Statement (Profit & Loss)";
  }

  @Override
  protected byte[] renderPdf(List<IncomeStatementRow> rows, ReportParameters parameters) {
    PdfReportBuilder pdf = newPdf(parameters, PdfOptions.Orientation.PORTRAIT);

    Function<IncomeStatementRow, List<String>> line =
        item -> cells(item.category(), pdfMoney(item.amount(), parameters), percent(item.percentage()));
    addSectionTable(
        pdf,
        rows,
        new SectionTable(
            "Income", Section.INCOME, Section.INCOME_TOTAL,
            "Category", "% of Income", "Total Income", "No income recorded"),
        line);
    addSectionTable(
        pdf,
        rows,
        new SectionTable(
            "Expenses", Section.EXPENSES, Section.EXPENSES_TOTAL,
            "Category", "% of Expenses", "Total Expenses", "No expenses recorded"),
        line);

    Optional<IncomeStatementRow> netIncome = firstInSection(rows, Section.NET_INCOME);
    if (netIncome.isPresent()) {
      pdf.addText("", TextOptions.bold(12));
      pdf.addText(
          "Net Income: "
              + pdfMoney(netIncome.get().amount(), parameters)
              + " ("
              + percent(netIncome.get().percentage())
              + " of income)",
          TextOptions.bold(12));
    }

    return pdf.toByteArray();
  }

  @Override
  protected byte[] renderCsv(List<IncomeStatementRow> rows, ReportParameters parameters) {
    CsvReportBuilder csv = newCsv(parameters);
    csv.addData(
        rows.stream()
            .map(item ->
                csvRecord(
                    "Section", item.section(),
                    "Category", item.category(),
                    "Amount", item.amount(),
                    "Percentage", item.percentage()))
            .toList());
    return csv.toByteArray();
  }

  @Override
  protected byte[] renderXlsx(List<IncomeStatementRow> rows, ReportParameters parameters) {
    XlsxReportBuilder xlsx = newXlsx(parameters);
    xlsx.addHeaderRow(List.of("Section", "Category", "Amount", "Percentage"));
    xlsx.addDataRows(
        rows.stream()
            .map(item ->
                values(item.section(), item.category(), money(item.amount(), parameters), item.percentage()))
            .toList());
    return xlsx.toByteArray();
  }
}
