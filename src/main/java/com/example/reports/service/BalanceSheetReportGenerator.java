package com.example.reports.service;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import com.example.reports.domain.BalanceSheetRow;
import com.example.reports.domain.BalanceSheetRow.Section;
import com.example.reports.domain.ReportParameters;
import com.example.reports.export.CsvReportBuilder;
import com.example.reports.export.PdfOptions;
import com.example.reports.export.PdfReportBuilder;
import com.example.reports.export.ReportFormatter;
import com.example.reports.export.TextOptions;
import com.example.reports.export.XlsxReportBuilder;

/** Balance sheet as of a single date: assets, liabilities and net worth. */
class BalanceSheetReportGenerator extends AbstractReportGenerator<BalanceSheetRow> {

  BalanceSheetReportGenerator(RenderSettings settings) {
    super(settings);
  }

  @Override
  protected String title() {
    return "Balance Sheet";
  }

  @Override
  protected String subtitle(ReportParameters parameters) {
    return "As of: " + ReportFormatter.formatDate(parameters.effectiveAsOfDate());
  }

  @Override
  protected byte[] renderPdf(List<BalanceSheetRow> rows, ReportParameters parameters) {
    PdfReportBuilder pdf = newPdf(parameters, PdfOptions.Orientation.PORTRAIT);

    Function<BalanceSheetRow, List<String>> line =
        item -> cells(item.item(), pdfMoney(item.amount(), parameters), percent(item.percentage()));
    addSectionTable(
        pdf,
        rows,
        new SectionTable(
            "Assets", Section.ASSETS, Section.ASSETS_TOTAL,
            "Account", "% of Assets", "Total Assets", "No assets recorded"),
        line);
    addSectionTable(
        pdf,
        rows,
        new SectionTable(
            "Liabilities", Section.LIABILITIES, Section.LIABILITIES_TOTAL,
            "Account", "% of Liabilities", "Total Liabilities", "No liabilities recorded"),
        line);

    Optional<BalanceSheetRow> netWorth = firstInSection(rows, Section.NET_WORTH);
    if (netWorth.isPresent()) {
      pdf.addText("", TextOptions.bold(12));
      pdf.addText(
          "Net Worth: " + pdfMoney(netWorth.get().amount(), parameters), TextOptions.bold(12));
    }

    return pdf.toByteArray();
  }

  @Override
  protected byte[] renderCsv(List<BalanceSheetRow> rows, ReportParameters parameters) {
    CsvReportBuilder csv = newCsv(parameters);
    csv.addData(
        rows.stream()
            .map(item ->
                csvRecord(
                    "Section", item.section(),
                    "Item", item.item(),
                    "Amount", item.amount(),
                    "Percentage", item.percentage()))
            .toList());
    return csv.toByteArray();
  }

  @Override
  protected byte[] renderXlsx(List<BalanceSheetRow> rows, ReportParameters parameters) {
    XlsxReportBuilder xlsx = newXlsx(parameters);
    xlsx.addHeaderRow(List.of("Section", "Item", "Amount", "Percentage"));
    xlsx.addDataRows(
        rows.stream()
            .map(item ->
                values(item.section(), item.item(), money(item.amount(), parameters), item.percentage()))
            .toList());
    return xlsx.toByteArray();
  }
}
