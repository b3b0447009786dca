package com.example.reports.service;

import java.util.List;

import com.example.reports.domain.MerchantAnalysisRow;
import com.example.reports.domain.ReportParameters;
import com.example.reports.export.ColumnAlignment;
import com.example.reports.export.CsvReportBuilder;
import com.example.reports.export.PdfOptions;
import com.example.reports.export.PdfReportBuilder;
import com.example.reports.export.ReportFormatter;
import com.example.reports.export.TableOptions;
import com.example.reports.export.XlsxReportBuilder;

/** Spending per merchant with visit counts and the average gap between purchases. */
class MerchantAnalysisReportGenerator extends AbstractReportGenerator<MerchantAnalysisRow> {

  private static final int PDF_CATEGORIES_LENGTH = 30;

  private static final List<String> HEADERS =
      List.of(
          "Merchant",
          "Transaction Count",
          "Total Spent",
          "Average Transaction",
          "First Transaction",
          "Last Transaction",
          "Categories",
          "Frequency (days)");

  MerchantAnalysisReportGenerator(RenderSettings settings) {
    super(settings);
  }

  @Override
  protected String title() {
    return "Merchant Analysis Report";
  }

  @Override
  protected byte[] renderPdf(List<MerchantAnalysisRow> rows, ReportParameters parameters) {
    PdfReportBuilder pdf = newPdf(parameters, PdfOptions.Orientation.LANDSCAPE);

    if (rows.isEmpty()) {
      pdf.addText("No merchant activity found for this period");
      return pdf.toByteArray();
    }

    TableOptions options =
        TableOptions.rightAligned(2, 3)
            .withAlignment(1, ColumnAlignment.CENTER)
            .withAlignment(5, ColumnAlignment.CENTER);
    pdf.addTable(
        List.of(
            "Merchant", "Transactions", "Total Spent", "Avg Transaction", "Categories",
            "Frequency (days)"),
        rows.stream()
            .map(item ->
                cells(
                    item.merchant(),
                    String.valueOf(item.transactionCount()),
                    pdfMoney(item.totalSpent(), parameters),
                    pdfMoney(item.averageTransaction(), parameters),
                    ReportFormatter.truncate(
                        String.join(", ", item.categories()), PDF_CATEGORIES_LENGTH),
                    ReportFormatter.formatDecimal(item.frequencyDays(), 1)))
            .toList(),
        options);

    return pdf.toByteArray();
  }

  @Override
  protected byte[] renderCsv(List<MerchantAnalysisRow> rows, ReportParameters parameters) {
    CsvReportBuilder csv = newCsv(parameters);
    csv.addData(
        rows.stream()
            .map(item ->
                csvRecord(
                    "Merchant", item.merchant(),
                    "Transaction Count", item.transactionCount(),
                    "Total Spent", item.totalSpent(),
                    "Average Transaction", item.averageTransaction(),
                    "First Transaction", item.firstTransaction(),
                    "Last Transaction", item.lastTransaction(),
                    "Categories", item.categories(),
                    "Frequency (days)", item.frequencyDays()))
            .toList());
    return csv.toByteArray();
  }

  @Override
  protected byte[] renderXlsx(List<MerchantAnalysisRow> rows, ReportParameters parameters) {
    XlsxReportBuilder xlsx = newXlsx(parameters);
    xlsx.addHeaderRow(HEADERS);
    xlsx.addDataRows(
        rows.stream()
            .map(item ->
                values(
                    item.merchant(),
                    item.transactionCount(),
                    money(item.totalSpent(), parameters),
                    money(item.averageTransaction(), parameters),
                    item.firstTransaction(),
                    item.lastTransaction(),
                    String.join(", ", item.categories()),
                    item.frequencyDays()))
            .toList());
    return xlsx.toByteArray();
  }
}
