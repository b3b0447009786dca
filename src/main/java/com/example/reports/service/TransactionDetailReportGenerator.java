package com.example.reports.service;

import java.util.List;

import com.example.reports.domain.ReportParameters;
import com.example.reports.domain.TransactionDetailRow;
import com.example.reports.export.CsvReportBuilder;
import com.example.reports.export.PdfOptions;
import com.example.reports.export.PdfReportBuilder;
import com.example.reports.export.ReportFormatter;
import com.example.reports.export.TableOptions;
import com.example.reports.export.XlsxReportBuilder;

/**
 * Transaction listing. The PDF shows a condensed table; CSV and XLSX carry every field, including
 * tags, merchant and notes.
 */
class TransactionDetailReportGenerator extends AbstractReportGenerator<TransactionDetailRow> {

  private static final int PDF_DESCRIPTION_LENGTH = 30;

  private static final List<String> HEADERS =
      List.of(
          "Date",
          "Description",
          "Category",
          "Account",
          "Type",
          "Amount",
          "Balance Impact",
          "Merchant",
          "Tags",
          "Notes");

  TransactionDetailReportGenerator(RenderSettings settings) {
    super(settings);
  }

  @Override
  protected String title() {
    return "Transaction Detail Report";
  }

  @Override
  protected byte[] renderPdf(List<TransactionDetailRow> rows, ReportParameters parameters) {
    PdfReportBuilder pdf = newPdf(parameters, PdfOptions.Orientation.LANDSCAPE);

    if (rows.isEmpty()) {
      pdf.addText("No transactions found for this period");
      return pdf.toByteArray();
    }

    pdf.addTable(
        List.of("Date", "Description", "Category", "Account", "Type", "Amount"),
        rows.stream()
            .map(item ->
                cells(
                    ReportFormatter.formatDate(item.date()),
                    ReportFormatter.truncate(item.description(), PDF_DESCRIPTION_LENGTH),
                    item.category(),
                    item.account(),
                    item.type(),
                    pdfMoney(item.amount(), parameters)))
            .toList(),
        TableOptions.rightAligned(5).withRelativeWidths(List.of(1.2f, 2.6f, 1.5f, 1.5f, 1f, 1.4f)));

    return pdf.toByteArray();
  }

  @Override
  protected byte[] renderCsv(List<TransactionDetailRow> rows, ReportParameters parameters) {
    CsvReportBuilder csv = newCsv(parameters);
    csv.addData(
        rows.stream()
            .map(item ->
                csvRecord(
                    "Date", item.date(),
                    "Description", item.description(),
                    "Category", item.category(),
                    "Account", item.account(),
                    "Type", item.type(),
                    "Amount", item.amount(),
                    "Balance Impact", item.balanceImpact(),
                    "Merchant", item.merchant(),
                    "Tags", item.tags(),
                    "Notes", item.notes()))
            .toList());
    return csv.toByteArray();
  }

  @Override
  protected byte[] renderXlsx(List<TransactionDetailRow> rows, ReportParameters parameters) {
    XlsxReportBuilder xlsx = newXlsx(parameters);
    xlsx.addHeaderRow(HEADERS);
    xlsx.addDataRows(
        rows.stream()
            .map(item ->
                values(
                    item.date(),
                    item.description(),
                    item.category(),
                    item.account(),
                    item.type(),
                    money(item.amount(), parameters),
                    money(item.balanceImpact(), parameters),
                    item.merchant(),
                    String.join(", ", item.tags()),
                    item.notes()))
            .toList());
    return xlsx.toByteArray();
  }
}
