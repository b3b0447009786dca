package com.example.reports.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.example.reports.domain.CashFlowRow;
import com.example.reports.domain.CashFlowRow.Section;
import com.example.reports.domain.ReportParameters;
import com.example.reports.export.CsvReportBuilder;
import com.example.reports.export.PdfOptions;
import com.example.reports.export.PdfReportBuilder;
import com.example.reports.export.TableOptions;
import com.example.reports.export.XlsxReportBuilder;

/**
 * Cash flow statement: operating activities with their net total, investing activities when there
 * are any, and the opening and closing cash balances.
 */
class CashFlowReportGenerator extends AbstractReportGenerator<CashFlowRow> {

  CashFlowReportGenerator(RenderSettings settings) {
    super(settings);
  }

  @Override
  protected String title() {
    return "Cash Flow Statement";
  }

  @Override
  protected byte[] renderPdf(List<CashFlowRow> rows, ReportParameters parameters) {
    PdfReportBuilder pdf = newPdf(parameters, PdfOptions.Orientation.PORTRAIT);

    List<CashFlowRow> operating = inSection(rows, Section.OPERATING);
    Optional<CashFlowRow> operatingTotal = firstInSection(rows, Section.OPERATING_TOTAL);
    List<CashFlowRow> investing = inSection(rows, Section.INVESTING);
    Optional<CashFlowRow> beginBalance = firstInSection(rows, Section.BALANCE);
    Optional<CashFlowRow> endBalance = firstInSection(rows, Section.BALANCE_END);

    pdf.addSection("Operating Activities");
    if (operating.isEmpty()) {
      pdf.addText("No operating activity recorded");
    } else {
      TableOptions options = TableOptions.rightAligned(1);
      if (operatingTotal.isPresent()) {
        options =
            options.withFooterRow(
                cells("Net Operating Cash Flow", pdfMoney(operatingTotal.get().amount(), parameters)));
      }
      pdf.addTable(List.of("Item", "Amount"), itemRows(operating, parameters), options);
    }

    if (!investing.isEmpty()) {
      pdf.addSection("Investing Activities");
      pdf.addTable(
          List.of("Item", "Amount"), itemRows(investing, parameters), TableOptions.rightAligned(1));
    }

    pdf.addSection("Cash Balance");
    List<List<String>> balanceRows = new ArrayList<>();
    beginBalance.ifPresent(
        row -> balanceRows.add(cells("Beginning Balance", pdfMoney(row.amount(), parameters))));
    endBalance.ifPresent(
        row -> balanceRows.add(cells("Ending Balance", pdfMoney(row.amount(), parameters))));
    if (balanceRows.isEmpty()) {
      pdf.addText("No balance information available");
    } else {
      pdf.addTable(List.of("", "Amount"), balanceRows, TableOptions.rightAligned(1));
    }

    return pdf.toByteArray();
  }

  private static List<List<String>> itemRows(List<CashFlowRow> items, ReportParameters parameters) {
    return items.stream().map(item -> cells(item.item(), pdfMoney(item.amount(), parameters))).toList();
  }

  @Override
  protected byte[] renderCsv(List<CashFlowRow> rows, ReportParameters parameters) {
    CsvReportBuilder csv = newCsv(parameters);
    csv.addData(
        rows.stream()
            .map(item ->
                csvRecord("Section", item.section(), "Item", item.item(), "Amount", item.amount()))
            .toList());
    return csv.toByteArray();
  }

  @Override
  protected byte[] renderXlsx(List<CashFlowRow> rows, ReportParameters parameters) {
    XlsxReportBuilder xlsx = newXlsx(parameters);
    xlsx.addHeaderRow(List.of("Section", "Item", "Amount"));
    xlsx.addDataRows(
        rows.stream()
            .map(item -> values(item.section(), item.item(), money(item.amount(), parameters)))
            .toList());
    return xlsx.toByteArray();
  }
}
