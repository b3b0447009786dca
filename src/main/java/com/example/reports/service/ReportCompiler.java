package com.example.reports.service;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.reports.domain.BalanceSheetRow;
import com.example.reports.domain.BudgetPerformanceRow;
import com.example.reports.domain.BudgetVarianceRow;
import com.example.reports.domain.CashFlowRow;
import com.example.reports.domain.GeneratedDocument;
import com.example.reports.domain.IncomeStatementRow;
import com.example.reports.domain.MerchantAnalysisRow;
import com.example.reports.domain.ReportFormat;
import com.example.reports.domain.ReportParameters;
import com.example.reports.domain.ReportRow;
import com.example.reports.domain.ReportType;
import com.example.reports.domain.TransactionDetailRow;
import com.example.reports.export.ReportRenderingException;

/**
 * Compiles typed report rows into a PDF, CSV or Excel document. Routing is an exhaustive switch over
 * {@link ReportType}; every row is checked against the type's row shape before any document
 * backend is created.
 *
 * <p>The compiler holds no mutable state and may be shared between threads.
 */
@Service
public class ReportCompiler {

  private static final Logger log = LoggerFactory.getLogger(ReportCompiler.class);

  private final RenderSettings settings;
  private final IncomeStatementReportGenerator incomeStatement;
  private final BalanceSheetReportGenerator balanceSheet;
  private final CashFlowReportGenerator cashFlow;
  private final BudgetPerformanceReportGenerator budgetPerformance;
  private final BudgetVarianceReportGenerator budgetVariance;
  private final TransactionDetailReportGenerator transactionDetail;
  private final MerchantAnalysisReportGenerator merchantAnalysis;

  public ReportCompiler(RenderSettings settings) {
    this.settings = settings;
    this.incomeStatement = new IncomeStatementReportGenerator(settings);
    this.balanceSheet = new BalanceSheetReportGenerator(settings);
    this.cashFlow = new CashFlowReportGenerator(settings);
    this.budgetPerformance = new BudgetPerformanceReportGenerator(settings);
    this.budgetVariance = new BudgetVarianceReportGenerator(settings);
    this.transactionDetail = new TransactionDetailReportGenerator(settings);
    this.merchantAnalysis = new MerchantAnalysisReportGenerator(settings);
  }

  /**
   * Resolves wire codes such as {@code "income_statement"} and {@code "pdf"}, then compiles.
   *
   * @throws UnsupportedReportTypeException if the type code is unknown
   * @throws UnsupportedReportFormatException if the format code is unknown
   */
  public GeneratedDocument generateReport(
      String reportType, String reportFormat, List<? extends ReportRow> data, ReportParameters parameters) {
    ReportType type = ReportType.fromCode(reportType);
    ReportFormat format = ReportFormat.fromCode(reportFormat);
    return generateReport(type, format, data, parameters);
  }

  /**
   * Compiles the rows into a document of the requested format.
   *
   * @throws InvalidReportDataException if a row does not match the report type's row shape
   * @throws ReportRenderingException if the document backend fails
   */
  public GeneratedDocument generateReport(
      ReportType type, ReportFormat format, List<? extends ReportRow> data, ReportParameters parameters) {
    if (type == null) {
      throw new UnsupportedReportTypeException(null);
    }
    if (format == null) {
      throw new UnsupportedReportFormatException(null);
    }
    List<? extends ReportRow> rows = data == null ? List.of() : data;
    ReportParameters params =
        parameters == null ? ReportParameters.forPeriod(null, null, null) : parameters;

    byte[] content;
    try {
      content =
          switch (type) {
            case INCOME_STATEMENT -> incomeStatement.generate(
                rowsOf(type, rows, IncomeStatementRow.class), format, params);
            case BALANCE_SHEET -> balanceSheet.generate(
                rowsOf(type, rows, BalanceSheetRow.class), format, params);
            case CASH_FLOW -> cashFlow.generate(rowsOf(type, rows, CashFlowRow.class), format, params);
            case BUDGET_PERFORMANCE -> budgetPerformance.generate(
                rowsOf(type, rows, BudgetPerformanceRow.class), format, params);
            case BUDGET_VARIANCE -> budgetVariance.generate(
                rowsOf(type, rows, BudgetVarianceRow.class), format, params);
            case TRANSACTION_DETAIL -> transactionDetail.generate(
                rowsOf(type, rows, TransactionDetailRow.class), format, params);
            case MERCHANT_ANALYSIS -> merchantAnalysis.generate(
                rowsOf(type, rows, MerchantAnalysisRow.class), format, params);
          };
    } catch (ReportRenderingException e) {
      log.error("Failed to generate {} {}", type.getTitle(), format.name(), e);
      throw e;
    }

    log.info(
        "Generated {} {} ({} bytes, {} rows)", type.getTitle(), format.name(), content.length, rows.size());
    return new GeneratedDocument(
        content, format, ReportFileNames.fileName(type, format, settings.clock()), rows.size());
  }

  private static <R extends ReportRow> List<R> rowsOf(
      ReportType type, List<? extends ReportRow> rows, Class<R> rowType) {
    List<R> typed = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      ReportRow row = rows.get(i);
      if (!rowType.isInstance(row)) {
        throw new InvalidReportDataException(
            String.format(
                "Row %d of a %s report must be %s but was %s",
                i,
                type.getCode(),
                rowType.getSimpleName(),
                row == null ? "null" : row.getClass().getSimpleName()));
      }
      typed.add(rowType.cast(row));
    }
    return typed;
  }
}
