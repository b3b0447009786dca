package com.example.reports.export;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

class XlsxReportBuilderTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2025-01-31T10:00:00Z"), ZoneOffset.UTC);

  @Test
  void toByteArray_writesRowsInOrderOnDefaultSheet() throws IOException {
    XlsxReportBuilder xlsx = new XlsxReportBuilder(ReportStyle.defaults());
    xlsx.addRow(List.of("Merchant Analysis Report"));
    xlsx.addEmptyRow();
    xlsx.addHeaderRow(List.of("Merchant", "Visits"));
    xlsx.addDataRows(List.of(List.of("FreshMart", 4), List.of("Cafe Aroma", 9)));

    try (XSSFWorkbook workbook = read(xlsx.toByteArray())) {
      assertEquals(1, workbook.getNumberOfSheets());
      Sheet sheet = workbook.getSheet(XlsxReportBuilder.DEFAULT_SHEET);

      assertEquals("Merchant Analysis Report", sheet.getRow(0).getCell(0).getStringCellValue());
      assertEquals("Merchant", sheet.getRow(2).getCell(0).getStringCellValue());
      assertEquals("Cafe Aroma", sheet.getRow(4).getCell(0).getStringCellValue());
      assertEquals(9.0, sheet.getRow(4).getCell(1).getNumericCellValue());
      assertEquals(4, sheet.getLastRowNum());
    }
  }

  @Test
  void toByteArray_headerRowIsBoldAndFilled() throws IOException {
    XlsxReportBuilder xlsx = new XlsxReportBuilder(ReportStyle.defaults());
    xlsx.addHeaderRow(List.of("Section"));

    try (XSSFWorkbook workbook = read(xlsx.toByteArray())) {
      XSSFCellStyle style = workbook.getSheetAt(0).getRow(0).getCell(0).getCellStyle();

      assertTrue(style.getFont().getBold());
      assertNotNull(style.getFillForegroundColorColor());
    }
  }

  @Test
  void toByteArray_currencyAmountsAreNumericWithNativeSymbolFormat() throws IOException {
    XlsxReportBuilder xlsx = new XlsxReportBuilder(ReportStyle.defaults());
    xlsx.addRow(List.of(CurrencyAmount.of(new BigDecimal("1000"), "INR")));

    try (XSSFWorkbook workbook = read(xlsx.toByteArray())) {
      Cell cell = workbook.getSheetAt(0).getRow(0).getCell(0);

      assertEquals(CellType.NUMERIC, cell.getCellType());
      assertEquals(1000.0, cell.getNumericCellValue());
      assertTrue(cell.getCellStyle().getDataFormatString().contains("₹"));
    }
  }

  @Test
  void toByteArray_typedCells() throws IOException {
    XlsxReportBuilder xlsx = new XlsxReportBuilder(ReportStyle.defaults());
    xlsx.addRow(Arrays.asList(Boolean.TRUE, null, new BigDecimal("12.5"), "text"));

    try (XSSFWorkbook workbook = read(xlsx.toByteArray())) {
      Row row = workbook.getSheetAt(0).getRow(0);

      assertEquals(CellType.BOOLEAN, row.getCell(0).getCellType());
      assertEquals(CellType.BLANK, row.getCell(1).getCellType());
      assertEquals(12.5, row.getCell(2).getNumericCellValue());
      assertEquals("text", row.getCell(3).getStringCellValue());
    }
  }

  @Test
  void toByteArray_columnWidthsAreClamped() throws IOException {
    XlsxReportBuilder xlsx = new XlsxReportBuilder(ReportStyle.defaults());
    xlsx.addRow(List.of("x", "a".repeat(20), "b".repeat(120)));

    try (XSSFWorkbook workbook = read(xlsx.toByteArray())) {
      Sheet sheet = workbook.getSheetAt(0);

      assertEquals(XlsxReportBuilder.MIN_COLUMN_WIDTH * 256, sheet.getColumnWidth(0));
      assertEquals(22 * 256, sheet.getColumnWidth(1));
      assertEquals(XlsxReportBuilder.MAX_COLUMN_WIDTH * 256, sheet.getColumnWidth(2));
    }
  }

  @Test
  void addSheet_unusedDefaultSheetIsDropped() throws IOException {
    XlsxReportBuilder xlsx = new XlsxReportBuilder(ReportStyle.defaults());
    xlsx.addSheet("Summary");
    xlsx.addRow(List.of("Total"));
    xlsx.addSheet("Detail");
    xlsx.addRow(List.of("Line"));

    try (XSSFWorkbook workbook = read(xlsx.toByteArray())) {
      assertEquals(2, workbook.getNumberOfSheets());
      assertEquals("Summary", workbook.getSheetName(0));
      assertEquals("Detail", workbook.getSheetName(1));
    }
  }

  @Test
  void toByteArray_emptyBuilderStillProducesOneSheet() throws IOException {
    XlsxReportBuilder xlsx = new XlsxReportBuilder(ReportStyle.defaults());

    try (XSSFWorkbook workbook = read(xlsx.toByteArray())) {
      assertEquals(1, workbook.getNumberOfSheets());
      assertEquals(XlsxReportBuilder.DEFAULT_SHEET, workbook.getSheetName(0));
    }
  }

  @Test
  void toByteArray_packageAndEntryTimesComeFromClock() throws IOException {
    XlsxReportBuilder xlsx = new XlsxReportBuilder(ReportStyle.defaults(), CLOCK);
    xlsx.addHeaderRow(List.of("Item", "Amount"));
    xlsx.addRow(List.of("Salary", CurrencyAmount.of(new BigDecimal("5000"), "USD")));

    byte[] bytes = xlsx.toByteArray();

    int entries = 0;
    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(bytes))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        assertEquals(CLOCK.millis(), entry.getTime(), entry.getName());
        entries++;
      }
    }
    assertTrue(entries > 0);
    try (XSSFWorkbook workbook = read(bytes)) {
      Date created = Date.from(CLOCK.instant());
      assertEquals(created, workbook.getProperties().getCoreProperties().getCreated());
      assertEquals(created, workbook.getProperties().getCoreProperties().getModified());
      assertEquals("Salary", workbook.getSheetAt(0).getRow(1).getCell(0).getStringCellValue());
    }
  }

  @Test
  void toByteArray_sameRowsAndClockGiveSameBytes() throws InterruptedException {
    byte[] first = cashFlowWorkbook();
    // zip entry times have a two second resolution
    Thread.sleep(2100);
    byte[] second = cashFlowWorkbook();

    assertArrayEquals(first, second);
  }

  private static byte[] cashFlowWorkbook() {
    XlsxReportBuilder xlsx = new XlsxReportBuilder(ReportStyle.defaults(), CLOCK);
    xlsx.addRow(List.of("Cash Flow Statement"));
    xlsx.addHeaderRow(List.of("Section", "Item", "Amount"));
    xlsx.addRow(List.of("OPERATING", "Salary", CurrencyAmount.of(new BigDecimal("5000"), "EUR")));
    return xlsx.toByteArray();
  }

  private static XSSFWorkbook read(byte[] bytes) throws IOException {
    return new XSSFWorkbook(new ByteArrayInputStream(bytes));
  }
}
