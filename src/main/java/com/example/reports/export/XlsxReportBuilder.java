package com.example.reports.export;

import java.awt.Color;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DataFormat;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds an Excel workbook as a grid of cells. Rows are appended to the current sheet; the workbook
 * itself is only created in {@link #toByteArray()}, which also sizes every column to its widest
 * cell.
 *
 * <p>The package created and modified dates and every zip entry time are taken from the given
 * {@link Clock}, so identical rows rendered at the same instant give identical bytes.
 */
public class XlsxReportBuilder {

  private static final Logger log = LoggerFactory.getLogger(XlsxReportBuilder.class);

  static final String DEFAULT_SHEET = "Sheet1";
  static final int MIN_COLUMN_WIDTH = 10;
  static final int MAX_COLUMN_WIDTH = 50;

  private final ReportStyle style;
  private final Clock clock;
  private final Map<String, List<SheetRow>> sheets = new LinkedHashMap<>();
  private String currentSheet = DEFAULT_SHEET;

  private record SheetRow(List<Object> cells, boolean header) {}

  public XlsxReportBuilder(ReportStyle style) {
    this(style, Clock.systemDefaultZone());
  }

  public XlsxReportBuilder(ReportStyle style, Clock clock) {
    this.style = style;
    this.clock = clock;
    sheets.put(DEFAULT_SHEET, new ArrayList<>());
  }

  /** Switches to the named sheet, creating it when it does not exist yet. */
  public void addSheet(String name) {
    currentSheet = name;
    sheets.computeIfAbsent(name, key -> new ArrayList<>());
  }

  public void addRow(List<?> cells) {
    sheets.get(currentSheet).add(new SheetRow(new ArrayList<>(cells), false));
  }

  public void addEmptyRow() {
    addRow(List.of());
  }

  public void addHeaderRow(List<String> headers) {
    sheets.get(currentSheet).add(new SheetRow(new ArrayList<>(headers), true));
  }

  public void addDataRows(List<? extends List<?>> rows) {
    for (List<?> row : rows) {
      addRow(row);
    }
  }

  public byte[] toByteArray() {
    try (XSSFWorkbook workbook = new XSSFWorkbook();
        ByteArrayOutputStream baos = new ByteArrayOutputStream()) {

      Date createdAt = Date.from(clock.instant());
      workbook.getProperties().getCoreProperties().setCreated(Optional.of(createdAt));
      workbook.getProperties().getCoreProperties().setModified(Optional.of(createdAt));

      CellStyle headerStyle = createHeaderStyle(workbook);
      Map<String, CellStyle> currencyStyles = new HashMap<>();

      for (Map.Entry<String, List<SheetRow>> entry : sheets.entrySet()) {
        boolean unusedDefault =
            entry.getKey().equals(DEFAULT_SHEET) && entry.getValue().isEmpty() && sheets.size() > 1;
        if (unusedDefault) {
          continue;
        }
        Sheet sheet = workbook.createSheet(WorkbookUtil.createSafeSheetName(entry.getKey()));
        List<Integer> widths = new ArrayList<>();

        int rowNum = 0;
        for (SheetRow sheetRow : entry.getValue()) {
          Row row = sheet.createRow(rowNum++);
          for (int i = 0; i < sheetRow.cells().size(); i++) {
            Object value = sheetRow.cells().get(i);
            Cell cell = row.createCell(i);
            writeValue(workbook, cell, value, currencyStyles);
            if (sheetRow.header()) {
              cell.setCellStyle(headerStyle);
            }
            int width = ReportFormatter.plainText(value).length() + 2;
            if (widths.size() <= i) {
              widths.add(MIN_COLUMN_WIDTH);
            }
            widths.set(i, Math.max(widths.get(i), width));
          }
        }

        for (int i = 0; i < widths.size(); i++) {
          sheet.setColumnWidth(i, Math.min(widths.get(i), MAX_COLUMN_WIDTH) * 256);
        }
      }

      workbook.write(baos);
      byte[] content = withEntryTimes(baos.toByteArray(), createdAt.getTime());
      log.debug("Finalized Excel report ({} bytes, {} sheets)", content.length, workbook.getNumberOfSheets());
      return content;

    } catch (IOException e) {
      throw new ReportRenderingException("Failed to write Excel workbook: " + e.getMessage(), e);
    }
  }

  private void writeValue(
      XSSFWorkbook workbook, Cell cell, Object value, Map<String, CellStyle> currencyStyles) {
    if (value == null) {
      cell.setBlank();
    } else if (value instanceof CurrencyAmount money) {
      if (money.amount() == null) {
        cell.setBlank();
        return;
      }
      cell.setCellValue(money.amount().doubleValue());
      cell.setCellStyle(
          currencyStyles.computeIfAbsent(
              money.currency(), currency -> createCurrencyStyle(workbook, currency)));
    } else if (value instanceof BigDecimal decimal) {
      cell.setCellValue(decimal.doubleValue());
    } else if (value instanceof Number number) {
      cell.setCellValue(number.doubleValue());
    } else if (value instanceof Boolean bool) {
      cell.setCellValue(bool);
    } else {
      cell.setCellValue(ReportFormatter.plainText(value));
    }
  }

  /** Rewrites the package with every entry stamped at the given time; POI stamps the wall clock. */
  private static byte[] withEntryTimes(byte[] workbook, long time) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream(workbook.length);
    try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(workbook));
        ZipOutputStream zip = new ZipOutputStream(out)) {
      ZipEntry entry;
      while ((entry = in.getNextEntry()) != null) {
        ZipEntry stamped = new ZipEntry(entry.getName());
        stamped.setTime(time);
        zip.putNextEntry(stamped);
        in.transferTo(zip);
        zip.closeEntry();
      }
    }
    return out.toByteArray();
  }

  // ==================== EXCEL STYLE HELPERS ====================

  private CellStyle createHeaderStyle(XSSFWorkbook workbook) {
    XSSFCellStyle headerStyle = workbook.createCellStyle();
    headerStyle.setFillForegroundColor(xssfColor(style.headerBackground()));
    headerStyle.setFillPattern(FillPatternType.SOLID_FOREGROUND);

    XSSFFont font = workbook.createFont();
    font.setBold(true);
    font.setColor(xssfColor(style.headerText()));
    headerStyle.setFont(font);

    headerStyle.setBorderBottom(BorderStyle.THIN);
    headerStyle.setBorderTop(BorderStyle.THIN);
    headerStyle.setBorderLeft(BorderStyle.THIN);
    headerStyle.setBorderRight(BorderStyle.THIN);

    return headerStyle;
  }

  private CellStyle createCurrencyStyle(XSSFWorkbook workbook, String currency) {
    CellStyle currencyStyle = workbook.createCellStyle();
    DataFormat format = workbook.createDataFormat();
    currencyStyle.setDataFormat(format.getFormat(ReportFormatter.excelCurrencyFormat(currency)));
    return currencyStyle;
  }

  private static XSSFColor xssfColor(Color color) {
    return new XSSFColor(
        new byte[] {(byte) color.getRed(), (byte) color.getGreen(), (byte) color.getBlue()}, null);
  }
}
