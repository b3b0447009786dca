package com.example.reports.export;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.GregorianCalendar;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lowagie.text.Chunk;
import com.lowagie.text.Document;
import com.lowagie.text.DocumentException;
import com.lowagie.text.Element;
import com.lowagie.text.Font;
import com.lowagie.text.PageSize;
import com.lowagie.text.Paragraph;
import com.lowagie.text.Phrase;
import com.lowagie.text.Rectangle;
import com.lowagie.text.pdf.PdfDate;
import com.lowagie.text.pdf.PdfDictionary;
import com.lowagie.text.pdf.PdfEncryption;
import com.lowagie.text.pdf.PdfName;
import com.lowagie.text.pdf.PdfPCell;
import com.lowagie.text.pdf.PdfPTable;
import com.lowagie.text.pdf.PdfWriter;

/**
 * Builds a paginated PDF report with OpenPDF. The header block (title, subtitle, generation
 * timestamp) is written on construction; sections, tables and text lines are appended in call
 * order below a layout cursor that tracks the current vertical write position.
 *
 * <p>An instance renders exactly one document: {@link #toByteArray()} closes it, after which every
 * further call fails.
 *
 * <p>Creation and modification dates in the document info come from the given {@link Clock}, and
 * the file identifier is derived from the title and that instant, so the same input rendered at the
 * same instant yields the same bytes.
 */
public class PdfReportBuilder {

  private static final Logger log = LoggerFactory.getLogger(PdfReportBuilder.class);

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("MMM d, yyyy, h:mm:ss a", Locale.US);

  private final ReportStyle style;
  private final ByteArrayOutputStream baos = new ByteArrayOutputStream();
  private final Document document;
  private final PdfWriter writer;

  private float cursor;
  private boolean closed;

  public PdfReportBuilder(PdfOptions options, ReportStyle style) {
    this(options, style, Clock.systemDefaultZone());
  }

  public PdfReportBuilder(PdfOptions options, ReportStyle style, Clock clock) {
    this.style = style;
    Rectangle pageSize =
        options.orientation() == PdfOptions.Orientation.LANDSCAPE
            ? PageSize.A4.rotate()
            : PageSize.A4;
    this.document =
        new Document(
            pageSize,
            style.marginHorizontal(),
            style.marginHorizontal(),
            style.marginTop(),
            style.marginBottom());
    try {
      this.writer = PdfWriter.getInstance(document, baos);
    } catch (DocumentException e) {
      throw new ReportRenderingException("Failed to create PDF writer: " + e.getMessage(), e);
    }
    document.addTitle(RenderSurface.PDF.adapt(options.title()));
    document.open();
    stampInfo(options.title(), ZonedDateTime.now(clock));
    cursor = document.top();
    writeHeader(options);
  }

  private void stampInfo(String title, ZonedDateTime createdAt) {
    PdfDictionary info = writer.getInfo();
    PdfDate date = new PdfDate(GregorianCalendar.from(createdAt));
    info.put(PdfName.CREATIONDATE, date);
    info.put(PdfName.MODDATE, date);
    byte[] id = documentId(title + "|" + createdAt.toInstant());
    info.put(PdfName.FILEID, PdfEncryption.createInfoId(id, id));
  }

  private static byte[] documentId(String seed) {
    try {
      return MessageDigest.getInstance("MD5").digest(seed.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new ReportRenderingException("MD5 is not available: " + e.getMessage(), e);
    }
  }

  private void writeHeader(PdfOptions options) {
    add(new Paragraph(pdfText(options.title()), font(true, style.titleFontSize(), Color.BLACK)));
    if (options.subtitle() != null) {
      add(
          new Paragraph(
              pdfText(options.subtitle()), font(false, style.subtitleFontSize(), Color.BLACK)));
    }
    if (options.generatedAt() != null) {
      Paragraph timestamp =
          new Paragraph(
              "Generated: " + options.generatedAt().format(TIMESTAMP_FORMAT),
              font(false, style.timestampFontSize(), style.mutedText()));
      timestamp.setSpacingAfter(10);
      add(timestamp);
    }
  }

  /** Writes a sub-heading. */
  public void addSection(String title) {
    Paragraph section =
        new Paragraph(pdfText(title), font(true, style.sectionFontSize(), Color.BLACK));
    section.setSpacingBefore(5);
    section.setSpacingAfter(6);
    add(section);
  }

  /**
   * Writes a table with a colored, repeating header row, a striped body and optional colored footer
   * rows. Rows shorter than the header are padded with empty cells; longer rows are cut. Page breaks
   * inside the table are left to the table layout.
   */
  public void addTable(List<String> headers, List<List<String>> rows, TableOptions options) {
    if (headers == null || headers.isEmpty()) {
      throw new IllegalArgumentException("A table needs at least one column");
    }
    TableOptions layout = options == null ? TableOptions.defaults() : options;
    int columns = headers.size();

    PdfPTable table = new PdfPTable(columns);
    table.setWidthPercentage(100);
    table.setHeaderRows(1);
    table.setSpacingBefore(2);
    table.setSpacingAfter(10);
    if (layout.relativeWidths().size() == columns) {
      float[] widths = new float[columns];
      for (int i = 0; i < columns; i++) {
        widths[i] = layout.relativeWidths().get(i);
      }
      try {
        table.setWidths(widths);
      } catch (DocumentException e) {
        throw new ReportRenderingException("Invalid PDF column widths: " + e.getMessage(), e);
      }
    }

    Font headerFont = font(true, style.headerFontSize(), style.headerText());
    for (int i = 0; i < columns; i++) {
      addCell(table, headers.get(i), headerFont, style.headerBackground(), layout.alignmentOf(i));
    }

    Font cellFont = font(false, style.tableFontSize(), Color.BLACK);
    boolean alternate = false;
    for (List<String> row : rows) {
      Color bg = alternate ? style.altRowBackground() : Color.WHITE;
      for (int i = 0; i < columns; i++) {
        addCell(table, cellAt(row, i), cellFont, bg, layout.alignmentOf(i));
      }
      alternate = !alternate;
    }

    Font footerFont = font(true, style.headerFontSize(), style.footerText());
    for (List<String> footer : layout.footerRows()) {
      for (int i = 0; i < columns; i++) {
        addCell(table, cellAt(footer, i), footerFont, style.footerBackground(), layout.alignmentOf(i));
      }
    }

    add(table);
  }

  /** Writes one line of free text. An empty string leaves a blank line. */
  public void addText(String text, TextOptions options) {
    TextOptions textOptions = options == null ? TextOptions.plain() : options;
    float size = textOptions.fontSize() > 0 ? textOptions.fontSize() : style.textFontSize();
    Font font = font(textOptions.bold(), size, Color.BLACK);
    if (text == null || text.isEmpty()) {
      add(new Paragraph(Chunk.NEWLINE));
      return;
    }
    add(new Paragraph(pdfText(text), font));
  }

  public void addText(String text) {
    addText(text, TextOptions.plain());
  }

  /** Starts a new page and moves the cursor back to the top margin. */
  public void addPageBreak() {
    ensureOpen();
    writer.setPageEmpty(false);
    document.newPage();
    cursor = document.top();
  }

  /** Closes the document and returns its bytes. */
  public byte[] toByteArray() {
    ensureOpen();
    closed = true;
    try {
      document.close();
    } catch (RuntimeException e) {
      throw new ReportRenderingException("Failed to finalize PDF: " + e.getMessage(), e);
    }
    log.debug("Finalized PDF report ({} bytes, {} pages)", baos.size(), writer.getPageNumber());
    return baos.toByteArray();
  }

  /** Current vertical write position in points from the bottom of the page. */
  float cursor() {
    return cursor;
  }

  private void add(Element element) {
    ensureOpen();
    try {
      document.add(element);
    } catch (DocumentException e) {
      throw new ReportRenderingException("Failed to write PDF content: " + e.getMessage(), e);
    }
    cursor = writer.getVerticalPosition(false);
  }

  private void addCell(PdfPTable table, String text, Font font, Color bg, ColumnAlignment alignment) {
    PdfPCell cell = new PdfPCell(new Phrase(pdfText(text), font));
    cell.setBackgroundColor(bg);
    cell.setPadding(5);
    cell.setHorizontalAlignment(alignment.pdfAlignment());
    cell.setBorderColor(style.borderColor());
    table.addCell(cell);
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("PDF report has already been finalized");
    }
  }

  private static String cellAt(List<String> row, int index) {
    return row != null && index < row.size() && row.get(index) != null ? row.get(index) : "";
  }

  private static String pdfText(String text) {
    return RenderSurface.PDF.adapt(text == null ? "" : text);
  }

  private static Font font(boolean bold, float size, Color color) {
    return new Font(Font.HELVETICA, size, bold ? Font.BOLD : Font.NORMAL, color);
  }
}
