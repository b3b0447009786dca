package com.example.reports.export;

import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.util.Map;

/**
 * The places report text ends up, each with the set of glyphs it can draw. Text bound for a surface
 * goes through {@link #adapt(String)}, which swaps every glyph the surface cannot draw for its
 * declared fallback.
 *
 * <p>PDF output uses the standard Helvetica font, which only covers the WinAnsi (windows-1252)
 * repertoire. Spreadsheet and CSV output carry Unicode text as is.
 */
public enum RenderSurface {
  PDF(
      Charset.forName("windows-1252"),
      Map.ofEntries(
          Map.entry(0x20B9, "Rs."), // Indian rupee sign
          Map.entry(0xFFE5, "¥"), // fullwidth yen sign
          Map.entry(0x20A9, "W"), // won sign
          Map.entry(0x20A6, "N"), // naira sign
          Map.entry(0x20B1, "PHP"), // peso sign
          Map.entry(0x20BA, "TL"), // lira sign
          Map.entry(0x20BD, "RUB"), // ruble sign
          Map.entry(0x20AB, "d"), // dong sign
          Map.entry(0x20AA, "ILS"), // new sheqel sign
          Map.entry(0x2713, "+"), // check mark
          Map.entry(0x2717, "x"), // ballot x
          Map.entry(0x202F, " "), // narrow no-break space
          Map.entry(0x2009, " "), // thin space
          Map.entry(0x2212, "-"))), // minus sign
  CSV(null, Map.of()),
  XLSX(null, Map.of());

  static final String UNDRAWABLE = "?";

  private final Charset glyphRepertoire;
  private final Map<Integer, String> fallbacks;

  RenderSurface(Charset glyphRepertoire, Map<Integer, String> fallbacks) {
    this.glyphRepertoire = glyphRepertoire;
    this.fallbacks = fallbacks;
  }

  /** Whether the surface can draw the given code point without substitution. */
  boolean canDraw(int codePoint) {
    return canDraw(glyphRepertoire == null ? null : glyphRepertoire.newEncoder(), codePoint);
  }

  /** Returns the text with every undrawable glyph replaced by its fallback, or {@code ?}. */
  public String adapt(String text) {
    if (text == null || glyphRepertoire == null) {
      return text;
    }
    CharsetEncoder encoder = glyphRepertoire.newEncoder();
    StringBuilder adapted = null;
    int i = 0;
    while (i < text.length()) {
      int codePoint = text.codePointAt(i);
      int width = Character.charCount(codePoint);
      boolean drawable = canDraw(encoder, codePoint);
      if (!drawable && adapted == null) {
        adapted = new StringBuilder(text.length() + 8).append(text, 0, i);
      }
      if (adapted != null) {
        adapted.append(
            drawable ? text.substring(i, i + width) : fallbacks.getOrDefault(codePoint, UNDRAWABLE));
      }
      i += width;
    }
    return adapted == null ? text : adapted.toString();
  }

  private static boolean canDraw(CharsetEncoder encoder, int codePoint) {
    if (encoder == null || Character.isISOControl(codePoint)) {
      return true;
    }
    return encoder.canEncode(new String(Character.toChars(codePoint)));
  }
}
