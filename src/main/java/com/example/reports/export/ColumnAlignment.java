package com.example.reports.export;

import com.lowagie.text.Element;

/** Horizontal alignment of a table column. */
public enum ColumnAlignment {
  LEFT(Element.ALIGN_LEFT),
  CENTER(Element.ALIGN_CENTER),
  RIGHT(Element.ALIGN_RIGHT);

  private final int pdfAlignment;

  ColumnAlignment(int pdfAlignment) {
    this.pdfAlignment = pdfAlignment;
  }

  int pdfAlignment() {
    return pdfAlignment;
  }
}
