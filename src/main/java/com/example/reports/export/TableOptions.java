package com.example.reports.export;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-table layout options: column alignments, relative column widths and footer (totals) rows.
 * Instances are immutable; each {@code with...} call returns a copy.
 */
public record TableOptions(
    Map<Integer, ColumnAlignment> alignments, List<Float> relativeWidths, List<List<String>> footerRows) {

  public TableOptions {
    alignments = alignments == null ? Map.of() : Map.copyOf(alignments);
    relativeWidths = relativeWidths == null ? List.of() : List.copyOf(relativeWidths);
    footerRows = footerRows == null ? List.of() : List.copyOf(footerRows);
  }

  public static TableOptions defaults() {
    return new TableOptions(null, null, null);
  }

  /** Right-aligns the given columns, the usual layout for amount columns. */
  public static TableOptions rightAligned(int... columns) {
    TableOptions options = defaults();
    for (int column : columns) {
      options = options.withAlignment(column, ColumnAlignment.RIGHT);
    }
    return options;
  }

  public TableOptions withAlignment(int column, ColumnAlignment alignment) {
    Map<Integer, ColumnAlignment> updated = new HashMap<>(alignments);
    updated.put(column, alignment);
    return new TableOptions(updated, relativeWidths, footerRows);
  }

  public TableOptions withRelativeWidths(List<Float> widths) {
    return new TableOptions(alignments, widths, footerRows);
  }

  public TableOptions withFooterRow(List<String> footerRow) {
    List<List<String>> updated = new ArrayList<>(footerRows);
    updated.add(List.copyOf(footerRow));
    return new TableOptions(alignments, relativeWidths, updated);
  }

  ColumnAlignment alignmentOf(int column) {
    return alignments.getOrDefault(column, ColumnAlignment.LEFT);
  }
}
