package com.example.reports.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * A single transaction. Missing tags are normalized to an empty list.
 */
public record TransactionDetailRow(
    LocalDate date,
    String description,
    String category,
    String account,
    String type,
    BigDecimal amount,
    BigDecimal balanceImpact,
    List<String> tags,
    String merchant,
    String notes
) implements ReportRow {

    public TransactionDetailRow {
        tags = tags == null
            ? List.of()
            : tags.stream().filter(Objects::nonNull).toList();
    }
}
