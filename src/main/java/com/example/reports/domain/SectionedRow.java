package com.example.reports.domain;

/**
 * A row partitioned by a {@code section} tag drawn from its report type's fixed vocabulary.
 */
public interface SectionedRow {

    String section();

    /**
     * Exact tag match. Rows are never assigned to a section by position.
     */
    default boolean isIn(Enum<?> section) {
        return section.name().equals(section());
    }
}
