package com.example.reports.domain;

import com.example.reports.service.UnsupportedReportFormatException;

/**
 * Output encodings supported by the report compiler.
 */
public enum ReportFormat {
    PDF("pdf", "application/pdf"),
    CSV("csv", "text/csv"),
    XLSX("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final String code;
    private final String mimeType;

    ReportFormat(String code, String mimeType) {
        this.code = code;
        this.mimeType = mimeType;
    }

    public String getCode() {
        return code;
    }

    public String getMimeType() {
        return mimeType;
    }

    public String getFileExtension() {
        return code;
    }

    /**
     * Resolves a wire code such as {@code "xlsx"}.
     *
     * @throws UnsupportedReportFormatException if the code names no known format
     */
    public static ReportFormat fromCode(String code) {
        if (code != null) {
            for (ReportFormat format : values()) {
                if (format.code.equalsIgnoreCase(code.trim())) {
                    return format;
                }
            }
        }
        throw new UnsupportedReportFormatException(code);
    }
}
