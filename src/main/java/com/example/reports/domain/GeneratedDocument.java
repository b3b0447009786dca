package com.example.reports.domain;

/**
 * A rendered report: the payload plus what a caller needs to serve or audit it.
 *
 * @param content     the document bytes
 * @param format      output format, which determines the MIME type
 * @param fileName    suggested, filesystem-safe file name
 * @param recordCount number of input rows the document was compiled from
 */
public record GeneratedDocument(byte[] content, ReportFormat format, String fileName, int recordCount) {

    public String mimeType() {
        return format.getMimeType();
    }

    public int sizeBytes() {
        return content.length;
    }
}
