package com.letably.reporting.payload;

import com.letably.reporting.domain.ReportType;

import java.time.Instant;

/**
 * Result of one report run. Implementations are immutable records serialized to JSON by
 * {@link com.letably.reporting.export.ReportJson} and to CSV by
 * {@link com.letably.reporting.export.CsvReportExporter}.
 */
public interface ReportPayload {

    /** Report that produced this payload. */
    ReportType reportType();

    /** When the report was generated. */
    Instant generatedAt();
}
