package com.letably.reporting.export;

import java.nio.charset.StandardCharsets;

/**
 * A rendered CSV file.
 *
 * @param filename suggested download name, e.g. {@code arrears-2024-09-01.csv}
 * @param content  file content, starting with a UTF-8 byte order mark so spreadsheet tools pick
 *                 the right encoding
 */
public record CsvExport(String filename, String content) {

    public static final String CONTENT_TYPE = "text/csv; charset=utf-8";

    public byte[] bytes() {
        return content.getBytes(StandardCharsets.UTF_8);
    }
}
