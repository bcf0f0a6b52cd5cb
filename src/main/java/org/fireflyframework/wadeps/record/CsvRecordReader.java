/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.wadeps.record;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a comma-separated submission file into a {@link CsvContent}.
 *
 * <p>Parsing rules:</p>
 * <ul>
 *   <li>UTF-8, with a leading byte order mark removed</li>
 *   <li>a field starting with a double quote is quoted: it may contain commas and
 *       line breaks, and {@code ""} stands for one quote</li>
 *   <li>values are kept as written, surrounding spaces included</li>
 *   <li>blank lines are skipped</li>
 *   <li>a row shorter than the header is padded with empty values; a longer row,
 *       or a quote left open at the end of the file, yields a malformed record</li>
 * </ul>
 *
 * <p>Examples:</p>
 * <pre>
 *   JD,09/23/2025,Yes          → ["JD", "09/23/2025", "Yes"]
 *   JD,"Smith, Jr.",Yes        → ["JD", "Smith, Jr.", "Yes"]
 *   JD,"said ""stop""",Yes     → ["JD", "said \"stop\"", "Yes"]
 * </pre>
 *
 * <p>This reader is stateless and can be safely used concurrently.</p>
 */
@Slf4j
public class CsvRecordReader {

    private static final char BOM = '\uFEFF';
    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';

    /**
     * Reads a CSV file.
     *
     * @param path the file to read
     * @return the header and records
     * @throws RecordSourceException if the file cannot be read or has no header row
     */
    public CsvContent read(Path path) {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RecordSourceException("Cannot read " + path + ": " + e.getMessage(), e);
        }
        String fileName = path.getFileName().toString();
        CsvContent content = parse(fileName, text);
        log.debug("Read {} data rows from {}", content.getRecords().size(), fileName);
        return content;
    }

    /**
     * Parses CSV text.
     *
     * @param fileName the name reported in the result
     * @param text     the file content
     * @return the header and records
     * @throws RecordSourceException if the text has no header row
     */
    public CsvContent parse(String fileName, String text) {
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }

        List<ParsedRow> rows = split(text);
        if (rows.isEmpty() || rows.get(0).unterminated) {
            throw new RecordSourceException(fileName + " has no header row");
        }

        List<String> header = rows.get(0).fields;
        List<ValidationRecord> records = new ArrayList<>(rows.size() - 1);
        for (ParsedRow row : rows.subList(1, rows.size())) {
            records.add(toRecord(header, row));
        }

        return CsvContent.builder()
                .fileName(fileName)
                .header(List.copyOf(header))
                .records(records)
                .build();
    }

    private ValidationRecord toRecord(List<String> header, ParsedRow row) {
        if (row.unterminated) {
            return ValidationRecord.malformed("unterminated quoted field");
        }
        if (row.fields.size() > header.size()) {
            return ValidationRecord.malformed(
                    "expected " + header.size() + " fields but found " + row.fields.size());
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < header.size(); i++) {
            values.put(header.get(i), i < row.fields.size() ? row.fields.get(i) : "");
        }
        return ValidationRecord.of(values);
    }

    private List<ParsedRow> split(String text) {
        List<ParsedRow> rows = new ArrayList<>();
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean fieldStart = true;
        int i = 0;

        while (i < text.length()) {
            char c = text.charAt(i);
            if (inQuotes) {
                if (c == QUOTE) {
                    if (i + 1 < text.length() && text.charAt(i + 1) == QUOTE) {
                        field.append(QUOTE);
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    field.append(c);
                }
            } else if (c == QUOTE && fieldStart) {
                inQuotes = true;
                fieldStart = false;
            } else if (c == DELIMITER) {
                fields.add(field.toString());
                field.setLength(0);
                fieldStart = true;
            } else if (c == '\r' || c == '\n') {
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                endRow(rows, fields, field, false);
                fields = new ArrayList<>();
                fieldStart = true;
            } else {
                field.append(c);
                fieldStart = false;
            }
            i++;
        }

        if (inQuotes || !fields.isEmpty() || field.length() > 0) {
            endRow(rows, fields, field, inQuotes);
        }
        return rows;
    }

    private static void endRow(List<ParsedRow> rows, List<String> fields, StringBuilder field, boolean unterminated) {
        fields.add(field.toString());
        field.setLength(0);
        boolean blank = fields.size() == 1 && fields.get(0).isEmpty() && !unterminated;
        if (!blank) {
            rows.add(new ParsedRow(fields, unterminated));
        }
    }

    private static final class ParsedRow {

        private final List<String> fields;
        private final boolean unterminated;

        private ParsedRow(List<String> fields, boolean unterminated) {
            this.fields = fields;
            this.unterminated = unterminated;
        }
    }
}
