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

package org.fireflyframework.wadeps.validation;

import lombok.Builder;
import lombok.Data;

/**
 * A single issue found in one field of one row.
 */
@Data
@Builder
public class FieldFinding {

    /** Column name used for findings that concern a whole row. */
    public static final String ROW_COLUMN = "(row)";

    private final int rowNumber;
    private final String column;
    private final String value;
    private final String message;
    private final FindingSeverity severity;

    /**
     * Creates an error finding.
     *
     * @param rowNumber the 1-based file row, header included
     * @param column    the column name
     * @param value     the trimmed value that failed
     * @param message   a human-readable description of the failure
     * @return an error {@link FieldFinding}
     */
    public static FieldFinding error(int rowNumber, String column, String value, String message) {
        return FieldFinding.builder()
                .rowNumber(rowNumber)
                .column(column)
                .value(value)
                .message(message)
                .severity(FindingSeverity.ERROR)
                .build();
    }

    /**
     * Creates a warning for a row that could not be read as a record.
     *
     * @param rowNumber the 1-based file row
     * @param reason    why the row was skipped
     * @return a warning {@link FieldFinding}
     */
    public static FieldFinding skippedRow(int rowNumber, String reason) {
        return FieldFinding.builder()
                .rowNumber(rowNumber)
                .column(ROW_COLUMN)
                .value("")
                .message("Row skipped: " + reason)
                .severity(FindingSeverity.WARNING)
                .build();
    }
}
