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

package org.fireflyframework.wadeps.report;

import lombok.Getter;
import org.fireflyframework.wadeps.validation.FieldFinding;

import java.util.Locale;

/**
 * Groups field findings by the kind of fix they need.
 */
@Getter
public enum ErrorCategory {

    DATE_FORMAT("Date Format Issues", "Date format issue", "Use format MM/DD/YYYY (e.g., 09/23/2025)"),
    TIME_FORMAT("Time Format Issues", "Time format issue", "Use format HH:MM (e.g., 08:21)"),
    INVALID_DROPDOWN("Invalid Dropdown Values", "Invalid dropdown value", "Use exact value from dropdown list"),
    OTHER("Other Validation Issues", null, "Check validation requirements");

    private static final int MAX_LABEL_MESSAGE_LENGTH = 30;

    private final String title;
    private final String issueLabel;
    private final String fix;

    ErrorCategory(String title, String issueLabel, String fix) {
        this.title = title;
        this.issueLabel = issueLabel;
        this.fix = fix;
    }

    /**
     * Categorizes a finding by its message.
     *
     * @param finding the finding
     * @return the category, {@link #OTHER} when nothing more specific applies
     */
    public static ErrorCategory of(FieldFinding finding) {
        String message = finding.getMessage() != null ? finding.getMessage() : "";
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("date format")) {
            return DATE_FORMAT;
        }
        if (lower.contains("time format")) {
            return TIME_FORMAT;
        }
        if (message.contains("Must be one of")) {
            return INVALID_DROPDOWN;
        }
        return OTHER;
    }

    /**
     * Returns the grouping key of a finding in this category, such as
     * {@code "event_date: Date format issue"}. Uncategorized findings are keyed
     * by the start of their message.
     *
     * @param finding the finding
     * @return the grouping key
     */
    public String keyFor(FieldFinding finding) {
        String label = issueLabel;
        if (label == null) {
            String message = finding.getMessage() != null ? finding.getMessage() : "";
            label = message.length() > MAX_LABEL_MESSAGE_LENGTH
                    ? message.substring(0, MAX_LABEL_MESSAGE_LENGTH)
                    : message;
        }
        return finding.getColumn() + ": " + label;
    }
}
