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

import org.fireflyframework.wadeps.schema.HeaderComparison;
import org.fireflyframework.wadeps.validation.FieldFinding;
import org.fireflyframework.wadeps.validation.SubjectIdClassification;
import org.fireflyframework.wadeps.validation.SubjectIdFinding;
import org.fireflyframework.wadeps.validation.SubjectIdSummary;
import org.fireflyframework.wadeps.validation.ValidationReport;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders a {@link ValidationReport} as plain text.
 *
 * <ul>
 *   <li>{@link #formatErrorReport} - compact report grouping data issues by column and kind</li>
 *   <li>{@link #formatDetails} - row-level listing with recommendations</li>
 * </ul>
 */
public class ValidationReportTextFormatter {

    private static final String RULE = "=".repeat(60);
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final int REPORT_HEADER_LIMIT = 10;
    private static final int DETAIL_ERROR_LIMIT = 20;
    private static final int DETAIL_WARNING_LIMIT = 10;
    private static final int LINE_BREAK_HEADER_WIDTH = 50;

    /**
     * Formats the error report: header problems, data issues grouped per column
     * and category with a count, an example value and a fix, then the status.
     *
     * @param fileName    the validated file
     * @param report      the report
     * @param validatedAt when the file was validated
     * @return the report text, lines separated by {@code \n}
     */
    public String formatErrorReport(String fileName, ValidationReport report, LocalDateTime validatedAt) {
        StringJoiner out = new StringJoiner("\n");
        out.add("WADEPS VALIDATION ERROR REPORT");
        out.add(RULE);
        out.add("File: " + fileName);
        out.add("Date: " + validatedAt.format(DATE));
        out.add("");

        HeaderComparison headers = report.getHeaders();
        if (!headers.getMissing().isEmpty()) {
            out.add("MISSING HEADERS:");
            appendLimited(out, List.copyOf(headers.getMissing()), REPORT_HEADER_LIMIT, "  - ", "  ... and %d more");
            out.add("");
        }

        if (!headers.getExtra().isEmpty()) {
            out.add("EXTRA/MALFORMED HEADERS:");
            List<String> extra = List.copyOf(headers.getExtra());
            for (String header : extra.subList(0, Math.min(REPORT_HEADER_LIMIT, extra.size()))) {
                if (header.contains("\n") || header.contains("\r")) {
                    out.add("  - Header has line break: " + truncate(escape(header), LINE_BREAK_HEADER_WIDTH));
                } else {
                    out.add("  - " + header);
                }
            }
            out.add("  FIX: Remove line breaks from header row");
            out.add("");
        }

        if (report.hasErrors()) {
            out.add("DATA VALIDATION ISSUES:");
            groupIssues(report.getErrors()).entrySet().stream()
                    .sorted(Comparator.comparingInt((Map.Entry<String, IssueGroup> e) -> e.getValue().count).reversed())
                    .forEach(entry -> {
                        IssueGroup group = entry.getValue();
                        out.add(String.format("  %3d × %s", group.count, entry.getKey()));
                        out.add("       Example: \"" + group.example + "\"");
                        out.add("       Fix: " + group.fix);
                    });
            out.add("");
        }

        out.add("VALIDATION STATUS:");
        switch (ValidationSummary.of(report).getStatus()) {
            case PASSED:
                out.add("  PASSED - No critical issues");
                break;
            case WARNING:
                out.add("  PASSED WITH WARNINGS - Review warnings before submission");
                break;
            default:
                out.add("  FAILED - Issues must be fixed before submission");
                break;
        }
        return out.toString();
    }

    /**
     * Formats the detailed results: header differences, the first errors and
     * warnings row by row, subject identifier issues with examples, and
     * recommendations.
     *
     * @param fileName the validated file
     * @param report   the report
     * @return the detail text, lines separated by {@code \n}
     */
    public String formatDetails(String fileName, ValidationReport report) {
        StringJoiner out = new StringJoiner("\n");
        out.add(RULE);
        out.add("DETAILED VALIDATION RESULTS: " + fileName);
        out.add(RULE);

        HeaderComparison headers = report.getHeaders();
        if (!headers.getMissing().isEmpty() || !headers.getExtra().isEmpty()) {
            out.add("");
            out.add("HEADER VALIDATION:");
            if (!headers.getMissing().isEmpty()) {
                out.add("  Missing headers (" + headers.getMissing().size() + "):");
                appendLimited(out, List.copyOf(headers.getMissing()), REPORT_HEADER_LIMIT, "    - ", "    ... and %d more");
            }
            if (!headers.getExtra().isEmpty()) {
                out.add("  Extra headers (" + headers.getExtra().size() + "):");
                appendLimited(out, List.copyOf(headers.getExtra()), REPORT_HEADER_LIMIT, "    + ", "    ... and %d more");
            }
        }

        List<FieldFinding> errors = report.getErrors();
        if (!errors.isEmpty()) {
            out.add("");
            out.add("DATA VALIDATION ERRORS (" + errors.size() + "):");
            for (FieldFinding error : errors.subList(0, Math.min(DETAIL_ERROR_LIMIT, errors.size()))) {
                out.add("  Row " + error.getRowNumber() + ", " + error.getColumn() + ": " + error.getMessage());
                if (error.getValue() != null && !error.getValue().isEmpty()) {
                    out.add("    Value: \"" + error.getValue() + "\"");
                }
            }
            if (errors.size() > DETAIL_ERROR_LIMIT) {
                out.add("  ... and " + (errors.size() - DETAIL_ERROR_LIMIT) + " more errors");
            }
        }

        List<FieldFinding> warnings = report.getWarnings();
        if (!warnings.isEmpty()) {
            out.add("");
            out.add("WARNINGS (" + warnings.size() + "):");
            for (FieldFinding warning : warnings.subList(0, Math.min(DETAIL_WARNING_LIMIT, warnings.size()))) {
                out.add("  Row " + warning.getRowNumber() + ", " + warning.getColumn() + ": " + warning.getMessage());
            }
            if (warnings.size() > DETAIL_WARNING_LIMIT) {
                out.add("  ... and " + (warnings.size() - DETAIL_WARNING_LIMIT) + " more warnings");
            }
        }

        SubjectIdSummary subjectIds = report.getSubjectIds();
        if (subjectIds.getTotalCount() > 0) {
            out.add("");
            out.add("SUBJECT ID ISSUES (" + subjectIds.getTotalCount() + "):");
            for (SubjectIdClassification classification : SubjectIdClassification.values()) {
                out.add("  " + classification.getLabel() + ": " + subjectIds.countOf(classification));
            }
            if (!subjectIds.getExamples().isEmpty()) {
                out.add("  Examples:");
                for (SubjectIdFinding example : subjectIds.getExamples()) {
                    out.add("    Row " + example.getRowNumber() + ": \"" + example.getValue() + "\" - "
                            + example.getMessage());
                }
            }
        }

        out.add("");
        out.add("RECOMMENDATIONS:");
        ValidationSummary.of(report).recommendations().forEach(line -> out.add("  - " + line));
        out.add("");
        out.add(RULE);
        return out.toString();
    }

    private static Map<String, IssueGroup> groupIssues(List<FieldFinding> findings) {
        Map<String, IssueGroup> groups = new LinkedHashMap<>();
        for (FieldFinding finding : findings) {
            ErrorCategory category = ErrorCategory.of(finding);
            groups.computeIfAbsent(category.keyFor(finding),
                    key -> new IssueGroup(finding.getValue(), category.getFix())).count++;
        }
        return groups;
    }

    private static void appendLimited(StringJoiner out, List<String> items, int limit, String prefix, String more) {
        for (String item : items.subList(0, Math.min(limit, items.size()))) {
            out.add(prefix + item);
        }
        if (items.size() > limit) {
            out.add(String.format(more, items.size() - limit));
        }
    }

    private static String escape(String header) {
        return "'" + header.replace("\\", "\\\\").replace("\r", "\\r").replace("\n", "\\n") + "'";
    }

    private static String truncate(String text, int width) {
        return text.length() > width ? text.substring(0, width) : text;
    }

    private static final class IssueGroup {

        private final String example;
        private final String fix;
        private int count;

        private IssueGroup(String example, String fix) {
            this.example = example;
            this.fix = fix;
        }
    }
}
