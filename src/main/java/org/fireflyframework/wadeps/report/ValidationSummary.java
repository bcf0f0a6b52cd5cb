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

import lombok.Builder;
import lombok.Data;
import org.fireflyframework.wadeps.validation.ValidationReport;

import java.util.ArrayList;
import java.util.List;

/**
 * Presentation metrics derived from a {@link ValidationReport}.
 */
@Data
@Builder
public class ValidationSummary {

    private final ValidationStatus status;

    /** {@code 100 - errors per row * 100}, floored at zero. */
    private final double qualityScore;

    private final int totalRows;
    private final int errorCount;
    private final int warningCount;
    private final boolean headersValid;
    private final int headerIssueCount;
    private final int subjectIdIssueCount;

    /**
     * Derives the summary of a report.
     *
     * @param report the validation report
     * @return the summary
     */
    public static ValidationSummary of(ValidationReport report) {
        int totalRows = report.getTotalRows();
        int errors = report.getErrors().size();
        int warnings = report.getWarnings().size();
        int subjectIdIssues = report.getSubjectIds().getTotalCount();
        boolean headersValid = report.getHeaders().isValid();

        ValidationStatus status;
        if (!headersValid || errors > 0) {
            status = ValidationStatus.FAILED;
        } else if (warnings > 0 || subjectIdIssues > 0) {
            status = ValidationStatus.WARNING;
        } else {
            status = ValidationStatus.PASSED;
        }

        double qualityScore = Math.max(0.0, 100.0 - ((double) errors / Math.max(totalRows, 1) * 100.0));

        return ValidationSummary.builder()
                .status(status)
                .qualityScore(qualityScore)
                .totalRows(totalRows)
                .errorCount(errors)
                .warningCount(warnings)
                .headersValid(headersValid)
                .headerIssueCount(report.getHeaders().getMissing().size() + report.getHeaders().getExtra().size())
                .subjectIdIssueCount(subjectIdIssues)
                .build();
    }

    /**
     * Lists what to fix before resubmission, or a ready-for-submission note.
     *
     * @return the recommendation lines
     */
    public List<String> recommendations() {
        List<String> lines = new ArrayList<>();
        if (!headersValid) {
            lines.add("Fix missing headers before resubmission");
        }
        if (errorCount > 0) {
            lines.add("Address " + errorCount + " critical validation errors");
        }
        if (warningCount > 0) {
            lines.add("Review " + warningCount + " warnings for data quality");
        }
        if (subjectIdIssueCount > 0) {
            lines.add("Fix " + subjectIdIssueCount + " subject ID format issues");
        }
        if (isReadyForSubmission()) {
            lines.add("File is ready for submission!");
        }
        return lines;
    }

    /**
     * Whether the headers are complete and there are neither errors nor subject
     * identifier issues. Warnings alone do not block submission.
     */
    public boolean isReadyForSubmission() {
        return headersValid && errorCount == 0 && subjectIdIssueCount == 0;
    }
}
