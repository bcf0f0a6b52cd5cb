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

import org.fireflyframework.wadeps.validation.FieldFinding;
import org.fireflyframework.wadeps.validation.ValidationReport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.fireflyframework.wadeps.report.ValidationReportFixtures.COLUMNS;
import static org.fireflyframework.wadeps.report.ValidationReportFixtures.clean;
import static org.fireflyframework.wadeps.report.ValidationReportFixtures.dateError;
import static org.fireflyframework.wadeps.report.ValidationReportFixtures.noSubjectIdIssues;
import static org.fireflyframework.wadeps.report.ValidationReportFixtures.oneFullName;
import static org.fireflyframework.wadeps.report.ValidationReportFixtures.report;

/**
 * Unit tests for {@link ValidationSummary}.
 */
class ValidationSummaryTest {

    @Test
    void of_shouldPassCleanReport() {
        ValidationSummary summary = ValidationSummary.of(clean(10));

        assertThat(summary.getStatus()).isEqualTo(ValidationStatus.PASSED);
        assertThat(summary.getQualityScore()).isEqualTo(100.0);
        assertThat(summary.isHeadersValid()).isTrue();
    }

    @Test
    void of_shouldFailOnErrors() {
        // Given
        ValidationReport report = report(COLUMNS, List.of(dateError(2, "x"), dateError(3, "y")),
                List.of(), 8, noSubjectIdIssues());

        // When
        ValidationSummary summary = ValidationSummary.of(report);

        // Then
        assertThat(summary.getStatus()).isEqualTo(ValidationStatus.FAILED);
        assertThat(summary.getErrorCount()).isEqualTo(2);
        assertThat(summary.getQualityScore()).isCloseTo(75.0, within(0.0001));
    }

    @Test
    void of_shouldFailOnMissingHeaders() {
        ValidationSummary summary = ValidationSummary.of(
                report(List.of("subject_id", "notes"), List.of(), List.of(), 1, noSubjectIdIssues()));

        assertThat(summary.getStatus()).isEqualTo(ValidationStatus.FAILED);
        assertThat(summary.isHeadersValid()).isFalse();
        assertThat(summary.getHeaderIssueCount()).isEqualTo(3);
    }

    @Test
    void of_shouldWarnOnWarningsOrSubjectIdIssues() {
        ValidationSummary withWarning = ValidationSummary.of(report(COLUMNS, List.of(),
                List.of(FieldFinding.skippedRow(4, "unterminated quoted field")), 3, noSubjectIdIssues()));
        ValidationSummary withSubjectId = ValidationSummary.of(
                report(COLUMNS, List.of(), List.of(), 3, oneFullName(2, "John Doe")));

        assertThat(withWarning.getStatus()).isEqualTo(ValidationStatus.WARNING);
        assertThat(withSubjectId.getStatus()).isEqualTo(ValidationStatus.WARNING);
        assertThat(withSubjectId.getSubjectIdIssueCount()).isEqualTo(1);
    }

    @Test
    void of_shouldFloorQualityScoreAtZero() {
        // Given - more errors than rows
        ValidationReport report = report(COLUMNS, List.of(dateError(2, "a"), dateError(2, "b"), dateError(2, "c")),
                List.of(), 1, noSubjectIdIssues());

        // When & Then
        assertThat(ValidationSummary.of(report).getQualityScore()).isZero();
    }

    @Test
    void of_shouldNotDivideByZeroForEmptyFile() {
        ValidationReport report = report(COLUMNS, List.of(), List.of(), 0, noSubjectIdIssues());

        assertThat(ValidationSummary.of(report).getQualityScore()).isEqualTo(100.0);
    }

    @Test
    void recommendations_shouldListEveryOutstandingIssue() {
        // Given
        ValidationReport report = report(List.of("subject_id"),
                List.of(dateError(2, "x")),
                List.of(FieldFinding.skippedRow(3, "unterminated quoted field")),
                2, oneFullName(2, "John Doe"));

        // When
        ValidationSummary summary = ValidationSummary.of(report);

        // Then
        assertThat(summary.isReadyForSubmission()).isFalse();
        assertThat(summary.recommendations()).containsExactly(
                "Fix missing headers before resubmission",
                "Address 1 critical validation errors",
                "Review 1 warnings for data quality",
                "Fix 1 subject ID format issues");
    }

    @Test
    void recommendations_shouldConfirmReadyFile() {
        ValidationSummary summary = ValidationSummary.of(clean(3));

        assertThat(summary.isReadyForSubmission()).isTrue();
        assertThat(summary.recommendations()).containsExactly("File is ready for submission!");
    }

    @Test
    void recommendations_shouldNotConfirmFileWithSubjectIdIssues() {
        // Given - warnings only, no errors
        ValidationSummary summary = ValidationSummary.of(
                report(COLUMNS, List.of(), List.of(), 3, oneFullName(2, "John Doe")));

        // When & Then
        assertThat(summary.isReadyForSubmission()).isFalse();
        assertThat(summary.recommendations()).containsExactly("Fix 1 subject ID format issues");
    }
}
