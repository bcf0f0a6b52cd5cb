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
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.fireflyframework.wadeps.report.ValidationReportFixtures.COLUMNS;
import static org.fireflyframework.wadeps.report.ValidationReportFixtures.clean;
import static org.fireflyframework.wadeps.report.ValidationReportFixtures.dateError;
import static org.fireflyframework.wadeps.report.ValidationReportFixtures.dropdownError;
import static org.fireflyframework.wadeps.report.ValidationReportFixtures.noSubjectIdIssues;
import static org.fireflyframework.wadeps.report.ValidationReportFixtures.oneFullName;
import static org.fireflyframework.wadeps.report.ValidationReportFixtures.report;

/**
 * Unit tests for {@link ValidationDashboardRenderer}.
 */
class ValidationDashboardRendererTest {

    private static final LocalDateTime VALIDATED_AT = LocalDateTime.of(2026, 3, 2, 10, 15, 30);

    private final ValidationDashboardRenderer renderer = new ValidationDashboardRenderer();

    @TempDir
    Path tempDir;

    @Test
    void render_shouldShowFailedStatusAndErrors() {
        // Given
        ValidationReport report = report(List.of("subject_id", "event_date", "force_used", "notes"),
                List.of(dateError(3, "13/45/2024")), List.of(), 2, noSubjectIdIssues());

        // When
        String html = renderer.render("march.csv", report, VALIDATED_AT);

        // Then
        assertThat(html).contains("<title>WADEPS Validation Results - march.csv</title>");
        assertThat(html).contains("File: march.csv | Generated: 2026-03-02 10:15:30");
        assertThat(html).contains("class=\"badge failed\"", "Validation Failed");
        assertThat(html).contains("Data Validation Errors (1)", "Date Format Issues: 1 errors");
        assertThat(html).contains("Invalid date format. Expected MM/DD/YYYY", "13/45/2024");
        assertThat(html).contains("Extra Headers", "<li>notes</li>");
        assertThat(html).contains("Address 1 critical validation errors");
        assertThat(html).doesNotContain("All Validations Passed", "Subject ID Issues</h2>");
    }

    @Test
    void render_shouldShowSuccessPanelForCleanReport() {
        // When
        String html = renderer.render("clean.csv", clean(3), VALIDATED_AT);

        // Then
        assertThat(html).contains("class=\"badge passed\"", "Validation Passed");
        assertThat(html).contains("All Validations Passed", "File is ready for submission!");
        assertThat(html).doesNotContain("Data Validation Errors", "Header Validation</h2>", "Warnings (");
    }

    @Test
    void render_shouldShowSubjectIdExamplesAndWarnings() {
        // Given
        ValidationReport report = report(COLUMNS, List.of(),
                List.of(FieldFinding.skippedRow(4, "unterminated quoted field")),
                3, oneFullName(2, "John Doe"));

        // When
        String html = renderer.render("april.csv", report, VALIDATED_AT);

        // Then
        assertThat(html).contains("class=\"badge warning\"", "Warnings Found");
        assertThat(html).contains("Warnings (1)", "Row skipped: unterminated quoted field");
        assertThat(html).contains("Subject ID Issues</h2>", "Full names: 1", "Unknown values: 0", "John Doe");
        assertThat(html).contains("Subject ID appears to be a full name. Use initials instead");
        assertThat(html).doesNotContain("All Validations Passed");
    }

    @Test
    void toDashboard_shouldCapListsAndShortenHeaders() {
        // Given - 17 extra headers, the first longer than a line, and 25 errors
        List<String> header = new ArrayList<>(COLUMNS);
        String longHeader = "x".repeat(70);
        header.add(longHeader);
        for (int i = 1; i <= 16; i++) {
            header.add("extra_" + i);
        }
        List<FieldFinding> errors = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            errors.add(dateError(i + 2, "bad"));
        }
        for (int i = 0; i < 10; i++) {
            errors.add(dropdownError(i + 2, "Maybe"));
        }
        ValidationReport report = report(header, errors, List.of(), 25, noSubjectIdIssues());

        // When
        ValidationDashboard dashboard = renderer.toDashboard("big.csv", report, VALIDATED_AT);

        // Then
        assertThat(dashboard.getExtraHeaderCount()).isEqualTo(17);
        assertThat(dashboard.getExtraHeaders()).hasSize(15);
        assertThat(dashboard.getExtraHeaders().get(0)).isEqualTo("x".repeat(57) + "...");
        assertThat(dashboard.getExtraHeaders().get(1)).isEqualTo("extra_1");
        assertThat(dashboard.getMoreExtraHeaders()).isEqualTo(2);
        assertThat(dashboard.getMissingHeaders()).isEmpty();

        assertThat(dashboard.getErrors()).hasSize(20);
        assertThat(dashboard.getMoreErrors()).isEqualTo(5);
        assertThat(dashboard.getErrorCategories()).containsExactly(
                DashboardCount.builder().label("Date Format Issues").count(15).build(),
                DashboardCount.builder().label("Invalid Dropdown Values").count(10).build());
        assertThat(dashboard.getStatusStyle()).isEqualTo("failed");
    }

    @Test
    void render_shouldPointToJsonForUnlistedErrors() {
        // Given
        List<FieldFinding> errors = new ArrayList<>();
        for (int i = 0; i < 23; i++) {
            errors.add(dateError(i + 2, "bad"));
        }
        ValidationReport report = report(COLUMNS, errors, List.of(), 23, noSubjectIdIssues());

        // When
        String html = renderer.render("big.csv", report, VALIDATED_AT);

        // Then
        assertThat(html).contains("... and 3 more errors (see JSON file for complete list)");
        assertThat(html).contains("Row <span>21</span>");
        assertThat(html).doesNotContain("Row <span>22</span>");
    }

    @Test
    void write_shouldWriteDashboardNextToResults() throws Exception {
        // When
        Path written = renderer.write("march.csv", clean(1), VALIDATED_AT, tempDir.resolve("output"));

        // Then
        assertThat(written).isEqualTo(tempDir.resolve("output").resolve("march_dashboard.html"));
        assertThat(Files.readString(written, StandardCharsets.UTF_8))
                .startsWith("<!DOCTYPE html>")
                .contains("File: march.csv | Generated: 2026-03-02 10:15:30");
    }
}
