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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.wadeps.validation.ValidationReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.fireflyframework.wadeps.report.ValidationReportFixtures.dateError;
import static org.fireflyframework.wadeps.report.ValidationReportFixtures.oneFullName;
import static org.fireflyframework.wadeps.report.ValidationReportFixtures.report;

/**
 * Unit tests for {@link ValidationReportJsonWriter}.
 */
class ValidationReportJsonWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ValidationReportJsonWriter writer = new ValidationReportJsonWriter(objectMapper,
            Clock.fixed(Instant.parse("2026-03-02T10:15:30Z"), ZoneOffset.UTC));

    @TempDir
    Path tempDir;

    @Test
    void write_shouldWriteTimestampedDocument() throws Exception {
        // Given
        ValidationReport report = report(List.of("subject_id", "event_date", "force_used", "notes"),
                List.of(dateError(3, "13/45/2024")), List.of(), 2, oneFullName(2, "John Doe"));

        // When
        Path written = writer.write("march.csv", report, LocalDateTime.of(2026, 3, 2, 10, 15, 30),
                tempDir.resolve("output"));

        // Then
        assertThat(written.getFileName().toString()).isEqualTo("march_validation_20260302_101530.json");
        JsonNode root = objectMapper.readTree(written.toFile());
        assertThat(root.get("file").asText()).isEqualTo("march.csv");
        assertThat(root.get("timestamp").asText()).isEqualTo("2026-03-02T10:15:30");
        assertThat(root.get("status").asText()).isEqualTo("FAILED");
        assertThat(root.get("quality_score").asDouble()).isEqualTo(50.0);

        JsonNode headers = root.get("header_validation");
        assertThat(headers.get("extra").get(0).asText()).isEqualTo("notes");
        assertThat(headers.get("missing")).isEmpty();
        assertThat(headers.get("is_valid").asBoolean()).isTrue();

        JsonNode error = root.get("data_validation").get("errors").get(0);
        assertThat(error.get("row").asInt()).isEqualTo(3);
        assertThat(error.get("column").asText()).isEqualTo("event_date");
        assertThat(error.get("value").asText()).isEqualTo("13/45/2024");
        assertThat(error.get("error").asText()).isEqualTo("Invalid date format. Expected MM/DD/YYYY");
        assertThat(error.get("severity").asText()).isEqualTo("error");
        assertThat(root.get("data_validation").get("total_rows").asInt()).isEqualTo(2);

        JsonNode subjectIds = root.get("subject_id_validation");
        assertThat(subjectIds.get("name_count").asInt()).isEqualTo(1);
        assertThat(subjectIds.get("unknown_count").asInt()).isZero();
        assertThat(subjectIds.get("examples").get(0).get("type").asText()).isEqualTo("name");
        assertThat(subjectIds.get("examples").get(0).get("value").asText()).isEqualTo("John Doe");
    }

    @Test
    void writeRunSummary_shouldWriteTotals() throws Exception {
        // Given
        RunSummary summary = RunSummary.builder()
                .totalFiles(2)
                .passed(1)
                .failed(1)
                .filesProcessed(List.of("a.csv", "b.csv"))
                .templateHeaders(6)
                .templateRules(5)
                .build();

        // When
        Path written = writer.writeRunSummary(summary, tempDir);

        // Then
        assertThat(written).isEqualTo(tempDir.resolve("validation_summary_20260302_101530.json"));
        assertThat(Files.exists(written)).isTrue();
        JsonNode root = objectMapper.readTree(written.toFile());
        assertThat(root.get("validation_run").asText()).isEqualTo("2026-03-02T10:15:30");
        assertThat(root.get("total_files").asInt()).isEqualTo(2);
        assertThat(root.get("files_processed").get(1).asText()).isEqualTo("b.csv");
        assertThat(root.get("template_info").get("validation_rules").asInt()).isEqualTo(5);
    }

    @Test
    void stem_shouldDropExtensionOnly() {
        assertThat(ValidationReportJsonWriter.stem("march.2026.csv")).isEqualTo("march.2026");
        assertThat(ValidationReportJsonWriter.stem("noext")).isEqualTo("noext");
        assertThat(ValidationReportJsonWriter.stem(".hidden")).isEqualTo(".hidden");
    }
}
