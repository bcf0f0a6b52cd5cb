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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.wadeps.schema.HeaderComparison;
import org.fireflyframework.wadeps.validation.FieldFinding;
import org.fireflyframework.wadeps.validation.SubjectIdFinding;
import org.fireflyframework.wadeps.validation.SubjectIdSummary;
import org.fireflyframework.wadeps.validation.ValidationReport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Exports validation reports as JSON documents.
 *
 * <p><b>Example document:</b></p>
 * <pre>{@code
 * {
 *   "file": "march.csv",
 *   "timestamp": "2026-03-02T10:15:30",
 *   "status": "FAILED",
 *   "quality_score": 50.0,
 *   "header_validation": { "matching": [...], "missing": [], "extra": ["notes"], "is_valid": true },
 *   "data_validation": {
 *     "errors": [ { "row": 2, "column": "event_date", "value": "13/45/2024",
 *                   "error": "Invalid date format. Expected MM/DD/YYYY", "severity": "error" } ],
 *     "warnings": [],
 *     "total_rows": 2
 *   },
 *   "subject_id_validation": { "unknown_count": 0, "name_count": 1, "invalid_count": 0, "examples": [...] }
 * }
 * }</pre>
 */
@Slf4j
public class ValidationReportJsonWriter {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ValidationReportJsonWriter(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemDefaultZone());
    }

    public ValidationReportJsonWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Writes a report to {@code <outputDirectory>/<file stem>_validation_<yyyyMMdd_HHmmss>.json},
     * creating the directory when needed.
     *
     * @param fileName        the validated file
     * @param report          the report
     * @param validatedAt     when the file was validated, used for the name and the timestamp
     * @param outputDirectory the directory to write to
     * @return the written file
     * @throws UncheckedIOException if the file cannot be written
     */
    public Path write(String fileName, ValidationReport report, LocalDateTime validatedAt, Path outputDirectory) {
        Path target = outputDirectory.resolve(
                stem(fileName) + "_validation_" + validatedAt.format(FILE_STAMP) + ".json");
        writeJson(toDocument(fileName, report, validatedAt), target);
        log.info("Results saved to: {}", target);
        return target;
    }

    /**
     * Writes the totals of a batch run to
     * {@code <outputDirectory>/validation_summary_<yyyyMMdd_HHmmss>.json}.
     *
     * @param summary         the run totals
     * @param outputDirectory the directory to write to
     * @return the written file
     * @throws UncheckedIOException if the file cannot be written
     */
    public Path writeRunSummary(RunSummary summary, Path outputDirectory) {
        LocalDateTime now = LocalDateTime.now(clock);
        Map<String, Object> templateInfo = new LinkedHashMap<>();
        templateInfo.put("headers", summary.getTemplateHeaders());
        templateInfo.put("validation_rules", summary.getTemplateRules());

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("validation_run", now.toString());
        document.put("total_files", summary.getTotalFiles());
        document.put("passed", summary.getPassed());
        document.put("failed", summary.getFailed());
        document.put("files_processed", summary.getFilesProcessed());
        document.put("template_info", templateInfo);

        Path target = outputDirectory.resolve("validation_summary_" + now.format(FILE_STAMP) + ".json");
        writeJson(document, target);
        log.info("Summary report: {}", target);
        return target;
    }

    /**
     * Builds the JSON document of a report as nested maps and lists.
     *
     * @param fileName  the validated file
     * @param report    the report
     * @param timestamp the time recorded in the document
     * @return the document
     */
    public Map<String, Object> toDocument(String fileName, ValidationReport report, LocalDateTime timestamp) {
        ValidationSummary summary = ValidationSummary.of(report);
        HeaderComparison headers = report.getHeaders();

        Map<String, Object> headerValidation = new LinkedHashMap<>();
        headerValidation.put("matching", List.copyOf(headers.getMatching()));
        headerValidation.put("missing", List.copyOf(headers.getMissing()));
        headerValidation.put("extra", List.copyOf(headers.getExtra()));
        headerValidation.put("is_valid", headers.isValid());

        Map<String, Object> dataValidation = new LinkedHashMap<>();
        dataValidation.put("errors", findings(report.getErrors()));
        dataValidation.put("warnings", findings(report.getWarnings()));
        dataValidation.put("total_rows", report.getTotalRows());

        SubjectIdSummary subjectIds = report.getSubjectIds();
        Map<String, Object> subjectIdValidation = new LinkedHashMap<>();
        subjectIdValidation.put("unknown_count", subjectIds.getUnknownCount());
        subjectIdValidation.put("name_count", subjectIds.getFullNameCount());
        subjectIdValidation.put("invalid_count", subjectIds.getInvalidFormatCount());
        subjectIdValidation.put("examples", subjectIds.getExamples().stream()
                .map(ValidationReportJsonWriter::example)
                .collect(Collectors.toList()));

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("file", fileName);
        document.put("timestamp", timestamp.toString());
        document.put("status", summary.getStatus().name());
        document.put("quality_score", summary.getQualityScore());
        document.put("header_validation", headerValidation);
        document.put("data_validation", dataValidation);
        document.put("subject_id_validation", subjectIdValidation);
        return document;
    }

    private static List<Map<String, Object>> findings(List<FieldFinding> findings) {
        return findings.stream().map(finding -> {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("row", finding.getRowNumber());
            node.put("column", finding.getColumn());
            node.put("value", finding.getValue());
            node.put("error", finding.getMessage());
            node.put("severity", finding.getSeverity().name().toLowerCase(Locale.ROOT));
            return node;
        }).collect(Collectors.toList());
    }

    private static Map<String, Object> example(SubjectIdFinding finding) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("row", finding.getRowNumber());
        node.put("value", finding.getValue());
        node.put("type", finding.getClassification().getCode());
        node.put("error", finding.getMessage());
        return node;
    }

    private void writeJson(Object document, Path target) {
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), document);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + target, e);
        }
    }

    /**
     * Returns a file name without its extension.
     *
     * @param fileName the file name
     * @return the name up to its last dot
     */
    public static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
