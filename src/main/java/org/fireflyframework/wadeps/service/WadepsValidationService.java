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

package org.fireflyframework.wadeps.service;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.wadeps.config.WadepsValidatorProperties;
import org.fireflyframework.wadeps.event.ValidationCompletedEvent;
import org.fireflyframework.wadeps.record.CsvContent;
import org.fireflyframework.wadeps.record.CsvRecordReader;
import org.fireflyframework.wadeps.record.RecordSourceException;
import org.fireflyframework.wadeps.report.RunSummary;
import org.fireflyframework.wadeps.report.ValidationDashboardRenderer;
import org.fireflyframework.wadeps.report.ValidationReportJsonWriter;
import org.fireflyframework.wadeps.report.ValidationReportTextFormatter;
import org.fireflyframework.wadeps.report.ValidationSummary;
import org.fireflyframework.wadeps.schema.Schema;
import org.fireflyframework.wadeps.schema.template.ValidationTemplateLoader;
import org.fireflyframework.wadeps.validation.FieldFinding;
import org.fireflyframework.wadeps.validation.ValidationEngine;
import org.fireflyframework.wadeps.validation.ValidationReport;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Validates submission files end to end: reads the CSV, validates it against the
 * template schema, writes the JSON results, text report and HTML dashboard, and
 * publishes a {@link ValidationCompletedEvent}. The three outputs of a file carry
 * the same validation time.
 *
 * <p>The schema is loaded from {@link WadepsValidatorProperties#getTemplatePath()}
 * on first use and reused for every file. A malformed template aborts with a
 * {@link org.fireflyframework.wadeps.schema.SchemaDefinitionException}.</p>
 */
@Slf4j
public class WadepsValidationService {

    private final WadepsValidatorProperties properties;
    private final ValidationTemplateLoader templateLoader;
    private final CsvRecordReader recordReader;
    private final ValidationEngine engine;
    private final ValidationReportJsonWriter jsonWriter;
    private final ValidationReportTextFormatter textFormatter;
    private final ValidationDashboardRenderer dashboardRenderer;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private volatile Schema schema;

    public WadepsValidationService(WadepsValidatorProperties properties,
                                   ValidationTemplateLoader templateLoader,
                                   CsvRecordReader recordReader,
                                   ValidationEngine engine,
                                   ValidationReportJsonWriter jsonWriter,
                                   ValidationReportTextFormatter textFormatter,
                                   ValidationDashboardRenderer dashboardRenderer,
                                   ApplicationEventPublisher eventPublisher) {
        this(properties, templateLoader, recordReader, engine, jsonWriter, textFormatter, dashboardRenderer,
                eventPublisher, Clock.systemDefaultZone());
    }

    public WadepsValidationService(WadepsValidatorProperties properties,
                                   ValidationTemplateLoader templateLoader,
                                   CsvRecordReader recordReader,
                                   ValidationEngine engine,
                                   ValidationReportJsonWriter jsonWriter,
                                   ValidationReportTextFormatter textFormatter,
                                   ValidationDashboardRenderer dashboardRenderer,
                                   ApplicationEventPublisher eventPublisher,
                                   Clock clock) {
        this.properties = properties;
        this.templateLoader = templateLoader;
        this.recordReader = recordReader;
        this.engine = engine;
        this.jsonWriter = jsonWriter;
        this.textFormatter = textFormatter;
        this.dashboardRenderer = dashboardRenderer;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Returns the template schema, loading it on first call.
     *
     * @return the schema
     */
    public Schema getSchema() {
        Schema current = schema;
        if (current == null) {
            synchronized (this) {
                current = schema;
                if (current == null) {
                    current = templateLoader.load(Paths.get(properties.getTemplatePath()));
                    schema = current;
                }
            }
        }
        return current;
    }

    /**
     * Validates one CSV file and writes its results to the output directory.
     *
     * @param csvFile the submission file
     * @return the report, its summary and the written files
     * @throws RecordSourceException if the file cannot be read
     * @throws UncheckedIOException  if the results cannot be written
     */
    public FileValidationResult validateFile(Path csvFile) {
        Schema activeSchema = getSchema();
        log.info("Validating: {}", csvFile.getFileName());

        CsvContent content = recordReader.read(csvFile);
        LocalDateTime validatedAt = LocalDateTime.now(clock);
        ValidationReport report = engine.validate(activeSchema, content.getHeader(), content.getRecords());
        ValidationSummary summary = ValidationSummary.of(report);
        logReport(content.getFileName(), report, summary);

        Path outputDirectory = Paths.get(properties.getOutputDirectory());
        Path jsonReport = jsonWriter.write(content.getFileName(), report, validatedAt, outputDirectory);
        Path textReport = properties.isWriteTextReport()
                ? writeTextReport(content.getFileName(), report, validatedAt, outputDirectory)
                : null;
        Path dashboard = properties.isWriteDashboard()
                ? dashboardRenderer.write(content.getFileName(), report, validatedAt, outputDirectory)
                : null;

        publishEvent(new ValidationCompletedEvent(content.getFileName(), report, summary));

        return FileValidationResult.builder()
                .fileName(content.getFileName())
                .report(report)
                .summary(summary)
                .jsonReport(jsonReport)
                .textReport(textReport)
                .dashboard(dashboard)
                .build();
    }

    /**
     * Validates every {@code *.csv} file of the input directory, in name order,
     * and writes a run summary. Missing input or output directories are created;
     * when the input directory had to be created or holds no CSV file, nothing is
     * validated. A file that cannot be read or written is logged and skipped.
     *
     * @return the per-file results and the run summary
     * @throws org.fireflyframework.wadeps.schema.SchemaDefinitionException if the template is malformed
     */
    public BatchValidationResult validateDirectory() {
        Path inputDirectory = Paths.get(properties.getInputDirectory());
        Path outputDirectory = Paths.get(properties.getOutputDirectory());

        if (!Files.isDirectory(inputDirectory)) {
            createDirectory(inputDirectory);
            log.info("Created '{}' folder; place CSV files in it and run again", inputDirectory);
            return BatchValidationResult.empty();
        }
        if (!Files.isDirectory(outputDirectory)) {
            createDirectory(outputDirectory);
            log.info("Created '{}' folder for results", outputDirectory);
        }

        List<Path> csvFiles = listCsvFiles(inputDirectory);
        if (csvFiles.isEmpty()) {
            log.info("No CSV files found in '{}' folder", inputDirectory);
            return BatchValidationResult.empty();
        }
        log.info("{} CSV file(s) to process", csvFiles.size());

        Schema activeSchema = getSchema();
        List<FileValidationResult> results = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (Path csvFile : csvFiles) {
            try {
                results.add(validateFile(csvFile));
            } catch (RecordSourceException | UncheckedIOException e) {
                log.error("Error processing {}: {}", csvFile.getFileName(), e.getMessage(), e);
                skipped.add(csvFile.getFileName().toString());
            }
        }

        int passed = (int) results.stream()
                .filter(result -> result.getReport().getHeaders().isValid() && !result.getReport().hasErrors())
                .count();
        RunSummary summary = RunSummary.builder()
                .totalFiles(results.size())
                .passed(passed)
                .failed(results.size() - passed)
                .filesProcessed(results.stream().map(FileValidationResult::getFileName).collect(Collectors.toList()))
                .templateHeaders(activeSchema.getColumns().size())
                .templateRules(activeSchema.getRules().size())
                .build();
        log.info("Validation complete: {} file(s) processed, {} passed, {} failed",
                summary.getTotalFiles(), summary.getPassed(), summary.getFailed());

        Path summaryFile = jsonWriter.writeRunSummary(summary, outputDirectory);
        return BatchValidationResult.builder()
                .results(results)
                .skippedFiles(skipped)
                .summary(summary)
                .summaryFile(summaryFile)
                .build();
    }

    private Path writeTextReport(String fileName, ValidationReport report, LocalDateTime validatedAt,
                                 Path outputDirectory) {
        Path target = outputDirectory.resolve(ValidationReportJsonWriter.stem(fileName) + "_error_report.txt");
        String text = textFormatter.formatErrorReport(fileName, report, validatedAt)
                + "\n\n"
                + textFormatter.formatDetails(fileName, report)
                + "\n";
        try {
            Files.createDirectories(outputDirectory);
            Files.writeString(target, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + target, e);
        }
        log.debug("Text report saved to: {}", target);
        return target;
    }

    private void logReport(String fileName, ValidationReport report, ValidationSummary summary) {
        log.info("{}: headers {} matching, {} missing, {} extra",
                fileName,
                report.getHeaders().getMatching().size(),
                report.getHeaders().getMissing().size(),
                report.getHeaders().getExtra().size());
        log.info("{}: validated {} rows, {} errors, {} warnings",
                fileName, report.getTotalRows(), summary.getErrorCount(), summary.getWarningCount());
        long skippedRows = report.getWarnings().stream()
                .filter(warning -> FieldFinding.ROW_COLUMN.equals(warning.getColumn()))
                .count();
        if (skippedRows > 0) {
            log.warn("{}: {} malformed row(s) skipped", fileName, skippedRows);
        }
        if (summary.getSubjectIdIssueCount() > 0) {
            log.info("{}: subject ID issues: {}", fileName, summary.getSubjectIdIssueCount());
        }
        log.info("{}: status {} (quality score {})",
                fileName, summary.getStatus(), String.format("%.1f", summary.getQualityScore()));
    }

    private void publishEvent(ValidationCompletedEvent event) {
        if (eventPublisher != null) {
            eventPublisher.publishEvent(event);
        }
    }

    private static List<Path> listCsvFiles(Path directory) {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().endsWith(".csv"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + directory, e);
        }
    }

    private static void createDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create " + directory, e);
        }
    }
}
