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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.wadeps.schema.HeaderComparison;
import org.fireflyframework.wadeps.validation.FieldFinding;
import org.fireflyframework.wadeps.validation.SubjectIdClassification;
import org.fireflyframework.wadeps.validation.SubjectIdSummary;
import org.fireflyframework.wadeps.validation.ValidationReport;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a validation report as a self-contained HTML dashboard.
 *
 * <p>The page is produced by the Thymeleaf template {@code wadeps/dashboard.html}
 * from the classpath. It shows the status badge, the headline numbers, the
 * header comparison, up to {@value #MAX_ERRORS_LISTED} errors grouped by
 * {@link ErrorCategory}, the warnings, the subject identifier examples and the
 * recommendations of {@link ValidationSummary#recommendations()}.</p>
 */
@Slf4j
public class ValidationDashboardRenderer {

    static final int MAX_HEADERS_LISTED = 15;
    static final int MAX_HEADER_LENGTH = 60;
    static final int MAX_ERRORS_LISTED = 20;
    static final int MAX_SUBJECT_ID_EXAMPLES_LISTED = 5;

    private static final String TEMPLATE = "dashboard";
    private static final DateTimeFormatter GENERATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final TemplateEngine templateEngine;

    public ValidationDashboardRenderer() {
        this(defaultTemplateEngine());
    }

    public ValidationDashboardRenderer(TemplateEngine templateEngine) {
        this.templateEngine = templateEngine;
    }

    /**
     * Renders the dashboard page of a report.
     *
     * @param fileName    the validated file
     * @param report      the report
     * @param validatedAt when the file was validated
     * @return the HTML page
     */
    public String render(String fileName, ValidationReport report, LocalDateTime validatedAt) {
        Context context = new Context(Locale.ROOT);
        context.setVariable("dashboard", toDashboard(fileName, report, validatedAt));
        return templateEngine.process(TEMPLATE, context);
    }

    /**
     * Writes the dashboard of a report to {@code <outputDirectory>/<file stem>_dashboard.html}.
     *
     * @param fileName        the validated file
     * @param report          the report
     * @param validatedAt     when the file was validated
     * @param outputDirectory the directory to write to
     * @return the written file
     * @throws UncheckedIOException if the file cannot be written
     */
    public Path write(String fileName, ValidationReport report, LocalDateTime validatedAt, Path outputDirectory) {
        Path target = outputDirectory.resolve(ValidationReportJsonWriter.stem(fileName) + "_dashboard.html");
        String html = render(fileName, report, validatedAt);
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            Files.writeString(target, html, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + target, e);
        }
        log.info("Dashboard saved to: {}", target);
        return target;
    }

    /**
     * Builds the values displayed by the template.
     *
     * @param fileName    the validated file
     * @param report      the report
     * @param validatedAt when the file was validated
     * @return the dashboard model
     */
    public ValidationDashboard toDashboard(String fileName, ValidationReport report, LocalDateTime validatedAt) {
        ValidationSummary summary = ValidationSummary.of(report);
        HeaderComparison headers = report.getHeaders();
        SubjectIdSummary subjectIds = report.getSubjectIds();
        List<FieldFinding> errors = report.getErrors();

        List<DashboardCount> subjectIdCounts = new ArrayList<>();
        for (SubjectIdClassification classification : SubjectIdClassification.values()) {
            subjectIdCounts.add(DashboardCount.builder()
                    .label(classification.getLabel())
                    .count(subjectIds.countOf(classification))
                    .build());
        }

        return ValidationDashboard.builder()
                .title("WADEPS Validation Results - " + fileName)
                .subtitle("File: " + fileName + " | Generated: " + validatedAt.format(GENERATED))
                .statusLabel(statusLabel(summary.getStatus()))
                .statusStyle(summary.getStatus().name().toLowerCase(Locale.ROOT))
                .summary(summary)
                .matchingHeaderCount(headers.getMatching().size())
                .missingHeaderCount(headers.getMissing().size())
                .extraHeaderCount(headers.getExtra().size())
                .missingHeaders(listedHeaders(headers.getMissing()))
                .moreMissingHeaders(Math.max(0, headers.getMissing().size() - MAX_HEADERS_LISTED))
                .extraHeaders(listedHeaders(headers.getExtra()))
                .moreExtraHeaders(Math.max(0, headers.getExtra().size() - MAX_HEADERS_LISTED))
                .errorCategories(errorCategories(errors))
                .errors(List.copyOf(errors.subList(0, Math.min(errors.size(), MAX_ERRORS_LISTED))))
                .moreErrors(Math.max(0, errors.size() - MAX_ERRORS_LISTED))
                .warnings(report.getWarnings())
                .subjectIdCounts(subjectIdCounts)
                .subjectIdExamples(subjectIds.getExamples().stream()
                        .limit(MAX_SUBJECT_ID_EXAMPLES_LISTED)
                        .collect(Collectors.toList()))
                .recommendations(summary.recommendations())
                .readyForSubmission(summary.isReadyForSubmission())
                .build();
    }

    private static String statusLabel(ValidationStatus status) {
        return switch (status) {
            case FAILED -> "Validation Failed";
            case WARNING -> "Warnings Found";
            case PASSED -> "Validation Passed";
        };
    }

    private static List<String> listedHeaders(Collection<String> headers) {
        return headers.stream()
                .limit(MAX_HEADERS_LISTED)
                .map(header -> header.length() > MAX_HEADER_LENGTH
                        ? header.substring(0, MAX_HEADER_LENGTH - 3) + "..."
                        : header)
                .collect(Collectors.toList());
    }

    private static List<DashboardCount> errorCategories(List<FieldFinding> errors) {
        Map<ErrorCategory, Integer> counts = new EnumMap<>(ErrorCategory.class);
        for (FieldFinding error : errors) {
            counts.merge(ErrorCategory.of(error), 1, Integer::sum);
        }
        return counts.entrySet().stream()
                .map(entry -> DashboardCount.builder()
                        .label(entry.getKey().getTitle())
                        .count(entry.getValue())
                        .build())
                .collect(Collectors.toList());
    }

    private static TemplateEngine defaultTemplateEngine() {
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("wadeps/");
        resolver.setSuffix(".html");
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setCharacterEncoding(StandardCharsets.UTF_8.name());
        resolver.setCacheable(true);

        TemplateEngine engine = new TemplateEngine();
        engine.setTemplateResolver(resolver);
        return engine;
    }
}
