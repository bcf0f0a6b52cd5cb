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

import org.fireflyframework.wadeps.record.ValidationRecord;
import org.fireflyframework.wadeps.schema.HeaderComparator;
import org.fireflyframework.wadeps.schema.Schema;
import org.fireflyframework.wadeps.schema.rules.FieldRule;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Validates the rows of a submission against a {@link Schema} and produces a
 * {@link ValidationReport}.
 *
 * <p>For every record the engine:</p>
 * <ul>
 *   <li>evaluates each present column that has a rule with the {@link FieldRuleEvaluator}</li>
 *   <li>classifies the subject identifier column, when present, with the {@link SubjectIdClassifier}</li>
 * </ul>
 *
 * <p>Row numbers start at 2, the header being row 1. A malformed record is
 * reported as a warning and skipped: it does not count towards
 * {@link ValidationReport#getTotalRows()} but still takes up a row number.
 * A bad value never stops the run.</p>
 *
 * <p>The engine holds no per-run state and may be shared between threads; each
 * call builds its own report.</p>
 */
public class ValidationEngine {

    public static final String DEFAULT_SUBJECT_ID_COLUMN = "subject_id";
    public static final int DEFAULT_MAX_SUBJECT_ID_EXAMPLES = 5;

    private static final int FIRST_DATA_ROW = 2;

    private final String subjectIdColumn;
    private final int maxSubjectIdExamples;
    private final FieldRuleEvaluator evaluator;
    private final SubjectIdClassifier classifier;

    /**
     * Creates an engine that classifies the {@code subject_id} column and keeps
     * five subject identifier examples.
     */
    public ValidationEngine() {
        this(DEFAULT_SUBJECT_ID_COLUMN, DEFAULT_MAX_SUBJECT_ID_EXAMPLES);
    }

    /**
     * Creates an engine.
     *
     * @param subjectIdColumn      the column holding subject identifiers
     * @param maxSubjectIdExamples how many subject identifier findings to keep as examples
     */
    public ValidationEngine(String subjectIdColumn, int maxSubjectIdExamples) {
        this(subjectIdColumn, maxSubjectIdExamples, new FieldRuleEvaluator(), new SubjectIdClassifier());
    }

    ValidationEngine(String subjectIdColumn, int maxSubjectIdExamples,
                     FieldRuleEvaluator evaluator, SubjectIdClassifier classifier) {
        if (maxSubjectIdExamples < 0) {
            throw new IllegalArgumentException("maxSubjectIdExamples must not be negative: " + maxSubjectIdExamples);
        }
        this.subjectIdColumn = subjectIdColumn;
        this.maxSubjectIdExamples = maxSubjectIdExamples;
        this.evaluator = evaluator;
        this.classifier = classifier;
    }

    /**
     * Validates a header row and its records.
     *
     * @param schema  the expected columns and rules
     * @param header  the header row of the submission
     * @param records the data rows, in file order
     * @return the finalized report
     */
    public ValidationReport validate(Schema schema, List<String> header, Iterable<ValidationRecord> records) {
        ReportAccumulator accumulator = new ReportAccumulator(
                HeaderComparator.compare(schema.getColumns(), header), maxSubjectIdExamples);

        int rowNumber = FIRST_DATA_ROW;
        for (ValidationRecord record : records) {
            if (record.isMalformed()) {
                accumulator.add(FieldFinding.skippedRow(rowNumber, record.getMalformedReason()));
            } else {
                accumulator.countRow();
                validateRecord(schema, record, rowNumber, accumulator);
            }
            rowNumber++;
        }
        return accumulator.toReport();
    }

    /**
     * Reactive variant of {@link #validate(Schema, List, Iterable)}. Validation
     * runs when the returned {@link Mono} is subscribed.
     *
     * @param schema  the expected columns and rules
     * @param header  the header row of the submission
     * @param records the data rows, in file order
     * @return a {@link Mono} emitting the finalized report
     */
    public Mono<ValidationReport> validateAsync(Schema schema, List<String> header,
                                                Iterable<ValidationRecord> records) {
        return Mono.fromCallable(() -> validate(schema, header, records));
    }

    private void validateRecord(Schema schema, ValidationRecord record, int rowNumber,
                                ReportAccumulator accumulator) {
        for (Map.Entry<String, String> field : record.getValues().entrySet()) {
            FieldRule rule = schema.getRules().get(field.getKey());
            if (rule != null) {
                evaluator.evaluate(field.getKey(), field.getValue(), rule, rowNumber)
                        .ifPresent(accumulator::add);
            }
        }

        if (record.has(subjectIdColumn)) {
            classifier.classify(record.get(subjectIdColumn), rowNumber)
                    .ifPresent(accumulator::add);
        }
    }

    public String getSubjectIdColumn() {
        return subjectIdColumn;
    }
}
