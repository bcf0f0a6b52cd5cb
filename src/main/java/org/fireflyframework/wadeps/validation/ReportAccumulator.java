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

import org.fireflyframework.wadeps.schema.HeaderComparison;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of a single validation run. Owned by one
 * {@link ValidationEngine#validate} call and frozen into a
 * {@link ValidationReport} at the end.
 */
class ReportAccumulator {

    private final HeaderComparison headers;
    private final List<FieldFinding> errors = new ArrayList<>();
    private final List<FieldFinding> warnings = new ArrayList<>();
    private final Map<SubjectIdClassification, Integer> subjectIdCounts =
            new EnumMap<>(SubjectIdClassification.class);
    private final List<SubjectIdFinding> examples;
    private final int maxExamples;
    private int totalRows;

    ReportAccumulator(HeaderComparison headers, int maxExamples) {
        this.headers = headers;
        this.maxExamples = maxExamples;
        this.examples = new ArrayList<>(maxExamples);
    }

    void countRow() {
        totalRows++;
    }

    void add(FieldFinding finding) {
        if (finding.getSeverity() == FindingSeverity.ERROR) {
            errors.add(finding);
        } else {
            warnings.add(finding);
        }
    }

    /**
     * Counts the finding and keeps it as an example while fewer than
     * {@code maxExamples} are held. {@code examples.size() <= maxExamples} always.
     */
    void add(SubjectIdFinding finding) {
        subjectIdCounts.merge(finding.getClassification(), 1, Integer::sum);
        if (examples.size() < maxExamples) {
            examples.add(finding);
        }
    }

    ValidationReport toReport() {
        SubjectIdSummary subjectIds = SubjectIdSummary.builder()
                .unknownCount(subjectIdCounts.getOrDefault(SubjectIdClassification.UNKNOWN, 0))
                .fullNameCount(subjectIdCounts.getOrDefault(SubjectIdClassification.FULL_NAME, 0))
                .invalidFormatCount(subjectIdCounts.getOrDefault(SubjectIdClassification.INVALID_FORMAT, 0))
                .examples(List.copyOf(examples))
                .build();

        return ValidationReport.builder()
                .headers(headers)
                .errors(List.copyOf(errors))
                .warnings(List.copyOf(warnings))
                .totalRows(totalRows)
                .subjectIds(subjectIds)
                .build();
    }
}
