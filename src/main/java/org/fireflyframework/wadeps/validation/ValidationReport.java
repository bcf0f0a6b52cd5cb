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

import lombok.Builder;
import lombok.Data;
import org.fireflyframework.wadeps.schema.HeaderComparison;

import java.util.List;

/**
 * Aggregated, immutable outcome of validating one submission with the
 * {@link ValidationEngine}.
 *
 * <p>The report holds no timestamps: validating the same rows twice yields equal
 * reports. Presentation metrics such as a quality score are derived by report
 * consumers.</p>
 */
@Data
@Builder
public class ValidationReport {

    private final HeaderComparison headers;
    private final List<FieldFinding> errors;
    private final List<FieldFinding> warnings;
    private final int totalRows;
    private final SubjectIdSummary subjectIds;

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
