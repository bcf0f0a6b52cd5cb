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

import lombok.Builder;
import lombok.Data;
import org.fireflyframework.wadeps.report.ValidationSummary;
import org.fireflyframework.wadeps.validation.ValidationReport;

import java.nio.file.Path;

/**
 * Outcome of validating one submission file, with the locations of the files
 * written for it.
 */
@Data
@Builder
public class FileValidationResult {

    private final String fileName;
    private final ValidationReport report;
    private final ValidationSummary summary;
    private final Path jsonReport;

    /** Plain-text error report, or {@code null} when text reports are disabled. */
    private final Path textReport;

    /** HTML dashboard, or {@code null} when dashboards are disabled. */
    private final Path dashboard;
}
