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
import org.fireflyframework.wadeps.report.RunSummary;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a batch run over the input directory.
 */
@Data
@Builder
public class BatchValidationResult {

    private final List<FileValidationResult> results;

    /** Files that could not be read or written, by name. */
    private final List<String> skippedFiles;

    /** Run totals, or {@code null} when no file was found. */
    private final RunSummary summary;

    /** Written run summary, or {@code null} when no file was found. */
    private final Path summaryFile;

    public static BatchValidationResult empty() {
        return BatchValidationResult.builder()
                .results(List.of())
                .skippedFiles(List.of())
                .build();
    }
}
