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

package org.fireflyframework.wadeps.config;

import lombok.Data;
import org.fireflyframework.wadeps.validation.ValidationEngine;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the WADEPS validator.
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   wadeps:
 *     validator:
 *       template-path: templates/wadeps_uof_template.json
 *       input-directory: input_source
 *       output-directory: output
 *       subject-id-column: subject_id
 *       max-subject-id-examples: 5
 *       write-text-report: true
 *       write-dashboard: true
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.wadeps.validator")
public class WadepsValidatorProperties {

    /** Whether the validator beans are created. */
    private boolean enabled = true;

    /** JSON template holding the expected headers and validation rules. */
    private String templatePath = "templates/wadeps_uof_template.json";

    /** Folder scanned for {@code *.csv} submissions in batch runs. */
    private String inputDirectory = "input_source";

    /** Folder receiving JSON results, text reports and run summaries. */
    private String outputDirectory = "output";

    /** Column classified by the subject identifier heuristic. */
    private String subjectIdColumn = ValidationEngine.DEFAULT_SUBJECT_ID_COLUMN;

    /** Number of subject identifier findings kept as examples per file. */
    private int maxSubjectIdExamples = ValidationEngine.DEFAULT_MAX_SUBJECT_ID_EXAMPLES;

    /** Whether a plain-text error report is written next to the JSON results. */
    private boolean writeTextReport = true;

    /** Whether an HTML dashboard is written next to the JSON results. */
    private boolean writeDashboard = true;
}
