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

import lombok.Builder;
import lombok.Data;
import org.fireflyframework.wadeps.validation.FieldFinding;
import org.fireflyframework.wadeps.validation.SubjectIdFinding;

import java.util.List;

/**
 * Everything the dashboard template displays for one validated file. Lists are
 * already capped and header names already shortened.
 */
@Data
@Builder
public class ValidationDashboard {

    private final String title;

    /** {@code File: <name> | Generated: <yyyy-MM-dd HH:mm:ss>} */
    private final String subtitle;

    private final String statusLabel;

    /** CSS class of the status badge: {@code passed}, {@code warning} or {@code failed}. */
    private final String statusStyle;

    private final ValidationSummary summary;

    private final int matchingHeaderCount;
    private final int missingHeaderCount;
    private final int extraHeaderCount;
    private final List<String> missingHeaders;
    private final int moreMissingHeaders;
    private final List<String> extraHeaders;
    private final int moreExtraHeaders;

    private final List<DashboardCount> errorCategories;
    private final List<FieldFinding> errors;
    private final int moreErrors;
    private final List<FieldFinding> warnings;

    private final List<DashboardCount> subjectIdCounts;
    private final List<SubjectIdFinding> subjectIdExamples;

    private final List<String> recommendations;
    private final boolean readyForSubmission;
}
