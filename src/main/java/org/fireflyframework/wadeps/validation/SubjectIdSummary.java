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

import java.util.List;

/**
 * Subject identifier findings of one run: a count per classification and the
 * first few findings as examples.
 */
@Data
@Builder
public class SubjectIdSummary {

    private final int unknownCount;
    private final int fullNameCount;
    private final int invalidFormatCount;
    private final List<SubjectIdFinding> examples;

    public int getTotalCount() {
        return unknownCount + fullNameCount + invalidFormatCount;
    }

    /**
     * Returns the number of findings of one classification.
     *
     * @param classification the classification
     * @return its count
     */
    public int countOf(SubjectIdClassification classification) {
        return switch (classification) {
            case UNKNOWN -> unknownCount;
            case FULL_NAME -> fullNameCount;
            case INVALID_FORMAT -> invalidFormatCount;
        };
    }
}
