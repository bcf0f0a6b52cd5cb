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

import lombok.Getter;

/**
 * Categories of subject identifiers that are not acceptable initials.
 */
@Getter
public enum SubjectIdClassification {

    UNKNOWN("unknown", "Unknown values", "Subject ID should not be \"unknown\""),
    FULL_NAME("name", "Full names", "Subject ID appears to be a full name. Use initials instead"),
    INVALID_FORMAT("invalid", "Invalid format", "Subject ID must be initials (e.g., \"JD\", \"J.D.\", \"J.D.S\")");

    /** Short type code used in exported reports. */
    private final String code;

    /** Heading used when counts are listed per classification. */
    private final String label;
    private final String message;

    SubjectIdClassification(String code, String label, String message) {
        this.code = code;
        this.label = label;
        this.message = message;
    }
}
