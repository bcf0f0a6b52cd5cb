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

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Heuristic check that a subject identifier holds initials rather than a
 * placeholder or a real name.
 *
 * <p>Checks run in a fixed order and the first hit wins:</p>
 * <ol>
 *   <li>{@code unknown} or {@code unk}, in any case: {@link SubjectIdClassification#UNKNOWN}</li>
 *   <li>several whitespace-separated words, one of them longer than three
 *       characters: {@link SubjectIdClassification#FULL_NAME}</li>
 *   <li>neither one to four letters nor dotted initials such as {@code J.D.}:
 *       {@link SubjectIdClassification#INVALID_FORMAT}</li>
 * </ol>
 */
public class SubjectIdClassifier {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern BARE_INITIALS = Pattern.compile("[A-Za-z]{1,4}");
    private static final Pattern DOTTED_INITIALS = Pattern.compile("[A-Za-z](\\.[A-Za-z])*\\.?");

    private static final int MAX_INITIAL_LENGTH = 3;

    /**
     * Classifies a subject identifier.
     *
     * @param rawValue  the raw value, possibly {@code null} or padded
     * @param rowNumber the 1-based file row
     * @return the finding, or empty if the value is blank or valid initials
     */
    public Optional<SubjectIdFinding> classify(String rawValue, int rowNumber) {
        String value = FieldValues.trim(rawValue);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        return classification(value)
                .map(classification -> SubjectIdFinding.builder()
                        .rowNumber(rowNumber)
                        .value(value)
                        .classification(classification)
                        .build());
    }

    private Optional<SubjectIdClassification> classification(String value) {
        if (value.equalsIgnoreCase("unknown") || value.equalsIgnoreCase("unk")) {
            return Optional.of(SubjectIdClassification.UNKNOWN);
        }
        if (looksLikeFullName(value)) {
            return Optional.of(SubjectIdClassification.FULL_NAME);
        }
        if (!BARE_INITIALS.matcher(value).matches() && !DOTTED_INITIALS.matcher(value).matches()) {
            return Optional.of(SubjectIdClassification.INVALID_FORMAT);
        }
        return Optional.empty();
    }

    private boolean looksLikeFullName(String value) {
        String[] parts = WHITESPACE.split(value);
        return parts.length >= 2
                && Arrays.stream(parts).anyMatch(part -> part.length() > MAX_INITIAL_LENGTH);
    }
}
