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

import org.fireflyframework.wadeps.schema.rules.FieldRule;

import java.util.Optional;

/**
 * Evaluates one field value against its {@link FieldRule}.
 *
 * <p>Values are trimmed first, no-break spaces included. A blank value never
 * produces a finding: required fields are a caller policy, not a rule concern.
 * Every finding produced here is an {@link FindingSeverity#ERROR}.</p>
 */
public class FieldRuleEvaluator {

    /**
     * Evaluates a single field.
     *
     * @param column    the column name
     * @param rawValue  the raw value, possibly {@code null} or padded
     * @param rule      the rule attached to the column
     * @param rowNumber the 1-based file row
     * @return the finding, or empty if the value conforms or is blank
     */
    public Optional<FieldFinding> evaluate(String column, String rawValue, FieldRule rule, int rowNumber) {
        String value = FieldValues.trim(rawValue);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        return rule.check(value)
                .map(message -> FieldFinding.error(rowNumber, column, value, message));
    }
}
