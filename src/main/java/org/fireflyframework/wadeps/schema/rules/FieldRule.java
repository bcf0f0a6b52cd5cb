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

package org.fireflyframework.wadeps.schema.rules;

import java.util.Optional;

/**
 * Validation strategy attached to a single column of a
 * {@link org.fireflyframework.wadeps.schema.Schema}.
 *
 * <p>The set of rule kinds is closed: every rule is one of {@link ListRule},
 * {@link DateRule}, {@link TimeRule}, {@link NumberRule} or {@link PatternRule}.
 * Rules are immutable and may be shared across validation runs.</p>
 *
 * <p>Implementations only ever see a trimmed, non-empty value. Blank handling
 * belongs to the {@link org.fireflyframework.wadeps.validation.FieldRuleEvaluator}.</p>
 */
public sealed interface FieldRule permits ListRule, DateRule, TimeRule, NumberRule, PatternRule {

    /**
     * Checks the given value against this rule.
     *
     * @param value the trimmed, non-empty field value
     * @return the violation message, or empty if the value conforms
     */
    Optional<String> check(String value);

    /**
     * Returns the template type tag of this rule ({@code list}, {@code date},
     * {@code time}, {@code number} or {@code pattern}).
     *
     * @return the rule type tag
     */
    String getType();
}
