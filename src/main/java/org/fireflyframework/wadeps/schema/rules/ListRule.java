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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rule that restricts a field to a fixed set of dropdown values.
 *
 * <p>Membership is case-sensitive, except for a plain {@code Yes}/{@code No}
 * list, which accepts any casing.</p>
 */
@ToString
@EqualsAndHashCode
public final class ListRule implements FieldRule {

    static final int MAX_LISTED_VALUES = 5;

    @Getter
    private final Set<String> allowedValues;

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final Set<String> lowerCaseValues;

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    @Getter
    private final boolean yesNo;

    /**
     * Creates a list rule. Iteration order of {@code allowedValues} is kept for
     * the failure message; duplicates collapse.
     *
     * @param allowedValues the accepted values
     */
    public ListRule(Collection<String> allowedValues) {
        this.allowedValues = Collections.unmodifiableSet(new LinkedHashSet<>(allowedValues));
        this.yesNo = this.allowedValues.size() == 2
                && this.allowedValues.contains("Yes")
                && this.allowedValues.contains("No");
        this.lowerCaseValues = this.allowedValues.stream()
                .map(v -> v.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public Optional<String> check(String value) {
        if (allowedValues.contains(value)) {
            return Optional.empty();
        }
        if (yesNo && lowerCaseValues.contains(value.toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        return Optional.of(describe());
    }

    private String describe() {
        String listed = allowedValues.stream()
                .limit(MAX_LISTED_VALUES)
                .collect(Collectors.joining(", "));
        return "Must be one of: " + listed + (allowedValues.size() > MAX_LISTED_VALUES ? "..." : "");
    }

    @Override
    public String getType() {
        return "list";
    }
}
