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

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rule that requires a zero-padded {@code MM/DD/YYYY} date.
 *
 * <p>Only the shape and the month/day ranges are checked. Month lengths are not,
 * so {@code 02/30/2024} is accepted.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DateRule implements FieldRule {

    public static final String DEFAULT_FORMAT = "MM/DD/YYYY";

    private static final Pattern DATE = Pattern.compile("(0[1-9]|1[0-2])/(0[1-9]|[12][0-9]|3[01])/\\d{4}");

    /** Format text shown in the failure message. */
    private final String format;

    public DateRule() {
        this(DEFAULT_FORMAT);
    }

    public DateRule(String format) {
        this.format = format != null ? format : DEFAULT_FORMAT;
    }

    @Override
    public Optional<String> check(String value) {
        if (DATE.matcher(value).matches()) {
            return Optional.empty();
        }
        return Optional.of("Invalid date format. Expected " + format);
    }

    @Override
    public String getType() {
        return "date";
    }
}
