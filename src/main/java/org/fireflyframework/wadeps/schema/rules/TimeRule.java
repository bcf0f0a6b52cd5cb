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
 * Rule that requires a two-digit {@code HH:MM} time. Hour and minute ranges
 * are not checked.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class TimeRule implements FieldRule {

    public static final String DEFAULT_FORMAT = "HH:MM";

    private static final Pattern TIME = Pattern.compile("\\d{2}:\\d{2}");

    private final String format;

    public TimeRule() {
        this(DEFAULT_FORMAT);
    }

    public TimeRule(String format) {
        this.format = format != null ? format : DEFAULT_FORMAT;
    }

    @Override
    public Optional<String> check(String value) {
        if (TIME.matcher(value).matches()) {
            return Optional.empty();
        }
        return Optional.of("Invalid time format. Expected " + format);
    }

    @Override
    public String getType() {
        return "time";
    }
}
