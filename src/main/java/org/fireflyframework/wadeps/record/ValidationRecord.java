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

package org.fireflyframework.wadeps.record;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One data row of a submission: column name to raw value, in file order.
 *
 * <p>A row the reader could not split into fields is represented by
 * {@link #malformed(String)}; it carries no values, only the reason.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ValidationRecord {

    private final Map<String, String> values;

    /** Why the row could not be read, or {@code null} for a well-formed row. */
    private final String malformedReason;

    private ValidationRecord(Map<String, String> values, String malformedReason) {
        this.values = values;
        this.malformedReason = malformedReason;
    }

    public static ValidationRecord of(Map<String, String> values) {
        return new ValidationRecord(Collections.unmodifiableMap(new LinkedHashMap<>(values)), null);
    }

    public static ValidationRecord malformed(String reason) {
        return new ValidationRecord(Map.of(), reason);
    }

    public boolean isMalformed() {
        return malformedReason != null;
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public String get(String column) {
        return values.get(column);
    }
}
