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

package org.fireflyframework.wadeps.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Compares expected column names against the columns actually present.
 *
 * <p>Both sides are treated as sets. Result sets keep first-seen order:
 * {@code matching} and {@code missing} follow the expected order,
 * {@code extra} follows the actual order.</p>
 */
public final class HeaderComparator {

    private HeaderComparator() {}

    /**
     * Compares two column collections.
     *
     * @param expected the expected column names
     * @param actual   the column names found in the data
     * @return the comparison, never {@code null}
     */
    public static HeaderComparison compare(Collection<String> expected, Collection<String> actual) {
        Set<String> expectedSet = new LinkedHashSet<>(expected);
        Set<String> actualSet = new LinkedHashSet<>(actual);

        Set<String> matching = new LinkedHashSet<>(expectedSet);
        matching.retainAll(actualSet);

        Set<String> missing = new LinkedHashSet<>(expectedSet);
        missing.removeAll(actualSet);

        Set<String> extra = new LinkedHashSet<>(actualSet);
        extra.removeAll(expectedSet);

        return HeaderComparison.builder()
                .matching(Collections.unmodifiableSet(matching))
                .missing(Collections.unmodifiableSet(missing))
                .extra(Collections.unmodifiableSet(extra))
                .build();
    }
}
