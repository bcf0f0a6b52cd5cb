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

import lombok.Builder;
import lombok.Data;

import java.util.Set;

/**
 * Set comparison between the expected columns of a {@link Schema} and the
 * header row of a submission.
 *
 * <p>Headers are valid when nothing is missing; extra columns alone do not
 * fail the comparison.</p>
 */
@Data
@Builder
public class HeaderComparison {

    private final Set<String> matching;
    private final Set<String> missing;
    private final Set<String> extra;

    public boolean isValid() {
        return missing.isEmpty();
    }
}
