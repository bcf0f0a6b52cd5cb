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

/**
 * Trimming shared by the field evaluator and the subject identifier classifier.
 *
 * <p>Removes whitespace and Unicode space separators, no-break spaces included,
 * from both ends of a value.</p>
 */
final class FieldValues {

    private FieldValues() {}

    /**
     * Trims a raw field value.
     *
     * @param rawValue the value, possibly {@code null}
     * @return the trimmed value, empty for {@code null} or blank input
     */
    static String trim(String rawValue) {
        if (rawValue == null) {
            return "";
        }
        int start = 0;
        int end = rawValue.length();
        while (start < end && isSpace(rawValue.charAt(start))) {
            start++;
        }
        while (end > start && isSpace(rawValue.charAt(end - 1))) {
            end--;
        }
        return rawValue.substring(start, end);
    }

    private static boolean isSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }
}
