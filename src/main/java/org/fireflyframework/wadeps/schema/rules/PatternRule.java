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

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.fireflyframework.wadeps.schema.SchemaDefinitionException;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Rule that validates an upper-cased field against a regular expression.
 *
 * <p>The expression is matched from the start of the value only: a value with
 * trailing characters after a match still passes unless the expression itself
 * ends with {@code $}.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class PatternRule implements FieldRule {

    private final String regex;

    /** Failure message override, or {@code null}. */
    private final String description;

    @Getter(AccessLevel.NONE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private final Pattern pattern;

    /**
     * Creates a pattern rule.
     *
     * @param regex       the regular expression
     * @param description the failure message, or {@code null} for a generated one
     * @throws SchemaDefinitionException if {@code regex} does not compile
     */
    public PatternRule(String regex, String description) {
        if (regex == null) {
            throw new SchemaDefinitionException("Pattern rule requires a pattern");
        }
        try {
            this.pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new SchemaDefinitionException("Invalid pattern '" + regex + "': " + e.getDescription(), e);
        }
        this.regex = regex;
        this.description = description;
    }

    public PatternRule(String regex) {
        this(regex, null);
    }

    @Override
    public Optional<String> check(String value) {
        if (pattern.matcher(value.toUpperCase(Locale.ROOT)).lookingAt()) {
            return Optional.empty();
        }
        return Optional.of(description != null ? description : "Must match pattern: " + regex);
    }

    @Override
    public String getType() {
        return "pattern";
    }
}
