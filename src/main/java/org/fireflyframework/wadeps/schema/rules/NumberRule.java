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
import org.fireflyframework.wadeps.schema.SchemaDefinitionException;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rule that requires a floating-point number, optionally bounded inclusively.
 *
 * <p>Bounds keep the representation they were declared with, so a bound of
 * {@code 10} is reported as {@code "Value must be >= 10"}. A value that is not a
 * number is reported as such and its bounds are not checked. When both bounds
 * could fail, only the minimum is reported.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class NumberRule implements FieldRule {

    private static final String DIGITS = "\\d+(?:_\\d+)*";

    private static final Pattern DECIMAL = Pattern.compile(
            "[+-]?(?:" + DIGITS + "(?:\\.(?:" + DIGITS + ")?)?|\\." + DIGITS + ")(?:[eE][+-]?" + DIGITS + ")?");

    private static final Set<String> SPECIAL_VALUES =
            Set.of("nan", "inf", "infinity");

    /** Inclusive lower bound, or {@code null}. */
    private final BigDecimal min;

    /** Inclusive upper bound, or {@code null}. */
    private final BigDecimal max;

    /**
     * Creates a number rule.
     *
     * @param min the inclusive lower bound, or {@code null}
     * @param max the inclusive upper bound, or {@code null}
     * @throws SchemaDefinitionException if both bounds are set and {@code min > max}
     */
    public NumberRule(BigDecimal min, BigDecimal max) {
        if (min != null && max != null && min.compareTo(max) > 0) {
            throw new SchemaDefinitionException(
                    "Number rule minimum " + min.toPlainString() + " exceeds maximum " + max.toPlainString());
        }
        this.min = min;
        this.max = max;
    }

    public static NumberRule unbounded() {
        return new NumberRule(null, null);
    }

    @Override
    public Optional<String> check(String value) {
        OptionalDouble parsed = parse(value);
        if (parsed.isEmpty()) {
            return Optional.of("Must be a number");
        }
        double number = parsed.getAsDouble();
        if (min != null && number < min.doubleValue()) {
            return Optional.of("Value must be >= " + min.toPlainString());
        }
        if (max != null && number > max.doubleValue()) {
            return Optional.of("Value must be <= " + max.toPlainString());
        }
        return Optional.empty();
    }

    /**
     * Parses a decimal literal, with optional sign and exponent, or one of the
     * special values {@code nan}, {@code inf} and {@code infinity} in any case.
     * Single underscores may group digits, as in {@code 1_000}.
     * NaN never violates a bound.
     */
    static OptionalDouble parse(String value) {
        if (DECIMAL.matcher(value).matches()) {
            return OptionalDouble.of(Double.parseDouble(value.replace("_", "")));
        }
        String unsigned = value.startsWith("+") || value.startsWith("-") ? value.substring(1) : value;
        String special = unsigned.toLowerCase(Locale.ROOT);
        if (!SPECIAL_VALUES.contains(special)) {
            return OptionalDouble.empty();
        }
        if (special.equals("nan")) {
            return OptionalDouble.of(Double.NaN);
        }
        return OptionalDouble.of(value.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
    }

    @Override
    public String getType() {
        return "number";
    }
}
