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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.fireflyframework.wadeps.schema.rules.FieldRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable description of the expected columns of a submission and the
 * {@link FieldRule} attached to each validated column.
 *
 * <p>Column order is kept for display only. Rules may name columns that are not
 * in {@link #getColumns()}; such columns are validated whenever they appear.</p>
 *
 * <p>A schema is built once and shared read-only across validation runs:</p>
 * <pre>{@code
 * Schema schema = Schema.builder()
 *         .column("subject_id")
 *         .column("event_date", new DateRule())
 *         .build();
 * }</pre>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Schema {

    private final List<String> columns;
    private final Map<String, FieldRule> rules;

    private Schema(List<String> columns, Map<String, FieldRule> rules) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    /**
     * Creates a schema from an ordered column list and a rule mapping.
     *
     * @param columns the expected column names, without duplicates
     * @param rules   rules keyed by column name
     * @return the schema
     * @throws SchemaDefinitionException if a column is blank or duplicated, or a rule is missing
     */
    public static Schema of(List<String> columns, Map<String, ? extends FieldRule> rules) {
        Builder builder = builder();
        columns.forEach(builder::column);
        rules.forEach(builder::rule);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<FieldRule> ruleFor(String column) {
        return Optional.ofNullable(rules.get(column));
    }

    /**
     * Fluent builder for {@link Schema}. Validation happens as columns and rules
     * are added, so a builder never produces an inconsistent schema.
     */
    public static final class Builder {

        private final Set<String> columns = new LinkedHashSet<>();
        private final Map<String, FieldRule> rules = new LinkedHashMap<>();

        private Builder() {}

        public Builder column(String name) {
            requireName(name);
            if (!columns.add(name)) {
                throw new SchemaDefinitionException("Duplicate column '" + name + "'");
            }
            return this;
        }

        public Builder column(String name, FieldRule rule) {
            return column(name).rule(name, rule);
        }

        public Builder rule(String column, FieldRule rule) {
            requireName(column);
            if (rule == null) {
                throw new SchemaDefinitionException("Rule for column '" + column + "' must not be null");
            }
            if (rules.putIfAbsent(column, rule) != null) {
                throw new SchemaDefinitionException("Duplicate rule for column '" + column + "'");
            }
            return this;
        }

        public Schema build() {
            return new Schema(new ArrayList<>(columns), rules);
        }

        private static void requireName(String name) {
            if (name == null || name.isEmpty()) {
                throw new SchemaDefinitionException("Column name must not be empty");
            }
        }
    }
}
