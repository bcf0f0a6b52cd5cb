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

import org.fireflyframework.wadeps.schema.rules.DateRule;
import org.fireflyframework.wadeps.schema.rules.ListRule;
import org.fireflyframework.wadeps.schema.rules.TimeRule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Schema}.
 */
class SchemaTest {

    @Test
    void builder_shouldKeepColumnOrderAndRules() {
        // Given & When
        Schema schema = Schema.builder()
                .column("subject_id")
                .column("event_date", new DateRule())
                .column("event_time", new TimeRule())
                .build();

        // Then
        assertThat(schema.getColumns()).containsExactly("subject_id", "event_date", "event_time");
        assertThat(schema.ruleFor("event_date")).containsInstanceOf(DateRule.class);
        assertThat(schema.ruleFor("subject_id")).isEmpty();
    }

    @Test
    void builder_shouldAllowRulesForColumnsOutsideHeaderList() {
        Schema schema = Schema.builder()
                .column("subject_id")
                .rule("optional_flag", new ListRule(List.of("Yes", "No")))
                .build();

        assertThat(schema.getColumns()).containsExactly("subject_id");
        assertThat(schema.getRules()).containsKey("optional_flag");
    }

    @Test
    void builder_shouldRejectDuplicateColumn() {
        assertThatThrownBy(() -> Schema.builder().column("a").column("a"))
                .isInstanceOf(SchemaDefinitionException.class)
                .hasMessage("Duplicate column 'a'");
    }

    @Test
    void builder_shouldRejectEmptyColumnName() {
        assertThatThrownBy(() -> Schema.builder().column(""))
                .isInstanceOf(SchemaDefinitionException.class);
    }

    @Test
    void builder_shouldRejectNullRule() {
        assertThatThrownBy(() -> Schema.builder().rule("a", null))
                .isInstanceOf(SchemaDefinitionException.class)
                .hasMessageContaining("must not be null");
    }

    @Test
    void of_shouldBuildEquivalentSchema() {
        Schema viaOf = Schema.of(List.of("a", "b"), Map.of("b", new TimeRule()));
        Schema viaBuilder = Schema.builder().column("a").column("b", new TimeRule()).build();

        assertThat(viaOf).isEqualTo(viaBuilder);
    }

    @Test
    void getters_shouldExposeUnmodifiableViews() {
        Schema schema = Schema.builder().column("a").build();

        assertThatThrownBy(() -> schema.getColumns().add("b"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> schema.getRules().put("a", new TimeRule()))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
