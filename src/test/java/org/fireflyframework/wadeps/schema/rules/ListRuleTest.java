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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ListRule}.
 */
class ListRuleTest {

    @Test
    void check_shouldAcceptExactMember() {
        ListRule rule = new ListRule(List.of("Patrol", "Traffic", "Other"));

        assertThat(rule.check("Traffic")).isEmpty();
    }

    @Test
    void check_shouldBeCaseSensitiveForOrdinaryLists() {
        ListRule rule = new ListRule(List.of("Patrol", "Traffic"));

        assertThat(rule.check("patrol")).contains("Must be one of: Patrol, Traffic");
    }

    @Test
    void check_shouldAcceptAnyCasingForYesNoList() {
        // Given
        ListRule rule = new ListRule(List.of("Yes", "No"));

        // When & Then
        assertThat(rule.isYesNo()).isTrue();
        assertThat(rule.check("yes")).isEmpty();
        assertThat(rule.check("NO")).isEmpty();
        assertThat(rule.check("Maybe")).contains("Must be one of: Yes, No");
    }

    @Test
    void check_shouldNotTreatListWithExtraValuesAsYesNo() {
        ListRule rule = new ListRule(List.of("Yes", "No", "Unknown"));

        assertThat(rule.isYesNo()).isFalse();
        assertThat(rule.check("yes")).isPresent();
    }

    @Test
    void check_shouldListOnlyFirstFiveValuesWithEllipsis() {
        // Given
        ListRule rule = new ListRule(List.of("A", "B", "C", "D", "E", "F", "G"));

        // When & Then
        assertThat(rule.check("Z")).contains("Must be one of: A, B, C, D, E...");
    }

    @Test
    void check_shouldOmitEllipsisForExactlyFiveValues() {
        ListRule rule = new ListRule(List.of("A", "B", "C", "D", "E"));

        assertThat(rule.check("Z")).contains("Must be one of: A, B, C, D, E");
    }

    @Test
    void constructor_shouldKeepOrderAndCollapseDuplicates() {
        ListRule rule = new ListRule(List.of("B", "A", "B"));

        assertThat(rule.getAllowedValues()).containsExactly("B", "A");
        assertThat(rule.getType()).isEqualTo("list");
    }
}
