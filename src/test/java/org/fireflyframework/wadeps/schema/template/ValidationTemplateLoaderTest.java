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

package org.fireflyframework.wadeps.schema.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.wadeps.schema.Schema;
import org.fireflyframework.wadeps.schema.SchemaDefinitionException;
import org.fireflyframework.wadeps.schema.rules.DateRule;
import org.fireflyframework.wadeps.schema.rules.ListRule;
import org.fireflyframework.wadeps.schema.rules.NumberRule;
import org.fireflyframework.wadeps.schema.rules.PatternRule;
import org.fireflyframework.wadeps.schema.rules.TimeRule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ValidationTemplateLoader}.
 */
class ValidationTemplateLoaderTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-03-02T10:15:30Z"), ZoneOffset.UTC);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ValidationTemplateLoader loader = new ValidationTemplateLoader(objectMapper, FIXED_CLOCK);

    @TempDir
    Path tempDir;

    @Test
    void load_shouldReadEveryRuleType() throws Exception {
        // Given
        Schema schema;
        try (InputStream in = getClass().getResourceAsStream("/templates/wadeps_test_template.json")) {
            // When
            schema = loader.load(in, "wadeps_test_template.json");
        }

        // Then
        assertThat(schema.getColumns()).containsExactly(
                "subject_id", "event_date", "event_time", "force_used", "officer_age", "zip_code");
        assertThat(schema.getRules()).hasSize(5);
        assertThat(schema.getRules().get("event_date")).isEqualTo(new DateRule("MM/DD/YYYY"));
        assertThat(schema.getRules().get("event_time")).isEqualTo(new TimeRule("HH:MM"));
        assertThat(schema.getRules().get("force_used")).isEqualTo(new ListRule(List.of("Yes", "No")));

        NumberRule age = (NumberRule) schema.getRules().get("officer_age");
        assertThat(age.getMin()).isEqualByComparingTo(new BigDecimal("18"));
        assertThat(age.getMax()).isEqualByComparingTo(new BigDecimal("80"));

        PatternRule zip = (PatternRule) schema.getRules().get("zip_code");
        assertThat(zip.getRegex()).isEqualTo("\\d{5}");
        assertThat(zip.getDescription()).isEqualTo("Must be a 5 digit ZIP");
    }

    @Test
    void load_shouldAcceptTemplateWithoutValidations() {
        Schema schema = load("{\"headers\": [\"a\", \"b\"]}");

        assertThat(schema.getColumns()).containsExactly("a", "b");
        assertThat(schema.getRules()).isEmpty();
    }

    @Test
    void load_shouldRejectUnknownRuleType() {
        assertThatThrownBy(() -> load("{\"headers\": [\"a\"], \"validations\": {\"a\": {\"type\": \"email\"}}}"))
                .isInstanceOf(SchemaDefinitionException.class)
                .hasMessage("Unknown rule type 'email' for column 'a'");
    }

    @Test
    void load_shouldRejectListWithoutValues() {
        assertThatThrownBy(() -> load("{\"validations\": {\"a\": {\"type\": \"list\", \"values\": []}}}"))
                .isInstanceOf(SchemaDefinitionException.class)
                .hasMessageContaining("has no values");
    }

    @Test
    void load_shouldPrefixColumnToRuleConstructionErrors() {
        assertThatThrownBy(() -> load("{\"validations\": {\"age\": {\"type\": \"number\", \"min\": 9, \"max\": 1}}}"))
                .isInstanceOf(SchemaDefinitionException.class)
                .hasMessageStartingWith("Column 'age': ");

        assertThatThrownBy(() -> load("{\"validations\": {\"zip\": {\"type\": \"pattern\", \"pattern\": \"(\"}}}"))
                .isInstanceOf(SchemaDefinitionException.class)
                .hasMessageStartingWith("Column 'zip': Invalid pattern");
    }

    @Test
    void load_shouldRejectNonNumericBound() {
        assertThatThrownBy(() -> load("{\"validations\": {\"age\": {\"type\": \"number\", \"min\": \"ten\"}}}"))
                .isInstanceOf(SchemaDefinitionException.class)
                .hasMessageContaining("must be a number");
    }

    @Test
    void load_shouldRejectBoundOutsideDoubleRange() {
        assertThatThrownBy(() -> load("{\"validations\": {\"age\": {\"type\": \"number\", \"max\": 1e400}}}"))
                .isInstanceOf(SchemaDefinitionException.class)
                .hasMessageContaining("'max' of rule for column 'age' must be a finite number");
    }

    @Test
    void load_shouldRejectInvalidJson() {
        assertThatThrownBy(() -> load("{not json"))
                .isInstanceOf(SchemaDefinitionException.class)
                .hasMessageContaining("is not valid JSON");
        assertThatThrownBy(() -> load("[]"))
                .isInstanceOf(SchemaDefinitionException.class)
                .hasMessageContaining("must be a JSON object");
    }

    @Test
    void load_shouldReportMissingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.json")))
                .isInstanceOf(SchemaDefinitionException.class)
                .hasMessageStartingWith("Cannot read template");
    }

    @Test
    void save_shouldWriteTemplateThatLoadsBack() throws Exception {
        // Given
        Schema schema = Schema.builder()
                .column("subject_id")
                .column("event_date", new DateRule())
                .column("force_used", new ListRule(List.of("Yes", "No")))
                .column("officer_age", new NumberRule(new BigDecimal("18"), null))
                .column("zip_code", new PatternRule("\\d{5}"))
                .build();
        Path target = tempDir.resolve("out/template.json");

        // When
        loader.save(schema, "WADEPS UOF Template.xlsx", target);

        // Then
        JsonNode root = objectMapper.readTree(target.toFile());
        assertThat(root.get("totalHeaders").asInt()).isEqualTo(5);
        assertThat(root.get("totalValidations").asInt()).isEqualTo(4);
        assertThat(root.get("source").asText()).isEqualTo("WADEPS UOF Template.xlsx");
        assertThat(root.get("convertedDate").asText()).isEqualTo("2026-03-02T10:15:30");
        assertThat(root.path("validations").path("officer_age").has("max")).isFalse();
        assertThat(root.path("validations").path("zip_code").has("description")).isFalse();

        assertThat(loader.load(target)).isEqualTo(schema);
    }

    private Schema load(String json) {
        return loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "inline");
    }
}
