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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.wadeps.schema.Schema;
import org.fireflyframework.wadeps.schema.SchemaDefinitionException;
import org.fireflyframework.wadeps.schema.rules.DateRule;
import org.fireflyframework.wadeps.schema.rules.FieldRule;
import org.fireflyframework.wadeps.schema.rules.ListRule;
import org.fireflyframework.wadeps.schema.rules.NumberRule;
import org.fireflyframework.wadeps.schema.rules.PatternRule;
import org.fireflyframework.wadeps.schema.rules.TimeRule;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Reads and writes validation templates, the JSON form of a {@link Schema}.
 *
 * <p><b>Template format:</b></p>
 * <pre>{@code
 * {
 *   "headers": ["subject_id", "event_date", "force_used"],
 *   "validations": {
 *     "event_date": { "type": "date", "format": "MM/DD/YYYY" },
 *     "force_used": { "type": "list", "values": ["Yes", "No"] },
 *     "age":        { "type": "number", "min": 0, "max": 120 },
 *     "zip":        { "type": "pattern", "pattern": "^\\d{5}", "description": "Must be a 5 digit ZIP" }
 *   }
 * }
 * }</pre>
 *
 * <p>Any other top-level key is ignored. Every structural problem is reported as a
 * {@link SchemaDefinitionException} naming the offending column.</p>
 */
@Slf4j
public class ValidationTemplateLoader {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ValidationTemplateLoader(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemDefaultZone());
    }

    public ValidationTemplateLoader(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Loads a template file.
     *
     * @param path the template location
     * @return the schema described by the template
     * @throws SchemaDefinitionException if the file cannot be read or is malformed
     */
    public Schema load(Path path) {
        log.info("Reading validation template: {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new SchemaDefinitionException("Cannot read template " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads a template from a stream. The stream is not closed.
     *
     * @param in     the template JSON
     * @param source a name for the template used in messages
     * @return the schema described by the template
     * @throws SchemaDefinitionException if the stream cannot be read or is malformed
     */
    public Schema load(InputStream in, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new SchemaDefinitionException("Template " + source + " is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new SchemaDefinitionException("Template " + source + " must be a JSON object");
        }

        Schema.Builder builder = Schema.builder();
        for (String header : textArray(root.get("headers"), "headers")) {
            builder.column(header);
        }

        JsonNode validations = root.get("validations");
        if (validations != null && !validations.isNull()) {
            if (!validations.isObject()) {
                throw new SchemaDefinitionException("'validations' must be a JSON object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = validations.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.rule(field.getKey(), parseRule(field.getKey(), field.getValue()));
            }
        }

        Schema schema = builder.build();
        log.info("Loaded template {} with {} headers and {} validation rules",
                source, schema.getColumns().size(), schema.getRules().size());
        return schema;
    }

    /**
     * Writes a schema as a template, with header and rule counts and the
     * conversion time.
     *
     * @param schema the schema to write
     * @param source where the schema originally came from
     * @param target the file to write
     * @return {@code target}
     * @throws SchemaDefinitionException if the file cannot be written
     */
    public Path save(Schema schema, String source, Path target) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode headers = root.putArray("headers");
        schema.getColumns().forEach(headers::add);

        ObjectNode validations = root.putObject("validations");
        schema.getRules().forEach((column, rule) -> validations.set(column, toJson(rule)));

        root.put("totalHeaders", schema.getColumns().size());
        root.put("totalValidations", schema.getRules().size());
        root.put("source", source);
        root.put("convertedDate", LocalDateTime.now(clock).toString());

        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), root);
        } catch (IOException e) {
            throw new SchemaDefinitionException("Cannot write template " + target + ": " + e.getMessage(), e);
        }
        log.info("Template data saved to: {}", target);
        return target;
    }

    private FieldRule parseRule(String column, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new SchemaDefinitionException("Rule for column '" + column + "' must be a JSON object");
        }
        String type = optionalText(node, "type", column);
        if (type == null) {
            throw new SchemaDefinitionException("Rule for column '" + column + "' has no type");
        }
        switch (type) {
            case "list":
                List<String> values = textArray(node.get("values"), column + ".values");
                if (values.isEmpty()) {
                    throw new SchemaDefinitionException("List rule for column '" + column + "' has no values");
                }
                return new ListRule(values);
            case "date":
                return new DateRule(optionalText(node, "format", column));
            case "time":
                return new TimeRule(optionalText(node, "format", column));
            case "number":
                BigDecimal min = optionalNumber(node, "min", column);
                BigDecimal max = optionalNumber(node, "max", column);
                return forColumn(column, () -> new NumberRule(min, max));
            case "pattern":
                String pattern = optionalText(node, "pattern", column);
                if (pattern == null) {
                    throw new SchemaDefinitionException("Pattern rule for column '" + column + "' has no pattern");
                }
                String description = optionalText(node, "description", column);
                return forColumn(column, () -> new PatternRule(pattern, description));
            default:
                throw new SchemaDefinitionException("Unknown rule type '" + type + "' for column '" + column + "'");
        }
    }

    private static FieldRule forColumn(String column, Supplier<FieldRule> factory) {
        try {
            return factory.get();
        } catch (SchemaDefinitionException e) {
            throw new SchemaDefinitionException("Column '" + column + "': " + e.getMessage(), e);
        }
    }

    private ObjectNode toJson(FieldRule rule) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", rule.getType());
        if (rule instanceof ListRule listRule) {
            ArrayNode values = node.putArray("values");
            listRule.getAllowedValues().forEach(values::add);
        } else if (rule instanceof DateRule dateRule) {
            node.put("format", dateRule.getFormat());
        } else if (rule instanceof TimeRule timeRule) {
            node.put("format", timeRule.getFormat());
        } else if (rule instanceof NumberRule numberRule) {
            if (numberRule.getMin() != null) {
                node.put("min", numberRule.getMin());
            }
            if (numberRule.getMax() != null) {
                node.put("max", numberRule.getMax());
            }
        } else if (rule instanceof PatternRule patternRule) {
            node.put("pattern", patternRule.getRegex());
            if (patternRule.getDescription() != null) {
                node.put("description", patternRule.getDescription());
            }
        }
        return node;
    }

    private static List<String> textArray(JsonNode node, String name) {
        List<String> result = new ArrayList<>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (!node.isArray()) {
            throw new SchemaDefinitionException("'" + name + "' must be a JSON array");
        }
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new SchemaDefinitionException("'" + name + "' must only contain strings, found " + element);
            }
            result.add(element.asText());
        }
        return result;
    }

    private static String optionalText(JsonNode node, String field, String column) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new SchemaDefinitionException(
                    "'" + field + "' of rule for column '" + column + "' must be a string");
        }
        return value.asText();
    }

    private static BigDecimal optionalNumber(JsonNode node, String field, String column) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new SchemaDefinitionException(
                    "'" + field + "' of rule for column '" + column + "' must be a number");
        }
        if (value.isFloatingPointNumber() && !Double.isFinite(value.doubleValue())) {
            throw new SchemaDefinitionException(
                    "'" + field + "' of rule for column '" + column + "' must be a finite number, found " + value);
        }
        return value.decimalValue();
    }
}
