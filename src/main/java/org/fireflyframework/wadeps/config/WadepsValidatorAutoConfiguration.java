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

package org.fireflyframework.wadeps.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.wadeps.record.CsvRecordReader;
import org.fireflyframework.wadeps.report.ValidationDashboardRenderer;
import org.fireflyframework.wadeps.report.ValidationReportJsonWriter;
import org.fireflyframework.wadeps.report.ValidationReportTextFormatter;
import org.fireflyframework.wadeps.schema.template.ValidationTemplateLoader;
import org.fireflyframework.wadeps.service.WadepsValidationService;
import org.fireflyframework.wadeps.validation.ValidationEngine;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the WADEPS validator.
 *
 * <p>This configuration automatically sets up:</p>
 * <ul>
 *   <li>{@link ValidationTemplateLoader} and {@link CsvRecordReader} for the template and submission files</li>
 *   <li>{@link ValidationEngine} configured with the subject identifier column and example limit</li>
 *   <li>{@link ValidationReportJsonWriter}, {@link ValidationReportTextFormatter} and
 *       {@link ValidationDashboardRenderer} for results</li>
 *   <li>{@link WadepsValidationService} tying them together, publishing completion events when an
 *       {@link ApplicationEventPublisher} is available</li>
 * </ul>
 *
 * <p>The configuration is activated when:</p>
 * <ul>
 *   <li>The property {@code firefly.wadeps.validator.enabled} is true (default)</li>
 *   <li>Or the property is not set (enabled by default)</li>
 * </ul>
 *
 * <p>Every bean backs off when the application defines its own.</p>
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(WadepsValidatorProperties.class)
@ConditionalOnProperty(
    prefix = "firefly.wadeps.validator",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class WadepsValidatorAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ValidationTemplateLoader validationTemplateLoader(ObjectProvider<ObjectMapper> objectMapper) {
        return new ValidationTemplateLoader(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public CsvRecordReader csvRecordReader() {
        return new CsvRecordReader();
    }

    /**
     * Creates the validation engine bean.
     *
     * @param properties the validator properties
     * @return the engine for the configured subject identifier column
     */
    @Bean
    @ConditionalOnMissingBean
    public ValidationEngine validationEngine(WadepsValidatorProperties properties) {
        log.info("Configuring WADEPS validation engine (subject ID column '{}', {} examples kept)",
                properties.getSubjectIdColumn(), properties.getMaxSubjectIdExamples());
        return new ValidationEngine(properties.getSubjectIdColumn(), properties.getMaxSubjectIdExamples());
    }

    @Bean
    @ConditionalOnMissingBean
    public ValidationReportJsonWriter validationReportJsonWriter(ObjectProvider<ObjectMapper> objectMapper) {
        return new ValidationReportJsonWriter(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ValidationReportTextFormatter validationReportTextFormatter() {
        return new ValidationReportTextFormatter();
    }

    @Bean
    @ConditionalOnMissingBean
    public ValidationDashboardRenderer validationDashboardRenderer() {
        return new ValidationDashboardRenderer();
    }

    /**
     * Creates the validation service bean. The template is read on first use, not
     * at startup.
     */
    @Bean
    @ConditionalOnMissingBean
    public WadepsValidationService wadepsValidationService(
            WadepsValidatorProperties properties,
            ValidationTemplateLoader templateLoader,
            CsvRecordReader recordReader,
            ValidationEngine engine,
            ValidationReportJsonWriter jsonWriter,
            ValidationReportTextFormatter textFormatter,
            ValidationDashboardRenderer dashboardRenderer,
            ObjectProvider<ApplicationEventPublisher> eventPublisher) {
        log.info("Configuring WADEPS validation service with template {}", properties.getTemplatePath());
        return new WadepsValidationService(properties, templateLoader, recordReader, engine,
                jsonWriter, textFormatter, dashboardRenderer, eventPublisher.getIfAvailable());
    }
}
