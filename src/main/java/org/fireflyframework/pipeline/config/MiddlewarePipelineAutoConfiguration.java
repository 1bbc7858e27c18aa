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
package org.fireflyframework.pipeline.config;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.pipeline.controller.PipelineStatsController;
import org.fireflyframework.pipeline.core.MiddlewarePipeline;
import org.fireflyframework.pipeline.core.PipelineConfig;
import org.fireflyframework.pipeline.core.RecoveryPayload;
import org.fireflyframework.pipeline.middleware.MiddlewareRegistration;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Auto-configuration for the middleware pipeline.
 *
 * <p>This configuration automatically sets up:</p>
 * <ul>
 *   <li>a {@link PipelineConfig} bound from {@code firefly.pipeline.*}</li>
 *   <li>an {@code Object}-typed {@link MiddlewarePipeline} with every discovered
 *       {@code MiddlewareRegistration<Object, Object>} bean registered in bean order</li>
 *   <li>execution event publishing through the {@link ApplicationEventPublisher}</li>
 *   <li>the {@link PipelineStatsController}</li>
 * </ul>
 *
 * <p>The pipeline bean is shut down when the application context closes.</p>
 *
 * <p>The configuration is activated when {@code firefly.pipeline.enabled} is true or
 * not set.</p>
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(PipelineProperties.class)
@ConditionalOnProperty(
    prefix = "firefly.pipeline",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class MiddlewarePipelineAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public PipelineConfig pipelineConfig(PipelineProperties properties) {
        return properties.toPipelineConfig();
    }

    /**
     * Creates the pipeline bean. Recovered failures are answered with
     * {@link RecoveryPayload#toMap()}.
     *
     * @param config         the pipeline configuration
     * @param registrations  the middleware registrations, or {@code null} if none are declared
     * @param eventPublisher the event publisher, or {@code null} if unavailable
     * @return the configured pipeline
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(MiddlewarePipeline.class)
    public MiddlewarePipeline<Object, Object> middlewarePipeline(
            PipelineConfig config,
            @Autowired(required = false) List<MiddlewareRegistration<Object, Object>> registrations,
            @Autowired(required = false) ApplicationEventPublisher eventPublisher) {
        MiddlewarePipeline<Object, Object> pipeline =
                new MiddlewarePipeline<>(config, RecoveryPayload::toMap, eventPublisher);
        List<MiddlewareRegistration<Object, Object>> activeRegistrations =
                registrations != null ? registrations : List.of();
        activeRegistrations.forEach(pipeline::register);
        log.info("Configuring Middleware Pipeline with {} middleware (recovery={}, maxExecutionTime={})",
                activeRegistrations.size(), config.isEnableErrorRecovery(), config.getMaxExecutionTime());
        return pipeline;
    }

    @Bean
    @ConditionalOnMissingBean
    public PipelineStatsController pipelineStatsController(MiddlewarePipeline<?, ?> middlewarePipeline) {
        return new PipelineStatsController(middlewarePipeline);
    }
}
