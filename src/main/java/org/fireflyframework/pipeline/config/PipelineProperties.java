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

import lombok.Data;
import org.fireflyframework.pipeline.core.PipelineConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bound settings for the auto-configured {@link org.fireflyframework.pipeline.core.MiddlewarePipeline}.
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   pipeline:
 *     enabled: true
 *     error-recovery: false
 *     max-execution-time: 5s
 *     context-timeout: 30s
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.pipeline")
public class PipelineProperties {

    private boolean enabled = true;
    private boolean contextTracking = true;
    private boolean errorRecovery = true;
    private boolean performanceMonitoring = true;
    private boolean exposeErrorDetails = false;

    /** Zero disables the budget. */
    private Duration maxExecutionTime = Duration.ofSeconds(30);

    private Duration contextTimeout = Duration.ofSeconds(60);

    private Map<String, Object> metadata = new LinkedHashMap<>();

    public PipelineConfig toPipelineConfig() {
        return PipelineConfig.builder()
                .enableContextTracking(contextTracking)
                .enableErrorRecovery(errorRecovery)
                .enablePerformanceMonitoring(performanceMonitoring)
                .exposeErrorDetails(exposeErrorDetails)
                .maxExecutionTime(maxExecutionTime)
                .contextTimeout(contextTimeout)
                .metadata(metadata)
                .build();
    }
}
