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
package org.fireflyframework.pipeline.core;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable execution policies of one {@link MiddlewarePipeline}.
 *
 * <pre>{@code
 * PipelineConfig config = PipelineConfig.builder()
 *         .enableErrorRecovery(false)
 *         .maxExecutionTime(Duration.ofSeconds(5))
 *         .build();
 * }</pre>
 */
@Data
@Builder(toBuilder = true)
public class PipelineConfig {

    /** Record the trail of executed and skipped middleware in each context. */
    @Builder.Default
    private final boolean enableContextTracking = true;

    /** Recover from failures with a recovery payload instead of failing {@code execute}. */
    @Builder.Default
    private final boolean enableErrorRecovery = true;

    /** Capture per-middleware timings and aggregate execution metrics. */
    @Builder.Default
    private final boolean enablePerformanceMonitoring = true;

    /** Include the failure message in recovery payloads instead of a generic one. */
    @Builder.Default
    private final boolean exposeErrorDetails = false;

    /** Budget for the processing stages of one request; {@code null} or zero disables it. */
    @Builder.Default
    private final Duration maxExecutionTime = Duration.ofSeconds(30);

    /** Age after which an in-flight context is reported as stale. */
    @Builder.Default
    private final Duration contextTimeout = Duration.ofSeconds(60);

    @Singular("metadataEntry")
    private final Map<String, Object> metadata;

    public static PipelineConfig defaults() {
        return PipelineConfig.builder().build();
    }

    public boolean hasExecutionBudget() {
        return maxExecutionTime != null && !maxExecutionTime.isZero() && !maxExecutionTime.isNegative();
    }

    /**
     * Returns the flags and budgets as a flat map for introspection.
     *
     * @return an insertion-ordered snapshot of this configuration
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("enable_context_tracking", enableContextTracking);
        snapshot.put("enable_error_recovery", enableErrorRecovery);
        snapshot.put("enable_performance_monitoring", enablePerformanceMonitoring);
        snapshot.put("max_execution_time", maxExecutionTime);
        snapshot.put("context_timeout", contextTimeout);
        return snapshot;
    }
}
