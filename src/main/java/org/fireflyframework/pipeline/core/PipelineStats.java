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

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Read-only snapshot returned by {@link MiddlewarePipeline#getStats()}.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * {
 *   "activeContexts": 3,
 *   "staleContexts": 0,
 *   "stageCounts": {"PRE_PROCESSING": 1, "REQUEST_HANDLING": 2, "POST_PROCESSING": 0,
 *                   "ERROR_HANDLING": 1, "CLEANUP": 1},
 *   "config": {"enable_error_recovery": true, ...},
 *   "performance": {...}
 * }
 * }</pre>
 */
@Data
@Builder
@Schema(description = "Statistics of the middleware pipeline")
public class PipelineStats {

    @Schema(description = "Number of requests currently in flight", example = "3")
    private final int activeContexts;

    @Schema(description = "In-flight requests older than the configured context timeout", example = "0")
    private final int staleContexts;

    @Schema(description = "Number of registered middleware per stage")
    private final Map<PipelineStage, Integer> stageCounts;

    @Schema(description = "Snapshot of the pipeline configuration flags and budgets")
    private final Map<String, Object> config;

    @Schema(description = "Aggregated execution metrics, absent when performance monitoring is disabled")
    private final PerformanceReport performance;
}
