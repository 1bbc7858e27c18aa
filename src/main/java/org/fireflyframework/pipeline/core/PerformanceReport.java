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
import org.fireflyframework.pipeline.event.ExecutionOutcome;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregated execution metrics of a pipeline, produced by {@link PipelineMetrics}.
 */
@Data
@Builder
public class PerformanceReport {

    private final long totalExecutions;
    private final Map<ExecutionOutcome, Long> executionsByOutcome;
    private final long timeouts;
    private final double averageExecutionMs;
    private final Map<String, MiddlewareTiming> middlewareTimings;
    private final Instant generatedAt;

    /**
     * Invocation statistics of a single middleware.
     */
    @Data
    @Builder
    public static class MiddlewareTiming {

        private final String middlewareName;
        private final long invocations;
        private final long failures;
        private final double totalMs;
        private final double averageMs;
    }
}
