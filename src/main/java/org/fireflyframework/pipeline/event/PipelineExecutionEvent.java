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
package org.fireflyframework.pipeline.event;

import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * Event published by the {@link org.fireflyframework.pipeline.core.MiddlewarePipeline}
 * once per request, after cleanup has run.
 */
@Data
public class PipelineExecutionEvent {

    private final String requestId;
    private final ExecutionOutcome outcome;
    private final Duration duration;
    private final int errorCount;
    private final boolean timedOut;
    private final Instant timestamp;

    public PipelineExecutionEvent(String requestId, ExecutionOutcome outcome, Duration duration,
                                  int errorCount, boolean timedOut) {
        this.requestId = requestId;
        this.outcome = outcome;
        this.duration = duration;
        this.errorCount = errorCount;
        this.timedOut = timedOut;
        this.timestamp = Instant.now();
    }
}
