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
package org.fireflyframework.pipeline.error;

import lombok.Getter;

import java.time.Duration;

/**
 * Raised when a request exceeds the pipeline's maximum execution time.
 */
@Getter
public class PipelineTimeoutException extends PipelineException {

    public static final String ERROR_KIND = "timeout";

    private final Duration budget;

    public PipelineTimeoutException(String requestId, Duration budget) {
        super(ERROR_KIND, "Request " + requestId + " timed out after " + budget.toMillis() + "ms", null);
        this.budget = budget;
    }
}
