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
package org.fireflyframework.pipeline.resiliency;

import lombok.Data;

/**
 * Resilience settings for a {@link ResilientInterceptor}. Each pattern can be switched
 * on independently; a {@code timeoutMs} of zero or less disables the timeout.
 */
@Data
public class ResiliencyConfig {

    private boolean circuitBreakerEnabled = true;
    private float circuitBreakerFailureRateThreshold = 50.0f;
    private int circuitBreakerSlidingWindowSize = 10;
    private long circuitBreakerWaitDurationInOpenStateMs = 60000;

    /**
     * Re-runs the downstream chain, terminal handler included, on failure.
     */
    private boolean retryEnabled = false;
    private int retryMaxAttempts = 3;
    private long retryWaitDurationMs = 500;

    private boolean rateLimiterEnabled = false;
    private int rateLimitForPeriod = 100;
    private long rateLimitRefreshPeriodMs = 1000;

    private boolean bulkheadEnabled = false;
    private int bulkheadMaxConcurrentCalls = 25;

    private long timeoutMs = 10000;
}
