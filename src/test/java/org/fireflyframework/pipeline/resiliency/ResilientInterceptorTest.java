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

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.fireflyframework.pipeline.core.PipelineContext;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ResilientInterceptor}.
 */
class ResilientInterceptorTest {

    private final PipelineContext context = PipelineContext.of("req-1", "request");

    private static ResiliencyConfig allDisabled() {
        ResiliencyConfig config = new ResiliencyConfig();
        config.setCircuitBreakerEnabled(false);
        config.setRetryEnabled(false);
        config.setRateLimiterEnabled(false);
        config.setBulkheadEnabled(false);
        config.setTimeoutMs(0);
        return config;
    }

    @Test
    void intercept_shouldPassThroughWhenAllPatternsDisabled() {
        // Given
        ResilientInterceptor<String, String> interceptor = new ResilientInterceptor<>("backend", allDisabled());

        // When & Then
        StepVerifier.create(interceptor.intercept("req", context, request -> Mono.just("ok:" + request)))
                .expectNext("ok:req")
                .verifyComplete();
        assertThat(interceptor.getName()).isEqualTo("backend");
        assertThat(interceptor.getCircuitBreaker()).isNull();
    }

    @Test
    void intercept_shouldRetryDownstreamFailures() {
        // Given - the downstream fails twice and then succeeds
        ResiliencyConfig config = allDisabled();
        config.setRetryEnabled(true);
        config.setRetryMaxAttempts(3);
        config.setRetryWaitDurationMs(10);
        ResilientInterceptor<String, String> interceptor = new ResilientInterceptor<>("flaky", config);
        AtomicInteger attempts = new AtomicInteger();

        // When & Then
        StepVerifier.create(interceptor.intercept("req", context, request ->
                        attempts.incrementAndGet() < 3
                                ? Mono.error(new IllegalStateException("unavailable"))
                                : Mono.just("recovered")))
                .expectNext("recovered")
                .verifyComplete();

        assertThat(attempts).hasValue(3);
    }

    @Test
    void intercept_shouldNotRetryWithDefaultConfig() {
        // Given - the downstream always fails
        ResilientInterceptor<String, String> interceptor = new ResilientInterceptor<>("default", new ResiliencyConfig());
        AtomicInteger attempts = new AtomicInteger();

        // When & Then
        StepVerifier.create(interceptor.intercept("req", context, request -> {
                    attempts.incrementAndGet();
                    return Mono.error(new IllegalStateException("payment declined"));
                }))
                .expectErrorMessage("payment declined")
                .verify();

        assertThat(attempts).hasValue(1);
        assertThat(new ResiliencyConfig().isRetryEnabled()).isFalse();
    }

    @Test
    void intercept_shouldTimeOutSlowDownstream() {
        // Given
        ResiliencyConfig config = allDisabled();
        config.setTimeoutMs(50);
        ResilientInterceptor<String, String> interceptor = new ResilientInterceptor<>("slow", config);

        // When & Then
        StepVerifier.create(interceptor.intercept("req", context,
                        request -> Mono.just("late").delayElement(Duration.ofSeconds(5))))
                .expectError(TimeoutException.class)
                .verify(Duration.ofSeconds(2));
    }

    @Test
    void intercept_shouldOpenCircuitAfterFailures() {
        // Given - a window of 2 calls with a 50% threshold
        ResiliencyConfig config = allDisabled();
        config.setCircuitBreakerEnabled(true);
        config.setCircuitBreakerSlidingWindowSize(2);
        config.setCircuitBreakerFailureRateThreshold(50.0f);
        ResilientInterceptor<String, String> interceptor = new ResilientInterceptor<>("fragile", config);

        // When - two failures fill the window
        for (int i = 0; i < 2; i++) {
            StepVerifier.create(interceptor.intercept("req", context,
                            request -> Mono.error(new IllegalStateException("down"))))
                    .expectError(IllegalStateException.class)
                    .verify();
        }

        // Then
        assertThat(interceptor.getCircuitBreaker().getState()).isEqualTo(CircuitBreaker.State.OPEN);
        StepVerifier.create(interceptor.intercept("req", context, request -> Mono.just("ok")))
                .expectError(CallNotPermittedException.class)
                .verify();
    }

    @Test
    void intercept_shouldRejectCallsBeyondRateLimit() {
        // Given - one permit per long refresh period
        ResiliencyConfig config = allDisabled();
        config.setRateLimiterEnabled(true);
        config.setRateLimitForPeriod(1);
        config.setRateLimitRefreshPeriodMs(60000);
        ResilientInterceptor<String, String> interceptor = new ResilientInterceptor<>("limited", config);

        // When & Then
        StepVerifier.create(interceptor.intercept("req", context, request -> Mono.just("first")))
                .expectNext("first")
                .verifyComplete();
        StepVerifier.create(interceptor.intercept("req", context, request -> Mono.just("second")))
                .expectError(RequestNotPermitted.class)
                .verify();
    }
}
