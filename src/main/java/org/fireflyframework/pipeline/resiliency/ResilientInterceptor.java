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

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.reactor.bulkhead.operator.BulkheadOperator;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.pipeline.core.PipelineContext;
import org.fireflyframework.pipeline.middleware.Interceptor;
import org.fireflyframework.pipeline.middleware.RequestHandler;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Request-handling interceptor that protects the downstream chain with Resilience4j.
 *
 * <p>Decoration is applied in order: bulkhead, rate limiter, circuit breaker,
 * retry, timeout. A retry resubscribes to the downstream chain, so the interceptors
 * registered after this one and the terminal handler run again for every attempt.
 * Retry is off unless {@link ResiliencyConfig#setRetryEnabled(boolean)} turns it on,
 * and should only be enabled for idempotent handlers. The timeout bounds all attempts
 * together.</p>
 *
 * <p>The Resilience4j instances are created once per interceptor and shared by every
 * request that passes through it.</p>
 *
 * @param <Q> the request type
 * @param <R> the result type
 */
@Slf4j
public class ResilientInterceptor<Q, R> implements Interceptor<Q, R> {

    private final String name;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;
    private final RateLimiter rateLimiter;
    private final Bulkhead bulkhead;
    private final long timeoutMs;

    public ResilientInterceptor(String name, ResiliencyConfig config) {
        this.name = name;
        this.circuitBreaker = config.isCircuitBreakerEnabled() ? createCircuitBreaker(name, config) : null;
        this.retry = config.isRetryEnabled() ? createRetry(name, config) : null;
        this.rateLimiter = config.isRateLimiterEnabled() ? createRateLimiter(name, config) : null;
        this.bulkhead = config.isBulkheadEnabled() ? createBulkhead(name, config) : null;
        this.timeoutMs = config.getTimeoutMs();

        log.info("Created resilient interceptor '{}': circuitBreaker={}, retry={}, rateLimiter={}, bulkhead={}, timeoutMs={}",
                name,
                config.isCircuitBreakerEnabled(),
                config.isRetryEnabled(),
                config.isRateLimiterEnabled(),
                config.isBulkheadEnabled(),
                timeoutMs);
    }

    @Override
    public Mono<R> intercept(Q request, PipelineContext context, RequestHandler<Q, R> next) {
        Mono<R> decorated = Mono.defer(() -> next.handle(request));

        if (bulkhead != null) {
            decorated = decorated.transformDeferred(BulkheadOperator.of(bulkhead));
        }
        if (rateLimiter != null) {
            decorated = decorated.transformDeferred(RateLimiterOperator.of(rateLimiter));
        }
        if (circuitBreaker != null) {
            decorated = decorated.transformDeferred(CircuitBreakerOperator.of(circuitBreaker));
        }
        if (retry != null) {
            decorated = decorated.transformDeferred(RetryOperator.of(retry));
        }
        if (timeoutMs > 0) {
            decorated = decorated.timeout(Duration.ofMillis(timeoutMs));
        }

        return decorated.doOnError(error -> log.debug("[{}] '{}' gave up on the downstream chain: {}",
                context.getRequestId(), name, error.toString()));
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * @return the circuit breaker, or {@code null} when disabled
     */
    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    private static CircuitBreaker createCircuitBreaker(String name, ResiliencyConfig config) {
        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(config.getCircuitBreakerFailureRateThreshold())
                .slidingWindowSize(config.getCircuitBreakerSlidingWindowSize())
                .minimumNumberOfCalls(config.getCircuitBreakerSlidingWindowSize())
                .waitDurationInOpenState(Duration.ofMillis(config.getCircuitBreakerWaitDurationInOpenStateMs()))
                .build();
        return CircuitBreaker.of(name, cbConfig);
    }

    private static Retry createRetry(String name, ResiliencyConfig config) {
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(config.getRetryMaxAttempts())
                .waitDuration(Duration.ofMillis(config.getRetryWaitDurationMs()))
                .retryExceptions(Exception.class)
                .build();
        return Retry.of(name, retryConfig);
    }

    private static RateLimiter createRateLimiter(String name, ResiliencyConfig config) {
        RateLimiterConfig rlConfig = RateLimiterConfig.custom()
                .limitForPeriod(config.getRateLimitForPeriod())
                .limitRefreshPeriod(Duration.ofMillis(config.getRateLimitRefreshPeriodMs()))
                .timeoutDuration(Duration.ZERO)
                .build();
        return RateLimiter.of(name, rlConfig);
    }

    private static Bulkhead createBulkhead(String name, ResiliencyConfig config) {
        BulkheadConfig bhConfig = BulkheadConfig.custom()
                .maxConcurrentCalls(config.getBulkheadMaxConcurrentCalls())
                .build();
        return Bulkhead.of(name, bhConfig);
    }
}
