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

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Wraps single middleware invocations with trail recording and, when performance
 * monitoring is enabled, timing capture into the context and the pipeline metrics.
 */
class MiddlewareMonitor {

    private final PipelineConfig config;
    private final PipelineMetrics metrics;

    MiddlewareMonitor(PipelineConfig config, PipelineMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Defers {@code invocation}, so that a middleware throwing instead of returning a
     * failed {@link Mono} surfaces as an error signal.
     */
    <T> Mono<T> observe(String middlewareName, PipelineContext context, Supplier<Mono<T>> invocation) {
        return Mono.defer(() -> {
            context.recordExecuted(middlewareName);
            Mono<T> call = Mono.defer(invocation);
            if (!config.isEnablePerformanceMonitoring()) {
                return call;
            }
            long start = System.nanoTime();
            return call
                    .doOnSuccess(value -> record(middlewareName, context, start, false))
                    .doOnError(error -> record(middlewareName, context, start, true));
        });
    }

    private void record(String middlewareName, PipelineContext context, long start, boolean failed) {
        Duration duration = Duration.ofNanos(System.nanoTime() - start);
        context.recordTiming(middlewareName, duration);
        metrics.recordMiddleware(middlewareName, duration, failed);
    }
}
