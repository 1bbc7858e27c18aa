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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.pipeline.event.ExecutionOutcome;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Thread-safe aggregation of pipeline execution metrics.
 *
 * <p>Counts executions per {@link ExecutionOutcome}, the accumulated execution time,
 * and per-middleware invocation counts, failures and durations. Lock-free so it can be
 * updated by every concurrent request.</p>
 */
@Slf4j
public class PipelineMetrics {

    private final Map<ExecutionOutcome, AtomicLong> executions = new ConcurrentHashMap<>();
    private final AtomicLong totalExecutionNanos = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();
    private final Map<String, AtomicLong> middlewareInvocations = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> middlewareFailures = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> middlewareNanos = new ConcurrentHashMap<>();

    public void recordExecution(ExecutionOutcome outcome, Duration duration, boolean timedOut) {
        executions.computeIfAbsent(outcome, k -> new AtomicLong()).incrementAndGet();
        totalExecutionNanos.addAndGet(duration.toNanos());
        if (timedOut) {
            timeouts.incrementAndGet();
        }
    }

    public void recordMiddleware(String middlewareName, Duration duration, boolean failed) {
        middlewareInvocations.computeIfAbsent(middlewareName, k -> new AtomicLong()).incrementAndGet();
        middlewareNanos.computeIfAbsent(middlewareName, k -> new AtomicLong()).addAndGet(duration.toNanos());
        if (failed) {
            middlewareFailures.computeIfAbsent(middlewareName, k -> new AtomicLong()).incrementAndGet();
        }
    }

    public long getTotalExecutions() {
        return executions.values().stream().mapToLong(AtomicLong::get).sum();
    }

    /**
     * Generates a report of everything recorded so far.
     *
     * @return the performance report
     */
    public PerformanceReport getReport() {
        Map<ExecutionOutcome, Long> byOutcome = new EnumMap<>(ExecutionOutcome.class);
        for (ExecutionOutcome outcome : ExecutionOutcome.values()) {
            AtomicLong count = executions.get(outcome);
            byOutcome.put(outcome, count != null ? count.get() : 0L);
        }

        long total = getTotalExecutions();
        double averageMs = total == 0 ? 0.0 : toMillis(totalExecutionNanos.get()) / total;

        Map<String, PerformanceReport.MiddlewareTiming> timings = middlewareInvocations.entrySet().stream()
                .collect(Collectors.toMap(
                        Map.Entry::getKey,
                        entry -> {
                            String name = entry.getKey();
                            long invocations = entry.getValue().get();
                            double totalMs = toMillis(middlewareNanos.getOrDefault(name, new AtomicLong()).get());
                            return PerformanceReport.MiddlewareTiming.builder()
                                    .middlewareName(name)
                                    .invocations(invocations)
                                    .failures(middlewareFailures.getOrDefault(name, new AtomicLong()).get())
                                    .totalMs(totalMs)
                                    .averageMs(invocations == 0 ? 0.0 : totalMs / invocations)
                                    .build();
                        }
                ));

        return PerformanceReport.builder()
                .totalExecutions(total)
                .executionsByOutcome(byOutcome)
                .timeouts(timeouts.get())
                .averageExecutionMs(averageMs)
                .middlewareTimings(timings)
                .generatedAt(Instant.now())
                .build();
    }

    private static double toMillis(long nanos) {
        return nanos / 1_000_000.0;
    }
}
