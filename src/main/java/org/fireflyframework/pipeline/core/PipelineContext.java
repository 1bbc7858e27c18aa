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

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-request record created by {@link MiddlewarePipeline#execute} and handed
 * explicitly to every middleware.
 *
 * <p>Besides the request identity and timing it carries the failures captured
 * while processing, a general metadata map, and a store namespaced by middleware
 * name so that unrelated middleware cannot collide on key names:</p>
 * <pre>{@code
 * context.setMiddlewareData("auth", "user", user);
 * User user = (User) context.getMiddlewareData("auth", "user");
 * }</pre>
 *
 * <p>A context is only valid for the duration of its {@code execute} call.</p>
 */
@Getter
public class PipelineContext {

    private final String requestId;
    private final Instant startTime;
    private final Object request;

    @Getter(AccessLevel.NONE)
    private final long startNanos;

    @Getter(AccessLevel.NONE)
    private final List<Throwable> errors = new CopyOnWriteArrayList<>();

    private final Map<String, Object> metadata = new ConcurrentHashMap<>();

    @Getter(AccessLevel.NONE)
    private final Map<String, Map<String, Object>> middlewareData = new ConcurrentHashMap<>();

    @Getter(AccessLevel.NONE)
    private final List<String> executedMiddleware = new CopyOnWriteArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<String> skippedMiddleware = new CopyOnWriteArrayList<>();

    @Getter(AccessLevel.NONE)
    private final Map<String, Duration> timings = Collections.synchronizedMap(new LinkedHashMap<>());

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean finished = new AtomicBoolean(false);

    @Getter(AccessLevel.NONE)
    private final boolean tracking;

    PipelineContext(String requestId, Object request, boolean tracking) {
        this.requestId = Objects.requireNonNull(requestId, "requestId must not be null");
        this.request = request;
        this.tracking = tracking;
        this.startTime = Instant.now();
        this.startNanos = System.nanoTime();
    }

    /**
     * Creates a standalone context, for example to exercise a middleware outside a pipeline.
     *
     * @param requestId the request identifier
     * @param request   the request
     * @return a new context with execution tracking enabled
     */
    public static PipelineContext of(String requestId, Object request) {
        return new PipelineContext(requestId, request, true);
    }

    /**
     * Returns the failures captured so far, in the order they occurred.
     *
     * @return an unmodifiable snapshot of the captured failures
     */
    public List<Throwable> getErrors() {
        return List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public void addError(Throwable error) {
        errors.add(Objects.requireNonNull(error, "error must not be null"));
    }

    public Object getMiddlewareData(String middlewareName, String key) {
        return getMiddlewareData(middlewareName, key, null);
    }

    public Object getMiddlewareData(String middlewareName, String key, Object defaultValue) {
        Map<String, Object> data = middlewareData.get(middlewareName);
        if (data == null) {
            return defaultValue;
        }
        return data.getOrDefault(key, defaultValue);
    }

    /**
     * Stores {@code value} under {@code key} in the namespace of {@code middlewareName}.
     * A {@code null} value removes the entry.
     */
    public void setMiddlewareData(String middlewareName, String key, Object value) {
        Map<String, Object> data = middlewareData.computeIfAbsent(middlewareName, name -> new ConcurrentHashMap<>());
        if (value == null) {
            data.remove(key);
        } else {
            data.put(key, value);
        }
    }

    /**
     * Returns the names of the middleware that ran for this request, in invocation order.
     * Empty when context tracking is disabled.
     */
    public List<String> getExecutedMiddleware() {
        return List.copyOf(executedMiddleware);
    }

    /**
     * Returns the names of the middleware bypassed by a conditional wrapper.
     * Empty when context tracking is disabled.
     */
    public List<String> getSkippedMiddleware() {
        return List.copyOf(skippedMiddleware);
    }

    /**
     * Returns the accumulated execution time per middleware name.
     * Empty when performance monitoring is disabled.
     */
    public Map<String, Duration> getTimings() {
        synchronized (timings) {
            return Map.copyOf(timings);
        }
    }

    public void recordExecuted(String middlewareName) {
        if (tracking) {
            executedMiddleware.add(middlewareName);
        }
    }

    public void recordSkipped(String middlewareName) {
        if (tracking) {
            skippedMiddleware.add(middlewareName);
        }
    }

    void recordTiming(String middlewareName, Duration duration) {
        timings.merge(middlewareName, duration, Duration::plus);
    }

    /**
     * Returns the time elapsed since the context was created, on the monotonic clock.
     */
    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public boolean isOlderThan(Duration age) {
        return age != null && !age.isZero() && elapsed().compareTo(age) > 0;
    }

    boolean markFinished() {
        return finished.compareAndSet(false, true);
    }

    public boolean isFinished() {
        return finished.get();
    }

    @Override
    public String toString() {
        return "PipelineContext{requestId='" + requestId + "', errors=" + errors.size()
                + ", elapsedMs=" + elapsed().toMillis() + "}";
    }
}
