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

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry of the contexts of all in-flight requests, keyed by request ID.
 *
 * <p>Every concurrent {@code execute} call inserts and removes its own entry, so
 * insert/remove races are the normal case. Backed by a {@link ConcurrentHashMap}.</p>
 */
public class ActiveContextRegistry {

    private final Map<String, PipelineContext> contexts = new ConcurrentHashMap<>();

    public void register(PipelineContext context) {
        PipelineContext previous = contexts.putIfAbsent(context.getRequestId(), context);
        if (previous != null && previous != context) {
            throw new IllegalStateException("Duplicate request id: " + context.getRequestId());
        }
    }

    /**
     * Removes the context with the given request ID. Removing an absent entry is a no-op.
     *
     * @return {@code true} if an entry was removed
     */
    public boolean remove(String requestId) {
        return contexts.remove(requestId) != null;
    }

    public Optional<PipelineContext> get(String requestId) {
        return Optional.ofNullable(contexts.get(requestId));
    }

    public int size() {
        return contexts.size();
    }

    /**
     * Counts the in-flight contexts older than {@code age}.
     *
     * @param age the age threshold; {@code null} or zero counts nothing
     * @return the number of stale contexts
     */
    public int countOlderThan(Duration age) {
        return (int) contexts.values().stream()
                .filter(context -> context.isOlderThan(age))
                .count();
    }
}
