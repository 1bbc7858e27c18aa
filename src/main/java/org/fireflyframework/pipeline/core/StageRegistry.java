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

import org.fireflyframework.pipeline.middleware.CleanupHandler;
import org.fireflyframework.pipeline.middleware.ErrorHandler;
import org.fireflyframework.pipeline.middleware.Interceptor;
import org.fireflyframework.pipeline.middleware.TransformMiddleware;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered, typed middleware lists, one per {@link PipelineStage}.
 *
 * <p>Meant to be populated during application setup, before traffic starts.
 * Reads are safe at any time; registering while requests are in flight only
 * affects requests that reach the stage afterwards.</p>
 *
 * @param <Q> the request type
 * @param <R> the result type
 */
class StageRegistry<Q, R> {

    private final List<TransformMiddleware<Q>> preProcessing = new CopyOnWriteArrayList<>();
    private final List<Interceptor<Q, R>> requestHandling = new CopyOnWriteArrayList<>();
    private final List<TransformMiddleware<R>> postProcessing = new CopyOnWriteArrayList<>();
    private final List<ErrorHandler> errorHandling = new CopyOnWriteArrayList<>();
    private final List<CleanupHandler> cleanup = new CopyOnWriteArrayList<>();

    void addPreProcessing(TransformMiddleware<Q> transform) {
        preProcessing.add(Objects.requireNonNull(transform, "transform must not be null"));
    }

    void addRequestHandling(Interceptor<Q, R> interceptor) {
        requestHandling.add(Objects.requireNonNull(interceptor, "interceptor must not be null"));
    }

    void addPostProcessing(TransformMiddleware<R> transform) {
        postProcessing.add(Objects.requireNonNull(transform, "transform must not be null"));
    }

    void addErrorHandling(ErrorHandler handler) {
        errorHandling.add(Objects.requireNonNull(handler, "handler must not be null"));
    }

    void addCleanup(CleanupHandler handler) {
        cleanup.add(Objects.requireNonNull(handler, "handler must not be null"));
    }

    List<TransformMiddleware<Q>> preProcessing() {
        return Collections.unmodifiableList(preProcessing);
    }

    List<Interceptor<Q, R>> requestHandling() {
        return Collections.unmodifiableList(requestHandling);
    }

    List<TransformMiddleware<R>> postProcessing() {
        return Collections.unmodifiableList(postProcessing);
    }

    List<ErrorHandler> errorHandling() {
        return Collections.unmodifiableList(errorHandling);
    }

    List<CleanupHandler> cleanup() {
        return Collections.unmodifiableList(cleanup);
    }

    int count(PipelineStage stage) {
        return switch (stage) {
            case PRE_PROCESSING -> preProcessing.size();
            case REQUEST_HANDLING -> requestHandling.size();
            case POST_PROCESSING -> postProcessing.size();
            case ERROR_HANDLING -> errorHandling.size();
            case CLEANUP -> cleanup.size();
        };
    }

    Map<PipelineStage, Integer> counts() {
        Map<PipelineStage, Integer> counts = new EnumMap<>(PipelineStage.class);
        for (PipelineStage stage : PipelineStage.values()) {
            counts.put(stage, count(stage));
        }
        return counts;
    }
}
