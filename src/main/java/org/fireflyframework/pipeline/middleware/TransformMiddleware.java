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
package org.fireflyframework.pipeline.middleware;

import org.fireflyframework.pipeline.core.PipelineContext;
import reactor.core.publisher.Mono;

/**
 * Middleware for the sequential stages: pre-processing of the request and
 * post-processing of the result.
 *
 * <p>The value emitted becomes the payload of the next transform. An empty
 * {@link Mono} leaves the payload unchanged.</p>
 *
 * @param <T> the payload type
 */
@FunctionalInterface
public interface TransformMiddleware<T> extends Middleware {

    /**
     * Transforms the payload.
     *
     * @param payload the current payload
     * @param context the context of the request being processed
     * @return a {@link Mono} emitting the new payload
     */
    Mono<T> process(T payload, PipelineContext context);
}
