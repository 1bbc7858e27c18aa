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
 * Middleware for the request-handling stage, composed around the terminal handler.
 *
 * <p>An interceptor decides whether to invoke {@code next}. Returning a result
 * without invoking it short-circuits every downstream interceptor and the handler.</p>
 *
 * <pre>{@code
 * Interceptor<Map<String, Object>, Map<String, Object>> auth = (request, context, next) -> {
 *     if (!request.containsKey("authorization")) {
 *         return Mono.just(Map.of("status", 401));
 *     }
 *     return next.handle(request);
 * };
 * }</pre>
 *
 * @param <Q> the request type
 * @param <R> the result type
 */
@FunctionalInterface
public interface Interceptor<Q, R> extends Middleware {

    /**
     * Handles the request, optionally delegating to the rest of the chain.
     *
     * @param request the request
     * @param context the context of the request being processed
     * @param next    the downstream interceptors followed by the terminal handler
     * @return a {@link Mono} emitting the result
     */
    Mono<R> intercept(Q request, PipelineContext context, RequestHandler<Q, R> next);
}
