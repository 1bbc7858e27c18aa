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

import reactor.core.publisher.Mono;

/**
 * A callable that turns a request into a result.
 *
 * <p>Used both for the terminal handler selected by the router and for the
 * {@code next} continuation handed to each {@link Interceptor}.</p>
 *
 * @param <Q> the request type
 * @param <R> the result type
 */
@FunctionalInterface
public interface RequestHandler<Q, R> {

    Mono<R> handle(Q request);
}
