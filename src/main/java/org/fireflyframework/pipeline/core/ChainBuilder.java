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

import org.fireflyframework.pipeline.middleware.Interceptor;
import org.fireflyframework.pipeline.middleware.RequestHandler;

import java.util.List;

/**
 * Composes the request-handling interceptors and the terminal handler into one
 * nested callable.
 *
 * <p>The list {@code [M1, ..., Mn]} is folded from the end: starting from the handler,
 * each interceptor is bound around the callable built so far. Invoking the result runs
 * {@code M1} first, and each interceptor reaches the next one (and finally the handler)
 * only through its {@code next} argument, which is what allows short-circuiting.</p>
 */
class ChainBuilder {

    private final MiddlewareMonitor monitor;

    ChainBuilder(MiddlewareMonitor monitor) {
        this.monitor = monitor;
    }

    /**
     * Builds the chain for one request. With no interceptors the handler itself is returned.
     */
    <Q, R> RequestHandler<Q, R> build(List<Interceptor<Q, R>> interceptors, RequestHandler<Q, R> handler,
                                      PipelineContext context) {
        RequestHandler<Q, R> wrapped = handler;
        for (int i = interceptors.size() - 1; i >= 0; i--) {
            wrapped = bind(interceptors.get(i), wrapped, context);
        }
        return wrapped;
    }

    private <Q, R> RequestHandler<Q, R> bind(Interceptor<Q, R> interceptor, RequestHandler<Q, R> downstream,
                                             PipelineContext context) {
        return request -> monitor.observe(interceptor.getName(), context,
                () -> interceptor.intercept(request, context, downstream));
    }
}
