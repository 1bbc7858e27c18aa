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

import java.util.function.Predicate;

/**
 * Gates an inner {@link Interceptor} behind a predicate on the request.
 *
 * <p>When the predicate holds, the inner interceptor handles the request. Otherwise
 * the request goes straight to {@code next} and the inner interceptor is recorded as
 * skipped in the context.</p>
 *
 * @param <Q> the request type
 * @param <R> the result type
 */
public class ConditionalInterceptor<Q, R> implements Interceptor<Q, R> {

    private final Predicate<? super Q> condition;
    private final Interceptor<Q, R> inner;

    public ConditionalInterceptor(Predicate<? super Q> condition, Interceptor<Q, R> inner) {
        this.condition = condition;
        this.inner = inner;
    }

    @Override
    public Mono<R> intercept(Q request, PipelineContext context, RequestHandler<Q, R> next) {
        if (condition.test(request)) {
            return inner.intercept(request, context, next);
        }
        context.recordSkipped(inner.getName());
        return next.handle(request);
    }

    @Override
    public String getName() {
        return inner.getName();
    }
}
