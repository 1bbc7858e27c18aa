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
 * Gates an inner {@link TransformMiddleware} behind a predicate on the payload.
 * When the predicate does not hold the payload passes through unchanged.
 *
 * @param <T> the payload type
 */
public class ConditionalTransform<T> implements TransformMiddleware<T> {

    private final Predicate<? super T> condition;
    private final TransformMiddleware<T> inner;

    public ConditionalTransform(Predicate<? super T> condition, TransformMiddleware<T> inner) {
        this.condition = condition;
        this.inner = inner;
    }

    @Override
    public Mono<T> process(T payload, PipelineContext context) {
        if (condition.test(payload)) {
            return inner.process(payload, context);
        }
        context.recordSkipped(inner.getName());
        return Mono.just(payload);
    }

    @Override
    public String getName() {
        return inner.getName();
    }
}
