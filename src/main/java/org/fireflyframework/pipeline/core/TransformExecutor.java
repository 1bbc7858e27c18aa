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
import org.fireflyframework.pipeline.error.RequestRejectedException;
import org.fireflyframework.pipeline.error.StageMiddlewareException;
import org.fireflyframework.pipeline.middleware.TransformMiddleware;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs the transform middleware of a sequential stage over a payload, threading
 * the output of each middleware into the input of the next.
 *
 * <p>A failing middleware is recorded in the context as a
 * {@link StageMiddlewareException}. With error recovery enabled its effect is
 * discarded and the following middleware receive the payload from just before it;
 * otherwise the stage stops and the failure propagates. A {@link RequestRejectedException}
 * always stops the stage.</p>
 */
@Slf4j
class TransformExecutor {

    private final PipelineConfig config;
    private final MiddlewareMonitor monitor;

    TransformExecutor(PipelineConfig config, MiddlewareMonitor monitor) {
        this.config = config;
        this.monitor = monitor;
    }

    <T> Mono<T> execute(PipelineStage stage, List<TransformMiddleware<T>> middleware, T payload,
                        PipelineContext context) {
        Mono<T> result = Mono.just(payload);
        for (TransformMiddleware<T> transform : middleware) {
            result = result.flatMap(current -> apply(stage, transform, current, context));
        }
        return result;
    }

    private <T> Mono<T> apply(PipelineStage stage, TransformMiddleware<T> transform, T current,
                              PipelineContext context) {
        String name = transform.getName();
        return monitor.observe(name, context, () -> transform.process(current, context))
                .defaultIfEmpty(current)
                .onErrorResume(error -> {
                    StageMiddlewareException failure = new StageMiddlewareException(stage, name, error);
                    context.addError(failure);
                    if (config.isEnableErrorRecovery() && !(error instanceof RequestRejectedException)) {
                        log.warn("[{}] {}; continuing with the previous payload",
                                context.getRequestId(), failure.getMessage());
                        return Mono.just(current);
                    }
                    return Mono.error(failure);
                });
    }
}
