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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.pipeline.core.PipelineContext;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Factory methods for named, conditional and built-in middleware.
 *
 * <pre>{@code
 * pipeline.preProcessing(Middlewares.transform("normalize", (request, context) -> Mono.just(normalize(request))))
 *         .use(Middlewares.requestLogging("access"))
 *         .use(Middlewares.when(request -> request.isSecure(), authInterceptor))
 *         .cleanup(Middlewares.cleanup("release", context -> releaseResources(context)));
 * }</pre>
 */
@Slf4j
public final class Middlewares {

    /** Key under which {@link #timing(String)} stores the elapsed {@link Duration}. */
    public static final String ELAPSED_KEY = "elapsed";

    private Middlewares() {
    }

    public static <T> TransformMiddleware<T> transform(String name, TransformMiddleware<T> transform) {
        return new TransformMiddleware<>() {
            @Override
            public Mono<T> process(T payload, PipelineContext context) {
                return transform.process(payload, context);
            }

            @Override
            public String getName() {
                return name;
            }
        };
    }

    public static <Q, R> Interceptor<Q, R> interceptor(String name, Interceptor<Q, R> interceptor) {
        return new Interceptor<>() {
            @Override
            public Mono<R> intercept(Q request, PipelineContext context, RequestHandler<Q, R> next) {
                return interceptor.intercept(request, context, next);
            }

            @Override
            public String getName() {
                return name;
            }
        };
    }

    public static ErrorHandler errorHandler(String name, ErrorHandler handler) {
        return new ErrorHandler() {
            @Override
            public Mono<Void> onError(Throwable error, PipelineContext context) {
                return handler.onError(error, context);
            }

            @Override
            public String getName() {
                return name;
            }
        };
    }

    public static CleanupHandler cleanup(String name, CleanupHandler handler) {
        return new CleanupHandler() {
            @Override
            public Mono<Void> cleanup(PipelineContext context) {
                return handler.cleanup(context);
            }

            @Override
            public String getName() {
                return name;
            }
        };
    }

    /**
     * Runs {@code interceptor} only for requests matching {@code condition}.
     */
    public static <Q, R> Interceptor<Q, R> when(Predicate<? super Q> condition, Interceptor<Q, R> interceptor) {
        return new ConditionalInterceptor<>(condition, interceptor);
    }

    /**
     * Runs {@code transform} only for payloads matching {@code condition}.
     */
    public static <T> TransformMiddleware<T> whenPayload(Predicate<? super T> condition,
                                                         TransformMiddleware<T> transform) {
        return new ConditionalTransform<>(condition, transform);
    }

    /**
     * Creates an interceptor that measures the time spent in the downstream chain and
     * stores it in the context under {@code (name, "elapsed")}.
     *
     * @param name the middleware name
     * @return the timing interceptor
     */
    public static <Q, R> Interceptor<Q, R> timing(String name) {
        return interceptor(name, (request, context, next) -> {
            long start = System.nanoTime();
            return next.handle(request)
                    .doOnTerminate(() -> {
                        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                        context.setMiddlewareData(name, ELAPSED_KEY, elapsed);
                        log.debug("[{}] {}: {}ms", context.getRequestId(), name, elapsed.toMillis());
                    });
        });
    }

    /**
     * Creates an interceptor that logs the start and the outcome of each request.
     *
     * @param name the middleware name
     * @return the logging interceptor
     */
    public static <Q, R> Interceptor<Q, R> requestLogging(String name) {
        return interceptor(name, (request, context, next) -> {
            log.info("[{}] Processing request: {}", context.getRequestId(), request);
            return next.handle(request)
                    .doOnSuccess(result -> log.info("[{}] Request completed in {}ms",
                            context.getRequestId(), context.elapsed().toMillis()))
                    .doOnError(error -> log.info("[{}] Request failed in {}ms: {}",
                            context.getRequestId(), context.elapsed().toMillis(), error.getMessage()));
        });
    }
}
