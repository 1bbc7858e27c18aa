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
import org.fireflyframework.pipeline.error.CleanupFailureException;
import org.fireflyframework.pipeline.error.ErrorHandlerFailureException;
import org.fireflyframework.pipeline.error.HandlerChainException;
import org.fireflyframework.pipeline.error.PipelineException;
import org.fireflyframework.pipeline.error.PipelineTimeoutException;
import org.fireflyframework.pipeline.event.ExecutionOutcome;
import org.fireflyframework.pipeline.event.PipelineExecutionEvent;
import org.fireflyframework.pipeline.middleware.CleanupHandler;
import org.fireflyframework.pipeline.middleware.ErrorHandler;
import org.fireflyframework.pipeline.middleware.Interceptor;
import org.fireflyframework.pipeline.middleware.Middleware;
import org.fireflyframework.pipeline.middleware.MiddlewareRegistration;
import org.fireflyframework.pipeline.middleware.RequestHandler;
import org.fireflyframework.pipeline.middleware.TransformMiddleware;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Asynchronous staged execution engine that every request/handler pair flows through.
 *
 * <p>For each {@link #execute(Object, RequestHandler) execute} call the pipeline:</p>
 * <ol>
 *   <li>creates a {@link PipelineContext} and registers it as active</li>
 *   <li>runs the {@link PipelineStage#PRE_PROCESSING} transforms over the request</li>
 *   <li>dispatches the request through the {@link PipelineStage#REQUEST_HANDLING}
 *       interceptors, nested around the terminal handler</li>
 *   <li>runs the {@link PipelineStage#POST_PROCESSING} transforms over the result</li>
 *   <li>on failure, runs every {@link PipelineStage#ERROR_HANDLING} handler and then either
 *       returns a recovery payload or propagates the failure, depending on
 *       {@link PipelineConfig#isEnableErrorRecovery()}</li>
 *   <li>always runs the {@link PipelineStage#CLEANUP} handlers exactly once and deregisters
 *       the context, before the outcome reaches the subscriber</li>
 * </ol>
 *
 * <p>Steps 2 to 4 run under {@link PipelineConfig#getMaxExecutionTime()}; when the budget
 * expires they are cancelled and the request continues with a
 * {@link PipelineTimeoutException}.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * MiddlewarePipeline<Map<String, Object>, Map<String, Object>> pipeline =
 *     MiddlewarePipeline.forMaps(PipelineConfig.defaults())
 *         .preProcessing(validation)
 *         .use(authInterceptor)
 *         .cleanup(releaseResources);
 *
 * pipeline.execute(request, router.resolve(request)).subscribe(response -> ...);
 * }</pre>
 *
 * <p>Middleware are registered during setup; the pipeline itself is safe to execute
 * from any number of concurrent subscribers.</p>
 *
 * @param <Q> the request type
 * @param <R> the result type
 */
@Slf4j
public class MiddlewarePipeline<Q, R> {

    private final PipelineConfig config;
    private final RecoveryResponseFactory<R> recoveryResponseFactory;
    private final ApplicationEventPublisher eventPublisher;
    private final Supplier<String> requestIdGenerator;

    private final StageRegistry<Q, R> registry = new StageRegistry<>();
    private final ActiveContextRegistry activeContexts = new ActiveContextRegistry();
    private final PipelineMetrics metrics = new PipelineMetrics();
    private final MiddlewareMonitor monitor;
    private final TransformExecutor transformExecutor;
    private final ChainBuilder chainBuilder;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    /**
     * Creates a pipeline without event publishing.
     *
     * @param config                  the execution policies
     * @param recoveryResponseFactory shapes recovery payloads into the result type
     */
    public MiddlewarePipeline(PipelineConfig config, RecoveryResponseFactory<R> recoveryResponseFactory) {
        this(config, recoveryResponseFactory, null);
    }

    /**
     * Creates a pipeline with optional event publishing.
     *
     * @param config                  the execution policies
     * @param recoveryResponseFactory shapes recovery payloads into the result type
     * @param eventPublisher          the event publisher, or {@code null} to disable event publishing
     */
    public MiddlewarePipeline(PipelineConfig config, RecoveryResponseFactory<R> recoveryResponseFactory,
                              ApplicationEventPublisher eventPublisher) {
        this(config, recoveryResponseFactory, eventPublisher, MiddlewarePipeline::generateRequestId);
    }

    public MiddlewarePipeline(PipelineConfig config, RecoveryResponseFactory<R> recoveryResponseFactory,
                              ApplicationEventPublisher eventPublisher, Supplier<String> requestIdGenerator) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.recoveryResponseFactory = Objects.requireNonNull(recoveryResponseFactory,
                "recoveryResponseFactory must not be null");
        this.eventPublisher = eventPublisher;
        this.requestIdGenerator = Objects.requireNonNull(requestIdGenerator, "requestIdGenerator must not be null");
        this.monitor = new MiddlewareMonitor(config, metrics);
        this.transformExecutor = new TransformExecutor(config, monitor);
        this.chainBuilder = new ChainBuilder(monitor);
    }

    /**
     * Creates a pipeline over map-shaped requests and results whose recovery payload is
     * {@link RecoveryPayload#toMap()}.
     *
     * @param config the execution policies
     * @return a new pipeline
     */
    public static MiddlewarePipeline<Map<String, Object>, Map<String, Object>> forMaps(PipelineConfig config) {
        return new MiddlewarePipeline<>(config, RecoveryPayload::toMap);
    }

    // -- Registration ----------------------------------------------------------------------------

    /**
     * Appends the middleware carried by {@code registration} to the ordered list of its stage.
     *
     * @param registration a registration typed for this pipeline's request and result
     * @return this pipeline
     */
    public MiddlewarePipeline<Q, R> register(MiddlewareRegistration<Q, R> registration) {
        Objects.requireNonNull(registration, "registration must not be null");
        registration.registerWith(this);
        return this;
    }

    /**
     * Appends an interceptor to the request-handling stage.
     */
    public MiddlewarePipeline<Q, R> use(Interceptor<Q, R> interceptor) {
        registry.addRequestHandling(interceptor);
        return registered(PipelineStage.REQUEST_HANDLING, interceptor);
    }

    public MiddlewarePipeline<Q, R> preProcessing(TransformMiddleware<Q> transform) {
        registry.addPreProcessing(transform);
        return registered(PipelineStage.PRE_PROCESSING, transform);
    }

    public MiddlewarePipeline<Q, R> postProcessing(TransformMiddleware<R> transform) {
        registry.addPostProcessing(transform);
        return registered(PipelineStage.POST_PROCESSING, transform);
    }

    public MiddlewarePipeline<Q, R> errorHandling(ErrorHandler handler) {
        registry.addErrorHandling(handler);
        return registered(PipelineStage.ERROR_HANDLING, handler);
    }

    public MiddlewarePipeline<Q, R> cleanup(CleanupHandler handler) {
        registry.addCleanup(handler);
        return registered(PipelineStage.CLEANUP, handler);
    }

    private MiddlewarePipeline<Q, R> registered(PipelineStage stage, Middleware middleware) {
        log.debug("Registered middleware '{}' in stage {}", middleware.getName(), stage);
        return this;
    }

    // -- Execution -------------------------------------------------------------------------------

    /**
     * Runs {@code request} through every stage and {@code handler}.
     *
     * <p>The returned {@link Mono} is cold: each subscription is one execution with its
     * own context. It emits the post-processed result, or the recovery payload when a
     * failure was recovered, and completes empty when the chain produced no result.</p>
     *
     * @param request the request, already routed
     * @param handler the terminal handler selected by the router
     * @return a {@link Mono} emitting the outcome of the request
     */
    public Mono<R> execute(Q request, RequestHandler<Q, R> handler) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(handler, "handler must not be null");

        return Mono.defer(() -> {
            if (shutdown.get()) {
                return Mono.error(new IllegalStateException("Pipeline has been shut down"));
            }
            PipelineContext context = openContext(request);

            Mono<Optional<R>> processing = runStages(request, handler, context)
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty());

            if (config.hasExecutionBudget()) {
                processing = processing.timeout(config.getMaxExecutionTime(), Mono.defer(() -> {
                    PipelineTimeoutException timeout =
                            new PipelineTimeoutException(context.getRequestId(), config.getMaxExecutionTime());
                    context.addError(timeout);
                    return Mono.error(timeout);
                }));
            }

            return processing
                    .flatMap(result -> finish(context, ExecutionOutcome.COMPLETED).thenReturn(result))
                    .onErrorResume(error -> handleFailure(error, context))
                    .doOnCancel(() -> finish(context, ExecutionOutcome.CANCELLED).subscribe())
                    .doFinally(signal -> activeContexts.remove(context.getRequestId()))
                    .flatMap(result -> result.map(Mono::just).orElseGet(Mono::empty));
        });
    }

    private PipelineContext openContext(Q request) {
        PipelineContext context = new PipelineContext(requestIdGenerator.get(), request,
                config.isEnableContextTracking());
        activeContexts.register(context);
        log.debug("[{}] Pipeline execution started", context.getRequestId());
        return context;
    }

    private Mono<R> runStages(Q request, RequestHandler<Q, R> handler, PipelineContext context) {
        return transformExecutor.execute(PipelineStage.PRE_PROCESSING, registry.preProcessing(), request, context)
                .flatMap(processed -> dispatch(processed, handler, context))
                .flatMap(result -> transformExecutor.execute(
                        PipelineStage.POST_PROCESSING, registry.postProcessing(), result, context));
    }

    private Mono<R> dispatch(Q request, RequestHandler<Q, R> handler, PipelineContext context) {
        RequestHandler<Q, R> chain = chainBuilder.build(registry.requestHandling(), handler, context);
        return Mono.defer(() -> chain.handle(request))
                .onErrorResume(error -> {
                    HandlerChainException failure = new HandlerChainException(error);
                    context.addError(failure);
                    return Mono.error(failure);
                });
    }

    private Mono<Optional<R>> handleFailure(Throwable error, PipelineContext context) {
        PipelineException failure;
        if (error instanceof PipelineException) {
            failure = (PipelineException) error;
        } else {
            failure = new HandlerChainException(error);
            context.addError(failure);
        }

        Mono<Optional<R>> outcome;
        if (config.isEnableErrorRecovery()) {
            outcome = Mono.fromCallable(() -> {
                log.warn("[{}] Recovering from failure: {}", context.getRequestId(), failure.getMessage());
                return Optional.ofNullable(recoveryResponseFactory.toResponse(recoveryPayload(failure, context)));
            });
        } else {
            outcome = Mono.error(failure);
        }

        return runErrorHandlers(failure, context)
                .then(outcome)
                .flatMap(result -> finish(context, ExecutionOutcome.RECOVERED).thenReturn(result))
                .onErrorResume(propagated -> finish(context, ExecutionOutcome.FAILED).then(Mono.error(propagated)));
    }

    private RecoveryPayload recoveryPayload(PipelineException failure, PipelineContext context) {
        Throwable reported = failure.getCause() != null ? failure.getCause() : failure;
        String message = config.isExposeErrorDetails() && reported.getMessage() != null
                ? reported.getMessage()
                : RecoveryPayload.SAFE_MESSAGE;
        return RecoveryPayload.builder()
                .error(RecoveryPayload.DEFAULT_ERROR)
                .errorKind(failure.getErrorKind())
                .message(message)
                .requestId(context.getRequestId())
                .timestamp(Instant.now())
                .build();
    }

    private Mono<Void> runErrorHandlers(PipelineException failure, PipelineContext context) {
        return Flux.fromIterable(registry.errorHandling())
                .concatMap(handler -> monitor.observe(handler.getName(), context,
                                () -> handler.onError(failure, context))
                        .onErrorResume(error -> {
                            ErrorHandlerFailureException handlerFailure =
                                    new ErrorHandlerFailureException(handler.getName(), error);
                            log.warn("[{}] {}", context.getRequestId(), handlerFailure.getMessage(), handlerFailure);
                            return Mono.empty();
                        }))
                .then();
    }

    /**
     * Runs the cleanup handlers and deregisters the context. Only the first call for a
     * context has any effect.
     */
    private Mono<Void> finish(PipelineContext context, ExecutionOutcome outcome) {
        return Mono.defer(() -> {
            if (!context.markFinished()) {
                return Mono.empty();
            }
            return runCleanup(context).then(Mono.fromRunnable(() -> complete(context, outcome)));
        });
    }

    private Mono<Void> runCleanup(PipelineContext context) {
        return Flux.fromIterable(registry.cleanup())
                .concatMap(handler -> monitor.observe(handler.getName(), context, () -> handler.cleanup(context))
                        .onErrorResume(error -> {
                            CleanupFailureException cleanupFailure =
                                    new CleanupFailureException(handler.getName(), error);
                            log.warn("[{}] {}", context.getRequestId(), cleanupFailure.getMessage(), cleanupFailure);
                            return Mono.empty();
                        }))
                .then();
    }

    private void complete(PipelineContext context, ExecutionOutcome outcome) {
        activeContexts.remove(context.getRequestId());

        boolean timedOut = context.getErrors().stream().anyMatch(PipelineTimeoutException.class::isInstance);
        if (config.isEnablePerformanceMonitoring()) {
            metrics.recordExecution(outcome, context.elapsed(), timedOut);
        }
        if (context.isOlderThan(config.getContextTimeout())) {
            log.warn("[{}] Context outlived its timeout of {}ms ({}ms)", context.getRequestId(),
                    config.getContextTimeout().toMillis(), context.elapsed().toMillis());
        }
        log.debug("[{}] Pipeline execution finished: {} in {}ms", context.getRequestId(), outcome,
                context.elapsed().toMillis());
        publishEvent(context, outcome, timedOut);
    }

    private void publishEvent(PipelineContext context, ExecutionOutcome outcome, boolean timedOut) {
        if (eventPublisher == null) {
            return;
        }
        try {
            eventPublisher.publishEvent(new PipelineExecutionEvent(context.getRequestId(), outcome,
                    context.elapsed(), context.getErrors().size(), timedOut));
        } catch (RuntimeException e) {
            log.warn("[{}] Failed to publish pipeline execution event: {}", context.getRequestId(),
                    e.getMessage(), e);
        }
    }

    // -- Introspection and lifecycle -------------------------------------------------------------

    /**
     * Returns a read-only snapshot of the active contexts, the per-stage middleware
     * counts and the configuration. Safe to call while requests are in flight.
     *
     * @return the pipeline statistics
     */
    public PipelineStats getStats() {
        return PipelineStats.builder()
                .activeContexts(activeContexts.size())
                .staleContexts(activeContexts.countOlderThan(config.getContextTimeout()))
                .stageCounts(registry.counts())
                .config(config.snapshot())
                .performance(config.isEnablePerformanceMonitoring() ? metrics.getReport() : null)
                .build();
    }

    public Optional<PipelineContext> getActiveContext(String requestId) {
        return activeContexts.get(requestId);
    }

    public PipelineConfig getConfig() {
        return config;
    }

    /**
     * Stops accepting new executions. Requests already in flight finish normally.
     */
    public void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            log.info("Shutting down middleware pipeline with {} active contexts", activeContexts.size());
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    private static String generateRequestId() {
        return "req_" + UUID.randomUUID();
    }
}
