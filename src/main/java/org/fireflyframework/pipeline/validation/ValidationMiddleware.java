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
package org.fireflyframework.pipeline.validation;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.pipeline.core.PipelineContext;
import org.fireflyframework.pipeline.middleware.TransformMiddleware;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Pre-processing transform that evaluates a set of {@link ValidationRule}s against the
 * request before it reaches the handler chain.
 *
 * <p>The {@link ValidationReport} is stored in the context under
 * {@code (getName(), "report")}. When a CRITICAL rule fails the transform fails with a
 * {@link RequestValidationException}; otherwise the request passes through unchanged.</p>
 *
 * <p>Supports two evaluation strategies via {@link ValidationStrategy}:</p>
 * <ul>
 *   <li>{@link ValidationStrategy#FAIL_FAST} - stops on the first CRITICAL failure</li>
 *   <li>{@link ValidationStrategy#COLLECT_ALL} - evaluates every rule regardless of failures</li>
 * </ul>
 *
 * @param <T> the request type
 */
@Slf4j
public class ValidationMiddleware<T> implements TransformMiddleware<T> {

    public static final String REPORT_KEY = "report";

    private final String name;
    private final List<ValidationRule<T>> rules;
    private final ValidationStrategy strategy;

    public ValidationMiddleware(List<ValidationRule<T>> rules) {
        this("validation", rules, ValidationStrategy.COLLECT_ALL);
    }

    public ValidationMiddleware(String name, List<ValidationRule<T>> rules, ValidationStrategy strategy) {
        this.name = name;
        this.rules = List.copyOf(rules);
        this.strategy = strategy;
    }

    @Override
    public Mono<T> process(T payload, PipelineContext context) {
        return validate(payload)
                .flatMap(report -> {
                    context.setMiddlewareData(name, REPORT_KEY, report);
                    if (!report.isPassed()) {
                        return Mono.error(new RequestValidationException(report));
                    }
                    if (report.getFailedRules() > 0) {
                        log.warn("[{}] {} validation warning(s): {}", context.getRequestId(),
                                report.getFailedRules(), report.getFailures());
                    }
                    return Mono.just(payload);
                });
    }

    /**
     * Evaluates the rules against {@code request} with this middleware's strategy.
     *
     * @param request the request to validate
     * @return a {@link Mono} emitting the {@link ValidationReport}
     */
    public Mono<ValidationReport> validate(T request) {
        return Mono.fromCallable(() -> {
            List<ValidationResult> results = new ArrayList<>();
            for (ValidationRule<T> rule : rules) {
                ValidationResult result = rule.evaluate(request);
                results.add(result);
                if (strategy == ValidationStrategy.FAIL_FAST && result.isRejecting()) {
                    break;
                }
            }
            return ValidationReport.of(results);
        });
    }

    @Override
    public String getName() {
        return name;
    }
}
