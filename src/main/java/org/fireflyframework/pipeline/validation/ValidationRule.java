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

/**
 * A single validation concern evaluated against an incoming request.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * public class ContentLengthRule implements ValidationRule<HttpRequest> {
 *
 *     @Override
 *     public ValidationResult evaluate(HttpRequest request) {
 *         if (request.getBody().length <= MAX_BODY) {
 *             return ValidationResult.pass(getRuleName());
 *         }
 *         return ValidationResult.fail(getRuleName(), getSeverity(), "Request body too large");
 *     }
 *
 *     @Override
 *     public String getRuleName() {
 *         return "content-length";
 *     }
 *
 *     @Override
 *     public ValidationSeverity getSeverity() {
 *         return ValidationSeverity.CRITICAL;
 *     }
 * }
 * }</pre>
 *
 * @param <T> the request type this rule validates
 */
public interface ValidationRule<T> {

    /**
     * Evaluates this rule against the given request.
     *
     * @param request the request to validate
     * @return the result of the evaluation
     */
    ValidationResult evaluate(T request);

    String getRuleName();

    /**
     * Returns the severity of violations of this rule. Defaults to
     * {@link ValidationSeverity#CRITICAL}.
     *
     * @return the severity level
     */
    default ValidationSeverity getSeverity() {
        return ValidationSeverity.CRITICAL;
    }
}
