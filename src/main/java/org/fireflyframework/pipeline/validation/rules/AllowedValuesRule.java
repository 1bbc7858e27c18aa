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
package org.fireflyframework.pipeline.validation.rules;

import org.fireflyframework.pipeline.validation.ValidationResult;
import org.fireflyframework.pipeline.validation.ValidationRule;
import org.fireflyframework.pipeline.validation.ValidationSeverity;

import java.util.Set;
import java.util.function.Function;

/**
 * Requires a field to be one of a fixed set of values, such as the HTTP methods a route
 * accepts. An absent value passes.
 *
 * @param <T> the request type
 */
public class AllowedValuesRule<T> implements ValidationRule<T> {

    private final String fieldName;
    private final Set<?> allowed;
    private final Function<T, ?> extractor;
    private final ValidationSeverity severity;

    public AllowedValuesRule(String fieldName, Set<?> allowed, Function<T, ?> extractor) {
        this(fieldName, allowed, extractor, ValidationSeverity.CRITICAL);
    }

    public AllowedValuesRule(String fieldName, Set<?> allowed, Function<T, ?> extractor,
                             ValidationSeverity severity) {
        this.fieldName = fieldName;
        this.allowed = Set.copyOf(allowed);
        this.extractor = extractor;
        this.severity = severity;
    }

    @Override
    public ValidationResult evaluate(T request) {
        Object value = extractor.apply(request);
        if (value == null || allowed.contains(value)) {
            return ValidationResult.pass(getRuleName());
        }
        return ValidationResult.builder()
                .ruleName(getRuleName())
                .passed(false)
                .severity(severity)
                .message(fieldName + " value " + value + " is not one of " + allowed)
                .fieldName(fieldName)
                .actualValue(value)
                .build();
    }

    @Override
    public String getRuleName() {
        return "allowed-values:" + fieldName;
    }

    @Override
    public ValidationSeverity getSeverity() {
        return severity;
    }
}
