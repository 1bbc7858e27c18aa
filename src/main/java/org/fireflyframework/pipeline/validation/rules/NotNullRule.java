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

import java.util.function.Function;

/**
 * Requires a request field to be present.
 *
 * @param <T> the request type
 */
public class NotNullRule<T> implements ValidationRule<T> {

    private final String fieldName;
    private final Function<T, ?> extractor;
    private final ValidationSeverity severity;

    public NotNullRule(String fieldName, Function<T, ?> extractor) {
        this(fieldName, extractor, ValidationSeverity.CRITICAL);
    }

    public NotNullRule(String fieldName, Function<T, ?> extractor, ValidationSeverity severity) {
        this.fieldName = fieldName;
        this.extractor = extractor;
        this.severity = severity;
    }

    @Override
    public ValidationResult evaluate(T request) {
        if (extractor.apply(request) != null) {
            return ValidationResult.pass(getRuleName());
        }
        return ValidationResult.builder()
                .ruleName(getRuleName())
                .passed(false)
                .severity(severity)
                .message(fieldName + " is required")
                .fieldName(fieldName)
                .build();
    }

    @Override
    public String getRuleName() {
        return "not-null:" + fieldName;
    }

    @Override
    public ValidationSeverity getSeverity() {
        return severity;
    }
}
