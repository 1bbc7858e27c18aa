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
import java.util.regex.Pattern;

/**
 * Requires a string field to match a regular expression. An absent value passes;
 * combine with {@link NotNullRule} to make the field mandatory.
 *
 * @param <T> the request type
 */
public class PatternRule<T> implements ValidationRule<T> {

    private final String fieldName;
    private final Pattern pattern;
    private final Function<T, String> extractor;
    private final ValidationSeverity severity;

    public PatternRule(String fieldName, Pattern pattern, Function<T, String> extractor) {
        this(fieldName, pattern, extractor, ValidationSeverity.CRITICAL);
    }

    public PatternRule(String fieldName, Pattern pattern, Function<T, String> extractor,
                       ValidationSeverity severity) {
        this.fieldName = fieldName;
        this.pattern = pattern;
        this.extractor = extractor;
        this.severity = severity;
    }

    @Override
    public ValidationResult evaluate(T request) {
        String value = extractor.apply(request);
        if (value == null || pattern.matcher(value).matches()) {
            return ValidationResult.pass(getRuleName());
        }
        return ValidationResult.builder()
                .ruleName(getRuleName())
                .passed(false)
                .severity(severity)
                .message("Invalid value for " + fieldName)
                .fieldName(fieldName)
                .actualValue(value)
                .build();
    }

    @Override
    public String getRuleName() {
        return "pattern:" + fieldName;
    }

    @Override
    public ValidationSeverity getSeverity() {
        return severity;
    }
}
