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

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of one {@link ValidationRule} against one request.
 */
@Data
@Builder
public class ValidationResult {

    private final String ruleName;
    private final boolean passed;
    private final ValidationSeverity severity;
    private final String message;
    private final String fieldName;
    private final Object actualValue;

    public static ValidationResult pass(String ruleName) {
        return ValidationResult.builder()
                .ruleName(ruleName)
                .passed(true)
                .severity(ValidationSeverity.INFO)
                .build();
    }

    public static ValidationResult fail(String ruleName, ValidationSeverity severity, String message) {
        return ValidationResult.builder()
                .ruleName(ruleName)
                .passed(false)
                .severity(severity)
                .message(message)
                .build();
    }

    /**
     * @return {@code true} when this result failed with {@link ValidationSeverity#CRITICAL}
     */
    public boolean isRejecting() {
        return !passed && severity == ValidationSeverity.CRITICAL;
    }
}
