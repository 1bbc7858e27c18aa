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
package org.fireflyframework.pipeline.error;

import org.fireflyframework.pipeline.core.PipelineStage;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link PipelineException} hierarchy.
 */
class PipelineExceptionTest {

    @Test
    void stageMiddlewareException_shouldDescribeStageMiddlewareAndCause() {
        // Given
        IllegalStateException cause = new IllegalStateException("bad header");

        // When
        StageMiddlewareException exception =
                new StageMiddlewareException(PipelineStage.PRE_PROCESSING, "headers", cause);

        // Then
        assertThat(exception.getErrorKind()).isEqualTo("stage_middleware_error");
        assertThat(exception.getStage()).isEqualTo(PipelineStage.PRE_PROCESSING);
        assertThat(exception.getMiddlewareName()).isEqualTo("headers");
        assertThat(exception).hasMessage("Middleware 'headers' failed in stage PRE_PROCESSING: bad header")
                .hasCause(cause);
    }

    @Test
    void handlerChainException_shouldFallBackToCauseTypeWithoutMessage() {
        // When
        HandlerChainException exception = new HandlerChainException(new NullPointerException());

        // Then
        assertThat(exception.getErrorKind()).isEqualTo("handler_chain_error");
        assertThat(exception).hasMessage("Request handling failed: NullPointerException");
    }

    @Test
    void bestEffortFailures_shouldCarryHandlerName() {
        // When
        ErrorHandlerFailureException handlerFailure =
                new ErrorHandlerFailureException("alerting", new IllegalStateException("smtp down"));
        CleanupFailureException cleanupFailure =
                new CleanupFailureException("release", new IllegalStateException("pool closed"));

        // Then
        assertThat(handlerFailure.getErrorKind()).isEqualTo("error_handler_failure");
        assertThat(handlerFailure.getHandlerName()).isEqualTo("alerting");
        assertThat(handlerFailure).hasMessageContaining("smtp down");
        assertThat(cleanupFailure.getErrorKind()).isEqualTo("cleanup_failure");
        assertThat(cleanupFailure.getHandlerName()).isEqualTo("release");
        assertThat(cleanupFailure).hasMessage("Cleanup handler 'release' failed: pool closed");
    }

    @Test
    void timeoutException_shouldCarryBudget() {
        // When
        PipelineTimeoutException exception = new PipelineTimeoutException("req-1", Duration.ofMillis(250));

        // Then
        assertThat(exception.getErrorKind()).isEqualTo("timeout");
        assertThat(exception.getBudget()).isEqualTo(Duration.ofMillis(250));
        assertThat(exception).hasMessage("Request req-1 timed out after 250ms")
                .isInstanceOf(PipelineException.class);
    }
}
