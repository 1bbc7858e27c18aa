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
package org.fireflyframework.pipeline.controller;

import org.fireflyframework.pipeline.core.MiddlewarePipeline;
import org.fireflyframework.pipeline.core.PipelineConfig;
import org.fireflyframework.pipeline.core.PipelineStage;
import org.fireflyframework.pipeline.middleware.Middlewares;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PipelineStatsController}.
 */
class PipelineStatsControllerTest {

    @Test
    void getStats_shouldReturnPipelineSnapshot() {
        // Given
        MiddlewarePipeline<Map<String, Object>, Map<String, Object>> pipeline =
                MiddlewarePipeline.forMaps(PipelineConfig.defaults())
                        .use(Middlewares.requestLogging("access-log"))
                        .cleanup(Middlewares.cleanup("noop", context -> Mono.empty()));
        StepVerifier.create(pipeline.execute(Map.of("path", "/"), Mono::just))
                .expectNextCount(1)
                .verifyComplete();
        PipelineStatsController controller = new PipelineStatsController(pipeline);

        // When & Then
        StepVerifier.create(controller.getStats())
                .assertNext(stats -> {
                    assertThat(stats.getActiveContexts()).isZero();
                    assertThat(stats.getStageCounts())
                            .containsEntry(PipelineStage.REQUEST_HANDLING, 1)
                            .containsEntry(PipelineStage.CLEANUP, 1);
                    assertThat(stats.getConfig()).containsEntry("enable_error_recovery", true);
                    assertThat(stats.getPerformance().getTotalExecutions()).isEqualTo(1);
                })
                .verifyComplete();
    }
}
