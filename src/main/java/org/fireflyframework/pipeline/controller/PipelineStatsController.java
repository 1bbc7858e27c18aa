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

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.pipeline.core.MiddlewarePipeline;
import org.fireflyframework.pipeline.core.PipelineStats;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * REST controller exposing the statistics of the middleware pipeline.
 *
 * <p><b>Example:</b></p>
 * <pre>
 * GET /api/v1/pipeline/stats
 * </pre>
 *
 * @see MiddlewarePipeline#getStats()
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/pipeline/stats")
@Tag(name = "Middleware Pipeline", description = "Pipeline introspection and performance statistics")
@ConditionalOnBean(MiddlewarePipeline.class)
public class PipelineStatsController {

    private final MiddlewarePipeline<?, ?> pipeline;

    public PipelineStatsController(MiddlewarePipeline<?, ?> pipeline) {
        this.pipeline = pipeline;
    }

    @GetMapping
    @Operation(
        summary = "Get pipeline statistics",
        description = "Returns active and stale context counts, middleware counts per stage, " +
                     "the effective configuration and, when monitoring is enabled, the performance report."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Statistics generated successfully"),
        @ApiResponse(responseCode = "500", description = "Internal server error")
    })
    public Mono<PipelineStats> getStats() {
        log.debug("Generating middleware pipeline statistics");
        return Mono.fromCallable(pipeline::getStats);
    }
}
