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
package org.fireflyframework.pipeline.config;

import org.fireflyframework.pipeline.controller.PipelineStatsController;
import org.fireflyframework.pipeline.core.MiddlewarePipeline;
import org.fireflyframework.pipeline.core.PipelineConfig;
import org.fireflyframework.pipeline.core.PipelineStage;
import org.fireflyframework.pipeline.core.RecoveryPayload;
import org.fireflyframework.pipeline.middleware.Interceptor;
import org.fireflyframework.pipeline.middleware.MiddlewareRegistration;
import org.fireflyframework.pipeline.middleware.Middlewares;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.ApplicationContext;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MiddlewarePipelineAutoConfiguration}.
 */
class MiddlewarePipelineAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(MiddlewarePipelineAutoConfiguration.class));

    @SuppressWarnings("unchecked")
    private static MiddlewarePipeline<Object, Object> pipelineOf(ApplicationContext context) {
        return context.getBean(MiddlewarePipeline.class);
    }

    @Test
    void autoConfiguration_shouldCreatePipelineWithDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(MiddlewarePipeline.class);
            assertThat(context).hasSingleBean(PipelineConfig.class);
            assertThat(context).hasSingleBean(PipelineStatsController.class);

            PipelineConfig config = context.getBean(PipelineConfig.class);
            assertThat(config.isEnableErrorRecovery()).isTrue();
            assertThat(config.getMaxExecutionTime()).isEqualTo(Duration.ofSeconds(30));
        });
    }

    @Test
    void autoConfiguration_shouldBindProperties() {
        contextRunner
                .withPropertyValues(
                        "firefly.pipeline.error-recovery=false",
                        "firefly.pipeline.expose-error-details=true",
                        "firefly.pipeline.max-execution-time=5s",
                        "firefly.pipeline.context-timeout=2m",
                        "firefly.pipeline.metadata.service=orders")
                .run(context -> {
                    PipelineConfig config = context.getBean(PipelineConfig.class);
                    assertThat(config.isEnableErrorRecovery()).isFalse();
                    assertThat(config.isExposeErrorDetails()).isTrue();
                    assertThat(config.getMaxExecutionTime()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(config.getContextTimeout()).isEqualTo(Duration.ofMinutes(2));
                    assertThat(config.getMetadata()).containsEntry("service", "orders");
                });
    }

    @Test
    void autoConfiguration_shouldBeDisabledByProperty() {
        contextRunner
                .withPropertyValues("firefly.pipeline.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(MiddlewarePipeline.class);
                    assertThat(context).doesNotHaveBean(PipelineStatsController.class);
                });
    }

    @Test
    void autoConfiguration_shouldRegisterMiddlewareBeans() {
        Interceptor<Object, Object> tagging = Middlewares.interceptor("tagging",
                (request, context, next) -> next.handle(request).map(result -> "tagged:" + result));

        contextRunner
                .withBean("taggingRegistration", MiddlewareRegistration.class,
                        () -> MiddlewareRegistration.requestHandling(tagging))
                .run(context -> {
                    MiddlewarePipeline<Object, Object> pipeline = pipelineOf(context);
                    assertThat(pipeline.getStats().getStageCounts())
                            .containsEntry(PipelineStage.REQUEST_HANDLING, 1);

                    StepVerifier.create(pipeline.execute("req", Mono::just))
                            .expectNext("tagged:req")
                            .verifyComplete();
                });
    }

    @Test
    void autoConfiguration_shouldRecoverWithMapPayload() {
        contextRunner.run(context -> {
            MiddlewarePipeline<Object, Object> pipeline = pipelineOf(context);

            StepVerifier.create(pipeline.execute("req", request -> Mono.error(new IllegalStateException("boom"))))
                    .assertNext(response -> assertThat(response)
                            .asInstanceOf(InstanceOfAssertFactories.MAP)
                            .containsEntry("error", RecoveryPayload.DEFAULT_ERROR)
                            .containsKey("request_id"))
                    .verifyComplete();
        });
    }

    @Test
    void autoConfiguration_shouldBackOffWhenPipelineIsDefined() {
        MiddlewarePipeline<Object, Object> custom =
                new MiddlewarePipeline<>(PipelineConfig.defaults(), payload -> Map.of("custom", true));

        contextRunner
                .withBean(MiddlewarePipeline.class, () -> custom)
                .run(context -> assertThat(context.getBean(MiddlewarePipeline.class)).isSameAs(custom));
    }

    @Test
    void contextClose_shouldShutDownPipeline() {
        contextRunner.run(context -> {
            MiddlewarePipeline<Object, Object> pipeline = pipelineOf(context);
            assertThat(pipeline.isShutdown()).isFalse();

            context.close();

            assertThat(pipeline.isShutdown()).isTrue();
        });
    }
}
