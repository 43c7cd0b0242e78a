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

package org.botical.workflow.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the Botical workflow engine.
 */
@ConfigurationProperties(prefix = "botical.workflow")
@Validated
@Data
public class WorkflowProperties {

    /**
     * Whether the workflow engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Whether to enable metrics collection.
     */
    private boolean metricsEnabled = true;

    /**
     * Whether to enable health checks.
     */
    private boolean healthEnabled = true;

    /**
     * Execution state store configuration.
     */
    @Valid
    @NotNull
    private StateConfig state = new StateConfig();

    /**
     * Live event broadcast configuration.
     */
    @Valid
    @NotNull
    private EventConfig events = new EventConfig();

    /**
     * Defaults for the {@code retry} error strategy.
     */
    @Valid
    @NotNull
    private RetryConfig retry = new RetryConfig();

    /**
     * Per-action circuit breaker configuration.
     */
    @Valid
    @NotNull
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

    /**
     * Polling of child executions started by workflow steps.
     */
    @Valid
    @NotNull
    private SubWorkflowConfig subWorkflow = new SubWorkflowConfig();

    /**
     * Defaults for session steps.
     */
    @Valid
    @NotNull
    private SessionConfig session = new SessionConfig();

    /**
     * Execution state store configuration.
     */
    @Data
    public static class StateConfig {

        /**
         * How long execution and step records are retained after their last write.
         */
        @NotNull
        private Duration defaultTtl = Duration.ofDays(7);

        /**
         * Maximum number of executions kept in memory.
         */
        @Min(1)
        private long maximumSize = 10_000;
    }

    /**
     * Live event broadcast configuration.
     */
    @Data
    public static class EventConfig {

        /**
         * Whether to broadcast workflow events.
         */
        private boolean enabled = true;

        /**
         * Whether to broadcast step-level events.
         */
        private boolean publishStepEvents = true;

        /**
         * Per-subscriber buffer before slow subscribers start losing events.
         */
        @Min(1)
        private int bufferSize = 256;
    }

    /**
     * Retry configuration.
     */
    @Data
    public static class RetryConfig {

        /**
         * Additional attempts when a step does not set {@code retryCount}.
         */
        @Min(1)
        private int defaultRetryCount = 3;

        /**
         * Base backoff delay when a step does not set {@code retryDelay}.
         */
        @NotNull
        private Duration defaultBaseDelay = Duration.ofSeconds(1);

        /**
         * Upper bound of the random jitter added to each delay, as a fraction of the delay.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitterFactor = 0.1;
    }

    /**
     * Circuit breaker configuration, applied to one breaker per action id.
     */
    @Data
    public static class CircuitBreakerConfig {

        /**
         * Whether action invocations go through a circuit breaker.
         */
        private boolean enabled = true;

        /**
         * Size of the window of most recent calls the breaker evaluates.
         */
        @Min(1)
        private int failureThreshold = 5;

        /**
         * Failure rate in percent over the window at which the breaker opens. At 100 the breaker
         * opens once every call in the window failed.
         */
        @DecimalMin("1.0")
        @DecimalMax("100.0")
        private float failureRateThreshold = 100.0f;

        /**
         * How long the breaker stays open before letting a trial call through.
         */
        @NotNull
        private Duration resetTimeout = Duration.ofSeconds(30);

        /**
         * Trial calls permitted while half-open.
         */
        @Min(1)
        private int permittedCallsInHalfOpenState = 1;
    }

    /**
     * Sub-workflow polling configuration.
     */
    @Data
    public static class SubWorkflowConfig {

        /**
         * Interval between status polls of a child execution.
         */
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(1);

        /**
         * Polls before the child is reported as timed out.
         */
        @Min(1)
        private int maxPollAttempts = 300;
    }

    /**
     * Session step configuration.
     */
    @Data
    public static class SessionConfig {

        /**
         * Agent used when a session step does not name one.
         */
        @NotBlank
        private String defaultAgent = "default";

        /**
         * Agent turn limit when a session step does not set {@code maxMessages}.
         */
        @Min(1)
        private int defaultMaxMessages = 10;
    }
}
