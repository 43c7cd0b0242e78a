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

package org.botical.workflow.resilience;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.botical.workflow.exception.RetriesExhaustedException;
import org.botical.workflow.exception.WorkflowValidationException;
import org.botical.workflow.properties.WorkflowProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowResilienceTest {

    private static final RetryPolicy FAST_RETRY = new RetryPolicy(3, Duration.ofMillis(1), 0.1);

    private WorkflowResilience resilience;

    @BeforeEach
    void setUp() {
        resilience = new WorkflowResilience(new WorkflowProperties(), new ErrorClassifier(), null);
    }

    @Nested
    @DisplayName("circuit breaker")
    class CircuitBreakerTests {

        @Test
        @DisplayName("sixth call after five failures is short-circuited")
        void shouldShortCircuitAfterFailureThreshold() {
            AtomicInteger invocations = new AtomicInteger();
            Mono<String> failing = Mono.defer(() -> {
                invocations.incrementAndGet();
                return Mono.error(new RuntimeException("boom"));
            });

            for (int i = 0; i < 5; i++) {
                StepVerifier.create(resilience.decorateAction("flaky", failing))
                        .expectErrorMessage("boom")
                        .verify();
            }
            assertThat(resilience.getCircuitBreakerState("flaky")).isEqualTo(CircuitBreaker.State.OPEN);

            StepVerifier.create(resilience.decorateAction("flaky", failing))
                    .expectError(CallNotPermittedException.class)
                    .verify();

            assertThat(invocations).hasValue(5);
        }

        @Test
        @DisplayName("earlier successes do not keep the breaker closed through five failures")
        void shouldOpenAfterFailuresFollowingSuccesses() {
            for (int i = 0; i < 6; i++) {
                StepVerifier.create(resilience.decorateAction("a", Mono.just("ok")))
                        .expectNext("ok")
                        .verifyComplete();
            }

            AtomicInteger invocations = new AtomicInteger();
            Mono<String> failing = Mono.defer(() -> {
                invocations.incrementAndGet();
                return Mono.error(new RuntimeException("boom"));
            });
            for (int i = 0; i < 6; i++) {
                StepVerifier.create(resilience.decorateAction("a", failing))
                        .expectError()
                        .verify();
            }

            assertThat(invocations).hasValue(5);
            assertThat(resilience.getCircuitBreakerState("a")).isEqualTo(CircuitBreaker.State.OPEN);
        }

        @Test
        void shouldKeepBreakersPerAction() {
            Mono<String> failing = Mono.error(new RuntimeException("boom"));
            for (int i = 0; i < 5; i++) {
                StepVerifier.create(resilience.decorateAction("broken", failing)).expectError().verify();
            }

            StepVerifier.create(resilience.decorateAction("healthy", Mono.just("ok")))
                    .expectNext("ok")
                    .verifyComplete();

            assertThat(resilience.getAllCircuitBreakerStates())
                    .containsEntry("broken", CircuitBreaker.State.OPEN)
                    .containsEntry("healthy", CircuitBreaker.State.CLOSED);
        }

        @Test
        void shouldCloseBreakerOnReset() {
            for (int i = 0; i < 5; i++) {
                StepVerifier.create(resilience.decorateAction("broken", Mono.error(new RuntimeException("x"))))
                        .expectError()
                        .verify();
            }

            resilience.resetCircuitBreaker("broken");

            assertThat(resilience.getCircuitBreakerState("broken")).isEqualTo(CircuitBreaker.State.CLOSED);
            assertThat(resilience.getCircuitBreakerMetrics("broken").failedCalls()).isZero();
        }

        @Test
        void shouldResetEveryBreaker() {
            resilience.getOrCreateCircuitBreaker("first").transitionToOpenState();
            resilience.getOrCreateCircuitBreaker("second").transitionToOpenState();

            resilience.resetAll();

            assertThat(resilience.getAllCircuitBreakerStates())
                    .containsEntry("first", CircuitBreaker.State.CLOSED)
                    .containsEntry("second", CircuitBreaker.State.CLOSED);
        }

        @Test
        void shouldReportUnknownActionsAsAbsent() {
            assertThat(resilience.getCircuitBreakerState("never-called")).isNull();
            assertThat(resilience.getCircuitBreakerMetrics("never-called")).isNull();
        }

        @Test
        void shouldPassThroughWhenDisabled() {
            WorkflowProperties properties = new WorkflowProperties();
            properties.getCircuitBreaker().setEnabled(false);
            WorkflowResilience disabled = new WorkflowResilience(properties, new ErrorClassifier(), null);

            for (int i = 0; i < 10; i++) {
                StepVerifier.create(disabled.decorateAction("a", Mono.error(new RuntimeException("x"))))
                        .expectErrorMessage("x")
                        .verify();
            }
            assertThat(disabled.getAllCircuitBreakerStates()).isEmpty();
        }
    }

    @Nested
    @DisplayName("retry")
    class RetryTests {

        @Test
        void shouldSucceedAfterTransientFailures() {
            AtomicInteger attempts = new AtomicInteger();

            Mono<String> result = resilience.executeWithRetry("wfx_1", "fetch", FAST_RETRY, () -> {
                if (attempts.incrementAndGet() <= 2) {
                    return Mono.error(new RuntimeException("connection reset"));
                }
                return Mono.just("value");
            });

            StepVerifier.create(result).expectNext("value").verifyComplete();
            assertThat(attempts).hasValue(3);
        }

        @Test
        void shouldGiveUpAfterRetryCount() {
            AtomicInteger attempts = new AtomicInteger();

            Mono<String> result = resilience.executeWithRetry("wfx_1", "fetch", FAST_RETRY, () -> {
                attempts.incrementAndGet();
                return Mono.error(new RuntimeException("network error"));
            });

            StepVerifier.create(result)
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(RetriesExhaustedException.class)
                                .hasMessage("network error");
                        RetriesExhaustedException exhausted = (RetriesExhaustedException) error;
                        assertThat(exhausted.getAttempts()).isEqualTo(4);
                        assertThat(exhausted.getLastAttemptAt()).isNotNull();
                    })
                    .verify();
            assertThat(attempts).hasValue(4);
        }

        @Test
        void shouldStopOnTerminalErrors() {
            AtomicInteger attempts = new AtomicInteger();

            Mono<String> result = resilience.executeWithRetry("wfx_1", "fetch", FAST_RETRY, () -> {
                attempts.incrementAndGet();
                return Mono.error(new RuntimeException("permission denied"));
            });

            StepVerifier.create(result)
                    .expectErrorSatisfies(error -> assertThat(((RetriesExhaustedException) error).getAttempts())
                            .isEqualTo(1))
                    .verify();
            assertThat(attempts).hasValue(1);
        }

        @Test
        void shouldPropagateDefinitionErrorsUnchanged() {
            Mono<String> result = resilience.executeWithRetry("wfx_1", "fetch", FAST_RETRY,
                    () -> Mono.error(new WorkflowValidationException("Action step missing action ID")));

            StepVerifier.create(result)
                    .expectError(WorkflowValidationException.class)
                    .verify();
        }
    }
}
