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
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.botical.workflow.exception.RetriesExhaustedException;
import org.botical.workflow.exception.WorkflowValidationException;
import org.botical.workflow.metrics.WorkflowMetrics;
import org.botical.workflow.properties.WorkflowProperties;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Fault tolerance around step execution.
 * <p>
 * Every action id owns one Resilience4j circuit breaker named {@code action:<id>}, shared by all
 * executions of all workflows. The breaker looks at the last {@code failure-threshold} calls and
 * opens when at least {@code failure-rate-threshold} percent of them failed, which by default means
 * all of them; after {@code reset-timeout} one trial call is let through. The breaker's
 * state machine is thread-safe, so concurrent steps of the same action never lose updates.
 * <p>
 * Retries follow {@link RetryPolicy}: transient failures are retried with exponential backoff,
 * terminal failures stop immediately, and definition errors are never retried.
 */
@Slf4j
public class WorkflowResilience {

    private static final String ACTION_PREFIX = "action:";

    private final WorkflowProperties properties;
    private final ErrorClassifier errorClassifier;
    private final WorkflowMetrics metrics;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Map<String, CircuitBreaker> actionCircuitBreakers = new ConcurrentHashMap<>();

    public WorkflowResilience(WorkflowProperties properties,
                              ErrorClassifier errorClassifier,
                              @Nullable WorkflowMetrics metrics) {
        this.properties = properties;
        this.errorClassifier = errorClassifier;
        this.metrics = metrics;
        this.circuitBreakerRegistry = createCircuitBreakerRegistry();

        var cbConfig = properties.getCircuitBreaker();
        log.info("RESILIENCE_INIT: circuitBreaker={}, failureThreshold={}, failureRateThreshold={}, resetTimeout={}",
                cbConfig.isEnabled(), cbConfig.getFailureThreshold(),
                cbConfig.getFailureRateThreshold(), cbConfig.getResetTimeout());
    }

    /**
     * Routes an action invocation through the action's circuit breaker.
     * <p>
     * When the breaker is open the invocation is not subscribed and the returned Mono fails
     * with {@link CallNotPermittedException}.
     *
     * @param actionId the action id
     * @param invocation the deferred invocation
     * @param <T> the result type
     * @return the decorated Mono
     */
    public <T> Mono<T> decorateAction(String actionId, Mono<T> invocation) {
        if (!properties.getCircuitBreaker().isEnabled()) {
            return invocation;
        }
        CircuitBreaker circuitBreaker = getOrCreateCircuitBreaker(actionId);
        return invocation
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .doOnError(CallNotPermittedException.class, e -> {
                    log.warn("CIRCUIT_BREAKER_REJECTED: name={}", circuitBreaker.getName());
                    if (metrics != null) {
                        metrics.recordCallNotPermitted(actionId);
                    }
                });
    }

    /**
     * Runs an operation, retrying transient failures per the policy.
     * <p>
     * When the operation keeps failing, or fails with a non-retryable error, the returned Mono
     * fails with {@link RetriesExhaustedException} carrying the last error and attempt count.
     * A {@link WorkflowValidationException} is propagated unchanged.
     *
     * @param executionId the execution, for logging
     * @param stepId the step, for logging
     * @param policy the retry schedule
     * @param operation supplies one attempt per subscription
     * @param <T> the result type
     * @return the first successful result
     */
    public <T> Mono<T> executeWithRetry(String executionId, String stepId, RetryPolicy policy,
                                        Supplier<Mono<T>> operation) {
        return attempt(executionId, stepId, policy, operation, 1);
    }

    private <T> Mono<T> attempt(String executionId, String stepId, RetryPolicy policy,
                                Supplier<Mono<T>> operation, int attemptNumber) {
        return Mono.defer(operation)
                .doOnNext(result -> {
                    if (attemptNumber > 1) {
                        log.info("STEP_RETRY_SUCCEEDED: executionId={}, stepId={}, attempt={}",
                                executionId, stepId, attemptNumber);
                    }
                })
                .onErrorResume(error -> {
                    if (error instanceof WorkflowValidationException) {
                        return Mono.error(error);
                    }
                    Instant failedAt = Instant.now();
                    ErrorClassification classification = errorClassifier.classify(error);

                    if (!classification.shouldRetry() || !policy.shouldRetry(attemptNumber)) {
                        log.warn("STEP_RETRY_EXHAUSTED: executionId={}, stepId={}, attempts={}, reason={}, error={}",
                                executionId, stepId, attemptNumber, classification.reason(), error.getMessage());
                        return Mono.error(new RetriesExhaustedException(stepId, messageOf(error),
                                attemptNumber, failedAt, error));
                    }

                    Duration delay = policy.getDelayForRetry(attemptNumber, classification.retryDelay());
                    log.info("STEP_RETRY: executionId={}, stepId={}, attempt={}/{}, delayMs={}, reason={}",
                            executionId, stepId, attemptNumber + 1, policy.getMaxAttempts(),
                            delay.toMillis(), classification.reason());
                    if (metrics != null) {
                        metrics.recordStepRetry(stepId, attemptNumber + 1);
                    }
                    return Mono.delay(delay)
                            .then(attempt(executionId, stepId, policy, operation, attemptNumber + 1));
                });
    }

    /**
     * Gets or creates the circuit breaker of an action.
     */
    public CircuitBreaker getOrCreateCircuitBreaker(String actionId) {
        return actionCircuitBreakers.computeIfAbsent(actionId, id -> {
            CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(ACTION_PREFIX + id);
            cb.getEventPublisher()
                    .onStateTransition(event ->
                            log.info("CIRCUIT_BREAKER_STATE: name={}, from={}, to={}",
                                    event.getCircuitBreakerName(),
                                    event.getStateTransition().getFromState(),
                                    event.getStateTransition().getToState()))
                    .onError(event ->
                            log.debug("CIRCUIT_BREAKER_ERROR: name={}, error={}",
                                    event.getCircuitBreakerName(),
                                    event.getThrowable().getMessage()));
            return cb;
        });
    }

    /**
     * Gets the circuit breaker state of an action, or null if the action was never invoked.
     */
    @Nullable
    public CircuitBreaker.State getCircuitBreakerState(String actionId) {
        CircuitBreaker cb = actionCircuitBreakers.get(actionId);
        return cb != null ? cb.getState() : null;
    }

    /**
     * Gets the states of all action circuit breakers, keyed by action id.
     */
    public Map<String, CircuitBreaker.State> getAllCircuitBreakerStates() {
        Map<String, CircuitBreaker.State> states = new TreeMap<>();
        actionCircuitBreakers.forEach((actionId, cb) -> states.put(actionId, cb.getState()));
        return states;
    }

    /**
     * Gets circuit breaker metrics of an action, or null if the action was never invoked.
     */
    @Nullable
    public CircuitBreakerMetrics getCircuitBreakerMetrics(String actionId) {
        CircuitBreaker cb = actionCircuitBreakers.get(actionId);
        if (cb == null) {
            return null;
        }
        CircuitBreaker.Metrics metrics = cb.getMetrics();
        return new CircuitBreakerMetrics(
                cb.getState(),
                metrics.getFailureRate(),
                metrics.getNumberOfSuccessfulCalls(),
                metrics.getNumberOfFailedCalls(),
                metrics.getNumberOfNotPermittedCalls()
        );
    }

    /**
     * Closes the circuit breaker of an action and clears its counters.
     */
    public void resetCircuitBreaker(String actionId) {
        CircuitBreaker cb = actionCircuitBreakers.get(actionId);
        if (cb != null) {
            cb.reset();
            log.info("CIRCUIT_BREAKER_RESET: name={}", cb.getName());
        }
    }

    /**
     * Resets every action circuit breaker.
     */
    public void resetAll() {
        actionCircuitBreakers.keySet().forEach(this::resetCircuitBreaker);
    }

    // ==================== Registry Creation ====================

    private CircuitBreakerRegistry createCircuitBreakerRegistry() {
        var cbConfig = properties.getCircuitBreaker();
        CircuitBreakerConfig defaultConfig = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(cbConfig.getFailureThreshold())
                .minimumNumberOfCalls(cbConfig.getFailureThreshold())
                .failureRateThreshold(cbConfig.getFailureRateThreshold())
                .waitDurationInOpenState(cbConfig.getResetTimeout())
                .permittedNumberOfCallsInHalfOpenState(cbConfig.getPermittedCallsInHalfOpenState())
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();

        return CircuitBreakerRegistry.of(defaultConfig);
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    // ==================== Metrics Record ====================

    /**
     * Circuit breaker metrics snapshot.
     */
    public record CircuitBreakerMetrics(
            CircuitBreaker.State state,
            float failureRate,
            int successfulCalls,
            int failedCalls,
            long notPermittedCalls
    ) {}
}
