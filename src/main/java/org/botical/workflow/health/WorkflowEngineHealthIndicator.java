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

package org.botical.workflow.health;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.botical.workflow.resilience.WorkflowResilience;
import org.botical.workflow.state.WorkflowExecutionStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for the workflow engine.
 * <p>
 * UP when the execution store answers; open action circuit breakers are listed as a detail
 * but do not make the engine unhealthy.
 */
@Slf4j
@RequiredArgsConstructor
public class WorkflowEngineHealthIndicator implements ReactiveHealthIndicator {

    private final WorkflowExecutionStore executionStore;
    private final WorkflowResilience resilience;

    @Override
    public Mono<Health> health() {
        return checkExecutionStore()
                .map(storeHealthy -> {
                    List<String> openBreakers = resilience.getAllCircuitBreakerStates().entrySet().stream()
                            .filter(entry -> entry.getValue() == CircuitBreaker.State.OPEN)
                            .map(Map.Entry::getKey)
                            .toList();

                    Health.Builder builder = storeHealthy ? Health.up() : Health.down();
                    return builder
                            .withDetail("executionStore", storeHealthy ? "available" : "unavailable")
                            .withDetail("openCircuitBreakers", openBreakers)
                            .build();
                })
                .onErrorResume(e -> {
                    log.warn("Workflow engine health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }

    private Mono<Boolean> checkExecutionStore() {
        return executionStore.findById("__health_check__")
                .map(execution -> true)
                .switchIfEmpty(Mono.just(true))
                .timeout(Duration.ofSeconds(5))
                .onErrorReturn(false);
    }
}
