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

package org.botical.workflow.state;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.botical.workflow.exception.WorkflowNotFoundException;
import org.botical.workflow.model.ExecutionStatus;
import org.botical.workflow.model.StepExecution;
import org.botical.workflow.model.StepUpdate;
import org.botical.workflow.model.WorkflowExecution;
import org.botical.workflow.properties.WorkflowProperties;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * In-memory {@link WorkflowExecutionStore} backed by a Caffeine cache.
 * <p>
 * Each entry holds one execution together with its step records, so every write is a single
 * atomic {@code compute} on the execution key. Entries expire {@code state.default-ttl} after
 * their last write.
 */
@Slf4j
public class CacheWorkflowExecutionStore implements WorkflowExecutionStore {

    static final String EXECUTION_ID_PREFIX = "wfx_";
    static final String STEP_ID_PREFIX = "stx_";

    private final Cache<String, ExecutionEntry> cache;
    private final Clock clock;

    public CacheWorkflowExecutionStore(WorkflowProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public CacheWorkflowExecutionStore(WorkflowProperties properties, Clock clock) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(properties.getState().getDefaultTtl())
                .maximumSize(properties.getState().getMaximumSize())
                .build();
        log.info("CacheWorkflowExecutionStore initialized with TTL: {}, maximumSize: {}",
                properties.getState().getDefaultTtl(), properties.getState().getMaximumSize());
    }

    @Override
    public Mono<WorkflowExecution> create(String workflowId, String projectId, Map<String, Object> input) {
        return Mono.fromSupplier(() -> {
            WorkflowExecution execution = WorkflowExecution.create(
                    newId(EXECUTION_ID_PREFIX), workflowId, projectId, input, clock.instant());
            cache.put(execution.id(), new ExecutionEntry(execution, new LinkedHashMap<>()));
            log.debug("Created workflow execution: executionId={}, workflowId={}", execution.id(), workflowId);
            return execution;
        });
    }

    @Override
    public Mono<WorkflowExecution> updateStatus(String executionId, ExecutionStatus status) {
        return transition(executionId, current -> current.withStatus(status, clock.instant()));
    }

    @Override
    public Mono<WorkflowExecution> complete(String executionId, Map<String, Object> output) {
        return transition(executionId, current -> current.complete(output, clock.instant()));
    }

    @Override
    public Mono<WorkflowExecution> fail(String executionId, String error) {
        return transition(executionId, current -> current.fail(error, clock.instant()));
    }

    @Override
    public Mono<WorkflowExecution> cancel(String executionId) {
        return transition(executionId, current -> current.withStatus(ExecutionStatus.CANCELLED, clock.instant()));
    }

    @Override
    public Mono<StepExecution> updateStep(String executionId, String stepId, StepUpdate update) {
        return Mono.fromSupplier(() -> {
            ExecutionEntry entry = cache.asMap().computeIfPresent(executionId, (id, current) -> {
                Map<String, StepExecution> steps = new LinkedHashMap<>(current.steps());
                StepExecution step = steps.get(stepId);
                if (step == null) {
                    step = StepExecution.create(newId(STEP_ID_PREFIX), executionId, stepId);
                }
                steps.put(stepId, step.apply(update, clock.instant()));
                return new ExecutionEntry(current.execution(), steps);
            });
            if (entry == null) {
                throw WorkflowNotFoundException.forExecution(executionId);
            }
            return entry.steps().get(stepId);
        });
    }

    @Override
    public Mono<WorkflowExecution> findById(String executionId) {
        return Mono.fromSupplier(() -> cache.getIfPresent(executionId))
                .map(ExecutionEntry::execution);
    }

    @Override
    public Flux<StepExecution> findSteps(String executionId) {
        return Mono.fromSupplier(() -> cache.getIfPresent(executionId))
                .flatMapMany(entry -> Flux.fromIterable(entry.steps().values()));
    }

    @Override
    public Flux<WorkflowExecution> findByWorkflowId(String workflowId, int limit, int offset) {
        return Flux.defer(() -> {
            List<WorkflowExecution> matches = new ArrayList<>();
            for (ExecutionEntry entry : cache.asMap().values()) {
                if (entry.execution().workflowId().equals(workflowId)) {
                    matches.add(entry.execution());
                }
            }
            matches.sort(Comparator.comparing(WorkflowExecution::startedAt).reversed());
            return Flux.fromIterable(matches).skip(offset).take(limit);
        });
    }

    private Mono<WorkflowExecution> transition(String executionId, UnaryOperator<WorkflowExecution> change) {
        return Mono.fromSupplier(() -> {
            ExecutionEntry entry = cache.asMap().computeIfPresent(executionId, (id, current) -> {
                if (current.execution().status().isTerminal()) {
                    log.debug("Ignoring status write for terminal execution: executionId={}, status={}",
                            executionId, current.execution().status());
                    return current;
                }
                return new ExecutionEntry(change.apply(current.execution()), current.steps());
            });
            if (entry == null) {
                throw WorkflowNotFoundException.forExecution(executionId);
            }
            return entry.execution();
        });
    }

    private static String newId(String prefix) {
        return prefix + UUID.randomUUID().toString().replace("-", "");
    }

    private record ExecutionEntry(WorkflowExecution execution, Map<String, StepExecution> steps) {
    }
}
