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

package org.botical.workflow.core;

import lombok.extern.slf4j.Slf4j;
import org.botical.workflow.event.WorkflowEventPublisher;
import org.botical.workflow.exception.StepExecutionException;
import org.botical.workflow.exception.WorkflowValidationException;
import org.botical.workflow.metrics.WorkflowMetrics;
import org.botical.workflow.model.ErrorStrategy;
import org.botical.workflow.model.ExecutionStatus;
import org.botical.workflow.model.StepResult;
import org.botical.workflow.model.StepType;
import org.botical.workflow.model.StepUpdate;
import org.botical.workflow.model.WorkflowExecution;
import org.botical.workflow.model.WorkflowStep;
import org.botical.workflow.state.WorkflowExecutionStore;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives one execution through its levels.
 * <p>
 * Levels run one after another. The steps of a level run concurrently; once every step of the
 * level has settled, their results are persisted and broadcast in declaration order, the
 * outputs of completed resolve steps are merged into the aggregate output and the level is
 * checked for fatal failures. A fatal failure stops the run and marks the execution failed.
 */
@Slf4j
public class WorkflowExecutor {

    private final StepExecutor stepExecutor;
    private final WorkflowExecutionStore executionStore;
    private final WorkflowEventPublisher eventPublisher;
    private final WorkflowMetrics metrics;

    public WorkflowExecutor(StepExecutor stepExecutor,
                            WorkflowExecutionStore executionStore,
                            WorkflowEventPublisher eventPublisher,
                            @Nullable WorkflowMetrics metrics) {
        this.stepExecutor = stepExecutor;
        this.executionStore = executionStore;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
    }

    /**
     * Runs an execution to a terminal status.
     *
     * @param context the execution context
     * @return the execution as stored after the terminal write
     */
    public Mono<WorkflowExecution> execute(ExecutionContext context) {
        return Mono.defer(() -> run(context));
    }

    private Mono<WorkflowExecution> run(ExecutionContext context) {
        String executionId = context.getExecutionId();
        String workflowId = context.getDefinition().id();
        long startedAt = System.nanoTime();
        if (metrics != null) {
            metrics.recordExecutionStarted(workflowId);
        }

        return executionStore.updateStatus(executionId, ExecutionStatus.RUNNING)
                .flatMap(running -> eventPublisher.publishExecutionUpdate(executionId, ExecutionStatus.RUNNING)
                        .thenReturn(running))
                .then(Mono.fromCallable(() ->
                        new WorkflowTopology(context.getDefinition().steps()).buildExecutionLayers()))
                .flatMap(layers -> {
                    log.info("WORKFLOW_START: executionId={}, workflowId={}, steps={}, levels={}",
                            executionId, workflowId, context.getDefinition().steps().size(), layers.size());
                    return executeLevels(context, layers, 0, new LinkedHashMap<>());
                })
                .flatMap(output -> completeExecution(context, output, startedAt))
                .onErrorResume(error -> failExecution(context, error, startedAt));
    }

    private Mono<Map<String, Object>> executeLevels(ExecutionContext context, List<List<WorkflowStep>> layers,
                                                    int levelIndex, Map<String, Object> finalOutput) {
        if (levelIndex >= layers.size()) {
            return Mono.just(finalOutput);
        }
        List<WorkflowStep> level = layers.get(levelIndex);
        log.debug("Executing level {} with {} steps for execution {}",
                levelIndex, level.size(), context.getExecutionId());

        return Flux.fromIterable(level)
                .flatMapSequential(step -> executeTimed(step, context), Math.max(1, level.size()))
                .concatMap(settled -> settle(context, settled).thenReturn(settled))
                .collectList()
                .flatMap(results -> {
                    for (SettledStep settled : results) {
                        if (settled.step().type() == StepType.RESOLVE
                                && settled.result() instanceof StepResult.Completed completed
                                && completed.output() instanceof Map<?, ?> resolved) {
                            resolved.forEach((key, value) -> finalOutput.put(String.valueOf(key), value));
                        }
                    }
                    for (SettledStep settled : results) {
                        if (settled.result() instanceof StepResult.Failed failed && isFatal(settled.step(), failed)) {
                            log.warn("STEP_FATAL: executionId={}, stepId={}, type={}, error={}",
                                    context.getExecutionId(), settled.step().id(), settled.step().type(),
                                    failed.error());
                            return Mono.error(new StepExecutionException(settled.step().id(), failed.error(),
                                    failed.cause()));
                        }
                    }
                    return executeLevels(context, layers, levelIndex + 1, finalOutput);
                });
    }

    private Mono<SettledStep> executeTimed(WorkflowStep step, ExecutionContext context) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return stepExecutor.execute(step, context)
                    .map(result -> new SettledStep(step, result, Duration.ofNanos(System.nanoTime() - start)));
        });
    }

    private Mono<Void> settle(ExecutionContext context, SettledStep settled) {
        String executionId = context.getExecutionId();
        WorkflowStep step = settled.step();
        StepResult result = settled.result();
        if (metrics != null) {
            metrics.recordStepFinished(context.getDefinition().id(), step.type(), result.status(), settled.duration());
        }

        StepUpdate update;
        Map<String, Object> data = new LinkedHashMap<>();
        if (result instanceof StepResult.Completed completed) {
            context.recordOutput(step.id(), completed.output());
            update = StepUpdate.completed(completed.output());
            data.put("output", completed.output());
        } else if (result instanceof StepResult.Failed failed) {
            update = StepUpdate.failed(failed.error());
            data.put("error", failed.error());
        } else {
            update = StepUpdate.skipped();
        }
        log.debug("Step {} of execution {} settled as {}", step.id(), executionId, result.status());

        return executionStore.updateStep(executionId, step.id(), update)
                .then(eventPublisher.publishStepUpdate(executionId, step.id(), result.status(), data));
    }

    /**
     * A failure aborts the run unless it is an action failure governed by a continue or retry policy.
     * Definition errors abort regardless of the policy.
     */
    static boolean isFatal(WorkflowStep step, StepResult.Failed failed) {
        if (failed.cause() instanceof WorkflowValidationException) {
            return true;
        }
        if (step.type() != StepType.ACTION || step.onError() == null) {
            return true;
        }
        ErrorStrategy strategy = step.onError().strategy();
        return strategy == null || strategy == ErrorStrategy.FAIL;
    }

    private Mono<WorkflowExecution> completeExecution(ExecutionContext context, Map<String, Object> output,
                                                      long startedAt) {
        String executionId = context.getExecutionId();
        return executionStore.complete(executionId, output)
                .flatMap(execution -> {
                    recordFinished(context, execution.status(), startedAt);
                    if (execution.status() != ExecutionStatus.COMPLETED) {
                        return keptStatus(execution);
                    }
                    log.info("WORKFLOW_COMPLETED: executionId={}, workflowId={}, outputKeys={}",
                            executionId, context.getDefinition().id(), output.keySet());
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("output", output);
                    return eventPublisher.publishExecutionUpdate(executionId, ExecutionStatus.COMPLETED, data)
                            .thenReturn(execution);
                });
    }

    private Mono<WorkflowExecution> failExecution(ExecutionContext context, Throwable error, long startedAt) {
        String executionId = context.getExecutionId();
        String message = StepExecutor.messageOf(error);
        log.error("WORKFLOW_FAILED: executionId={}, workflowId={}, error={}",
                executionId, context.getDefinition().id(), message);
        return executionStore.fail(executionId, message)
                .flatMap(execution -> {
                    recordFinished(context, execution.status(), startedAt);
                    if (execution.status() != ExecutionStatus.FAILED) {
                        return keptStatus(execution);
                    }
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("error", message);
                    return eventPublisher.publishExecutionUpdate(executionId, ExecutionStatus.FAILED, data)
                            .thenReturn(execution);
                });
    }

    /**
     * The store already held a terminal status, usually from a cancel; that status was broadcast when it
     * was written, so nothing is published here.
     */
    private Mono<WorkflowExecution> keptStatus(WorkflowExecution execution) {
        log.info("WORKFLOW_TERMINAL_KEPT: executionId={}, status={}", execution.id(), execution.status());
        return Mono.just(execution);
    }

    private void recordFinished(ExecutionContext context, ExecutionStatus status, long startedAt) {
        if (metrics != null) {
            metrics.recordExecutionFinished(context.getDefinition().id(), status,
                    Duration.ofNanos(System.nanoTime() - startedAt));
        }
    }

    private record SettledStep(WorkflowStep step, StepResult result, Duration duration) {}
}
