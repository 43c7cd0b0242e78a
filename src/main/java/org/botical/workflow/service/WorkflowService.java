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

package org.botical.workflow.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.botical.workflow.action.ActionContext;
import org.botical.workflow.core.ExecutionOptions;
import org.botical.workflow.core.WorkflowEngine;
import org.botical.workflow.event.WorkflowEventPublisher;
import org.botical.workflow.exception.WorkflowNotFoundException;
import org.botical.workflow.model.ExecutionStatus;
import org.botical.workflow.model.WorkflowDefinition;
import org.botical.workflow.model.WorkflowExecution;
import org.botical.workflow.state.WorkflowExecutionStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Service layer over the workflow engine.
 * <p>
 * Validates input before an execution is created and answers execution queries from the store.
 */
@Slf4j
@RequiredArgsConstructor
public class WorkflowService {

    public static final int DEFAULT_LIST_LIMIT = 50;

    private final WorkflowEngine workflowEngine;
    private final WorkflowExecutionStore executionStore;
    private final WorkflowEventPublisher eventPublisher;
    private final WorkflowInputValidator inputValidator;

    /**
     * Validates the input and starts the workflow.
     *
     * @return the new execution id
     */
    public Mono<String> startWorkflow(WorkflowDefinition definition, Map<String, Object> input,
                                      ActionContext actionContext, ExecutionOptions options) {
        return Mono.fromCallable(() -> inputValidator.validate(definition, input))
                .doOnNext(validated -> log.info("Starting workflow: workflowId={}, projectId={}",
                        definition.id(), actionContext.projectId()))
                .flatMap(validated -> workflowEngine.executeWorkflow(definition, validated, actionContext, options));
    }

    /**
     * Gets an execution with its step records.
     */
    public Mono<ExecutionDetails> getExecution(String executionId) {
        return executionStore.findById(executionId)
                .switchIfEmpty(Mono.error(() -> WorkflowNotFoundException.forExecution(executionId)))
                .flatMap(execution -> executionStore.findSteps(executionId)
                        .collectList()
                        .map(steps -> new ExecutionDetails(execution, steps)));
    }

    public Flux<WorkflowExecution> listExecutions(String workflowId) {
        return listExecutions(workflowId, DEFAULT_LIST_LIMIT, 0);
    }

    public Flux<WorkflowExecution> listExecutions(String workflowId, int limit, int offset) {
        return executionStore.findByWorkflowId(workflowId, limit, offset);
    }

    /**
     * Marks an execution cancelled. A run in progress is not interrupted; its later terminal
     * writes are ignored by the store.
     *
     * @return the stored execution after the write
     */
    public Mono<WorkflowExecution> cancelExecution(String executionId) {
        return executionStore.cancel(executionId)
                .flatMap(execution -> {
                    if (execution.status() != ExecutionStatus.CANCELLED) {
                        log.info("Cancel ignored: executionId={}, status={}", executionId, execution.status());
                        return Mono.just(execution);
                    }
                    log.info("WORKFLOW_CANCELLED: executionId={}", executionId);
                    return eventPublisher.publishExecutionUpdate(executionId, ExecutionStatus.CANCELLED)
                            .thenReturn(execution);
                });
    }
}
