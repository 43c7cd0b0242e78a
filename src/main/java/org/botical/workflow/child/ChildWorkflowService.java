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

package org.botical.workflow.child;

import lombok.extern.slf4j.Slf4j;
import org.botical.workflow.core.ExecutionContext;
import org.botical.workflow.exception.StepExecutionException;
import org.botical.workflow.exception.WorkflowNotFoundException;
import org.botical.workflow.exception.WorkflowValidationException;
import org.botical.workflow.model.ExecutionStatus;
import org.botical.workflow.model.WorkflowDefinition;
import org.botical.workflow.model.WorkflowExecution;
import org.botical.workflow.properties.WorkflowProperties;
import org.botical.workflow.state.WorkflowExecutionStore;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs a workflow step: resolves the target workflow, starts it as a separate execution and
 * polls the store until the child settles.
 */
@Slf4j
public class ChildWorkflowService {

    static final String SELF_INVOCATION_MESSAGE = "Workflow cannot call itself (infinite recursion detected)";

    private final WorkflowDefinitionResolver definitionResolver;
    private final WorkflowExecutionStore executionStore;
    private final WorkflowProperties properties;

    public ChildWorkflowService(@Nullable WorkflowDefinitionResolver definitionResolver,
                                WorkflowExecutionStore executionStore,
                                WorkflowProperties properties) {
        this.definitionResolver = definitionResolver;
        this.executionStore = executionStore;
        this.properties = properties;
    }

    /**
     * Invokes a child workflow and waits for it.
     *
     * @param context the parent execution
     * @param stepId the invoking step
     * @param workflowId the target id, or null to look up by name
     * @param workflowName the target name, used when {@code workflowId} is null
     * @param input the child input
     * @return output {@code {executionId, workflowId, workflowName, status, output, completedAt}}
     */
    public Mono<Object> invoke(ExecutionContext context, String stepId, @Nullable String workflowId,
                               @Nullable String workflowName, Map<String, Object> input) {
        String parentId = context.getDefinition().id();
        if (workflowId != null && workflowId.equals(parentId)) {
            return Mono.error(new WorkflowValidationException(SELF_INVOCATION_MESSAGE));
        }
        if (definitionResolver == null) {
            return Mono.error(StepExecutionException.notConfigured(stepId, "Workflow definition resolver"));
        }

        String projectId = context.getActionContext().projectId();
        String projectPath = context.getActionContext().projectPath();
        Mono<WorkflowDefinition> lookup = workflowId != null
                ? definitionResolver.findById(projectId, projectPath, workflowId)
                : definitionResolver.findByName(projectId, projectPath, workflowName);

        return lookup
                .switchIfEmpty(Mono.error(() -> WorkflowNotFoundException.forDefinition(
                        workflowId != null ? workflowId : workflowName)))
                .flatMap(child -> {
                    if (child.id().equals(parentId)) {
                        return Mono.error(new WorkflowValidationException(SELF_INVOCATION_MESSAGE));
                    }
                    return context.getLauncher()
                            .launch(child, input, context.getActionContext(), context.isAgentContext())
                            .doOnNext(childExecutionId -> log.info(
                                    "CHILD_WORKFLOW_STARTED: executionId={}, stepId={}, childWorkflowId={}, childExecutionId={}",
                                    context.getExecutionId(), stepId, child.id(), childExecutionId))
                            .flatMap(childExecutionId -> awaitCompletion(childExecutionId, 1))
                            .map(execution -> toOutput(execution, child));
                });
    }

    private Mono<WorkflowExecution> awaitCompletion(String childExecutionId, int attempt) {
        WorkflowProperties.SubWorkflowConfig config = properties.getSubWorkflow();
        if (attempt > config.getMaxPollAttempts()) {
            return Mono.error(new StepExecutionException("Workflow execution timed out"));
        }
        Duration interval = config.getPollInterval();
        return Mono.delay(interval)
                .then(executionStore.findById(childExecutionId))
                .switchIfEmpty(Mono.error(() -> new StepExecutionException("Workflow execution not found")))
                .flatMap(execution -> {
                    ExecutionStatus status = execution.status();
                    if (status == ExecutionStatus.COMPLETED) {
                        return Mono.just(execution);
                    }
                    if (status == ExecutionStatus.FAILED) {
                        String error = execution.error() != null ? execution.error() : "Workflow execution failed";
                        return Mono.error(new StepExecutionException(error));
                    }
                    if (status == ExecutionStatus.CANCELLED) {
                        return Mono.error(new StepExecutionException("Workflow execution was cancelled"));
                    }
                    return awaitCompletion(childExecutionId, attempt + 1);
                });
    }

    private static Object toOutput(WorkflowExecution execution, WorkflowDefinition child) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("executionId", execution.id());
        output.put("workflowId", child.id());
        output.put("workflowName", child.name());
        output.put("status", execution.status().value());
        output.put("output", execution.output());
        output.put("completedAt", execution.completedAt() != null ? execution.completedAt().toEpochMilli() : null);
        return output;
    }
}
