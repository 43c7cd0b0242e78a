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
import org.botical.workflow.action.ActionContext;
import org.botical.workflow.child.WorkflowLauncher;
import org.botical.workflow.model.WorkflowDefinition;
import org.botical.workflow.model.WorkflowExecution;
import org.botical.workflow.state.WorkflowExecutionStore;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Entry point for running workflows.
 * <p>
 * {@link #executeWorkflow} returns as soon as the execution record exists; the run itself
 * continues in the background and its progress is observable through the execution store and
 * the event stream.
 * <pre>
 * {@code
 * workflowEngine.executeWorkflow(definition, Map.of("orderId", "42"), actionContext, ExecutionOptions.DEFAULT)
 *     .subscribe(executionId -> log.info("Started: {}", executionId));
 * }
 * </pre>
 */
@Slf4j
public class WorkflowEngine implements WorkflowLauncher {

    private final WorkflowExecutor executor;
    private final WorkflowExecutionStore executionStore;
    private final Scheduler scheduler;

    public WorkflowEngine(WorkflowExecutor executor, WorkflowExecutionStore executionStore) {
        this(executor, executionStore, Schedulers.boundedElastic());
    }

    public WorkflowEngine(WorkflowExecutor executor, WorkflowExecutionStore executionStore, Scheduler scheduler) {
        this.executor = executor;
        this.executionStore = executionStore;
        this.scheduler = scheduler;
    }

    /**
     * Creates a pending execution and starts running it in the background.
     *
     * @param definition the workflow to run
     * @param input the execution input
     * @param actionContext the caller context
     * @param options execution options
     * @return the new execution id
     */
    public Mono<String> executeWorkflow(WorkflowDefinition definition, Map<String, Object> input,
                                        ActionContext actionContext, ExecutionOptions options) {
        return createContext(definition, input, actionContext, options)
                .map(context -> {
                    executor.execute(context)
                            .subscribeOn(scheduler)
                            .subscribe(
                                    execution -> log.debug("Execution {} finished with status {}",
                                            execution.id(), execution.status()),
                                    error -> log.error("WORKFLOW_RUN_ERROR: executionId={}, workflowId={}, error={}",
                                            context.getExecutionId(), definition.id(), error.getMessage(), error));
                    return context.getExecutionId();
                });
    }

    /**
     * Creates an execution and runs it, completing with the execution in its terminal state.
     */
    public Mono<WorkflowExecution> runToCompletion(WorkflowDefinition definition, Map<String, Object> input,
                                                   ActionContext actionContext, ExecutionOptions options) {
        return createContext(definition, input, actionContext, options).flatMap(executor::execute);
    }

    @Override
    public Mono<String> launch(WorkflowDefinition definition, Map<String, Object> input,
                               ActionContext actionContext, boolean agentContext) {
        return executeWorkflow(definition, input, actionContext, new ExecutionOptions(agentContext));
    }

    private Mono<ExecutionContext> createContext(WorkflowDefinition definition, Map<String, Object> input,
                                                 ActionContext actionContext, ExecutionOptions options) {
        ExecutionOptions effective = options != null ? options : ExecutionOptions.DEFAULT;
        String projectId = definition.projectId() != null ? definition.projectId() : actionContext.projectId();
        return executionStore.create(definition.id(), projectId, input)
                .map(execution -> {
                    log.info("WORKFLOW_CREATED: executionId={}, workflowId={}, agentContext={}",
                            execution.id(), definition.id(), effective.agentContext());
                    return new ExecutionContext(execution.id(), definition, execution.input(), actionContext,
                            effective.agentContext(), this);
                });
    }
}
