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

import org.botical.workflow.model.ExecutionStatus;
import org.botical.workflow.model.StepExecution;
import org.botical.workflow.model.StepUpdate;
import org.botical.workflow.model.WorkflowExecution;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Persistence for workflow executions and their step records.
 * <p>
 * Implementations must keep execution status monotonic: once an execution is completed,
 * failed or cancelled, later status writes are ignored and the stored record is returned.
 * Updates of an unknown execution signal {@link org.botical.workflow.exception.WorkflowNotFoundException}.
 */
public interface WorkflowExecutionStore {

    /**
     * Creates a pending execution.
     *
     * @param workflowId the workflow definition id
     * @param projectId the owning project
     * @param input the execution input
     * @return the created execution
     */
    Mono<WorkflowExecution> create(String workflowId, String projectId, Map<String, Object> input);

    /**
     * Moves an execution to a new non-terminal or terminal status.
     *
     * @param executionId the execution id
     * @param status the new status
     * @return the stored execution after the write
     */
    Mono<WorkflowExecution> updateStatus(String executionId, ExecutionStatus status);

    /**
     * Creates or patches the step record of an execution.
     *
     * @param executionId the execution id
     * @param stepId the step id
     * @param update the partial update
     * @return the stored step record after the write
     */
    Mono<StepExecution> updateStep(String executionId, String stepId, StepUpdate update);

    /**
     * Marks an execution completed with its aggregate output.
     */
    Mono<WorkflowExecution> complete(String executionId, Map<String, Object> output);

    /**
     * Marks an execution failed.
     */
    Mono<WorkflowExecution> fail(String executionId, String error);

    /**
     * Marks an active execution cancelled.
     */
    Mono<WorkflowExecution> cancel(String executionId);

    /**
     * Finds an execution by id.
     *
     * @param executionId the execution id
     * @return a Mono containing the execution if found
     */
    Mono<WorkflowExecution> findById(String executionId);

    /**
     * Lists the step records of an execution in the order they were first written.
     */
    Flux<StepExecution> findSteps(String executionId);

    /**
     * Lists executions of a workflow, newest first.
     *
     * @param workflowId the workflow definition id
     * @param limit maximum number of executions
     * @param offset number of executions to skip
     */
    Flux<WorkflowExecution> findByWorkflowId(String workflowId, int limit, int offset);
}
