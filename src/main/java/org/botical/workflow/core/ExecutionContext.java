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

import org.botical.workflow.action.ActionContext;
import org.botical.workflow.child.WorkflowLauncher;
import org.botical.workflow.model.WorkflowDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runtime state of one execution, alive for the duration of a single run.
 * <p>
 * Holds the input and the outputs of completed steps that later bindings read. Only completed
 * steps with a non-null output are recorded, so bindings to failed or skipped steps resolve to null.
 */
public class ExecutionContext {

    private final String executionId;
    private final WorkflowDefinition definition;
    private final Map<String, Object> input;
    private final ActionContext actionContext;
    private final boolean agentContext;
    private final WorkflowLauncher launcher;
    private final Map<String, Object> stepOutputs = new ConcurrentHashMap<>();

    public ExecutionContext(String executionId, WorkflowDefinition definition, Map<String, Object> input,
                            ActionContext actionContext, boolean agentContext, WorkflowLauncher launcher) {
        this.executionId = executionId;
        this.definition = definition;
        this.input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
        this.actionContext = actionContext;
        this.agentContext = agentContext;
        this.launcher = launcher;
    }

    public String getExecutionId() {
        return executionId;
    }

    public WorkflowDefinition getDefinition() {
        return definition;
    }

    public Map<String, Object> getInput() {
        return input;
    }

    public ActionContext getActionContext() {
        return actionContext;
    }

    /**
     * Whether the run was started by an agent; notify steps then return their message instead of
     * broadcasting it.
     */
    public boolean isAgentContext() {
        return agentContext;
    }

    /**
     * The engine entry point used by workflow steps to start child executions.
     */
    public WorkflowLauncher getLauncher() {
        return launcher;
    }

    /**
     * Records the output of a completed step.
     */
    public void recordOutput(String stepId, Object output) {
        if (output != null) {
            stepOutputs.put(stepId, output);
        }
    }

    /**
     * Gets the output of a completed step, or null.
     */
    public Object getStepOutput(String stepId) {
        return stepOutputs.get(stepId);
    }
}
