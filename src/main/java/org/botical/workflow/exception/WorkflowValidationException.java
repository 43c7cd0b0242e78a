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

package org.botical.workflow.exception;

/**
 * Exception thrown when a workflow definition cannot be executed as written.
 * <p>
 * Raised when:
 * <ul>
 *   <li>Circular dependencies are detected between steps</li>
 *   <li>A step is missing a field its kind requires (e.g. an action step without an action id)</li>
 *   <li>A workflow step names both or neither of {@code workflowId}/{@code workflowName}</li>
 *   <li>A workflow step targets its own definition</li>
 * </ul>
 * Definition errors are always fatal and are never subject to a step's error handling policy.
 */
public class WorkflowValidationException extends WorkflowException {

    public WorkflowValidationException(String message) {
        super(message);
    }
}
