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

/**
 * Options of a single execution.
 *
 * @param agentContext whether the execution was started by an agent; notify steps then return
 *                     their message as output instead of broadcasting it
 */
public record ExecutionOptions(boolean agentContext) {

    public static final ExecutionOptions DEFAULT = new ExecutionOptions(false);

    public static ExecutionOptions agent() {
        return new ExecutionOptions(true);
    }
}
