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

package org.botical.workflow.model;

import java.util.Map;

/**
 * A partial update of a {@link StepExecution}. Null fields leave the stored value untouched.
 */
public record StepUpdate(
        StepStatus status,
        Map<String, Object> resolvedArgs,
        Object output,
        String error
) {

    public static StepUpdate running() {
        return new StepUpdate(StepStatus.RUNNING, null, null, null);
    }

    public static StepUpdate resolvedArgs(Map<String, Object> args) {
        return new StepUpdate(null, args, null, null);
    }

    public static StepUpdate completed(Object output) {
        return new StepUpdate(StepStatus.COMPLETED, null, output, null);
    }

    public static StepUpdate failed(String error) {
        return new StepUpdate(StepStatus.FAILED, null, null, error);
    }

    public static StepUpdate skipped() {
        return new StepUpdate(StepStatus.SKIPPED, null, null, null);
    }
}
