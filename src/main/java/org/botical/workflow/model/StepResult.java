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

import org.springframework.lang.Nullable;

/**
 * The settled outcome of executing one step.
 */
public sealed interface StepResult permits StepResult.Completed, StepResult.Failed, StepResult.Skipped {

    static StepResult completed(@Nullable Object output) {
        return new Completed(output);
    }

    static StepResult failed(String error) {
        return new Failed(error, null);
    }

    static StepResult failed(String error, @Nullable Throwable cause) {
        return new Failed(error, cause);
    }

    static StepResult skipped() {
        return Skipped.INSTANCE;
    }

    StepStatus status();

    record Completed(@Nullable Object output) implements StepResult {
        @Override
        public StepStatus status() {
            return StepStatus.COMPLETED;
        }
    }

    /**
     * A failed step. {@code cause} is kept to tell definition errors apart from runtime failures.
     */
    record Failed(String error, @Nullable Throwable cause) implements StepResult {
        @Override
        public StepStatus status() {
            return StepStatus.FAILED;
        }
    }

    final class Skipped implements StepResult {

        private static final Skipped INSTANCE = new Skipped();

        private Skipped() {
        }

        @Override
        public StepStatus status() {
            return StepStatus.SKIPPED;
        }

        @Override
        public String toString() {
            return "Skipped";
        }
    }
}
