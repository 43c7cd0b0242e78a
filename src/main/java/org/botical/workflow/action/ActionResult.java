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

package org.botical.workflow.action;

import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * The tagged result of an action invocation.
 */
public sealed interface ActionResult permits ActionResult.Success, ActionResult.Error,
        ActionResult.Navigate, ActionResult.Ui {

    static ActionResult success(Object output) {
        return new Success(null, output, null);
    }

    static ActionResult error(String message) {
        return new Error(message, null);
    }

    record Success(@Nullable String title, @Nullable Object output,
                   @Nullable Map<String, Object> metadata) implements ActionResult {}

    /**
     * @param code optional machine-readable code, e.g. an upstream HTTP status
     */
    record Error(String message, @Nullable String code) implements ActionResult {}

    record Navigate(String pageId, @Nullable Map<String, Object> params) implements ActionResult {}

    record Ui(String action, @Nullable Object value, @Nullable String message) implements ActionResult {}
}
