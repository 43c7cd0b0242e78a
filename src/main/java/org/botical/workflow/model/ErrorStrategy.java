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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a step reacts to its own failure.
 */
public enum ErrorStrategy {

    /**
     * Fail the step. Fatal to the execution.
     */
    FAIL,

    /**
     * Complete the step with an error annotation and keep going.
     */
    CONTINUE,

    /**
     * Retry with exponential backoff, then complete with an error annotation.
     */
    RETRY;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ErrorStrategy fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
