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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The {@code onError} policy of an action, session or workflow step.
 *
 * @param strategy what to do when the step fails
 * @param retryCount additional attempts after the first failure (retry strategy only)
 * @param retryDelay base backoff delay in milliseconds (retry strategy only)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorHandling(
        ErrorStrategy strategy,
        Integer retryCount,
        Long retryDelay
) {

    public ErrorHandling {
        if (strategy == null) {
            strategy = ErrorStrategy.FAIL;
        }
    }

    public static ErrorHandling fail() {
        return new ErrorHandling(ErrorStrategy.FAIL, null, null);
    }

    public static ErrorHandling continueOnError() {
        return new ErrorHandling(ErrorStrategy.CONTINUE, null, null);
    }

    public static ErrorHandling retry(int retryCount, long retryDelay) {
        return new ErrorHandling(ErrorStrategy.RETRY, retryCount, retryDelay);
    }
}
