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

package org.botical.workflow.resilience;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.botical.workflow.exception.ActionExecutionException;
import org.botical.workflow.exception.WorkflowRejectedException;
import org.botical.workflow.exception.WorkflowValidationException;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a failed attempt is transient (worth retrying) or terminal.
 * <p>
 * Checks, in order: engine exceptions, the HTTP status an action reported as its error code,
 * then the message against upstream-outage, fatal and transient patterns. Anything unmatched
 * is treated as retryable.
 */
public class ErrorClassifier {

    private static final Set<Integer> RETRYABLE_HTTP_CODES = Set.of(408, 429, 500, 502, 503, 504, 507, 509, 510);

    private static final Set<Integer> NON_RETRYABLE_HTTP_CODES = Set.of(
            400, 401, 403, 404, 405, 406, 409, 410, 411, 412, 413, 414, 415, 416, 417, 418,
            421, 422, 423, 424, 426, 428, 431, 451);

    private static final Duration RATE_LIMIT_DELAY = Duration.ofSeconds(5);

    private static final List<Pattern> CIRCUIT_BREAKER_PATTERNS = compile(
            "service.*down",
            "service.*unavailable",
            "connection.*failed",
            "upstream.*error",
            "backend.*error",
            "database.*error",
            "external.*service.*error");

    private static final List<Pattern> FATAL_PATTERNS = compile(
            "out of memory",
            "stack overflow",
            "syntax error",
            "parse error",
            "invalid.*syntax",
            "compilation.*failed",
            "permission.*denied",
            "access.*denied",
            "authentication.*failed",
            "authorization.*failed",
            "invalid.*credentials",
            "malformed",
            "corrupt");

    private static final List<Pattern> TRANSIENT_PATTERNS = compile(
            "timeout",
            "connection.*reset",
            "connection.*refused",
            "network.*error",
            "temporary.*failure",
            "service.*unavailable",
            "rate.*limit",
            "quota.*exceeded",
            "throttle",
            "busy",
            "overload");

    /**
     * Classifies a failure.
     *
     * @param error the failure
     * @return the classification, never null
     */
    public ErrorClassification classify(Throwable error) {
        if (error instanceof WorkflowValidationException || error instanceof WorkflowRejectedException) {
            return ErrorClassification.of(ErrorCategory.NON_RETRYABLE_FATAL, false, false,
                    error.getClass().getSimpleName() + " - definition or business error, not retryable");
        }
        if (error instanceof CallNotPermittedException) {
            return ErrorClassification.of(ErrorCategory.CIRCUIT_BREAKER, true, true,
                    "Circuit breaker open, retrying after backoff");
        }

        Integer httpStatus = httpStatus(error);
        if (httpStatus != null) {
            if (NON_RETRYABLE_HTTP_CODES.contains(httpStatus)) {
                return ErrorClassification.of(ErrorCategory.NON_RETRYABLE_CLIENT, false, false,
                        "HTTP " + httpStatus + " - client error, not retryable");
            }
            if (RETRYABLE_HTTP_CODES.contains(httpStatus)) {
                return new ErrorClassification(ErrorCategory.RETRYABLE_TRANSIENT, true, httpStatus >= 500,
                        httpStatus == 429 ? RATE_LIMIT_DELAY : null,
                        "HTTP " + httpStatus + " - server error, retryable");
            }
        }

        String message = error.getMessage() != null ? error.getMessage() : error.toString();

        Pattern matched = firstMatch(CIRCUIT_BREAKER_PATTERNS, message);
        if (matched != null) {
            return ErrorClassification.of(ErrorCategory.CIRCUIT_BREAKER, true, true,
                    "Circuit breaker pattern matched: " + matched.pattern());
        }
        matched = firstMatch(FATAL_PATTERNS, message);
        if (matched != null) {
            return ErrorClassification.of(ErrorCategory.NON_RETRYABLE_FATAL, false, false,
                    "Fatal error pattern matched: " + matched.pattern());
        }
        matched = firstMatch(TRANSIENT_PATTERNS, message);
        if (matched != null) {
            return ErrorClassification.of(ErrorCategory.RETRYABLE_TRANSIENT, true, false,
                    "Transient error pattern matched: " + matched.pattern());
        }

        if (error instanceof IllegalArgumentException
                || error instanceof ClassCastException
                || error instanceof NullPointerException) {
            return ErrorClassification.of(ErrorCategory.NON_RETRYABLE_FATAL, false, false,
                    error.getClass().getSimpleName() + " - programming error, not retryable");
        }

        return ErrorClassification.of(ErrorCategory.RETRYABLE_IDEMPOTENT, true, false,
                "Unknown error type, defaulting to retryable");
    }

    private static Integer httpStatus(Throwable error) {
        if (error instanceof ActionExecutionException actionError && actionError.getCode() != null) {
            try {
                return Integer.parseInt(actionError.getCode().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Pattern firstMatch(List<Pattern> patterns, String message) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(message).find()) {
                return pattern;
            }
        }
        return null;
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
                .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
