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

import org.botical.workflow.model.ErrorHandling;
import org.botical.workflow.properties.WorkflowProperties;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff schedule for the {@code retry} error strategy.
 * <p>
 * The delay before retry {@code n} (1-based) is {@code baseDelay * 2^(n-1)} plus a uniformly
 * random jitter of up to {@code jitterFactor} of that value.
 *
 * @param retryCount additional attempts after the first one
 * @param baseDelay delay before the first retry, before jitter
 * @param jitterFactor upper bound of the jitter as a fraction of the delay
 */
public record RetryPolicy(
        int retryCount,
        Duration baseDelay,
        double jitterFactor
) {

    /**
     * Three retries starting at one second with 10% jitter.
     */
    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(1), 0.1);

    public RetryPolicy {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must not be negative");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be a non-negative duration");
        }
    }

    /**
     * Builds the policy for a step, falling back to configured defaults for unset or
     * non-positive values.
     *
     * @param errorHandling the step's error handling
     * @param defaults the configured retry defaults
     * @return the effective policy
     */
    public static RetryPolicy from(ErrorHandling errorHandling, WorkflowProperties.RetryConfig defaults) {
        Integer count = errorHandling.retryCount();
        Long delay = errorHandling.retryDelay();
        return new RetryPolicy(
                count != null && count > 0 ? count : defaults.getDefaultRetryCount(),
                delay != null && delay > 0 ? Duration.ofMillis(delay) : defaults.getDefaultBaseDelay(),
                defaults.getJitterFactor());
    }

    /**
     * Gets the delay before a retry, without jitter.
     *
     * @param retry the retry number (1-based)
     * @return the base delay for that retry
     */
    public Duration getBaseDelayForRetry(int retry) {
        if (retry < 1) {
            return Duration.ZERO;
        }
        return Duration.ofMillis((long) (baseDelay.toMillis() * Math.pow(2, retry - 1)));
    }

    /**
     * Gets the jittered delay before a retry.
     *
     * @param retry the retry number (1-based)
     * @return the delay to wait
     */
    public Duration getDelayForRetry(int retry) {
        return getDelayForRetry(retry, null);
    }

    /**
     * Gets the jittered delay before a retry, raised to {@code minimumDelay} when the failure
     * asked for a longer wait (e.g. a rate-limit response).
     *
     * @param retry the retry number (1-based)
     * @param minimumDelay optional lower bound
     * @return the delay to wait
     */
    public Duration getDelayForRetry(int retry, @Nullable Duration minimumDelay) {
        long base = getBaseDelayForRetry(retry).toMillis();
        long jitter = jitterFactor > 0 && base > 0
                ? (long) (ThreadLocalRandom.current().nextDouble() * jitterFactor * base)
                : 0L;
        Duration delay = Duration.ofMillis(base + jitter);
        if (minimumDelay != null && minimumDelay.compareTo(delay) > 0) {
            return minimumDelay;
        }
        return delay;
    }

    /**
     * Gets the largest delay {@link #getDelayForRetry(int)} can return for a retry.
     *
     * @param retry the retry number (1-based)
     * @return the upper bound including jitter
     */
    public Duration getMaxDelayForRetry(int retry) {
        return Duration.ofMillis((long) (getBaseDelayForRetry(retry).toMillis() * (1 + jitterFactor)));
    }

    /**
     * Checks if another attempt should be made.
     *
     * @param failedAttempts attempts made so far, including the first one
     * @return true if retry should be attempted
     */
    public boolean shouldRetry(int failedAttempts) {
        return failedAttempts <= retryCount;
    }

    /**
     * Total number of attempts when every attempt fails.
     */
    public int getMaxAttempts() {
        return retryCount + 1;
    }
}
