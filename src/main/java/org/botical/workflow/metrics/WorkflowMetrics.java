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

package org.botical.workflow.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.botical.workflow.model.ExecutionStatus;
import org.botical.workflow.model.StepStatus;
import org.botical.workflow.model.StepType;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records workflow execution metrics on a Micrometer {@link MeterRegistry}.
 * All metrics are prefixed with {@code botical.workflow.*}.
 */
@Slf4j
public class WorkflowMetrics {

    private static final String PREFIX = "botical.workflow.";

    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, AtomicInteger> activeExecutions = new ConcurrentHashMap<>();

    public WorkflowMetrics(MeterRegistry registry) {
        this.registry = registry;
        log.info("WorkflowMetrics initialized");
    }

    // ==================== Execution Metrics ====================

    public void recordExecutionStarted(String workflowId) {
        counter("started", "workflow.id", workflowId).increment();
        activeGauge(workflowId).incrementAndGet();
        log.debug("METRIC: execution.started workflowId={}", workflowId);
    }

    public void recordExecutionFinished(String workflowId, ExecutionStatus status, Duration duration) {
        String statusTag = status.value();

        counter("completed", "workflow.id", workflowId, "status", statusTag).increment();
        if (duration != null) {
            timer("duration", "workflow.id", workflowId, "status", statusTag).record(duration);
        }
        if (status == ExecutionStatus.FAILED) {
            counter("failed", "workflow.id", workflowId).increment();
        }

        AtomicInteger active = activeExecutions.get(workflowId);
        if (active != null && active.get() > 0) {
            active.decrementAndGet();
        }

        log.debug("METRIC: execution.finished workflowId={}, status={}, durationMs={}",
                workflowId, status, duration != null ? duration.toMillis() : null);
    }

    // ==================== Step Metrics ====================

    public void recordStepFinished(String workflowId, StepType type, StepStatus status, Duration duration) {
        String statusTag = status.value();

        counter("step.completed", "workflow.id", workflowId, "step.type", type.value(), "status", statusTag)
                .increment();
        if (duration != null) {
            timer("step.duration", "workflow.id", workflowId, "step.type", type.value(), "status", statusTag)
                    .record(duration);
        }

        log.debug("METRIC: step.finished workflowId={}, type={}, status={}", workflowId, type, status);
    }

    public void recordStepRetry(String stepId, int attemptNumber) {
        counter("step.retries", "step.id", stepId).increment();
        log.debug("METRIC: step.retry stepId={}, attempt={}", stepId, attemptNumber);
    }

    // ==================== Circuit Breaker Metrics ====================

    public void recordCallNotPermitted(String actionId) {
        counter("circuit-breaker.rejected", "action.id", normalizeTag(actionId)).increment();
        log.debug("METRIC: circuit-breaker.rejected actionId={}", actionId);
    }

    // ==================== Helper Methods ====================

    private Counter counter(String name, String... tags) {
        return Counter.builder(PREFIX + name).tags(tags).register(registry);
    }

    private Timer timer(String name, String... tags) {
        return Timer.builder(PREFIX + name).tags(tags).register(registry);
    }

    private AtomicInteger activeGauge(String workflowId) {
        return activeExecutions.computeIfAbsent(workflowId, id -> {
            AtomicInteger ref = new AtomicInteger(0);
            Gauge.builder(PREFIX + "active", ref, AtomicInteger::get)
                    .tag("workflow.id", id)
                    .register(registry);
            return ref;
        });
    }

    private String normalizeTag(String value) {
        if (value == null || value.isEmpty()) {
            return "unknown";
        }
        return value.replaceAll("[^a-zA-Z0-9._-]", "_").toLowerCase(Locale.ROOT);
    }
}
