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

package org.botical.workflow.event;

import org.botical.workflow.model.ExecutionStatus;
import org.botical.workflow.model.StepStatus;
import org.botical.workflow.properties.WorkflowProperties;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.Map;

/**
 * Broadcasts workflow events to every currently subscribed client.
 * <p>
 * Delivery is at-most-once per subscriber: nothing is replayed to late subscribers, and a
 * subscriber that falls more than {@code buffer-size} events behind loses the oldest ones.
 * Clients recover state from the execution store, not from the event stream.
 * <p>
 * Publishing never fails the caller; emission problems are logged and dropped.
 */
@Slf4j
public class WorkflowEventPublisher {

    private final WorkflowProperties properties;
    private final Sinks.Many<WorkflowEvent> sink;
    private final boolean enabled;

    public WorkflowEventPublisher(WorkflowProperties properties) {
        this.properties = properties;
        this.enabled = properties.getEvents().isEnabled();
        this.sink = Sinks.many().multicast().directBestEffort();

        log.info("WorkflowEventPublisher initialized: enabled={}, stepEvents={}",
                enabled, properties.getEvents().isPublishStepEvents());
    }

    /**
     * Live stream of events. Each subscriber gets its own bounded buffer.
     */
    public Flux<WorkflowEvent> events() {
        return sink.asFlux()
                .onBackpressureBuffer(properties.getEvents().getBufferSize(), BufferOverflowStrategy.DROP_OLDEST);
    }

    public Mono<Void> publishExecutionUpdate(String executionId, ExecutionStatus status) {
        return publishEvent(WorkflowEvent.execution(executionId, status, null));
    }

    public Mono<Void> publishExecutionUpdate(String executionId, ExecutionStatus status, Map<String, Object> data) {
        return publishEvent(WorkflowEvent.execution(executionId, status, data));
    }

    public Mono<Void> publishStepUpdate(String executionId, String stepId, StepStatus status) {
        return publishStepUpdate(executionId, stepId, status, null);
    }

    public Mono<Void> publishStepUpdate(String executionId, String stepId, StepStatus status, Map<String, Object> data) {
        if (!properties.getEvents().isPublishStepEvents()) {
            return Mono.empty();
        }
        return publishEvent(WorkflowEvent.step(executionId, stepId, status, data));
    }

    public Mono<Void> publishNotification(String message, String variant) {
        return publishEvent(WorkflowEvent.notification(message, variant));
    }

    public Mono<Void> publishApprovalRequired(String approvalId, String executionId, String stepId,
                                              String message, List<String> approvers, Long timeout) {
        return publishEvent(WorkflowEvent.approvalRequired(approvalId, executionId, stepId, message, approvers, timeout));
    }

    /**
     * Whether event broadcast is enabled.
     */
    public boolean isEnabled() {
        return enabled;
    }

    private Mono<Void> publishEvent(WorkflowEvent event) {
        if (!enabled) {
            return Mono.empty();
        }

        return Mono.<Void>fromRunnable(() -> emit(event))
                .onErrorResume(e -> {
                    log.warn("Failed to publish workflow event: type={}, executionId={}, error={}",
                            event.type(), event.executionId(), e.getMessage());
                    return Mono.empty();
                });
    }

    private void emit(WorkflowEvent event) {
        Sinks.EmitResult result;
        // Steps of one level emit from different threads; the sink requires serialized emission.
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Workflow event dropped: type={}, executionId={}, result={}",
                    event.type(), event.executionId(), result);
        } else {
            log.debug("Published event: type={}, executionId={}, stepId={}",
                    event.type(), event.executionId(), event.stepId());
        }
    }
}
