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
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowEventPublisherTest {

    @Test
    void shouldBroadcastEventsToSubscribers() {
        WorkflowEventPublisher publisher = new WorkflowEventPublisher(new WorkflowProperties());

        StepVerifier.create(publisher.events().take(4))
                .then(() -> {
                    publisher.publishExecutionUpdate("wfx_1", ExecutionStatus.RUNNING).block();
                    publisher.publishStepUpdate("wfx_1", "fetch", StepStatus.COMPLETED, Map.of("output", 1)).block();
                    publisher.publishNotification("Deployed", "success").block();
                    publisher.publishApprovalRequired("apr_1", "wfx_1", "gate", "Ship it?", List.of("usr-1"), 60_000L)
                            .block();
                })
                .assertNext(event -> {
                    assertThat(event.type()).isEqualTo(WorkflowEventType.EXECUTION);
                    assertThat(event.type().getWireName()).isEqualTo("workflow.execution");
                    assertThat(event.executionId()).isEqualTo("wfx_1");
                    assertThat(event.status()).isEqualTo("running");
                })
                .assertNext(event -> {
                    assertThat(event.type()).isEqualTo(WorkflowEventType.STEP);
                    assertThat(event.stepId()).isEqualTo("fetch");
                    assertThat(event.payload()).containsEntry("output", 1);
                })
                .assertNext(event -> {
                    assertThat(event.type()).isEqualTo(WorkflowEventType.NOTIFY);
                    assertThat(event.payload()).containsEntry("message", "Deployed").containsEntry("variant", "success");
                })
                .assertNext(event -> {
                    assertThat(event.type()).isEqualTo(WorkflowEventType.APPROVAL_REQUIRED);
                    assertThat(event.payload())
                            .containsEntry("approvalId", "apr_1")
                            .containsEntry("workflowExecutionId", "wfx_1")
                            .containsEntry("timeout", 60_000L);
                })
                .verifyComplete();
    }

    @Test
    void shouldNotReplayToLateSubscribers() {
        WorkflowEventPublisher publisher = new WorkflowEventPublisher(new WorkflowProperties());
        publisher.publishExecutionUpdate("wfx_1", ExecutionStatus.RUNNING).block();

        StepVerifier.create(publisher.events())
                .expectSubscription()
                .expectNoEvent(Duration.ofMillis(50))
                .thenCancel()
                .verify();
    }

    @Test
    void shouldSkipStepEventsWhenDisabled() {
        WorkflowProperties properties = new WorkflowProperties();
        properties.getEvents().setPublishStepEvents(false);
        WorkflowEventPublisher publisher = new WorkflowEventPublisher(properties);

        StepVerifier.create(publisher.events().take(1))
                .then(() -> {
                    publisher.publishStepUpdate("wfx_1", "fetch", StepStatus.RUNNING).block();
                    publisher.publishExecutionUpdate("wfx_1", ExecutionStatus.COMPLETED).block();
                })
                .assertNext(event -> assertThat(event.type()).isEqualTo(WorkflowEventType.EXECUTION))
                .verifyComplete();
    }

    @Test
    void shouldPublishNothingWhenDisabled() {
        WorkflowProperties properties = new WorkflowProperties();
        properties.getEvents().setEnabled(false);
        WorkflowEventPublisher publisher = new WorkflowEventPublisher(properties);

        assertThat(publisher.isEnabled()).isFalse();
        StepVerifier.create(publisher.events())
                .then(() -> publisher.publishNotification("hello", "info").block())
                .expectNoEvent(Duration.ofMillis(50))
                .thenCancel()
                .verify();
    }
}
