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

package org.botical.workflow.health;

import org.botical.workflow.properties.WorkflowProperties;
import org.botical.workflow.resilience.ErrorClassifier;
import org.botical.workflow.resilience.WorkflowResilience;
import org.botical.workflow.state.CacheWorkflowExecutionStore;
import org.botical.workflow.state.WorkflowExecutionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkflowEngineHealthIndicatorTest {

    @Mock
    private WorkflowExecutionStore failingStore;

    private WorkflowProperties properties;
    private WorkflowResilience resilience;

    @BeforeEach
    void setUp() {
        properties = new WorkflowProperties();
        resilience = new WorkflowResilience(properties, new ErrorClassifier(), null);
    }

    @Test
    void shouldReportUpWithOpenBreakersAsDetail() {
        resilience.getOrCreateCircuitBreaker("http.get").transitionToOpenState();
        resilience.getOrCreateCircuitBreaker("mail.send");
        WorkflowEngineHealthIndicator indicator =
                new WorkflowEngineHealthIndicator(new CacheWorkflowExecutionStore(properties), resilience);

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("executionStore", "available")
                            .containsEntry("openCircuitBreakers", List.of("http.get"));
                })
                .verifyComplete();
    }

    @Test
    void shouldReportDownWhenStoreFails() {
        when(failingStore.findById("__health_check__")).thenReturn(Mono.error(new IllegalStateException("offline")));
        WorkflowEngineHealthIndicator indicator = new WorkflowEngineHealthIndicator(failingStore, resilience);

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("executionStore", "unavailable");
                })
                .verifyComplete();
    }
}
