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

package org.botical.workflow.approval;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Persists approval requests. Deciding, expiring and resuming on them happens outside the engine.
 */
public interface ApprovalRequestService {

    /**
     * Creates a pending approval request.
     */
    Mono<ApprovalRequest> create(String executionId, String stepId, String message,
                                 List<String> approvers, Long timeoutMs, boolean autoApprove);
}
