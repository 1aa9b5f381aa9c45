package me.golemcore.deploy.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Conversation-scoped deployment state: the current stage, the accumulated
 * intent, the one active plan and a bounded window of recent turns.
 *
 * <p>
 * Instances are owned by {@code SessionManager}. Stage and plan change only
 * through the workflow engine, which runs at most one turn per session at a
 * time.
 */
@Getter
public class DeploymentSession {

    private final String id;
    private final String principal;
    private final Instant createdAt;
    private final int turnWindow;
    @Getter(AccessLevel.NONE)
    private final Deque<ConversationTurn> turns = new ArrayDeque<>();
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    @Setter
    private Stage stage = Stage.INTAKE;
    @Setter
    private DeploymentIntent intent = new DeploymentIntent();
    @Setter
    private Plan activePlan;
    @Setter
    private String contextSummary;
    @Setter
    private Instant confirmationDeadline;
    @Setter
    private String lastError;
    @Setter
    private ErrorCode lastErrorCode;
    @Setter
    private String lastRemediation;
    @Setter
    private String deploymentId;
    @Setter
    private Instant updatedAt;

    public DeploymentSession(String id, String principal, Instant createdAt, int turnWindow) {
        this.id = id;
        this.principal = principal;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.turnWindow = Math.max(1, turnWindow);
    }

    public synchronized void addTurn(ConversationTurn turn) {
        turns.addLast(turn);
        while (turns.size() > turnWindow) {
            turns.removeFirst();
        }
        updatedAt = turn.timestamp();
    }

    public synchronized List<ConversationTurn> getTurnsSnapshot() {
        return new ArrayList<>(turns);
    }

    public synchronized int getTurnCount() {
        return turns.size();
    }

    public boolean isAwaitingConfirmation() {
        return confirmationDeadline != null;
    }

    public void requestCancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public void clearCancel() {
        cancelRequested.set(false);
    }

    /**
     * Drop everything tied to the previous deployment intent. The turn window is
     * kept.
     */
    public void resetForNewIntent() {
        intent = new DeploymentIntent();
        resetForRetry();
    }

    /**
     * Drop the plan and outcome of a failed attempt but keep the intent, so the
     * user only has to correct what was wrong.
     */
    public void resetForRetry() {
        activePlan = null;
        contextSummary = null;
        confirmationDeadline = null;
        lastError = null;
        lastErrorCode = null;
        lastRemediation = null;
        deploymentId = null;
        cancelRequested.set(false);
    }
}
