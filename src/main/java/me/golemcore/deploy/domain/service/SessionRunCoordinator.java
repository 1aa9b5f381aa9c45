package me.golemcore.deploy.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.domain.model.AgentResponse;
import me.golemcore.deploy.domain.model.DeploymentException;
import me.golemcore.deploy.domain.model.DeploymentSession;
import me.golemcore.deploy.domain.model.ErrorCode;
import me.golemcore.deploy.domain.model.SessionSnapshot;
import me.golemcore.deploy.domain.workflow.IntentExtractor;
import me.golemcore.deploy.domain.workflow.WorkflowEngine;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Runs {@link WorkflowEngine} work for each session as an independent
 * sequential task.
 *
 * <p>
 * Supports:
 * </p>
 * <ul>
 * <li>Accept inbound messages while a turn is executing (queued, FIFO).</li>
 * <li>Cancel: flag the session immediately so a running turn stops at the next
 * stage or step boundary, then queue the cancellation itself.</li>
 * <li>Operator overrides and confirmation expiry run on the same queue, so no
 * two stages of one session ever run at once.</li>
 * </ul>
 */
@Service
@Slf4j
public class SessionRunCoordinator {

    private static final int MAX_QUEUED_TASKS_PER_SESSION = 100;

    private final SessionManager sessionManager;
    private final WorkflowEngine workflowEngine;
    private final IntentExtractor intentExtractor;
    private final ExecutorService sessionRunExecutor;
    private final List<SessionScopedState> sessionScopedState;

    private final Map<String, SessionRunner> runners = new ConcurrentHashMap<>();

    public SessionRunCoordinator(SessionManager sessionManager, WorkflowEngine workflowEngine,
            IntentExtractor intentExtractor, @Qualifier("sessionRunExecutor") ExecutorService sessionRunExecutor,
            List<SessionScopedState> sessionScopedState) {
        this.sessionManager = sessionManager;
        this.workflowEngine = workflowEngine;
        this.intentExtractor = intentExtractor;
        this.sessionRunExecutor = sessionRunExecutor;
        this.sessionScopedState = sessionScopedState;
    }

    public CompletableFuture<AgentResponse> submit(String sessionId, String principal, String message) {
        DeploymentSession session = sessionManager.open(sessionId, principal);
        if (intentExtractor.parse(message).command() == IntentExtractor.Command.CANCEL) {
            session.requestCancel();
        }
        return runner(session.getId()).enqueue(() -> workflowEngine.handle(session, message));
    }

    public CompletableFuture<AgentResponse> cancel(String sessionId) {
        DeploymentSession session = require(sessionId);
        session.requestCancel();
        log.info("[SessionRunCoordinator] cancel requested for session {}", sessionId);
        return runner(sessionId).enqueue(() -> workflowEngine.cancel(session));
    }

    public CompletableFuture<AgentResponse> overrideCompliance(String sessionId, String operator, String reason) {
        DeploymentSession session = require(sessionId);
        return runner(sessionId).enqueue(() -> workflowEngine.overrideCompliance(session, operator, reason));
    }

    /**
     * Queue a confirmation-expiry check for every session waiting on one.
     *
     * @return number of sessions checked
     */
    public int expireConfirmations() {
        int checked = 0;
        for (DeploymentSession session : sessionManager.all()) {
            if (session.isAwaitingConfirmation()) {
                runner(session.getId()).enqueue(() -> {
                    workflowEngine.expireConfirmation(session);
                    return null;
                });
                checked++;
            }
        }
        return checked;
    }

    /**
     * Close an idle session and release everything held for it in memory. Audit
     * and deployment records already persisted are kept.
     *
     * @return false when the session does not exist
     * @throws IllegalStateException
     *             when a turn of the session is running or queued
     */
    public boolean close(String sessionId) {
        if (sessionManager.get(sessionId).isEmpty()) {
            return false;
        }
        SessionRunner runner = runners.get(sessionId);
        if (runner != null) {
            if (!runner.retire()) {
                throw new IllegalStateException("Session " + sessionId + " is still running");
            }
            runners.remove(sessionId, runner);
        }
        sessionManager.close(sessionId);
        for (SessionScopedState state : sessionScopedState) {
            state.evictSession(sessionId);
        }
        return true;
    }

    /**
     * Close every session idle for longer than {@code idleTimeout}. Sessions
     * with work in progress are skipped until a later sweep.
     *
     * @return number of sessions closed
     */
    public int closeIdleSessions(Duration idleTimeout) {
        int closed = 0;
        for (DeploymentSession session : sessionManager.idle(idleTimeout)) {
            if (session.isAwaitingConfirmation() || isRunning(session.getId())) {
                continue;
            }
            try {
                if (close(session.getId())) {
                    closed++;
                }
            } catch (IllegalStateException e) {
                log.debug("[SessionRunCoordinator] idle session {} became busy, skipped", session.getId());
            }
        }
        return closed;
    }

    public boolean isRunning(String sessionId) {
        SessionRunner runner = runners.get(sessionId);
        return runner != null && runner.isActive();
    }

    public Optional<SessionSnapshot> describe(String sessionId) {
        return sessionManager.get(sessionId).map(session -> sessionManager.describe(session, isRunning(sessionId)));
    }

    private DeploymentSession require(String sessionId) {
        return sessionManager.get(sessionId).orElseThrow(() -> new DeploymentException(ErrorCode.VALIDATION_ERROR,
                "Unknown session: " + sessionId, "Open the session by sending a message first"));
    }

    private SessionRunner runner(String sessionId) {
        return runners.computeIfAbsent(sessionId, SessionRunner::new);
    }

    private final class SessionRunner {

        private final String sessionId;
        private final Object lock = new Object();
        private final Deque<Runnable> queue = new ArrayDeque<>();
        private boolean active;
        private boolean retired;

        private SessionRunner(String sessionId) {
            this.sessionId = sessionId;
        }

        CompletableFuture<AgentResponse> enqueue(Supplier<AgentResponse> work) {
            CompletableFuture<AgentResponse> future = new CompletableFuture<>();
            Runnable task = () -> {
                try {
                    future.complete(work.get());
                } catch (RuntimeException e) { // NOSONAR - must not kill the drain loop
                    log.error("[SessionRunCoordinator] run failed: session={}: {}", sessionId, e.getMessage(), e);
                    future.completeExceptionally(e);
                }
            };
            boolean start;
            synchronized (lock) {
                if (retired) {
                    future.completeExceptionally(new DeploymentException(ErrorCode.CANCELLED,
                            "Session " + sessionId + " was closed", "Start a new session"));
                    return future;
                }
                if (queue.size() >= MAX_QUEUED_TASKS_PER_SESSION) {
                    future.completeExceptionally(new DeploymentException(ErrorCode.RATE_LIMITED,
                            "Too many queued messages for session " + sessionId,
                            "Wait for the current deployment step to finish"));
                    return future;
                }
                queue.addLast(task);
                start = !active;
                active = true;
            }
            if (start) {
                sessionRunExecutor.execute(this::drain);
            }
            return future;
        }

        boolean retire() {
            synchronized (lock) {
                if (active) {
                    return false;
                }
                retired = true;
                return true;
            }
        }

        boolean isActive() {
            synchronized (lock) {
                return active;
            }
        }

        private void drain() {
            while (true) {
                Runnable next;
                synchronized (lock) {
                    next = queue.pollFirst();
                    if (next == null) {
                        active = false;
                        return;
                    }
                }
                next.run();
            }
        }
    }
}
