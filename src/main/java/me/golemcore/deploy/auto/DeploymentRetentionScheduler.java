package me.golemcore.deploy.auto;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.domain.service.DeploymentRecordService;
import me.golemcore.deploy.domain.service.SessionRunCoordinator;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background housekeeping: purges deployment records past their retention
 * window, expires confirmation prompts nobody answered and closes sessions
 * idle for longer than {@code deploy.session.idle-timeout}.
 *
 * <p>
 * All jobs run on one daemon thread. Confirmation expiry is queued onto the
 * owning session's run queue, so it never races a turn in progress.
 */
@Component
@Slf4j
public class DeploymentRetentionScheduler {

    private static final long CONFIRMATION_TICK_SECONDS = 15;
    private static final long IDLE_SWEEP_SECONDS = 300;

    private final DeploymentRecordService deploymentRecordService;
    private final SessionRunCoordinator sessionRunCoordinator;
    private final DeployProperties properties;
    private final AtomicBoolean purging = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> purgeTask;
    private ScheduledFuture<?> confirmationTask;
    private ScheduledFuture<?> idleSweepTask;

    public DeploymentRetentionScheduler(DeploymentRecordService deploymentRecordService,
            SessionRunCoordinator sessionRunCoordinator, DeployProperties properties) {
        this.deploymentRecordService = deploymentRecordService;
        this.sessionRunCoordinator = sessionRunCoordinator;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "deployment-retention-scheduler");
            t.setDaemon(true);
            return t;
        });

        long purgeSeconds = Math.max(60, properties.getDeployments().getPurgeInterval().toSeconds());
        purgeTask = scheduler.scheduleAtFixedRate(this::purgeTick, purgeSeconds, purgeSeconds, TimeUnit.SECONDS);
        confirmationTask = scheduler.scheduleAtFixedRate(this::confirmationTick,
                CONFIRMATION_TICK_SECONDS, CONFIRMATION_TICK_SECONDS, TimeUnit.SECONDS);
        idleSweepTask = scheduler.scheduleAtFixedRate(this::idleSessionTick,
                IDLE_SWEEP_SECONDS, IDLE_SWEEP_SECONDS, TimeUnit.SECONDS);
        log.info("[Retention] Started: purge every {}s, retention {}", purgeSeconds,
                properties.getDeployments().getRetention());
    }

    @PreDestroy
    public void shutdown() {
        if (purgeTask != null) {
            purgeTask.cancel(false);
        }
        if (confirmationTask != null) {
            confirmationTask.cancel(false);
        }
        if (idleSweepTask != null) {
            idleSweepTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Retention] Shut down");
    }

    void purgeTick() {
        if (!purging.compareAndSet(false, true)) {
            log.debug("[Retention] Purge skipped: previous run still in progress");
            return;
        }
        try {
            int purged = deploymentRecordService.purgeExpired();
            if (purged > 0) {
                log.info("[Retention] Tick: purged {} deployment record(s)", purged);
            }
        } catch (RuntimeException e) { // NOSONAR - keep the schedule alive
            log.error("[Retention] Purge failed: {}", e.getMessage(), e);
        } finally {
            purging.set(false);
        }
    }

    void confirmationTick() {
        try {
            int checked = sessionRunCoordinator.expireConfirmations();
            if (checked > 0) {
                log.debug("[Retention] Queued confirmation expiry check for {} session(s)", checked);
            }
        } catch (RuntimeException e) { // NOSONAR - keep the schedule alive
            log.error("[Retention] Confirmation expiry failed: {}", e.getMessage(), e);
        }
    }

    void idleSessionTick() {
        try {
            int closed = sessionRunCoordinator.closeIdleSessions(properties.getSession().getIdleTimeout());
            if (closed > 0) {
                log.info("[Retention] Closed {} idle session(s)", closed);
            }
        } catch (RuntimeException e) { // NOSONAR - keep the schedule alive
            log.error("[Retention] Idle session sweep failed: {}", e.getMessage(), e);
        }
    }
}
