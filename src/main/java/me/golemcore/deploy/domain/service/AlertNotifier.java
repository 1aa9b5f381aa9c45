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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.domain.model.AuditEvent;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Default alert subscriber: raises failures, escalations and compliance vetoes
 * at ERROR level so that log-based paging picks them up.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlertNotifier {

    private final AuditSink auditSink;
    private final AtomicLong alertCount = new AtomicLong();

    @PostConstruct
    public void register() {
        auditSink.subscribe(AuditSink.ALERT_FILTER, this::onAlert);
    }

    void onAlert(AuditEvent event) {
        alertCount.incrementAndGet();
        log.error("[Alert] session={} seq={} stage={} tool={} status={} code={} detail={}",
                event.sessionId(), event.sequence(), event.stage(), event.tool(), event.status(),
                event.errorCode(), event.detail());
    }

    public long getAlertCount() {
        return alertCount.get();
    }
}
