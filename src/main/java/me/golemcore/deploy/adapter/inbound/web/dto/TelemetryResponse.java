package me.golemcore.deploy.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Operational counters: audit backlog and loss, gateway load.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryResponse {
    private long auditDropped;
    private int auditPending;
    private int gatewayInFlight;
    private int gatewayAvailablePermits;
    private int openSessions;
    private String cloudProvider;
    private boolean cloudConfigured;
    private long uptimeMs;
}
