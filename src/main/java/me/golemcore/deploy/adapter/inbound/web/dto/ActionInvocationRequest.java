package me.golemcore.deploy.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Direct action call. {@code params} may be a JSON object or a JSON string.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionInvocationRequest {
    private String action;
    private Object params;
    @Builder.Default
    private boolean confirm = false;
    @JsonAlias("session_id")
    private String sessionId;
    private String principal;
}
