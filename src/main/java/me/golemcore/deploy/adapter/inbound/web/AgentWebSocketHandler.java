package me.golemcore.deploy.adapter.inbound.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.domain.model.AgentResponse;
import me.golemcore.deploy.domain.model.DeploymentException;
import me.golemcore.deploy.domain.service.SessionRunCoordinator;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Conversational channel. Accepts {@code {"message": "..."}} frames and answers
 * with {@code agent_response} or {@code error} frames. {@code ping} frames are
 * answered with {@code pong}; the server also pings every keep-alive interval
 * and closes a connection that stayed silent for a whole interval after a
 * ping.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentWebSocketHandler implements WebSocketHandler {

    private static final String TYPE = "type";

    private final SessionRunCoordinator sessionRunCoordinator;
    private final DeployProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String sessionId = normalize(extractQueryParam(session, "sessionId"));
        if (sessionId == null) {
            sessionId = UUID.randomUUID().toString();
        }
        String principal = normalize(extractQueryParam(session, "principal"));
        String conversationId = sessionId;
        log.info("[AgentWS] Connection established: session={}, principal={}", conversationId, principal);

        AtomicBoolean awaitingPong = new AtomicBoolean(false);
        Sinks.Empty<Void> inboundDone = Sinks.empty();

        Flux<String> replies = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .doOnNext(payload -> awaitingPong.set(false))
                .flatMapSequential(payload -> reply(payload, conversationId, principal))
                .doFinally(signal -> inboundDone.tryEmitEmpty());

        Duration interval = properties.getTransport().getKeepAliveInterval();
        Flux<String> pings = Flux.interval(interval, interval)
                .takeUntilOther(inboundDone.asMono())
                .concatMap(tick -> keepAlive(session, awaitingPong, conversationId));

        return session.send(Flux.merge(replies, pings).map(session::textMessage))
                .doFinally(signal -> log.info("[AgentWS] Connection closed: session={}, signal={}",
                        conversationId, signal));
    }

    Mono<String> reply(String payload, String sessionId, String principal) {
        Map<String, Object> json;
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> parsed = objectMapper.readValue(payload, Map.class);
            json = parsed;
        } catch (JsonProcessingException e) {
            log.warn("[AgentWS] Unreadable frame on session {}: {}", sessionId, e.getOriginalMessage());
            return Mono.just(errorFrame("Message must be a JSON object like {\"message\": \"...\"}"));
        }
        Object type = json.get(TYPE);
        if ("ping".equals(type)) {
            return Mono.just(frame(Map.of(TYPE, "pong")));
        }
        if ("pong".equals(type)) {
            return Mono.empty();
        }
        Object message = json.get("message");
        if (!(message instanceof String text) || text.isBlank()) {
            return Mono.just(errorFrame("message is required"));
        }
        return Mono.defer(() -> Mono.fromFuture(sessionRunCoordinator.submit(sessionId, principal, text)))
                .map(this::responseFrame)
                .onErrorResume(e -> Mono.just(errorFrame(describe(e))));
    }

    private Mono<String> keepAlive(WebSocketSession session, AtomicBoolean awaitingPong, String sessionId) {
        if (awaitingPong.getAndSet(true)) {
            log.warn("[AgentWS] No frame for a full keep-alive interval, closing session {}", sessionId);
            return session.close().then(Mono.empty());
        }
        return Mono.just(frame(Map.of(TYPE, "ping")));
    }

    private String responseFrame(AgentResponse response) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TYPE, "agent_response");
        payload.put("session_id", response.getSessionId());
        payload.put("final_answer", response.getFinalAnswer());
        payload.put("stage", response.getStage());
        payload.put("error_code", response.getErrorCode());
        payload.put("remediation", response.getRemediation());
        payload.put("awaiting_confirmation", response.isAwaitingConfirmation());
        List<Map<String, Object>> thoughts = new ArrayList<>();
        for (AgentResponse.ThoughtStep step : response.getThoughtProcess()) {
            Map<String, Object> thought = new LinkedHashMap<>();
            thought.put("stage", step.stage());
            thought.put("thought", step.thought());
            thought.put("action", step.action());
            thought.put("observation", step.observation());
            thoughts.add(thought);
        }
        payload.put("thought_process", thoughts);
        return frame(payload);
    }

    private String errorFrame(String detail) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TYPE, "error");
        payload.put("detail", detail);
        return frame(payload);
    }

    private String frame(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof DeploymentException deploymentException) {
            String remediation = deploymentException.getRemediation();
            return remediation != null
                    ? cause.getMessage() + ". " + remediation
                    : cause.getMessage();
        }
        log.error("[AgentWS] Turn failed: {}", cause.getMessage(), cause);
        return "The request could not be processed";
    }

    private static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private String extractQueryParam(WebSocketSession session, String key) {
        URI uri = session.getHandshakeInfo().getUri();
        String query = uri.getQuery();
        if (query == null || query.isBlank()) {
            return null;
        }
        return UriComponentsBuilder.newInstance()
                .query(query)
                .build()
                .getQueryParams()
                .getFirst(key);
    }
}
