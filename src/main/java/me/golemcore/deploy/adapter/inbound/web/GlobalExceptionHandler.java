package me.golemcore.deploy.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.deploy.domain.model.DeploymentException;
import me.golemcore.deploy.domain.model.ErrorCode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletionException;

/**
 * Centralized exception handler for API controllers.
 */
@ControllerAdvice(basePackages = "me.golemcore.deploy.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(DeploymentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleDeployment(DeploymentException ex) {
        HttpStatus status = statusFor(ex.getErrorCode());
        log.warn("[API] {} {}: {}", status.value(), ex.getErrorCode(), ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .code(ex.getErrorCode().name())
                .message(ex.getMessage())
                .remediation(ex.getRemediation())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(CompletionException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleCompletion(CompletionException ex) {
        if (ex.getCause() instanceof DeploymentException deploymentException) {
            return handleDeployment(deploymentException);
        }
        if (ex.getCause() instanceof IllegalStateException illegalState) {
            return handleIllegalState(illegalState);
        }
        return handleGeneric(ex);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(ex.getReason())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .code(ErrorCode.VALIDATION_ERROR.name())
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body));
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.CONFLICT.value())
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).body(body));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .message("Internal server error")
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body));
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
        case VALIDATION_ERROR, CONFIRMATION_REQUIRED, UNSUPPORTED_ACTION -> HttpStatus.BAD_REQUEST;
        case COMPLIANCE_VETO, CAPABILITY_DENIED -> HttpStatus.FORBIDDEN;
        case CREDENTIALS_MISSING -> HttpStatus.PRECONDITION_FAILED;
        case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
        case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
        case TOOL_FAILURE, ROLLBACK_FAILURE -> HttpStatus.BAD_GATEWAY;
        case CANCELLED -> HttpStatus.CONFLICT;
        };
    }
}
