package me.golemcore.deploy.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.deploy.adapter.inbound.web.dto.CredentialsRequest;
import me.golemcore.deploy.domain.model.CredentialStatus;
import me.golemcore.deploy.domain.service.CredentialBroker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Credential dialog endpoints. Responses carry only the non-secret status.
 */
@RestController
@RequestMapping("/api/credentials")
@RequiredArgsConstructor
public class CredentialsController {

    private final CredentialBroker credentialBroker;

    @GetMapping
    public Mono<ResponseEntity<CredentialStatus>> status(@RequestParam(required = false) String principal,
            @RequestParam(required = false) String sessionId) {
        String owner = principal != null && !principal.isBlank() ? principal : credentialBroker.principalOf(sessionId);
        return Mono.fromCallable(() -> credentialBroker.status(owner))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping
    public Mono<ResponseEntity<CredentialStatus>> store(@RequestBody CredentialsRequest request) {
        char[] secret = request.getSecretAccessKey() != null ? request.getSecretAccessKey().toCharArray() : null;
        char[] token = request.getSessionToken() != null ? request.getSessionToken().toCharArray() : null;
        String principal = request.getPrincipal() != null && !request.getPrincipal().isBlank()
                ? request.getPrincipal()
                : credentialBroker.principalOf(request.getSessionId());
        return Mono.fromCallable(() -> credentialBroker.store(principal, request.getAccessKeyId(), secret, token,
                request.getRegion()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
