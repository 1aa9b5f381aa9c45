package me.golemcore.deploy.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.deploy.domain.model.DeploymentRecord;
import me.golemcore.deploy.domain.service.DeploymentRecordService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Read access to persisted deployment records.
 */
@RestController
@RequestMapping("/api/deployments")
@RequiredArgsConstructor
public class DeploymentsController {

    private final DeploymentRecordService deploymentRecordService;

    @GetMapping
    public Mono<ResponseEntity<List<DeploymentRecord>>> listDeployments() {
        return Mono.fromCallable(deploymentRecordService::list)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<DeploymentRecord>> getDeployment(@PathVariable String id) {
        return Mono.fromCallable(() -> deploymentRecordService.find(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Deployment not found")))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
