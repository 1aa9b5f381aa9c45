package me.golemcore.deploy.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the deployment copilot, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code deploy.*} prefix:
 * <ul>
 * <li>{@link SessionProperties} - conversation window and confirmation
 * deadline</li>
 * <li>{@link GatewayProperties} - concurrency, timeouts and output limits of
 * the tool gateway</li>
 * <li>{@link RateLimitProperties} - external call and planning budgets</li>
 * <li>{@link WorkflowProperties} - retries and veto escalation</li>
 * <li>{@link ComplianceProperties} - deployment policy rules</li>
 * <li>{@link CredentialsProperties} - encryption key and handle lifetime</li>
 * <li>{@link AuditProperties} - buffering and retry of audit writes</li>
 * <li>{@link DeploymentsProperties} - record retention</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "deploy")
@Data
public class DeployProperties {

    private SessionProperties session = new SessionProperties();
    private GatewayProperties gateway = new GatewayProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private WorkflowProperties workflow = new WorkflowProperties();
    private ComplianceProperties compliance = new ComplianceProperties();
    private CredentialsProperties credentials = new CredentialsProperties();
    private AuditProperties audit = new AuditProperties();
    private DeploymentsProperties deployments = new DeploymentsProperties();
    private StorageProperties storage = new StorageProperties();
    private CloudProperties cloud = new CloudProperties();
    private TransportProperties transport = new TransportProperties();

    @Data
    public static class SessionProperties {
        private int turnWindow = 50;
        private Duration confirmationTimeout = Duration.ofMinutes(10);
        private String defaultPrincipal = "default";
        private Duration idleTimeout = Duration.ofHours(24);
    }

    @Data
    public static class GatewayProperties {
        private int maxConcurrent = 10;
        private Duration admissionTimeout = Duration.ofMinutes(5);
        private Duration shellTimeout = Duration.ofSeconds(120);
        private Duration cloudTimeout = Duration.ofSeconds(120);
        private int maxOutputLength = 6000;
        private int maxListItems = 5;
        private String workspaceRoot = "${user.home}/.golemcore/deploy/workspace";
    }

    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;
        private int externalCallsPerSecond = 2;
        private int planningCallsPerMinute = 4;
        private Duration admissionTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class WorkflowProperties {
        private int dryRunRetries = 1;
        private int validationRetries = 1;
        private int vetoEscalationThreshold = 2;
        private int maxStagesPerTurn = 32;
        private String buildCheckCommand = "";
        private String defaultRegion = "us-east-1";
    }

    @Data
    public static class ComplianceProperties {
        private List<String> allowedRegions = new ArrayList<>(List.of(
                "us-east-1", "us-east-2", "us-west-1", "us-west-2", "eu-west-1", "eu-central-1"));
        private List<String> allowedInstanceTypes = new ArrayList<>(List.of(
                "t2.micro", "t2.small", "t3.micro", "t3.small", "t3.medium"));
        private int maxInstanceCount = 2;
        private int maxDesiredCount = 4;
        private List<String> deniedBucketPrefixes = new ArrayList<>(List.of("aws-", "prod-"));
        private boolean requireTags = false;
    }

    @Data
    public static class CredentialsProperties {
        private String masterKey = "";
        private String masterKeyFile = "credentials/master.key";
        private Duration handleTtl = Duration.ofSeconds(30);
        private Duration storeTimeout = Duration.ofSeconds(10);
        private String overrideJson = "";
    }

    @Data
    public static class AuditProperties {
        private int bufferCapacity = 1000;
        private Duration flushInterval = Duration.ofMillis(500);
        private Duration retryInterval = Duration.ofSeconds(2);
        private Duration enqueueTimeout = Duration.ofMillis(200);
        private int memoryWindow = 500;
    }

    @Data
    public static class DeploymentsProperties {
        private Duration retention = Duration.ofDays(90);
        private Duration purgeInterval = Duration.ofHours(6);
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/deploy";
    }

    @Data
    public static class CloudProperties {
        private String provider = "sandbox";
    }

    @Data
    public static class TransportProperties {
        private Duration keepAliveInterval = Duration.ofSeconds(30);
    }
}
