package me.golemcore.deploy.ratelimit;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.domain.model.BucketState;
import me.golemcore.deploy.domain.model.RateLimitResult;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import me.golemcore.deploy.port.outbound.RateLimitPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token bucket based rate limiter with two independent budgets.
 *
 * <ul>
 * <li><b>External calls</b> - per caller, default 2 per second</li>
 * <li><b>Planning calls</b> - per session, default 4 per minute</li>
 * </ul>
 *
 * <p>
 * Buckets are rebuilt when the configured capacity changes. Can be disabled via
 * {@code deploy.rate-limit.enabled=false}.
 *
 * @see TokenBucket
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TokenBucketRateLimiter implements RateLimitPort {

    private static final String EXTERNAL_PREFIX = "external:";
    private static final String PLANNING_PREFIX = "planning:";

    private final DeployProperties properties;

    private final Map<String, ConfiguredBucket> buckets = new ConcurrentHashMap<>();

    @Override
    public RateLimitResult tryConsumeExternal(String callerId) {
        if (!properties.getRateLimit().isEnabled()) {
            return RateLimitResult.allowed(Long.MAX_VALUE);
        }

        String key = EXTERNAL_PREFIX + callerId;
        int perSecond = properties.getRateLimit().getExternalCallsPerSecond();
        RateLimitResult result = resolveBucket(key, perSecond, Duration.ofSeconds(1)).tryConsume();
        if (!result.isAllowed()) {
            log.debug("[RateLimit] External call budget exhausted for {}", callerId);
        }
        return result;
    }

    @Override
    public RateLimitResult tryConsumePlanning(String sessionId) {
        if (!properties.getRateLimit().isEnabled()) {
            return RateLimitResult.allowed(Long.MAX_VALUE);
        }

        String key = PLANNING_PREFIX + sessionId;
        int perMinute = properties.getRateLimit().getPlanningCallsPerMinute();
        RateLimitResult result = resolveBucket(key, perMinute, Duration.ofMinutes(1)).tryConsume();
        if (!result.isAllowed()) {
            log.debug("[RateLimit] Planning budget exhausted for session {}", sessionId);
        }
        return result;
    }

    @Override
    public List<BucketState> getBucketStates() {
        return buckets.entrySet().stream()
                .map(entry -> entry.getValue().bucket().getState(entry.getKey()))
                .sorted(Comparator.comparing(BucketState::getKey))
                .toList();
    }

    @Override
    public void evictSession(String sessionId) {
        buckets.remove(PLANNING_PREFIX + sessionId);
        buckets.remove(EXTERNAL_PREFIX + sessionId);
    }

    private TokenBucket resolveBucket(String key, int capacity, Duration refillPeriod) {
        ConfiguredBucket configured = buckets.compute(key, (bucketKey, existing) -> {
            if (existing == null || existing.capacity() != capacity
                    || !existing.refillPeriod().equals(refillPeriod)) {
                return new ConfiguredBucket(new TokenBucket(capacity, refillPeriod), capacity, refillPeriod);
            }
            return existing;
        });
        return configured.bucket();
    }

    private record ConfiguredBucket(TokenBucket bucket, int capacity, Duration refillPeriod) {
    }
}
