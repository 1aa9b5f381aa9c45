package me.golemcore.deploy.port.outbound;

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

import me.golemcore.deploy.domain.model.BucketState;
import me.golemcore.deploy.domain.model.RateLimitResult;
import me.golemcore.deploy.domain.service.SessionScopedState;

import java.util.List;

/**
 * Port for rate limiting gateway calls.
 */
public interface RateLimitPort extends SessionScopedState {

    /**
     * Consume one token from the caller's external-call bucket.
     */
    RateLimitResult tryConsumeExternal(String callerId);

    /**
     * Consume one token from the session's planning bucket.
     */
    RateLimitResult tryConsumePlanning(String sessionId);

    List<BucketState> getBucketStates();

    /**
     * Forget the session's planning bucket and any external bucket keyed by the
     * session id.
     */
    @Override
    void evictSession(String sessionId);
}
