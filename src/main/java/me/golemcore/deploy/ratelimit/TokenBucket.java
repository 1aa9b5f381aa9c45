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

import me.golemcore.deploy.domain.model.BucketState;
import me.golemcore.deploy.domain.model.RateLimitResult;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe token bucket implementation for rate limiting.
 *
 * <p>
 * The bucket starts full with {@code capacity} tokens, refills continuously
 * over {@code refillPeriod} and denies requests when empty, returning the wait
 * time until the next token.
 *
 * <p>
 * Refill is calculated lazily on each {@code tryConsume()} call based on
 * elapsed time since last refill.
 */
public class TokenBucket {

    private final long capacity;
    private final Duration refillPeriod;
    private final AtomicLong tokens;
    private final AtomicLong lastRefillNanos;
    private final NanoClock nanoClock;

    public TokenBucket(long capacity, Duration refillPeriod) {
        this(capacity, refillPeriod, System::nanoTime);
    }

    TokenBucket(long capacity, Duration refillPeriod, NanoClock nanoClock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.refillPeriod = refillPeriod;
        this.nanoClock = nanoClock;
        this.tokens = new AtomicLong(capacity);
        this.lastRefillNanos = new AtomicLong(nanoClock.nanoTime());
    }

    /**
     * Try to consume one token.
     */
    public synchronized RateLimitResult tryConsume() {
        refill();

        if (tokens.get() > 0) {
            long remaining = tokens.decrementAndGet();
            return RateLimitResult.allowed(remaining);
        }

        return RateLimitResult.denied(calculateWaitTimeMs(), "Rate limit exceeded");
    }

    public synchronized BucketState getState(String key) {
        refill();
        return BucketState.builder()
                .key(key)
                .tokens(tokens.get())
                .capacity(capacity)
                .refillPeriodMs(refillPeriod.toMillis())
                .build();
    }

    private void refill() {
        long now = nanoClock.nanoTime();
        long elapsedNanos = now - lastRefillNanos.get();

        if (elapsedNanos <= 0) {
            return;
        }

        long tokensToAdd = (elapsedNanos * capacity) / refillPeriod.toNanos();

        if (tokensToAdd > 0) {
            tokens.set(Math.min(capacity, tokens.get() + tokensToAdd));
            lastRefillNanos.set(now);
        }
    }

    private long calculateWaitTimeMs() {
        long nanosPerToken = refillPeriod.toNanos() / capacity;
        long elapsedNanos = nanoClock.nanoTime() - lastRefillNanos.get();
        long remainingNanos = Math.max(0, nanosPerToken - elapsedNanos);
        return Math.max(1, remainingNanos / 1_000_000);
    }

    @FunctionalInterface
    interface NanoClock {
        long nanoTime();
    }
}
