package me.golemcore.jira.ratelimit;

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

import me.golemcore.jira.domain.exception.ConfigurationException;
import me.golemcore.jira.domain.model.BucketState;
import me.golemcore.jira.domain.model.RateLimitResult;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Thread-safe token bucket with fractional tokens.
 *
 * <p>
 * The bucket:
 * <ul>
 * <li>Starts full with {@code capacity} tokens</li>
 * <li>Refills continuously at {@code capacity / refillPeriod}, never above
 * {@code capacity}</li>
 * <li>Consumes one whole token per permitted call</li>
 * <li>Denies calls while fewer than one token is available, returning the time
 * until one whole token will have accumulated</li>
 * </ul>
 *
 * <p>
 * Tokens are counted in integer units, {@code refillPeriod} nanoseconds worth
 * of units per token, so one elapsed nanosecond adds exactly {@code capacity}
 * units and refill never accumulates rounding error.
 *
 * <p>
 * Refill is computed lazily from the elapsed monotonic time on every
 * {@link #tryConsume()}. Refill and the consume decision happen under the same
 * monitor, so concurrent callers never spend the same fractional token twice.
 * A denied call does not reserve anything; the caller waits and asks again.
 *
 * @since 1.0
 */
public class TokenBucket {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final long capacity;
    private final Duration refillPeriod;
    private final LongSupplier nanoClock;
    private final long unitsPerToken;
    private final long maxUnits;
    // calls spaced by a truncated refillPeriod / capacity miss less than one
    // nanosecond of refill, i.e. at most capacity - 1 units
    private final long grantTolerance;

    private long units;
    private long lastRefillNanos;

    public TokenBucket(long capacity, Duration refillPeriod) {
        this(capacity, refillPeriod, System::nanoTime);
    }

    TokenBucket(long capacity, Duration refillPeriod, LongSupplier nanoClock) {
        if (capacity <= 0) {
            throw new ConfigurationException("Rate limit capacity must be positive, got " + capacity);
        }
        if (refillPeriod == null || refillPeriod.isZero() || refillPeriod.isNegative()) {
            throw new ConfigurationException("Rate limit period must be positive, got " + refillPeriod);
        }
        this.capacity = capacity;
        this.refillPeriod = refillPeriod;
        this.nanoClock = nanoClock;
        try {
            this.unitsPerToken = refillPeriod.toNanos();
            this.maxUnits = Math.multiplyExact(capacity, unitsPerToken);
        } catch (ArithmeticException e) {
            throw new ConfigurationException("Rate limit of " + capacity + " calls per " + refillPeriod
                    + " is too large", e);
        }
        this.grantTolerance = Math.min(capacity - 1, unitsPerToken - 1);
        this.units = maxUnits;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    /**
     * Try to consume one token.
     */
    public synchronized RateLimitResult tryConsume() {
        refill();

        if (units + grantTolerance >= unitsPerToken) {
            units = Math.max(0L, units - unitsPerToken);
            return RateLimitResult.allowed(tokens());
        }

        return RateLimitResult.denied(tokens(), timeUntilNextToken(), "Rate limit exceeded");
    }

    /**
     * Get current state of the bucket.
     */
    public synchronized BucketState getState() {
        refill();
        return BucketState.builder()
                .tokens(tokens())
                .capacity(capacity)
                .refillPeriod(refillPeriod)
                .refillRatePerSecond(capacity * NANOS_PER_SECOND / unitsPerToken)
                .build();
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsedNanos = now - lastRefillNanos;

        if (elapsedNanos <= 0) {
            return;
        }

        long added = elapsedNanos >= unitsPerToken ? maxUnits : elapsedNanos * capacity;
        units = added >= maxUnits - units ? maxUnits : units + added;
        lastRefillNanos = now;
    }

    private double tokens() {
        return (double) units / unitsPerToken;
    }

    private Duration timeUntilNextToken() {
        long missingUnits = unitsPerToken - units;
        return Duration.ofNanos(-Math.floorDiv(-missingUnits, capacity));
    }
}
