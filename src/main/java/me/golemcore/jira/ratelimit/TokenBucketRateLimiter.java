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

import me.golemcore.jira.domain.exception.RateLimitExceededException;
import me.golemcore.jira.domain.exception.TransportException;
import me.golemcore.jira.domain.model.BucketState;
import me.golemcore.jira.domain.model.RateLimitResult;
import me.golemcore.jira.infrastructure.config.JiraProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Token bucket based limiter for the Jira client.
 *
 * <p>
 * Owns exactly one {@link TokenBucket}, built from
 * {@code jira.rate-limit.calls} per {@code jira.rate-limit.period}. Every call
 * to {@link #acquire()} either spends a token or, depending on
 * {@code jira.rate-limit.policy}:
 * <ul>
 * <li><b>WAIT</b> - sleeps for the wait the bucket reported, then asks
 * again</li>
 * <li><b>REJECT</b> - throws {@link RateLimitExceededException}</li>
 * </ul>
 *
 * <p>
 * The sleep happens outside the bucket monitor: a waiting caller never holds
 * up other callers' bookkeeping, and no caller proceeds until it was granted
 * a whole token.
 *
 * @since 1.0
 * @see TokenBucket
 */
@Component
@Slf4j
public class TokenBucketRateLimiter implements RateLimiter {

    private final TokenBucket bucket;
    private final RateLimitPolicy policy;
    private final Sleeper sleeper;

    @Autowired
    public TokenBucketRateLimiter(JiraProperties properties) {
        this(new TokenBucket(properties.getRateLimit().getCalls(), properties.getRateLimit().getPeriod()),
                properties.getRateLimit().getPolicy(),
                duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos()));
    }

    TokenBucketRateLimiter(TokenBucket bucket, RateLimitPolicy policy, Sleeper sleeper) {
        this.bucket = bucket;
        this.policy = policy != null ? policy : RateLimitPolicy.WAIT;
        this.sleeper = sleeper;
    }

    @Override
    public Duration acquire() {
        Duration waited = Duration.ZERO;
        while (true) {
            RateLimitResult result = bucket.tryConsume();
            if (result.isAllowed()) {
                return waited;
            }

            Duration waitTime = result.getWaitTime();
            if (policy == RateLimitPolicy.REJECT) {
                log.debug("[RateLimit] Rejecting call, next token in {}ms", waitTime.toMillis());
                throw new RateLimitExceededException(waitTime);
            }

            log.info("[RateLimit] Rate limit reached. Waiting {} seconds",
                    String.format(Locale.ROOT, "%.2f", waitTime.toNanos() / 1_000_000_000d));
            sleep(waitTime);
            waited = waited.plus(waitTime);
        }
    }

    @Override
    public BucketState getBucketState() {
        return bucket.getState();
    }

    private void sleep(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for the Jira rate limit", e);
        }
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
