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

import me.golemcore.jira.domain.model.BucketState;

import java.time.Duration;

/**
 * Rate limiter guarding outbound Jira API calls.
 *
 * <p>
 * {@link #acquire()} is called exactly once before every HTTP exchange. When it
 * returns, one token has been spent on behalf of the caller.
 *
 * @since 1.0
 * @see TokenBucketRateLimiter
 */
public interface RateLimiter {

    /**
     * Acquire one call token, delaying the calling thread if the configured
     * policy requires it.
     *
     * @return how long the caller was delayed, {@link Duration#ZERO} if a token
     *         was immediately available
     * @throws me.golemcore.jira.domain.exception.RateLimitExceededException
     *             if the policy rejects instead of waiting
     */
    Duration acquire();

    /**
     * Get current bucket state.
     */
    BucketState getBucketState();
}
