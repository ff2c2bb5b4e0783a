package me.golemcore.jira.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Result of a single token bucket check.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code allowed} - whether a token was consumed</li>
 * <li>{@code remainingTokens} - fractional tokens left after the check</li>
 * <li>{@code waitTime} - if denied, how long until one whole token is
 * available; {@link Duration#ZERO} when allowed</li>
 * <li>{@code reason} - explanation for denial</li>
 * </ul>
 *
 * @since 1.0
 */
@Data
@Builder
public class RateLimitResult {

    private boolean allowed;
    private double remainingTokens;
    @Builder.Default
    private Duration waitTime = Duration.ZERO;
    private String reason;

    public static RateLimitResult allowed(double remaining) {
        return RateLimitResult.builder()
                .allowed(true)
                .remainingTokens(remaining)
                .build();
    }

    public static RateLimitResult denied(double remaining, Duration waitTime, String reason) {
        return RateLimitResult.builder()
                .allowed(false)
                .remainingTokens(remaining)
                .waitTime(waitTime)
                .reason(reason)
                .build();
    }
}
