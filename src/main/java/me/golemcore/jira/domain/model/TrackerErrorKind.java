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

/**
 * Machine-readable classification of tracker operation failures.
 *
 * <p>
 * Callers branch on the kind, never on the error message text.
 */
public enum TrackerErrorKind {

    /**
     * Invalid rate-limit parameters or missing credentials. Fatal at
     * construction.
     */
    CONFIGURATION("configuration_error"),

    /**
     * Malformed operation input, rejected locally before any network call.
     */
    VALIDATION("validation_error"),

    /**
     * The limiter refused the call instead of waiting (reject policy only).
     */
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded"),

    /**
     * Network-level failure: connection refused, DNS failure, timeout.
     */
    TRANSPORT("transport_error"),

    /**
     * Non-2xx response from the tracker; carries the original status code.
     */
    TRACKER_API("tracker_api_error");

    private final String code;

    TrackerErrorKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
