package me.golemcore.jira.domain.exception;

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

import me.golemcore.jira.domain.model.TrackerError;
import me.golemcore.jira.domain.model.TrackerErrorKind;

/**
 * Non-2xx response from Jira. Keeps the HTTP status and the message Jira
 * returned so callers can tell a 403 from a 404.
 */
public class TrackerApiException extends TrackerException {

    private static final long serialVersionUID = 1L;

    private final int status;

    public TrackerApiException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    @Override
    public TrackerErrorKind getKind() {
        return TrackerErrorKind.TRACKER_API;
    }

    @Override
    public TrackerError toError() {
        return TrackerError.api(status, getMessage());
    }
}
