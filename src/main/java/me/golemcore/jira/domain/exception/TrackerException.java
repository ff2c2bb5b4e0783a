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
 * Base class of every failure raised by the tracker client layer.
 *
 * <p>
 * These exceptions travel only between the HTTP client, the REST adapter and
 * the operation services. Services convert them into
 * {@link me.golemcore.jira.domain.model.OperationResult} failures via
 * {@link #toError()}, so nothing of this hierarchy reaches the tool layer.
 *
 * @see TrackerErrorKind
 */
public abstract class TrackerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected TrackerException(String message) {
        super(message);
    }

    protected TrackerException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract TrackerErrorKind getKind();

    public TrackerError toError() {
        return TrackerError.of(getKind(), getMessage());
    }
}
