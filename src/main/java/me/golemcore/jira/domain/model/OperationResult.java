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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of an operation handler: either a success payload or a typed
 * {@link TrackerError}, never both and never neither.
 *
 * @param <T>
 *            payload type
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class OperationResult<T> {

    private final T value;
    private final TrackerError error;

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(value, null);
    }

    public static <T> OperationResult<T> failure(TrackerError error) {
        if (error == null) {
            throw new IllegalArgumentException("Failure result requires an error");
        }
        return new OperationResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    @Override
    public String toString() {
        return isSuccess() ? "OperationResult[success=" + value + "]" : "OperationResult[error=" + error + "]";
    }
}
