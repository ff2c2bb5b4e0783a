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

/**
 * Typed error returned to callers instead of an exception. {@code status} is
 * only set for {@link TrackerErrorKind#TRACKER_API}.
 */
@Data
@Builder
public class TrackerError {

    private TrackerErrorKind kind;
    private String message;
    private Integer status;

    public static TrackerError of(TrackerErrorKind kind, String message) {
        return TrackerError.builder()
                .kind(kind)
                .message(message)
                .build();
    }

    public static TrackerError api(int status, String message) {
        return TrackerError.builder()
                .kind(TrackerErrorKind.TRACKER_API)
                .message(message)
                .status(status)
                .build();
    }
}
