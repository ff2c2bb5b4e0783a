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
 * Arguments for logging work. {@code timeSpent} uses Jira duration notation
 * ({@code "2h 30m"}, {@code "1d"}); {@code startedAt} is ISO-8601 and
 * defaults to now on the Jira side.
 */
@Data
@Builder
public class LogWorkRequest {

    private String issueKey;
    private String timeSpent;
    private String comment;
    private String startedAt;
}
