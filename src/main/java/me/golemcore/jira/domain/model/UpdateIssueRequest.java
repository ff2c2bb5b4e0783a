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

import java.util.List;
import java.util.Map;

/**
 * Sparse update of an issue. Null properties are left untouched on the
 * issue. A non-blank {@code comment} is posted as a separate call.
 */
@Data
@Builder
public class UpdateIssueRequest {

    private String issueKey;
    private String summary;
    private String description;
    private String priority;
    private String assignee;
    private List<String> labels;
    private String comment;
    private Map<String, Object> customFields;
}
