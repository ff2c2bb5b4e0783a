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
 * Arguments for cloning an issue.
 *
 * <p>
 * Every non-null override replaces the value carried over from the source
 * issue. {@code projectKey} moves the clone into another project; when null
 * the clone stays in the source project.
 */
@Data
@Builder
public class CloneIssueRequest {

    private String sourceIssueKey;
    private String projectKey;
    private String summary;
    private String description;
    private String issueType;
    private String priority;
    private String assignee;
    private List<String> labels;
    private Map<String, Object> customFields;
    private boolean copyAttachments;
    @Builder.Default
    private boolean addLinkToSource = true;
}
