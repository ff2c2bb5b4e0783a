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
 * A Jira issue as returned by the REST API.
 *
 * <p>
 * The commonly used fields are flattened into typed properties (display names
 * for users, names for status/type/priority). {@code fields} keeps the raw
 * field map exactly as Jira sent it; the clone operation works from that map.
 */
@Data
@Builder
public class Issue {

    private String id;
    private String key;
    private String self;
    private String summary;
    private String description;
    private String status;
    private String assignee;
    private String reporter;
    private String issueType;
    private String priority;
    private String projectKey;
    private List<String> labels;
    private String created;
    private String updated;
    private List<IssueAttachment> attachments;
    private Map<String, Object> fields;
}
