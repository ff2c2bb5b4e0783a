package me.golemcore.jira.domain.service;

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

import me.golemcore.jira.infrastructure.config.JiraProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds Jira {@code fields} values for the convenience arguments shared by
 * create, update and clone.
 *
 * <p>
 * Assignees are referenced by {@code name} (Jira Server/Data Center) or
 * {@code accountId} (Jira Cloud), chosen by
 * {@code jira.assignee-identifier}.
 */
@Component
@RequiredArgsConstructor
public class IssueFieldMapper {

    static final String ACCOUNT_ID = "accountId";
    static final String NAME = "name";

    private final JiraProperties properties;

    public Map<String, Object> project(String projectKey) {
        return Map.of("key", projectKey);
    }

    public Map<String, Object> issueType(String issueType) {
        return Map.of(NAME, issueType);
    }

    public Map<String, Object> priority(String priority) {
        return Map.of(NAME, priority);
    }

    public Map<String, Object> assignee(String assignee) {
        return Map.of(assigneeIdentifier(), assignee);
    }

    public List<String> labels(List<String> labels) {
        List<String> cleaned = new ArrayList<>();
        for (String label : labels) {
            if (label != null && !label.isBlank()) {
                cleaned.add(label.trim());
            }
        }
        return cleaned;
    }

    public String assigneeIdentifier() {
        return ACCOUNT_ID.equalsIgnoreCase(properties.getAssigneeIdentifier()) ? ACCOUNT_ID : NAME;
    }
}
