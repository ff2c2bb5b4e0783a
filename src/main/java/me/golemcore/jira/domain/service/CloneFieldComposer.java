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

import me.golemcore.jira.domain.model.CloneIssueRequest;
import me.golemcore.jira.domain.model.Issue;
import me.golemcore.jira.infrastructure.config.JiraProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Composes the {@code fields} payload for a cloned issue.
 *
 * <p>
 * Order of application:
 * <ol>
 * <li>every non-null source field not in {@code jira.clone.excluded-fields}
 * <li>target project (override or source project)
 * <li>summary with {@code jira.clone.summary-prefix}
 * <li>explicit overrides, custom fields last
 * </ol>
 *
 * <p>
 * Reference values (users, priorities, options, versions) are reduced to the
 * identity Jira accepts on create.
 */
@Component
@RequiredArgsConstructor
public class CloneFieldComposer {

    private final JiraProperties properties;
    private final IssueFieldMapper fieldMapper;

    public Map<String, Object> compose(Issue source, CloneIssueRequest request, String targetProjectKey) {
        Set<String> excluded = new HashSet<>(properties.getClone().getExcludedFields());
        Map<String, Object> fields = new LinkedHashMap<>();

        Map<String, Object> sourceFields = source.getFields() != null ? source.getFields() : Map.of();
        sourceFields.forEach((name, value) -> {
            if (value != null && !excluded.contains(name)) {
                Object reduced = reduce(value);
                if (reduced != null) {
                    fields.put(name, reduced);
                }
            }
        });

        fields.put("project", fieldMapper.project(targetProjectKey));
        if (request.getSummary() != null) {
            fields.put("summary", request.getSummary());
        } else if (source.getSummary() != null) {
            fields.put("summary", properties.getClone().getSummaryPrefix() + source.getSummary());
        }

        applyOverrides(fields, request);
        return fields;
    }

    private void applyOverrides(Map<String, Object> fields, CloneIssueRequest request) {
        if (request.getDescription() != null) {
            fields.put("description", request.getDescription());
        }
        if (request.getIssueType() != null) {
            fields.put("issuetype", fieldMapper.issueType(request.getIssueType()));
        }
        if (request.getPriority() != null) {
            fields.put("priority", fieldMapper.priority(request.getPriority()));
        }
        if (request.getAssignee() != null) {
            fields.put("assignee", fieldMapper.assignee(request.getAssignee()));
        }
        if (request.getLabels() != null) {
            fields.put("labels", fieldMapper.labels(request.getLabels()));
        }
        if (request.getCustomFields() != null) {
            fields.putAll(request.getCustomFields());
        }
    }

    @SuppressWarnings("unchecked")
    private Object reduce(Object value) {
        if (value instanceof Map) {
            return reduceReference((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> reduced = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                Object r = reduce(item);
                if (r != null) {
                    reduced.add(r);
                }
            }
            return reduced;
        }
        return value;
    }

    private Map<String, Object> reduceReference(Map<String, Object> reference) {
        if (reference.get(IssueFieldMapper.ACCOUNT_ID) != null) {
            return Map.of(IssueFieldMapper.ACCOUNT_ID, reference.get(IssueFieldMapper.ACCOUNT_ID));
        }
        boolean user = reference.containsKey("displayName") || reference.containsKey("emailAddress");
        if (user && reference.get(IssueFieldMapper.NAME) != null) {
            return Map.of(IssueFieldMapper.NAME, reference.get(IssueFieldMapper.NAME));
        }
        if (reference.get("id") != null) {
            return Map.of("id", reference.get("id"));
        }
        if (reference.get("key") != null) {
            return Map.of("key", reference.get("key"));
        }
        return reference;
    }
}
