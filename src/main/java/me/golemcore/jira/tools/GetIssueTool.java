package me.golemcore.jira.tools;

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

import me.golemcore.jira.domain.component.ToolComponent;
import me.golemcore.jira.domain.exception.TrackerException;
import me.golemcore.jira.domain.model.Issue;
import me.golemcore.jira.domain.model.ToolDefinition;
import me.golemcore.jira.domain.model.ToolResult;
import me.golemcore.jira.domain.service.IssueService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool returning one issue: a flattened view of the common fields plus the raw
 * {@code fields} map.
 */
@Component
@RequiredArgsConstructor
public class GetIssueTool implements ToolComponent {

    private static final String PARAM_ISSUE_KEY = "issue_key";
    private static final String PARAM_FIELDS = "fields";

    private final IssueService issueService;
    private final JiraToolSupport support;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("get_issue")
                .description("Get a Jira issue by key, with its summary, status, people, dates and all fields.")
                .inputSchema(JiraToolSupport.schema(Map.of(
                        PARAM_ISSUE_KEY, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                                "Issue key, e.g. PROJ-123"),
                        PARAM_FIELDS, JiraToolSupport.stringArray(
                                "Fields to return (default: all)")),
                        List.of(PARAM_ISSUE_KEY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return support.render(issueService.getIssue(
                        JiraToolSupport.stringParam(parameters, PARAM_ISSUE_KEY),
                        JiraToolSupport.stringListParam(parameters, PARAM_FIELDS)),
                        issue -> view(issue, true));
            } catch (TrackerException e) {
                return support.failure(e.toError());
            }
        });
    }

    static Map<String, Object> view(Issue issue, boolean includeRawFields) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("key", issue.getKey());
        view.put("id", issue.getId());
        view.put("summary", issue.getSummary());
        view.put("status", issue.getStatus());
        view.put("issue_type", issue.getIssueType());
        view.put("priority", issue.getPriority());
        view.put("assignee", issue.getAssignee());
        view.put("reporter", issue.getReporter());
        view.put("project", issue.getProjectKey());
        view.put("labels", issue.getLabels());
        view.put("created", issue.getCreated());
        view.put("updated", issue.getUpdated());
        view.put("description", issue.getDescription());
        if (includeRawFields) {
            view.put("attachments", issue.getAttachments());
            view.put("fields", issue.getFields());
        }
        return view;
    }
}
