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
import me.golemcore.jira.domain.model.CreateIssueRequest;
import me.golemcore.jira.domain.model.ToolDefinition;
import me.golemcore.jira.domain.model.ToolResult;
import me.golemcore.jira.domain.service.IssueService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
@RequiredArgsConstructor
public class CreateIssueTool implements ToolComponent {

    private static final String PARAM_PROJECT_KEY = "project_key";
    private static final String PARAM_SUMMARY = "summary";
    private static final String PARAM_DESCRIPTION = "description";
    private static final String PARAM_ISSUE_TYPE = "issue_type";
    private static final String PARAM_PRIORITY = "priority";
    private static final String PARAM_ASSIGNEE = "assignee";
    private static final String PARAM_LABELS = "labels";
    private static final String PARAM_CUSTOM_FIELDS = "custom_fields";

    private final IssueService issueService;
    private final JiraToolSupport support;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PARAM_PROJECT_KEY, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                "Project key, e.g. PROJ"));
        properties.put(PARAM_SUMMARY, JiraToolSupport.property(JiraToolSupport.TYPE_STRING, "Issue summary"));
        properties.put(PARAM_DESCRIPTION, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                "Issue description"));
        properties.put(PARAM_ISSUE_TYPE, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                "Issue type, e.g. Bug, Task, Story (default Task)"));
        properties.put(PARAM_PRIORITY, JiraToolSupport.property(JiraToolSupport.TYPE_STRING, "Priority name"));
        properties.put(PARAM_ASSIGNEE, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                "Assignee username or account id"));
        properties.put(PARAM_LABELS, JiraToolSupport.stringArray("Labels"));
        properties.put(PARAM_CUSTOM_FIELDS, JiraToolSupport.objectProperty(
                "Extra fields by id, e.g. {\"customfield_10010\": 5}"));

        return ToolDefinition.builder()
                .name("create_issue")
                .description("Create a Jira issue.")
                .inputSchema(JiraToolSupport.schema(properties, List.of(PARAM_PROJECT_KEY, PARAM_SUMMARY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                CreateIssueRequest.CreateIssueRequestBuilder request = CreateIssueRequest.builder()
                        .projectKey(JiraToolSupport.stringParam(parameters, PARAM_PROJECT_KEY))
                        .summary(JiraToolSupport.stringParam(parameters, PARAM_SUMMARY))
                        .description(JiraToolSupport.stringParam(parameters, PARAM_DESCRIPTION))
                        .priority(JiraToolSupport.stringParam(parameters, PARAM_PRIORITY))
                        .assignee(JiraToolSupport.stringParam(parameters, PARAM_ASSIGNEE))
                        .labels(JiraToolSupport.stringListParam(parameters, PARAM_LABELS))
                        .customFields(JiraToolSupport.mapParam(parameters, PARAM_CUSTOM_FIELDS));
                String issueType = JiraToolSupport.stringParam(parameters, PARAM_ISSUE_TYPE);
                if (issueType != null) {
                    request.issueType(issueType);
                }
                return support.render(issueService.createIssue(request.build()), created -> {
                    Map<String, Object> view = new LinkedHashMap<>();
                    view.put("key", created.getKey());
                    view.put("id", created.getId());
                    view.put("url", created.getBrowseUrl());
                    return view;
                });
            } catch (TrackerException e) {
                return support.failure(e.toError());
            }
        });
    }
}
