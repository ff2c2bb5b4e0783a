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
import me.golemcore.jira.domain.model.OperationResult;
import me.golemcore.jira.domain.model.StepOutcome;
import me.golemcore.jira.domain.model.ToolDefinition;
import me.golemcore.jira.domain.model.ToolResult;
import me.golemcore.jira.domain.model.UpdateIssueRequest;
import me.golemcore.jira.domain.model.UpdateIssueResult;
import me.golemcore.jira.domain.service.IssueService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Updates issue fields and/or adds a comment. The output reports the field
 * update and the comment separately ({@code skipped}, {@code succeeded} or
 * {@code failed} with the error).
 */
@Component
@RequiredArgsConstructor
public class UpdateIssueTool implements ToolComponent {

    private static final String PARAM_ISSUE_KEY = "issue_key";
    private static final String PARAM_SUMMARY = "summary";
    private static final String PARAM_DESCRIPTION = "description";
    private static final String PARAM_PRIORITY = "priority";
    private static final String PARAM_ASSIGNEE = "assignee";
    private static final String PARAM_LABELS = "labels";
    private static final String PARAM_COMMENT = "comment";
    private static final String PARAM_CUSTOM_FIELDS = "custom_fields";

    private final IssueService issueService;
    private final JiraToolSupport support;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PARAM_ISSUE_KEY, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                "Issue key, e.g. PROJ-123"));
        properties.put(PARAM_SUMMARY, JiraToolSupport.property(JiraToolSupport.TYPE_STRING, "New summary"));
        properties.put(PARAM_DESCRIPTION, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                "New description"));
        properties.put(PARAM_PRIORITY, JiraToolSupport.property(JiraToolSupport.TYPE_STRING, "New priority"));
        properties.put(PARAM_ASSIGNEE, JiraToolSupport.property(JiraToolSupport.TYPE_STRING, "New assignee"));
        properties.put(PARAM_LABELS, JiraToolSupport.stringArray("Replacement list of labels"));
        properties.put(PARAM_COMMENT, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                "Comment to add to the issue"));
        properties.put(PARAM_CUSTOM_FIELDS, JiraToolSupport.objectProperty("Custom field values to set"));

        return ToolDefinition.builder()
                .name("update_issue")
                .description("Update fields of a Jira issue and optionally add a comment.")
                .inputSchema(JiraToolSupport.schema(properties, List.of(PARAM_ISSUE_KEY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                UpdateIssueRequest request = UpdateIssueRequest.builder()
                        .issueKey(JiraToolSupport.stringParam(parameters, PARAM_ISSUE_KEY))
                        .summary(JiraToolSupport.stringParam(parameters, PARAM_SUMMARY))
                        .description(JiraToolSupport.stringParam(parameters, PARAM_DESCRIPTION))
                        .priority(JiraToolSupport.stringParam(parameters, PARAM_PRIORITY))
                        .assignee(JiraToolSupport.stringParam(parameters, PARAM_ASSIGNEE))
                        .labels(JiraToolSupport.stringListParam(parameters, PARAM_LABELS))
                        .comment(JiraToolSupport.stringParam(parameters, PARAM_COMMENT))
                        .customFields(JiraToolSupport.mapParam(parameters, PARAM_CUSTOM_FIELDS))
                        .build();
                OperationResult<UpdateIssueResult> result = issueService.updateIssue(request);
                if (result.isSuccess() && !result.getValue().isAnySucceeded()) {
                    return support.failure(result.getValue().getFirstError(), view(result.getValue()));
                }
                return support.render(result, UpdateIssueTool::view);
            } catch (TrackerException e) {
                return support.failure(e.toError());
            }
        });
    }

    private static Map<String, Object> view(UpdateIssueResult result) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("key", result.getIssueKey());
        view.put("fields", step(result.getFieldUpdate()));
        view.put("comment", step(result.getComment()));
        return view;
    }

    private static Map<String, Object> step(StepOutcome outcome) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("status", outcome.getStatus().name().toLowerCase(Locale.ROOT));
        if (outcome.getError() != null) {
            view.put("error", outcome.getError().getMessage());
            view.put("kind", outcome.getError().getKind().getCode());
        }
        return view;
    }
}
