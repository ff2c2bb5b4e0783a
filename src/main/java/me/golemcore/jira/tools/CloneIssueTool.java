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
import me.golemcore.jira.domain.model.CloneIssueRequest;
import me.golemcore.jira.domain.model.CloneIssueResult;
import me.golemcore.jira.domain.model.SubStepFailure;
import me.golemcore.jira.domain.model.ToolDefinition;
import me.golemcore.jira.domain.model.ToolResult;
import me.golemcore.jira.domain.service.CloneIssueService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Clones an issue, optionally into another project. A clone whose attachment
 * copy or source link failed is reported with status {@code partial_failure}
 * and the list of failed sub-steps.
 */
@Component
@RequiredArgsConstructor
public class CloneIssueTool implements ToolComponent {

    private static final String PARAM_SOURCE_ISSUE_KEY = "source_issue_key";
    private static final String PARAM_PROJECT_KEY = "project_key";
    private static final String PARAM_SUMMARY = "summary";
    private static final String PARAM_DESCRIPTION = "description";
    private static final String PARAM_ISSUE_TYPE = "issue_type";
    private static final String PARAM_PRIORITY = "priority";
    private static final String PARAM_ASSIGNEE = "assignee";
    private static final String PARAM_LABELS = "labels";
    private static final String PARAM_CUSTOM_FIELDS = "custom_fields";
    private static final String PARAM_COPY_ATTACHMENTS = "copy_attachments";
    private static final String PARAM_ADD_LINK = "add_link_to_source";

    private final CloneIssueService cloneIssueService;
    private final JiraToolSupport support;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PARAM_SOURCE_ISSUE_KEY, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                "Issue to clone, e.g. PROJ-123"));
        properties.put(PARAM_PROJECT_KEY, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                "Target project key (default: source project)"));
        properties.put(PARAM_SUMMARY, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                "New summary (default: 'Clone of <source summary>')"));
        properties.put(PARAM_DESCRIPTION, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                "New description (default: source description)"));
        properties.put(PARAM_ISSUE_TYPE, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                "Issue type (default: source issue type)"));
        properties.put(PARAM_PRIORITY, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                "Priority (default: source priority)"));
        properties.put(PARAM_ASSIGNEE, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                "Assignee (default: source assignee)"));
        properties.put(PARAM_LABELS, JiraToolSupport.stringArray("Labels (default: source labels)"));
        properties.put(PARAM_CUSTOM_FIELDS, JiraToolSupport.objectProperty("Field values to override"));
        properties.put(PARAM_COPY_ATTACHMENTS, JiraToolSupport.property(JiraToolSupport.TYPE_BOOLEAN,
                "Copy attachments to the clone (default false)"));
        properties.put(PARAM_ADD_LINK, JiraToolSupport.property(JiraToolSupport.TYPE_BOOLEAN,
                "Link the clone to the source issue (default true)"));

        return ToolDefinition.builder()
                .name("clone_issue")
                .description("Clone a Jira issue, copying its fields with optional overrides.")
                .inputSchema(JiraToolSupport.schema(properties, List.of(PARAM_SOURCE_ISSUE_KEY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                CloneIssueRequest request = CloneIssueRequest.builder()
                        .sourceIssueKey(JiraToolSupport.stringParam(parameters, PARAM_SOURCE_ISSUE_KEY))
                        .projectKey(JiraToolSupport.stringParam(parameters, PARAM_PROJECT_KEY))
                        .summary(JiraToolSupport.stringParam(parameters, PARAM_SUMMARY))
                        .description(JiraToolSupport.stringParam(parameters, PARAM_DESCRIPTION))
                        .issueType(JiraToolSupport.stringParam(parameters, PARAM_ISSUE_TYPE))
                        .priority(JiraToolSupport.stringParam(parameters, PARAM_PRIORITY))
                        .assignee(JiraToolSupport.stringParam(parameters, PARAM_ASSIGNEE))
                        .labels(JiraToolSupport.stringListParam(parameters, PARAM_LABELS))
                        .customFields(JiraToolSupport.mapParam(parameters, PARAM_CUSTOM_FIELDS))
                        .copyAttachments(JiraToolSupport.booleanParam(parameters, PARAM_COPY_ATTACHMENTS, false))
                        .addLinkToSource(JiraToolSupport.booleanParam(parameters, PARAM_ADD_LINK, true))
                        .build();
                return support.render(cloneIssueService.cloneIssue(request), CloneIssueTool::view);
            } catch (TrackerException e) {
                return support.failure(e.toError());
            }
        });
    }

    private static Map<String, Object> view(CloneIssueResult result) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("status", result.isPartialFailure() ? "partial_failure" : "success");
        view.put("key", result.getKey());
        view.put("id", result.getId());
        view.put("url", result.getBrowseUrl());
        view.put("source_key", result.getSourceKey());
        view.put("attachments_copied", result.getAttachmentsCopied());
        view.put("link_created", result.isLinkCreated());
        if (result.isPartialFailure()) {
            view.put("failures", result.getFailures().stream()
                    .map(CloneIssueTool::failureView)
                    .toList());
        }
        return view;
    }

    private static Map<String, Object> failureView(SubStepFailure failure) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("step", failure.getStep().name().toLowerCase(Locale.ROOT));
        view.put("target", failure.getTarget());
        view.put("kind", failure.getError().getKind().getCode());
        view.put("message", failure.getError().getMessage());
        return view;
    }
}
