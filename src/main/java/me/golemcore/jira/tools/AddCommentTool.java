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
import me.golemcore.jira.domain.model.AddCommentRequest;
import me.golemcore.jira.domain.model.ToolDefinition;
import me.golemcore.jira.domain.model.ToolResult;
import me.golemcore.jira.domain.service.CommentService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
@RequiredArgsConstructor
public class AddCommentTool implements ToolComponent {

    private static final String PARAM_ISSUE_KEY = "issue_key";
    private static final String PARAM_COMMENT = "comment";
    private static final String PARAM_VISIBILITY = "visibility";

    private final CommentService commentService;
    private final JiraToolSupport support;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("add_comment")
                .description("Add a comment to a Jira issue.")
                .inputSchema(JiraToolSupport.schema(Map.of(
                        PARAM_ISSUE_KEY, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                                "Issue key, e.g. PROJ-123"),
                        PARAM_COMMENT, JiraToolSupport.property(JiraToolSupport.TYPE_STRING, "Comment text"),
                        PARAM_VISIBILITY, Map.of(
                                JiraToolSupport.TYPE, JiraToolSupport.TYPE_OBJECT,
                                JiraToolSupport.DESCRIPTION, "Restrict visibility to a group or role",
                                "properties", Map.of(
                                        "type", Map.of(JiraToolSupport.TYPE, JiraToolSupport.TYPE_STRING,
                                                "enum", List.of("group", "role")),
                                        "value", Map.of(JiraToolSupport.TYPE, JiraToolSupport.TYPE_STRING)))),
                        List.of(PARAM_ISSUE_KEY, PARAM_COMMENT)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                AddCommentRequest request = AddCommentRequest.builder()
                        .issueKey(JiraToolSupport.stringParam(parameters, PARAM_ISSUE_KEY))
                        .body(JiraToolSupport.stringParam(parameters, PARAM_COMMENT))
                        .visibility(JiraToolSupport.stringMapParam(parameters, PARAM_VISIBILITY))
                        .build();
                return support.render(commentService.addComment(request), comment -> comment);
            } catch (TrackerException e) {
                return support.failure(e.toError());
            }
        });
    }
}
