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
import me.golemcore.jira.domain.model.CommentPage;
import me.golemcore.jira.domain.model.ToolDefinition;
import me.golemcore.jira.domain.model.ToolResult;
import me.golemcore.jira.domain.service.CommentService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
@RequiredArgsConstructor
public class GetCommentsTool implements ToolComponent {

    private static final String PARAM_ISSUE_KEY = "issue_key";
    private static final String PARAM_MAX_RESULTS = "max_results";
    private static final String PARAM_START_AT = "start_at";

    private final CommentService commentService;
    private final JiraToolSupport support;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("get_comments")
                .description("List comments of a Jira issue, oldest first.")
                .inputSchema(JiraToolSupport.schema(Map.of(
                        PARAM_ISSUE_KEY, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                                "Issue key, e.g. PROJ-123"),
                        PARAM_MAX_RESULTS, JiraToolSupport.property(JiraToolSupport.TYPE_INTEGER,
                                "Page size, 1-100 (default 50)"),
                        PARAM_START_AT, JiraToolSupport.property(JiraToolSupport.TYPE_INTEGER,
                                "Index of the first comment (default 0)")),
                        List.of(PARAM_ISSUE_KEY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return support.render(commentService.getComments(
                        JiraToolSupport.stringParam(parameters, PARAM_ISSUE_KEY),
                        JiraToolSupport.intParam(parameters, PARAM_START_AT),
                        JiraToolSupport.intParam(parameters, PARAM_MAX_RESULTS)),
                        GetCommentsTool::view);
            } catch (TrackerException e) {
                return support.failure(e.toError());
            }
        });
    }

    private static Map<String, Object> view(CommentPage page) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("key", page.getIssueKey());
        view.put("total", page.getTotal());
        view.put("start_at", page.getStartAt());
        view.put("max_results", page.getMaxResults());
        view.put("has_more", page.isHasMore());
        view.put("comments", page.getComments());
        return view;
    }
}
