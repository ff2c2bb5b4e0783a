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
import me.golemcore.jira.domain.model.LogWorkRequest;
import me.golemcore.jira.domain.model.ToolDefinition;
import me.golemcore.jira.domain.model.ToolResult;
import me.golemcore.jira.domain.service.WorklogService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
@RequiredArgsConstructor
public class LogWorkTool implements ToolComponent {

    private static final String PARAM_ISSUE_KEY = "issue_key";
    private static final String PARAM_TIME_SPENT = "time_spent";
    private static final String PARAM_COMMENT = "comment";
    private static final String PARAM_STARTED_AT = "started_at";

    private final WorklogService worklogService;
    private final JiraToolSupport support;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("log_work")
                .description("Log time spent on a Jira issue.")
                .inputSchema(JiraToolSupport.schema(Map.of(
                        PARAM_ISSUE_KEY, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                                "Issue key, e.g. PROJ-123"),
                        PARAM_TIME_SPENT, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                                "Time in Jira format, e.g. '2h 30m', '1d', '30m'"),
                        PARAM_COMMENT, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                                "Work log comment"),
                        PARAM_STARTED_AT, JiraToolSupport.property(JiraToolSupport.TYPE_STRING,
                                "ISO-8601 start time (default: now)")),
                        List.of(PARAM_ISSUE_KEY, PARAM_TIME_SPENT)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                LogWorkRequest request = LogWorkRequest.builder()
                        .issueKey(JiraToolSupport.stringParam(parameters, PARAM_ISSUE_KEY))
                        .timeSpent(JiraToolSupport.stringParam(parameters, PARAM_TIME_SPENT))
                        .comment(JiraToolSupport.stringParam(parameters, PARAM_COMMENT))
                        .startedAt(JiraToolSupport.stringParam(parameters, PARAM_STARTED_AT))
                        .build();
                return support.render(worklogService.logWork(request), worklog -> worklog);
            } catch (TrackerException e) {
                return support.failure(e.toError());
            }
        });
    }
}
