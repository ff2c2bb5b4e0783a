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
import me.golemcore.jira.domain.model.Project;
import me.golemcore.jira.domain.model.ProjectPage;
import me.golemcore.jira.domain.model.ToolDefinition;
import me.golemcore.jira.domain.model.ToolResult;
import me.golemcore.jira.domain.service.ProjectService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
@RequiredArgsConstructor
public class GetProjectsTool implements ToolComponent {

    private static final String PARAM_INCLUDE_ARCHIVED = "include_archived";
    private static final String PARAM_MAX_RESULTS = "max_results";
    private static final String PARAM_START_AT = "start_at";

    private final ProjectService projectService;
    private final JiraToolSupport support;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("get_projects")
                .description("List Jira projects visible to the configured user.")
                .inputSchema(JiraToolSupport.schema(Map.of(
                        PARAM_INCLUDE_ARCHIVED, JiraToolSupport.property(JiraToolSupport.TYPE_BOOLEAN,
                                "Include archived projects (default false)"),
                        PARAM_MAX_RESULTS, JiraToolSupport.property(JiraToolSupport.TYPE_INTEGER,
                                "Page size, 1-100 (default 50)"),
                        PARAM_START_AT, JiraToolSupport.property(JiraToolSupport.TYPE_INTEGER,
                                "Index of the first project (default 0)")),
                        List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return support.render(projectService.getProjects(
                        JiraToolSupport.booleanParam(parameters, PARAM_INCLUDE_ARCHIVED, false),
                        JiraToolSupport.intParam(parameters, PARAM_START_AT),
                        JiraToolSupport.intParam(parameters, PARAM_MAX_RESULTS)),
                        GetProjectsTool::view);
            } catch (TrackerException e) {
                return support.failure(e.toError());
            }
        });
    }

    private static Map<String, Object> view(ProjectPage page) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("total", page.getTotal());
        view.put("start_at", page.getStartAt());
        view.put("max_results", page.getMaxResults());
        view.put("has_more", page.isHasMore());
        view.put("projects", page.getProjects().stream()
                .map(GetProjectsTool::projectView)
                .toList());
        return view;
    }

    private static Map<String, Object> projectView(Project project) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", project.getId());
        view.put("key", project.getKey());
        view.put("name", project.getName());
        view.put("description", project.getDescription());
        view.put("lead", project.getLead());
        view.put("url", project.getUrl());
        view.put("style", project.getStyle());
        view.put("archived", project.isArchived());
        view.put("category", project.getCategory());
        view.put("simplified", project.isSimplified());
        view.put("project_type_key", project.getProjectTypeKey());
        return view;
    }
}
