package me.golemcore.jira.adapter.outbound.jira;

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

import me.golemcore.jira.domain.model.Comment;
import me.golemcore.jira.domain.model.CommentPage;
import me.golemcore.jira.domain.model.CreatedIssue;
import me.golemcore.jira.domain.model.Issue;
import me.golemcore.jira.domain.model.IssueAttachment;
import me.golemcore.jira.domain.model.IssueSearchPage;
import me.golemcore.jira.domain.model.Project;
import me.golemcore.jira.domain.model.ProjectPage;
import me.golemcore.jira.domain.model.Worklog;
import me.golemcore.jira.port.outbound.IssueTrackerPort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jira REST API v2 implementation of {@link IssueTrackerPort}.
 *
 * <p>
 * Builds request payloads and maps response JSON onto domain models. All
 * transport concerns (auth, rate limiting, error mapping) live in
 * {@link JiraHttpClient}.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JiraRestAdapter implements IssueTrackerPort {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final JiraHttpClient client;
    private final ObjectMapper objectMapper;

    @Override
    public Issue getIssue(String issueKey, List<String> fields) {
        Map<String, String> query = new LinkedHashMap<>();
        if (fields != null && !fields.isEmpty()) {
            query.put("fields", String.join(",", fields));
        }
        JsonNode node = client.exchange("GET", JiraApiPaths.issue(issueKey), query, null);
        return toIssue(node);
    }

    @Override
    public IssueSearchPage searchIssues(String jql, List<String> fields, int startAt, int maxResults) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("jql", jql);
        query.put("startAt", String.valueOf(startAt));
        query.put("maxResults", String.valueOf(maxResults));
        if (fields != null && !fields.isEmpty()) {
            query.put("fields", String.join(",", fields));
        }

        JsonNode node = client.exchange("GET", JiraApiPaths.SEARCH, query, null);
        List<Issue> issues = new ArrayList<>();
        node.path("issues").forEach(issue -> issues.add(toIssue(issue)));

        log.debug("[Jira] Search returned {} of {} issues", issues.size(), node.path("total").asLong());
        return IssueSearchPage.builder()
                .issues(issues)
                .total(node.path("total").asLong(issues.size()))
                .startAt(node.path("startAt").asInt(startAt))
                .maxResults(node.path("maxResults").asInt(maxResults))
                .build();
    }

    @Override
    public CreatedIssue createIssue(Map<String, Object> fields) {
        JsonNode node = client.exchange("POST", JiraApiPaths.ISSUE, null, Map.of("fields", fields));
        String key = text(node, "key");
        return CreatedIssue.builder()
                .id(text(node, "id"))
                .key(key)
                .self(text(node, "self"))
                .browseUrl(key != null ? client.browseUrl(key) : null)
                .build();
    }

    @Override
    public void updateIssue(String issueKey, Map<String, Object> fields) {
        client.exchange("PUT", JiraApiPaths.issue(issueKey), null, Map.of("fields", fields));
    }

    @Override
    public Comment addComment(String issueKey, String body, Map<String, String> visibility) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("body", body);
        if (visibility != null && !visibility.isEmpty()) {
            payload.put("visibility", visibility);
        }
        return toComment(client.exchange("POST", JiraApiPaths.comments(issueKey), null, payload));
    }

    @Override
    public CommentPage getComments(String issueKey, int startAt, int maxResults) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("startAt", String.valueOf(startAt));
        query.put("maxResults", String.valueOf(maxResults));

        JsonNode node = client.exchange("GET", JiraApiPaths.comments(issueKey), query, null);
        List<Comment> comments = new ArrayList<>();
        node.path("comments").forEach(comment -> comments.add(toComment(comment)));

        return CommentPage.builder()
                .issueKey(issueKey)
                .comments(comments)
                .total(node.path("total").asLong(comments.size()))
                .startAt(node.path("startAt").asInt(startAt))
                .maxResults(node.path("maxResults").asInt(maxResults))
                .build();
    }

    @Override
    public Worklog addWorklog(String issueKey, String timeSpent, String comment, String started) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timeSpent", timeSpent);
        if (comment != null) {
            payload.put("comment", comment);
        }
        if (started != null) {
            payload.put("started", started);
        }

        JsonNode node = client.exchange("POST", JiraApiPaths.worklog(issueKey), null, payload);
        return Worklog.builder()
                .id(text(node, "id"))
                .issueKey(issueKey)
                .author(displayName(node.path("author")))
                .timeSpent(node.hasNonNull("timeSpent") ? text(node, "timeSpent") : timeSpent)
                .timeSpentSeconds(node.path("timeSpentSeconds").asLong())
                .comment(node.hasNonNull("comment") ? text(node, "comment") : comment)
                .started(text(node, "started"))
                .build();
    }

    @Override
    public byte[] downloadAttachment(IssueAttachment attachment) {
        return client.download(attachment.getContentUrl());
    }

    @Override
    public List<IssueAttachment> uploadAttachment(String issueKey, String filename, byte[] content,
            String mimeType) {
        JsonNode node = client.upload(JiraApiPaths.attachments(issueKey), filename, content, mimeType);
        List<IssueAttachment> uploaded = new ArrayList<>();
        node.forEach(attachment -> uploaded.add(toAttachment(attachment)));
        return uploaded;
    }

    @Override
    public void createIssueLink(String linkType, String inwardIssueKey, String outwardIssueKey) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", Map.of("name", linkType));
        payload.put("inwardIssue", Map.of("key", inwardIssueKey));
        payload.put("outwardIssue", Map.of("key", outwardIssueKey));
        client.exchange("POST", JiraApiPaths.ISSUE_LINK, null, payload);
    }

    @Override
    public ProjectPage getProjects(boolean includeArchived, int startAt, int maxResults) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("startAt", String.valueOf(startAt));
        query.put("maxResults", String.valueOf(maxResults));
        query.put("expand", "description,lead");
        if (includeArchived) {
            query.put("status", "live,archived");
        }

        JsonNode node = client.exchange("GET", JiraApiPaths.PROJECT_SEARCH, query, null);
        List<Project> projects = new ArrayList<>();
        node.path("values").forEach(project -> projects.add(toProject(project)));

        return ProjectPage.builder()
                .projects(projects)
                .total(node.path("total").asLong(projects.size()))
                .startAt(node.path("startAt").asInt(startAt))
                .maxResults(node.path("maxResults").asInt(maxResults))
                .hasMore(!node.path("isLast").asBoolean(true))
                .build();
    }

    @Override
    public String browseUrl(String issueKey) {
        return client.browseUrl(issueKey);
    }

    Issue toIssue(JsonNode node) {
        JsonNode fields = node.path("fields");

        List<String> labels = new ArrayList<>();
        fields.path("labels").forEach(label -> labels.add(label.asText()));

        List<IssueAttachment> attachments = new ArrayList<>();
        fields.path("attachment").forEach(attachment -> attachments.add(toAttachment(attachment)));

        Map<String, Object> rawFields = fields.isObject()
                ? objectMapper.convertValue(fields, MAP_TYPE)
                : new LinkedHashMap<>();

        return Issue.builder()
                .id(text(node, "id"))
                .key(text(node, "key"))
                .self(text(node, "self"))
                .summary(text(fields, "summary"))
                .description(text(fields, "description"))
                .status(name(fields.path("status")))
                .assignee(displayName(fields.path("assignee")))
                .reporter(displayName(fields.path("reporter")))
                .issueType(name(fields.path("issuetype")))
                .priority(name(fields.path("priority")))
                .projectKey(text(fields.path("project"), "key"))
                .labels(labels)
                .created(text(fields, "created"))
                .updated(text(fields, "updated"))
                .attachments(attachments)
                .fields(rawFields)
                .build();
    }

    private Comment toComment(JsonNode node) {
        return Comment.builder()
                .id(text(node, "id"))
                .author(displayName(node.path("author")))
                .body(text(node, "body"))
                .created(text(node, "created"))
                .updated(text(node, "updated"))
                .build();
    }

    private IssueAttachment toAttachment(JsonNode node) {
        return IssueAttachment.builder()
                .id(text(node, "id"))
                .filename(text(node, "filename"))
                .mimeType(text(node, "mimeType"))
                .size(node.path("size").asLong())
                .contentUrl(text(node, "content"))
                .build();
    }

    private Project toProject(JsonNode node) {
        String key = text(node, "key");
        return Project.builder()
                .id(text(node, "id"))
                .key(key)
                .name(text(node, "name"))
                .description(text(node, "description"))
                .lead(displayName(node.path("lead")))
                .url(key != null ? client.browseUrl(key) : null)
                .projectTypeKey(text(node, "projectTypeKey"))
                .style(text(node, "style"))
                .category(name(node.path("projectCategory")))
                .simplified(node.path("simplified").asBoolean(false))
                .archived(node.path("archived").asBoolean(false))
                .build();
    }

    private static String displayName(JsonNode user) {
        if (user.isMissingNode() || user.isNull()) {
            return null;
        }
        String displayName = text(user, "displayName");
        return displayName != null ? displayName : text(user, "name");
    }

    private static String name(JsonNode node) {
        return text(node, "name");
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }
}
