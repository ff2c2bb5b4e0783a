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

import me.golemcore.jira.domain.exception.TrackerException;
import me.golemcore.jira.domain.exception.ValidationException;
import me.golemcore.jira.domain.model.CreateIssueRequest;
import me.golemcore.jira.domain.model.CreatedIssue;
import me.golemcore.jira.domain.model.Issue;
import me.golemcore.jira.domain.model.IssueSearchPage;
import me.golemcore.jira.domain.model.OperationResult;
import me.golemcore.jira.domain.model.StepOutcome;
import me.golemcore.jira.domain.model.TrackerError;
import me.golemcore.jira.domain.model.UpdateIssueRequest;
import me.golemcore.jira.domain.model.UpdateIssueResult;
import me.golemcore.jira.infrastructure.config.JiraProperties;
import me.golemcore.jira.port.outbound.IssueTrackerPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Issue read, search, create and update operations.
 *
 * <p>
 * Arguments are validated locally first; tracker faults are returned as
 * {@link OperationResult#failure(TrackerError)} and never thrown.
 *
 * <p>
 * Update performs at most two calls, attempted independently: one field
 * update and one comment. Once the arguments are valid, both steps are
 * reported as SKIPPED, SUCCEEDED or FAILED with their own error, even when
 * every attempted step failed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IssueService {

    private final IssueTrackerPort trackerPort;
    private final IssueFieldMapper fieldMapper;
    private final JiraProperties properties;

    public OperationResult<Issue> getIssue(String issueKey, List<String> fields) {
        try {
            String key = TrackerInputValidator.normalizeIssueKey(issueKey);
            return OperationResult.success(trackerPort.getIssue(key, fields));
        } catch (TrackerException e) {
            log.debug("[Jira] get_issue {} failed: {}", issueKey, e.getMessage());
            return OperationResult.failure(e.toError());
        }
    }

    public OperationResult<IssueSearchPage> searchIssues(String jql, List<String> fields, Integer startAt,
            Integer maxResults) {
        try {
            String query = TrackerInputValidator.requireText(jql, "JQL query");
            int start = TrackerInputValidator.startAt(startAt);
            int size = TrackerInputValidator.pageSize(maxResults, properties.getSearch().getDefaultMaxResults());
            List<String> projection = fields == null || fields.isEmpty()
                    ? properties.getSearch().getDefaultFields()
                    : fields;

            IssueSearchPage page = trackerPort.searchIssues(query, projection, start, size);
            log.debug("[Jira] JQL '{}' matched {} issues", query, page.getTotal());
            return OperationResult.success(page);
        } catch (TrackerException e) {
            log.debug("[Jira] search_issues failed: {}", e.getMessage());
            return OperationResult.failure(e.toError());
        }
    }

    public OperationResult<CreatedIssue> createIssue(CreateIssueRequest request) {
        try {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("project", fieldMapper.project(
                    TrackerInputValidator.normalizeProjectKey(request.getProjectKey())));
            fields.put("summary", TrackerInputValidator.requireText(request.getSummary(), "Summary"));
            String issueType = request.getIssueType() != null ? request.getIssueType() : "Task";
            fields.put("issuetype", fieldMapper.issueType(TrackerInputValidator.requireText(issueType,
                    "Issue type")));
            if (request.getDescription() != null) {
                fields.put("description", request.getDescription());
            }
            if (request.getPriority() != null) {
                fields.put("priority", fieldMapper.priority(
                        TrackerInputValidator.requireText(request.getPriority(), "Priority")));
            }
            if (request.getAssignee() != null) {
                fields.put("assignee", fieldMapper.assignee(
                        TrackerInputValidator.requireText(request.getAssignee(), "Assignee")));
            }
            if (request.getLabels() != null && !request.getLabels().isEmpty()) {
                fields.put("labels", fieldMapper.labels(request.getLabels()));
            }
            if (request.getCustomFields() != null) {
                fields.putAll(request.getCustomFields());
            }

            CreatedIssue created = trackerPort.createIssue(fields);
            log.info("[Jira] Created issue {}", created.getKey());
            return OperationResult.success(created);
        } catch (TrackerException e) {
            log.debug("[Jira] create_issue failed: {}", e.getMessage());
            return OperationResult.failure(e.toError());
        }
    }

    public OperationResult<UpdateIssueResult> updateIssue(UpdateIssueRequest request) {
        String key;
        Map<String, Object> fields;
        String comment;
        try {
            key = TrackerInputValidator.normalizeIssueKey(request.getIssueKey());
            fields = buildUpdateFields(request);
            comment = TrackerInputValidator.optionalText(request.getComment(), "Comment");
            if (fields.isEmpty() && comment == null) {
                throw new ValidationException("Nothing to update: provide at least one field or a comment");
            }
        } catch (TrackerException e) {
            return OperationResult.failure(e.toError());
        }

        StepOutcome fieldUpdate = StepOutcome.skipped();
        if (!fields.isEmpty()) {
            fieldUpdate = attempt(() -> trackerPort.updateIssue(key, fields), key, "field update");
        }
        StepOutcome commentStep = StepOutcome.skipped();
        if (comment != null) {
            commentStep = attempt(() -> trackerPort.addComment(key, comment, null), key, "comment");
        }

        return OperationResult.success(UpdateIssueResult.builder()
                .issueKey(key)
                .fieldUpdate(fieldUpdate)
                .comment(commentStep)
                .build());
    }

    private Map<String, Object> buildUpdateFields(UpdateIssueRequest request) {
        Map<String, Object> fields = new LinkedHashMap<>();
        String summary = TrackerInputValidator.optionalText(request.getSummary(), "Summary");
        if (summary != null) {
            fields.put("summary", summary);
        }
        if (request.getDescription() != null) {
            fields.put("description", request.getDescription());
        }
        String priority = TrackerInputValidator.optionalText(request.getPriority(), "Priority");
        if (priority != null) {
            fields.put("priority", fieldMapper.priority(priority));
        }
        String assignee = TrackerInputValidator.optionalText(request.getAssignee(), "Assignee");
        if (assignee != null) {
            fields.put("assignee", fieldMapper.assignee(assignee));
        }
        if (request.getLabels() != null) {
            fields.put("labels", fieldMapper.labels(request.getLabels()));
        }
        if (request.getCustomFields() != null) {
            fields.putAll(request.getCustomFields());
        }
        return fields;
    }

    private StepOutcome attempt(Runnable call, String issueKey, String step) {
        try {
            call.run();
            return StepOutcome.succeeded();
        } catch (TrackerException e) {
            log.warn("[Jira] {} of {} failed: {}", step, issueKey, e.getMessage());
            return StepOutcome.failed(e.toError());
        }
    }
}
