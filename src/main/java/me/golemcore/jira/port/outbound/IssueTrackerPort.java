package me.golemcore.jira.port.outbound;

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
import me.golemcore.jira.domain.model.ProjectPage;
import me.golemcore.jira.domain.model.Worklog;

import java.util.List;
import java.util.Map;

/**
 * Port for the issue tracker REST API. Every method is exactly one rate
 * limited network call.
 *
 * <p>
 * Failures are raised as
 * {@link me.golemcore.jira.domain.exception.TrackerException} subclasses:
 * {@code TrackerApiException} for non-2xx responses,
 * {@code TransportException} for network failures and
 * {@code RateLimitExceededException} when the limiter rejects.
 */
public interface IssueTrackerPort {

    /**
     * Fetch an issue.
     *
     * @param issueKey
     *            issue key, e.g. {@code PROJ-123}
     * @param fields
     *            field projection; null or empty for all fields
     */
    Issue getIssue(String issueKey, List<String> fields);

    /**
     * Run one JQL search page. {@code fields} is passed through verbatim.
     */
    IssueSearchPage searchIssues(String jql, List<String> fields, int startAt, int maxResults);

    /**
     * Create an issue from a complete {@code fields} payload.
     */
    CreatedIssue createIssue(Map<String, Object> fields);

    /**
     * Overwrite the given fields of an issue; other fields are untouched.
     */
    void updateIssue(String issueKey, Map<String, Object> fields);

    Comment addComment(String issueKey, String body, Map<String, String> visibility);

    CommentPage getComments(String issueKey, int startAt, int maxResults);

    /**
     * Append a work log entry.
     *
     * @param started
     *            start time in Jira's format, or null for now
     */
    Worklog addWorklog(String issueKey, String timeSpent, String comment, String started);

    /**
     * Download the binary content of an attachment.
     */
    byte[] downloadAttachment(IssueAttachment attachment);

    /**
     * Upload a file as a new attachment of the issue.
     */
    List<IssueAttachment> uploadAttachment(String issueKey, String filename, byte[] content, String mimeType);

    /**
     * Link two issues. For the {@code Cloners} type the outward issue "clones"
     * the inward one.
     */
    void createIssueLink(String linkType, String inwardIssueKey, String outwardIssueKey);

    ProjectPage getProjects(boolean includeArchived, int startAt, int maxResults);

    /**
     * Human-facing URL of an issue. No network call.
     */
    String browseUrl(String issueKey);
}
