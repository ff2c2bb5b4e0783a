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
import me.golemcore.jira.domain.model.AddCommentRequest;
import me.golemcore.jira.domain.model.Comment;
import me.golemcore.jira.domain.model.CommentPage;
import me.golemcore.jira.domain.model.OperationResult;
import me.golemcore.jira.port.outbound.IssueTrackerPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Adds and lists issue comments.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommentService {

    private static final int DEFAULT_PAGE_SIZE = 50;

    private final IssueTrackerPort trackerPort;

    public OperationResult<Comment> addComment(AddCommentRequest request) {
        try {
            String key = TrackerInputValidator.normalizeIssueKey(request.getIssueKey());
            String body = TrackerInputValidator.requireText(request.getBody(), "Comment");
            Map<String, String> visibility = normalizeVisibility(request.getVisibility());

            Comment comment = trackerPort.addComment(key, body, visibility);
            log.info("[Jira] Added comment {} to {}", comment.getId(), key);
            return OperationResult.success(comment);
        } catch (TrackerException e) {
            log.debug("[Jira] add_comment failed: {}", e.getMessage());
            return OperationResult.failure(e.toError());
        }
    }

    public OperationResult<CommentPage> getComments(String issueKey, Integer startAt, Integer maxResults) {
        try {
            String key = TrackerInputValidator.normalizeIssueKey(issueKey);
            int start = TrackerInputValidator.startAt(startAt);
            int size = TrackerInputValidator.pageSize(maxResults, DEFAULT_PAGE_SIZE);
            return OperationResult.success(trackerPort.getComments(key, start, size));
        } catch (TrackerException e) {
            log.debug("[Jira] get_comments failed: {}", e.getMessage());
            return OperationResult.failure(e.toError());
        }
    }

    private Map<String, String> normalizeVisibility(Map<String, String> visibility) {
        if (visibility == null || visibility.isEmpty()) {
            return null;
        }
        String type = visibility.get("type");
        String value = visibility.get("value");
        if (!"group".equals(type) && !"role".equals(type)) {
            throw new ValidationException("Comment visibility type must be 'group' or 'role'");
        }
        Map<String, String> normalized = new LinkedHashMap<>();
        normalized.put("type", type);
        normalized.put("value", TrackerInputValidator.requireText(value, "Comment visibility value"));
        return normalized;
    }
}
