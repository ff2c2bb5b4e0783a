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
import me.golemcore.jira.domain.model.CloneIssueRequest;
import me.golemcore.jira.domain.model.CloneIssueResult;
import me.golemcore.jira.domain.model.CreatedIssue;
import me.golemcore.jira.domain.model.Issue;
import me.golemcore.jira.domain.model.IssueAttachment;
import me.golemcore.jira.domain.model.OperationResult;
import me.golemcore.jira.domain.model.SubStepFailure;
import me.golemcore.jira.infrastructure.config.JiraProperties;
import me.golemcore.jira.port.outbound.IssueTrackerPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Clones an issue: fetch source, create the copy, then optionally copy
 * attachments and link the copy to the source.
 *
 * <p>
 * Failing to fetch the source or to create the copy is a total failure.
 * Attachment and link failures are collected on the
 * {@link CloneIssueResult}; the created issue is kept.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CloneIssueService {

    private final IssueTrackerPort trackerPort;
    private final CloneFieldComposer fieldComposer;
    private final JiraProperties properties;

    public OperationResult<CloneIssueResult> cloneIssue(CloneIssueRequest request) {
        String sourceKey;
        CreatedIssue created;
        Issue source;
        try {
            sourceKey = TrackerInputValidator.normalizeIssueKey(request.getSourceIssueKey());
            String targetOverride = TrackerInputValidator.normalizeOptionalProjectKey(request.getProjectKey());
            TrackerInputValidator.optionalText(request.getSummary(), "Summary");

            source = trackerPort.getIssue(sourceKey, null);
            String targetProject = targetOverride != null ? targetOverride : source.getProjectKey();
            if (targetProject == null) {
                targetProject = sourceKey.substring(0, sourceKey.lastIndexOf('-'));
            }

            Map<String, Object> fields = fieldComposer.compose(source, request, targetProject);
            created = trackerPort.createIssue(fields);
            log.info("[Jira] Cloned {} as {}", sourceKey, created.getKey());
        } catch (TrackerException e) {
            log.debug("[Jira] clone_issue {} failed: {}", request.getSourceIssueKey(), e.getMessage());
            return OperationResult.failure(e.toError());
        }

        List<SubStepFailure> failures = new ArrayList<>();
        int copied = 0;
        if (request.isCopyAttachments() && source.getAttachments() != null) {
            for (IssueAttachment attachment : source.getAttachments()) {
                if (copyAttachment(attachment, created.getKey(), failures)) {
                    copied++;
                }
            }
        }

        boolean linked = false;
        if (request.isAddLinkToSource()) {
            linked = linkToSource(sourceKey, created.getKey(), failures);
        }

        if (!failures.isEmpty()) {
            log.warn("[Jira] Clone {} of {} completed with {} failed sub-step(s)", created.getKey(), sourceKey,
                    failures.size());
        }

        return OperationResult.success(CloneIssueResult.builder()
                .key(created.getKey())
                .id(created.getId())
                .browseUrl(created.getBrowseUrl())
                .sourceKey(sourceKey)
                .attachmentsCopied(copied)
                .linkCreated(linked)
                .failures(failures)
                .build());
    }

    private boolean copyAttachment(IssueAttachment attachment, String targetKey, List<SubStepFailure> failures) {
        try {
            byte[] content = trackerPort.downloadAttachment(attachment);
            trackerPort.uploadAttachment(targetKey, attachment.getFilename(), content, attachment.getMimeType());
            return true;
        } catch (TrackerException e) {
            log.warn("[Jira] Failed to copy attachment '{}' to {}: {}", attachment.getFilename(), targetKey,
                    e.getMessage());
            failures.add(SubStepFailure.builder()
                    .step(SubStepFailure.Step.ATTACHMENT)
                    .target(attachment.getFilename())
                    .error(e.toError())
                    .build());
            return false;
        }
    }

    private boolean linkToSource(String sourceKey, String cloneKey, List<SubStepFailure> failures) {
        try {
            trackerPort.createIssueLink(properties.getClone().getLinkType(), sourceKey, cloneKey);
            return true;
        } catch (TrackerException e) {
            log.warn("[Jira] Failed to link {} to {}: {}", cloneKey, sourceKey, e.getMessage());
            failures.add(SubStepFailure.builder()
                    .step(SubStepFailure.Step.LINK)
                    .target(sourceKey)
                    .error(e.toError())
                    .build());
            return false;
        }
    }
}
