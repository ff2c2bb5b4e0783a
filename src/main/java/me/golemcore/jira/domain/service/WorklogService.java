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
import me.golemcore.jira.domain.model.LogWorkRequest;
import me.golemcore.jira.domain.model.OperationResult;
import me.golemcore.jira.domain.model.Worklog;
import me.golemcore.jira.port.outbound.IssueTrackerPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Appends work log entries. The time spent string is checked before any
 * network call; a start time without offset is read in the clock's zone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorklogService {

    private final IssueTrackerPort trackerPort;
    private final Clock clock;

    public OperationResult<Worklog> logWork(LogWorkRequest request) {
        try {
            String key = TrackerInputValidator.normalizeIssueKey(request.getIssueKey());
            String timeSpent = TrackerInputValidator.normalizeTimeSpent(request.getTimeSpent());
            String comment = request.getComment() != null && !request.getComment().isBlank()
                    ? request.getComment().trim()
                    : null;
            String started = TrackerInputValidator.toJiraDateTime(request.getStartedAt(), clock.getZone());

            Worklog worklog = trackerPort.addWorklog(key, timeSpent, comment, started);
            log.info("[Jira] Logged {} on {}", timeSpent, key);
            return OperationResult.success(worklog);
        } catch (TrackerException e) {
            log.debug("[Jira] log_work failed: {}", e.getMessage());
            return OperationResult.failure(e.toError());
        }
    }
}
