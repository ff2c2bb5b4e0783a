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
import me.golemcore.jira.domain.model.OperationResult;
import me.golemcore.jira.domain.model.ProjectPage;
import me.golemcore.jira.port.outbound.IssueTrackerPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectService {

    private static final int DEFAULT_PAGE_SIZE = 50;

    private final IssueTrackerPort trackerPort;

    public OperationResult<ProjectPage> getProjects(boolean includeArchived, Integer startAt, Integer maxResults) {
        try {
            int start = TrackerInputValidator.startAt(startAt);
            int size = TrackerInputValidator.pageSize(maxResults, DEFAULT_PAGE_SIZE);
            return OperationResult.success(trackerPort.getProjects(includeArchived, start, size));
        } catch (TrackerException e) {
            log.debug("[Jira] get_projects failed: {}", e.getMessage());
            return OperationResult.failure(e.toError());
        }
    }
}
