package me.golemcore.jira.domain.model;

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

import lombok.Builder;
import lombok.Data;

/**
 * Result of an update: the field update and the comment are separate calls
 * and are reported separately.
 */
@Data
@Builder
public class UpdateIssueResult {

    private String issueKey;
    private StepOutcome fieldUpdate;
    private StepOutcome comment;

    public boolean isAnySucceeded() {
        return fieldUpdate.getStatus() == StepStatus.SUCCEEDED || comment.getStatus() == StepStatus.SUCCEEDED;
    }

    /**
     * Error of the first failed step, null when nothing failed.
     */
    public TrackerError getFirstError() {
        if (fieldUpdate.isFailed()) {
            return fieldUpdate.getError();
        }
        return comment.isFailed() ? comment.getError() : null;
    }
}
