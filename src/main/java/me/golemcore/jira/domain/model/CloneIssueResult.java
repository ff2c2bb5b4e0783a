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

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a clone. A non-empty {@code failures} list means partial failure:
 * the issue was created but some attachment copies or the link were not.
 */
@Data
@Builder
public class CloneIssueResult {

    private String key;
    private String id;
    private String browseUrl;
    private String sourceKey;
    private int attachmentsCopied;
    private boolean linkCreated;
    @Builder.Default
    private List<SubStepFailure> failures = new ArrayList<>();

    public boolean isPartialFailure() {
        return failures != null && !failures.isEmpty();
    }
}
