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

import java.util.List;

/**
 * One page of JQL search results. The client never fetches further pages on
 * its own; {@link #isHasMore()} tells the caller whether to ask for one.
 */
@Data
@Builder
public class IssueSearchPage {

    private List<Issue> issues;
    private long total;
    private int startAt;
    private int maxResults;

    public boolean isHasMore() {
        int returned = issues != null ? issues.size() : 0;
        return startAt + returned < total;
    }
}
