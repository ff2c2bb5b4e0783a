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

/**
 * Jira REST API v2 paths, relative to the instance base URL.
 */
final class JiraApiPaths {

    static final String PREFIX = "/rest/api/2";

    static final String ISSUE = PREFIX + "/issue";
    static final String SEARCH = PREFIX + "/search";
    static final String ISSUE_LINK = PREFIX + "/issueLink";
    static final String PROJECT_SEARCH = PREFIX + "/project/search";

    static final String BROWSE = "/browse/";

    private JiraApiPaths() {
    }

    static String issue(String issueKey) {
        return ISSUE + "/" + issueKey;
    }

    static String comments(String issueKey) {
        return issue(issueKey) + "/comment";
    }

    static String worklog(String issueKey) {
        return issue(issueKey) + "/worklog";
    }

    static String attachments(String issueKey) {
        return issue(issueKey) + "/attachments";
    }
}
