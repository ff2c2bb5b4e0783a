package me.golemcore.jira.infrastructure.config;

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

import me.golemcore.jira.ratelimit.RateLimitPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.yml.
 *
 * <p>
 * All configuration is organized under the {@code jira.*} prefix:
 * <ul>
 * <li>{@code jira.url}, {@code jira.username}, {@code jira.api-token} -
 * instance and credentials (environment: {@code JIRA_URL},
 * {@code JIRA_USERNAME}, {@code JIRA_API_TOKEN})</li>
 * <li>{@link RateLimitProperties} - token bucket parameters</li>
 * <li>{@link HttpProperties} - transport timeouts</li>
 * <li>{@link CloneProperties} - clone field filtering and linking</li>
 * <li>{@link McpProperties} - tool server identity</li>
 * </ul>
 *
 * <p>
 * Values are read once at startup; nothing reloads them.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "jira")
@Data
public class JiraProperties {

    private String url;
    private String username;
    private String apiToken;
    private String assigneeIdentifier = "name";
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private HttpProperties http = new HttpProperties();
    private SearchProperties search = new SearchProperties();
    private CloneProperties clone = new CloneProperties();
    private McpProperties mcp = new McpProperties();

    @Data
    public static class RateLimitProperties {
        private long calls = 100;
        private Duration period = Duration.ofSeconds(60);
        private RateLimitPolicy policy = RateLimitPolicy.WAIT;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private long callTimeout = 60000;
    }

    @Data
    public static class SearchProperties {
        private int defaultMaxResults = 50;
        private List<String> defaultFields = new ArrayList<>(List.of(
                "key", "summary", "status", "assignee", "issuetype", "priority", "created", "updated"));
    }

    @Data
    public static class CloneProperties {
        private String summaryPrefix = "Clone of ";
        private String linkType = "Cloners";
        private List<String> excludedFields = new ArrayList<>(List.of(
                "project", "created", "updated", "lastViewed", "status", "statusCategoryChangedate",
                "resolution", "resolutiondate", "creator", "reporter", "votes", "watches", "worklog",
                "comment", "attachment", "issuelinks", "subtasks", "progress", "aggregateprogress",
                "timespent", "aggregatetimespent", "aggregatetimeestimate", "aggregatetimeoriginalestimate",
                "timeestimate", "timeoriginalestimate", "timetracking", "workratio"));
    }

    @Data
    public static class McpProperties {
        private boolean enabled = true;
        private String serverName = "golemcore-jira";
        private String serverVersion = "1.0.0";
    }
}
