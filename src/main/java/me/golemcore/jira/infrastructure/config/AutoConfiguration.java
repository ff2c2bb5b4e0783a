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

import me.golemcore.jira.adapter.inbound.mcp.McpStdioServer;
import me.golemcore.jira.domain.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import jakarta.annotation.PostConstruct;

import java.time.Clock;

/**
 * Spring configuration shared beans and startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link ObjectMapper} and {@link Clock} beans</li>
 * <li>Validates the rate limit settings at startup</li>
 * <li>Starts the MCP stdio server when {@code jira.mcp.enabled} is true</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final JiraProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        JiraProperties.RateLimitProperties rateLimit = properties.getRateLimit();
        if (rateLimit.getCalls() <= 0) {
            throw new ConfigurationException("jira.rate-limit.calls must be positive, got " + rateLimit.getCalls());
        }
        if (rateLimit.getPeriod() == null || rateLimit.getPeriod().isZero() || rateLimit.getPeriod().isNegative()) {
            throw new ConfigurationException("jira.rate-limit.period must be positive, got " + rateLimit.getPeriod());
        }
        log.info("GolemCore Jira starting...");
        log.info("Jira URL: {}", properties.getUrl());
        log.info("Rate limit: {} calls per {}s ({})", rateLimit.getCalls(), rateLimit.getPeriod().toSeconds(),
                rateLimit.getPolicy());
    }

    @Bean
    public ApplicationRunner mcpServerRunner(McpStdioServer server) {
        return args -> {
            if (!properties.getMcp().isEnabled()) {
                log.info("MCP server disabled (jira.mcp.enabled=false)");
                return;
            }
            server.serve(System.in, System.out);
        };
    }
}
