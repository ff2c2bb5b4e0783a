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

import me.golemcore.jira.domain.exception.ValidationException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Argument validation helpers for tracker operations. Every check runs before
 * any network call and fails with {@link ValidationException}.
 *
 * <p>
 * Issue keys: {@code ^[A-Z][A-Z0-9_]*-\d+$} after trimming and upper-casing.
 *
 * <p>
 * Time spent: one or more {@code <number><w|d|h|m>} tokens separated by
 * whitespace, e.g. {@code 1d 2h 30m}.
 */
public final class TrackerInputValidator {

    public static final int MIN_PAGE_SIZE = 1;
    public static final int MAX_PAGE_SIZE = 100;

    private static final Pattern ISSUE_KEY_PATTERN = Pattern.compile("^[A-Z][A-Z0-9_]*-\\d+$");
    private static final Pattern PROJECT_KEY_PATTERN = Pattern.compile("^[A-Z][A-Z0-9_]*$");
    private static final Pattern TIME_TOKEN_PATTERN = Pattern.compile("^\\d+[wdhm]$");
    private static final DateTimeFormatter JIRA_DATE_TIME = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ", Locale.ROOT);

    private TrackerInputValidator() {
    }

    public static String normalizeIssueKey(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Issue key is required (format PROJECT-123)");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (!ISSUE_KEY_PATTERN.matcher(normalized).matches()) {
            throw new ValidationException("Issue key must be in format PROJECT-123: " + value);
        }
        return normalized;
    }

    public static String normalizeProjectKey(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Project key cannot be empty");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (!PROJECT_KEY_PATTERN.matcher(normalized).matches()) {
            throw new ValidationException("Project key is not valid: " + value);
        }
        return normalized;
    }

    /**
     * Same as {@link #normalizeProjectKey(String)}, but null passes through.
     */
    public static String normalizeOptionalProjectKey(String value) {
        return value == null ? null : normalizeProjectKey(value);
    }

    public static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name + " cannot be empty");
        }
        return value.trim();
    }

    /**
     * Null passes through; a present value must not be blank.
     */
    public static String optionalText(String value, String name) {
        if (value == null) {
            return null;
        }
        if (value.isBlank()) {
            throw new ValidationException(name + " cannot be empty if provided");
        }
        return value.trim();
    }

    public static String normalizeTimeSpent(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Time spent is required, e.g. '2h 30m'");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (String token : normalized.split("\\s+")) {
            if (!TIME_TOKEN_PATTERN.matcher(token).matches()) {
                throw new ValidationException("Time must be a number followed by w, d, h or m (e.g. '2h', '30m'): "
                        + value);
            }
        }
        return String.join(" ", normalized.split("\\s+"));
    }

    public static int pageSize(Integer value, int defaultValue) {
        int size = value != null ? value : defaultValue;
        if (size < MIN_PAGE_SIZE || size > MAX_PAGE_SIZE) {
            throw new ValidationException("maxResults must be between " + MIN_PAGE_SIZE + " and " + MAX_PAGE_SIZE
                    + ", got " + size);
        }
        return size;
    }

    public static int startAt(Integer value) {
        int start = value != null ? value : 0;
        if (start < 0) {
            throw new ValidationException("startAt must be >= 0, got " + start);
        }
        return start;
    }

    /**
     * Convert an ISO-8601 timestamp into Jira's work log format
     * {@code yyyy-MM-dd'T'HH:mm:ss.SSSZ}. Local date-times are taken in
     * {@code zone}.
     *
     * @return converted value, or null when {@code value} is null
     */
    public static String toJiraDateTime(String value, ZoneId zone) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException("startedAt cannot be empty if provided");
        }
        return JIRA_DATE_TIME.format(parseDateTime(trimmed, zone));
    }

    private static ZonedDateTime parseDateTime(String value, ZoneId zone) {
        try {
            return OffsetDateTime.parse(value).toZonedDateTime();
        } catch (DateTimeParseException offsetFailure) {
            try {
                return Instant.parse(value).atZone(zone);
            } catch (DateTimeParseException instantFailure) {
                try {
                    return LocalDateTime.parse(value).atZone(zone);
                } catch (DateTimeParseException localFailure) {
                    throw new ValidationException("startedAt must be an ISO-8601 date-time, got: " + value);
                }
            }
        }
    }
}
