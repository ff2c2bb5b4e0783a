package me.golemcore.jira.tools;

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
import me.golemcore.jira.domain.model.OperationResult;
import me.golemcore.jira.domain.model.ToolResult;
import me.golemcore.jira.domain.model.TrackerError;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Shared argument readers, JSON Schema fragments and result rendering for the
 * Jira tools.
 *
 * <p>
 * Failures are rendered as
 * {@code {"error": {"kind": ..., "message": ..., "status": ...}}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JiraToolSupport {

    static final String TYPE = "type";
    static final String DESCRIPTION = "description";
    static final String TYPE_OBJECT = "object";
    static final String TYPE_STRING = "string";
    static final String TYPE_INTEGER = "integer";
    static final String TYPE_BOOLEAN = "boolean";
    static final String TYPE_ARRAY = "array";

    private final ObjectMapper objectMapper;

    /**
     * Render an operation result. {@code view} shapes the success payload.
     */
    public <T> ToolResult render(OperationResult<T> result, Function<T, Object> view) {
        if (!result.isSuccess()) {
            return failure(result.getError());
        }
        Object payload = view.apply(result.getValue());
        return ToolResult.success(toJson(payload));
    }

    public ToolResult failure(TrackerError error) {
        return failure(error, Map.of());
    }

    /**
     * Failure whose document carries {@code details} next to the error, for
     * operations that report per-step outcomes.
     */
    public ToolResult failure(TrackerError error, Map<String, Object> details) {
        Map<String, Object> errorView = new LinkedHashMap<>();
        errorView.put("kind", error.getKind().getCode());
        errorView.put("message", error.getMessage());
        if (error.getStatus() != null) {
            errorView.put("status", error.getStatus());
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("error", errorView);
        document.putAll(details);
        return ToolResult.failure(error.getMessage(), toJson(document));
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("[Tools] Failed to render tool output", e);
            throw new IllegalStateException("Failed to render tool output: " + e.getOriginalMessage(), e);
        }
    }

    static Map<String, Object> schema(Map<String, Object> properties, List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put(TYPE, TYPE_OBJECT);
        schema.put("properties", properties);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }

    static Map<String, Object> property(String type, String description) {
        return Map.of(TYPE, type, DESCRIPTION, description);
    }

    static Map<String, Object> stringArray(String description) {
        return Map.of(TYPE, TYPE_ARRAY, "items", Map.of(TYPE, TYPE_STRING), DESCRIPTION, description);
    }

    static Map<String, Object> objectProperty(String description) {
        return Map.of(TYPE, TYPE_OBJECT, DESCRIPTION, description);
    }

    /**
     * String argument, or null when absent. Non-string values are rejected.
     */
    static String stringParam(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s;
        }
        throw new ValidationException(key + " must be a string");
    }

    static Integer intParam(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            long whole = n.longValue();
            if (n.doubleValue() != whole || whole < Integer.MIN_VALUE || whole > Integer.MAX_VALUE) {
                throw new ValidationException(key + " must be a whole number within integer range, got: " + n);
            }
            return (int) whole;
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException(key + " must be an integer, got: " + s);
            }
        }
        throw new ValidationException(key + " must be an integer");
    }

    static boolean booleanParam(Map<String, Object> params, String key, boolean defaultValue) {
        Object value = params.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            String normalized = s.trim();
            if ("true".equalsIgnoreCase(normalized)) {
                return true;
            }
            if ("false".equalsIgnoreCase(normalized)) {
                return false;
            }
        }
        throw new ValidationException(key + " must be true or false, got: " + value);
    }

    static List<String> stringListParam(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof List<?> list) {
            List<String> result = new ArrayList<>();
            for (Object item : list) {
                if (item != null) {
                    result.add(String.valueOf(item));
                }
            }
            return result;
        }
        if (value instanceof String s) {
            List<String> result = new ArrayList<>();
            for (String part : s.split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
            return result;
        }
        throw new ValidationException(key + " must be an array of strings");
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> mapParam(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            return new LinkedHashMap<>((Map<String, Object>) map);
        }
        throw new ValidationException(key + " must be an object");
    }

    static Map<String, String> stringMapParam(Map<String, Object> params, String key) {
        Map<String, Object> raw = mapParam(params, key);
        if (raw == null) {
            return null;
        }
        Map<String, String> result = new LinkedHashMap<>();
        raw.forEach((k, v) -> result.put(k, v != null ? String.valueOf(v) : null));
        return result;
    }
}
