package me.golemcore.jira.adapter.inbound.mcp;

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

import me.golemcore.jira.domain.component.ToolComponent;
import me.golemcore.jira.domain.model.ToolDefinition;
import me.golemcore.jira.domain.model.ToolResult;
import me.golemcore.jira.infrastructure.config.JiraProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * JSON-RPC 2.0 server exposing the Jira tools over stdio (Model Context
 * Protocol).
 *
 * <p>
 * Messages are newline-delimited JSON. Requests are handled one at a time in
 * the order they arrive:
 * <ul>
 * <li>{@code initialize} - protocol version, capabilities and server info
 * <li>{@code notifications/initialized} - no response
 * <li>{@code ping} - empty result
 * <li>{@code tools/list} - definitions of all enabled tools
 * <li>{@code tools/call} - run one tool and wait for it
 * </ul>
 *
 * <p>
 * Tool failures are returned as results with {@code isError: true}; protocol
 * errors use the JSON-RPC codes -32700 (parse), -32600 (invalid request),
 * -32601 (unknown method) and -32602 (unknown tool or bad params).
 *
 * <p>
 * MCP protocol version: 2024-11-05
 */
@Component
@Slf4j
public class McpStdioServer {

    static final String JSONRPC_VERSION = "2.0";
    static final String MCP_PROTOCOL_VERSION = "2024-11-05";

    static final int PARSE_ERROR = -32700;
    static final int INVALID_REQUEST = -32600;
    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();
    private final ObjectMapper objectMapper;
    private final JiraProperties.McpProperties config;

    public McpStdioServer(List<ToolComponent> toolComponents, ObjectMapper objectMapper,
            JiraProperties properties) {
        this.objectMapper = objectMapper;
        this.config = properties.getMcp();
        for (ToolComponent tool : toolComponents) {
            if (tool.isEnabled()) {
                tools.put(tool.getToolName(), tool);
            }
        }
    }

    /**
     * Serve requests from {@code in} until end of stream. Responses go to
     * {@code out}; nothing else is ever written there.
     */
    public void serve(InputStream in, OutputStream out) throws IOException {
        log.info("[MCP] Serving {} tools over stdio: {}", tools.size(), tools.keySet());
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));

        String line;
        while ((line = reader.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            log.debug("[MCP] ← {}", line);
            Optional<String> response = handle(line);
            if (response.isPresent()) {
                log.debug("[MCP] → {}", response.get());
                writer.write(response.get());
                writer.newLine();
                writer.flush();
            }
        }
        log.info("[MCP] Input closed, stopping");
    }

    /**
     * Handle one JSON-RPC message.
     *
     * @return the serialized response, empty for notifications
     */
    Optional<String> handle(String line) {
        JsonNode message;
        try {
            message = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("[MCP] Malformed message: {}", e.getOriginalMessage());
            return Optional.of(write(error(null, PARSE_ERROR, "Parse error: " + e.getOriginalMessage())));
        }

        if (message == null || !message.isObject() || !message.hasNonNull("method")) {
            JsonNode id = message != null && message.isObject() ? message.get("id") : null;
            return Optional.of(write(error(id, INVALID_REQUEST, "Invalid request")));
        }

        String method = message.get("method").asText();
        JsonNode id = message.get("id");
        boolean notification = id == null || id.isNull();
        JsonNode params = message.path("params");

        if (notification) {
            log.debug("[MCP] Notification: {}", method);
            return Optional.empty();
        }

        return Optional.of(write(dispatch(id, method, params)));
    }

    private Map<String, Object> dispatch(JsonNode id, String method, JsonNode params) {
        switch (method) {
        case "initialize":
            return result(id, initializeResult(params));
        case "ping":
            return result(id, Map.of());
        case "tools/list":
            return result(id, Map.of("tools", listTools()));
        case "tools/call":
            return callTool(id, params);
        default:
            log.debug("[MCP] Unknown method: {}", method);
            return error(id, METHOD_NOT_FOUND, "Method not found: " + method);
        }
    }

    private Map<String, Object> initializeResult(JsonNode params) {
        String clientName = params.path("clientInfo").path("name").asText("unknown");
        log.info("[MCP] Client connected: {} (protocol {})", clientName,
                params.path("protocolVersion").asText("unspecified"));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", MCP_PROTOCOL_VERSION);
        result.put("capabilities", Map.of("tools", Map.of("listChanged", false)));
        result.put("serverInfo", Map.of(
                "name", config.getServerName(),
                "version", config.getServerVersion()));
        return result;
    }

    private List<Map<String, Object>> listTools() {
        List<Map<String, Object>> definitions = new ArrayList<>();
        for (ToolComponent tool : tools.values()) {
            ToolDefinition definition = tool.getDefinition();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", definition.getName());
            entry.put("description", definition.getDescription());
            entry.put("inputSchema", definition.getInputSchema());
            definitions.add(entry);
        }
        return definitions;
    }

    private Map<String, Object> callTool(JsonNode id, JsonNode params) {
        String name = params.path("name").asText(null);
        if (name == null) {
            return error(id, INVALID_PARAMS, "Missing tool name");
        }
        ToolComponent tool = tools.get(name);
        if (tool == null) {
            return error(id, INVALID_PARAMS, "Unknown tool: " + name);
        }

        JsonNode argumentsNode = params.path("arguments");
        if (!argumentsNode.isMissingNode() && !argumentsNode.isNull() && !argumentsNode.isObject()) {
            return error(id, INVALID_PARAMS, "Tool arguments must be an object");
        }
        Map<String, Object> arguments = argumentsNode.isObject()
                ? objectMapper.convertValue(argumentsNode, MAP_TYPE_REF)
                : new LinkedHashMap<>();

        log.debug("[MCP] Calling tool {}", name);
        ToolResult toolResult;
        try {
            toolResult = tool.execute(arguments).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[MCP] Tool {} failed unexpectedly", name, cause);
            toolResult = ToolResult.failure("Tool " + name + " failed: " + cause.getMessage());
        }

        String text = toolResult.getOutput() != null ? toolResult.getOutput() : toolResult.getError();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("content", List.of(Map.of("type", "text", "text", text != null ? text : "")));
        result.put("isError", !toolResult.isSuccess());
        return result(id, result);
    }

    private Map<String, Object> result(JsonNode id, Object result) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", JSONRPC_VERSION);
        response.put("id", id);
        response.put("result", result);
        return response;
    }

    private Map<String, Object> error(JsonNode id, int code, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", JSONRPC_VERSION);
        response.put("id", id);
        response.put("error", Map.of("code", code, "message", message));
        return response;
    }

    private String write(Map<String, Object> response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.error("[MCP] Failed to serialize response", e);
            return "{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":-32603,\"message\":\"Internal error\"}}";
        }
    }

    public List<String> getToolNames() {
        return List.copyOf(tools.keySet());
    }
}
