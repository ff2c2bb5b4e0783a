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

import me.golemcore.jira.domain.exception.ConfigurationException;
import me.golemcore.jira.domain.exception.TrackerApiException;
import me.golemcore.jira.domain.exception.TransportException;
import me.golemcore.jira.domain.exception.ValidationException;
import me.golemcore.jira.infrastructure.config.JiraProperties;
import me.golemcore.jira.ratelimit.RateLimiter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Single dispatch path for every HTTP call to Jira.
 *
 * <p>
 * All public methods end in {@link #dispatch(Request)}, which:
 * <ol>
 * <li>acquires one token from the {@link RateLimiter} (possibly waiting)
 * <li>executes exactly one HTTP exchange, with Basic credentials
 * <li>returns the body on 2xx, or raises a typed failure otherwise
 * </ol>
 *
 * <p>
 * Failure mapping:
 * <ul>
 * <li>non-2xx → {@link TrackerApiException} with the status code and the
 * message Jira put in {@code errorMessages}/{@code errors}
 * <li>{@link IOException} (connect, DNS, timeout) →
 * {@link TransportException}
 * </ul>
 * Nothing is retried here.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code jira.url} - instance base URL, may include a context path
 * <li>{@code jira.username} - account name or e-mail
 * <li>{@code jira.api-token} - API token (or password on Jira Server)
 * </ul>
 * Missing values fail construction with {@link ConfigurationException}.
 */
@Component
@Slf4j
public class JiraHttpClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");
    private static final int MAX_LOGGED_BODY_CHARS = 500;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final HttpUrl baseUrl;
    private final String authorization;

    public JiraHttpClient(JiraProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper,
            RateLimiter rateLimiter) {
        requireSetting(properties.getUrl(), "jira.url (JIRA_URL)");
        requireSetting(properties.getUsername(), "jira.username (JIRA_USERNAME)");
        requireSetting(properties.getApiToken(), "jira.api-token (JIRA_API_TOKEN)");

        HttpUrl parsed = HttpUrl.parse(properties.getUrl().trim());
        if (parsed == null) {
            throw new ConfigurationException("Jira URL is not a valid http(s) URL: " + properties.getUrl());
        }

        this.baseUrl = parsed;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
        this.authorization = Credentials.basic(properties.getUsername(), properties.getApiToken(),
                StandardCharsets.UTF_8);
        log.info("[Jira] Client configured for {} as {}", baseUrl, properties.getUsername());
    }

    /**
     * Perform a JSON exchange.
     *
     * @param method
     *            HTTP method
     * @param path
     *            path relative to the base URL, e.g. {@code /rest/api/2/issue}
     * @param query
     *            query parameters, may be null
     * @param body
     *            object serialized as the JSON body, may be null
     * @return parsed response body, {@link NullNode} for empty bodies
     */
    public JsonNode exchange(String method, String path, Map<String, String> query, Object body) {
        Request request = authorized(resolve(path, query))
                .header("Accept", "application/json")
                .method(method, jsonBody(method, body))
                .build();
        return parseJson(request, dispatch(request));
    }

    /**
     * Download raw bytes from an absolute URL on the configured Jira instance
     * (attachment content links).
     */
    public byte[] download(String absoluteUrl) {
        HttpUrl url = absoluteUrl != null ? HttpUrl.parse(absoluteUrl) : null;
        if (url == null || !sameOrigin(url)) {
            throw new ValidationException("Refusing to download from outside the Jira instance: " + absoluteUrl);
        }
        Request request = authorized(url).get().build();
        return dispatch(request);
    }

    /**
     * Upload one file as multipart form data ({@code file} part).
     */
    public JsonNode upload(String path, String filename, byte[] content, String mimeType) {
        MediaType mediaType = mimeType != null ? MediaType.parse(mimeType) : null;
        RequestBody filePart = RequestBody.create(content, mediaType != null ? mediaType : OCTET_STREAM);
        MultipartBody multipart = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("file", filename, filePart)
                .build();

        Request request = authorized(resolve(path, null))
                .header("Accept", "application/json")
                .header("X-Atlassian-Token", "no-check")
                .post(multipart)
                .build();
        return parseJson(request, dispatch(request));
    }

    /**
     * Browse URL of an issue, as shown to humans.
     */
    public String browseUrl(String issueKey) {
        return resolve(JiraApiPaths.BROWSE + issueKey, null).toString();
    }

    private byte[] dispatch(Request request) {
        Duration waited = rateLimiter.acquire();
        if (!waited.isZero()) {
            log.debug("[Jira] Waited {}ms for rate limit before {} {}", waited.toMillis(), request.method(),
                    request.url().encodedPath());
        }

        log.debug("[Jira] → {} {}", request.method(), request.url());
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            byte[] bytes = responseBody != null ? responseBody.bytes() : new byte[0];
            log.debug("[Jira] ← {} {} ({} bytes)", response.code(), request.url().encodedPath(), bytes.length);

            if (!response.isSuccessful()) {
                String message = extractErrorMessage(response, bytes);
                log.debug("[Jira] Error body: {}", truncate(new String(bytes, StandardCharsets.UTF_8)));
                throw new TrackerApiException(response.code(), message);
            }
            return bytes;
        } catch (IOException e) {
            log.warn("[Jira] {} {} failed: {}", request.method(), request.url().encodedPath(), e.getMessage());
            throw new TransportException("Jira request " + request.method() + " " + request.url().encodedPath()
                    + " failed: " + e.getMessage(), e);
        }
    }

    private Request.Builder authorized(HttpUrl url) {
        return new Request.Builder()
                .url(url)
                .header("Authorization", authorization);
    }

    private HttpUrl resolve(String path, Map<String, String> query) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                builder.addPathSegment(segment);
            }
        }
        if (query != null) {
            query.forEach((name, value) -> {
                if (value != null) {
                    builder.addQueryParameter(name, value);
                }
            });
        }
        return builder.build();
    }

    private boolean sameOrigin(HttpUrl url) {
        return url.scheme().equals(baseUrl.scheme())
                && url.host().equalsIgnoreCase(baseUrl.host())
                && url.port() == baseUrl.port();
    }

    private RequestBody jsonBody(String method, Object body) {
        if (body != null) {
            try {
                return RequestBody.create(objectMapper.writeValueAsString(body), JSON);
            } catch (JsonProcessingException e) {
                throw new ValidationException("Request body is not serializable to JSON: " + e.getOriginalMessage());
            }
        }
        if ("POST".equals(method) || "PUT".equals(method) || "PATCH".equals(method)) {
            return RequestBody.create(new byte[0], JSON);
        }
        return null;
    }

    private JsonNode parseJson(Request request, byte[] bytes) {
        if (bytes.length == 0) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(bytes);
        } catch (IOException e) {
            throw new TransportException("Unreadable response from " + request.method() + " "
                    + request.url().encodedPath() + ": " + e.getMessage(), e);
        }
    }

    private String extractErrorMessage(Response response, byte[] bytes) {
        String raw = new String(bytes, StandardCharsets.UTF_8).trim();
        if (!raw.isEmpty()) {
            try {
                JsonNode node = objectMapper.readTree(raw);
                List<String> messages = new ArrayList<>();
                JsonNode errorMessages = node.path("errorMessages");
                if (errorMessages.isArray()) {
                    errorMessages.forEach(m -> messages.add(m.asText()));
                }
                JsonNode errors = node.path("errors");
                if (errors.isObject()) {
                    Iterator<Map.Entry<String, JsonNode>> it = errors.fields();
                    while (it.hasNext()) {
                        Map.Entry<String, JsonNode> entry = it.next();
                        messages.add(entry.getKey() + ": " + entry.getValue().asText());
                    }
                }
                if (!messages.isEmpty()) {
                    return String.join("; ", messages);
                }
            } catch (JsonProcessingException e) {
                log.debug("[Jira] Error body is not JSON, using raw text");
            }
            return truncate(raw);
        }
        String reason = response.message();
        return "HTTP " + response.code() + (reason != null && !reason.isBlank() ? " " + reason : "");
    }

    private static void requireSetting(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Jira configuration is incomplete: " + name + " is not set");
        }
    }

    private static String truncate(String text) {
        return text.length() > MAX_LOGGED_BODY_CHARS ? text.substring(0, MAX_LOGGED_BODY_CHARS) + "…" : text;
    }
}
