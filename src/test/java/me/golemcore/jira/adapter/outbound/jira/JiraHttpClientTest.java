package me.golemcore.jira.adapter.outbound.jira;

import me.golemcore.jira.domain.exception.ConfigurationException;
import me.golemcore.jira.domain.exception.RateLimitExceededException;
import me.golemcore.jira.domain.exception.TrackerApiException;
import me.golemcore.jira.domain.exception.TransportException;
import me.golemcore.jira.domain.exception.ValidationException;
import me.golemcore.jira.infrastructure.config.JiraProperties;
import me.golemcore.jira.ratelimit.RateLimiter;
import me.golemcore.jira.testsupport.http.OkHttpMockEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JiraHttpClientTest {

    private static final String BASE_URL = "https://jira.example.com";

    private OkHttpMockEngine engine;
    private RateLimiter rateLimiter;
    private JiraProperties properties;
    private JiraHttpClient client;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        rateLimiter = mock(RateLimiter.class);
        when(rateLimiter.acquire()).thenReturn(Duration.ZERO);
        properties = new JiraProperties();
        properties.setUrl(BASE_URL);
        properties.setUsername("bot@example.com");
        properties.setApiToken("secret-token");
        client = newClient(properties);
    }

    private JiraHttpClient newClient(JiraProperties props) {
        OkHttpClient httpClient = new OkHttpClient.Builder().addInterceptor(engine).build();
        return new JiraHttpClient(props, httpClient, new ObjectMapper(), rateLimiter);
    }

    @Test
    void exchange_sendsBasicAuthAndParsesJson() {
        engine.enqueueJson(200, "{\"key\":\"PROJ-1\"}");

        JsonNode node = client.exchange("GET", JiraApiPaths.issue("PROJ-1"), Map.of("fields", "summary"), null);

        assertEquals("PROJ-1", node.path("key").asText());
        OkHttpMockEngine.RecordedRequest request = engine.takeRequest();
        assertEquals("GET", request.method());
        assertEquals("/rest/api/2/issue/PROJ-1", request.path());
        assertEquals("summary", request.queryParameter("fields"));
        assertEquals(Credentials.basic("bot@example.com", "secret-token", StandardCharsets.UTF_8),
                request.headers().get("Authorization"));
    }

    @Test
    void exchange_acquiresExactlyOneTokenPerCall() {
        engine.enqueueJson(200, "{}");
        engine.enqueueJson(404, "{}");

        client.exchange("GET", JiraApiPaths.SEARCH, null, null);
        assertThrows(TrackerApiException.class, () -> client.exchange("GET", JiraApiPaths.SEARCH, null, null));

        verify(rateLimiter, times(2)).acquire();
        assertEquals(2, engine.getRequestCount());
    }

    @Test
    void exchange_mapsNotFoundToTrackerApiErrorWithJiraMessage() {
        engine.enqueueJiraError(404, "Issue does not exist or you do not have permission to see it.");

        TrackerApiException e = assertThrows(TrackerApiException.class,
                () -> client.exchange("GET", JiraApiPaths.issue("PROJ-999"), null, null));

        assertEquals(404, e.getStatus());
        assertEquals("Issue does not exist or you do not have permission to see it.", e.getMessage());
        assertEquals(404, e.toError().getStatus());
    }

    @Test
    void exchange_joinsFieldErrors() {
        engine.enqueueJson(400, "{\"errorMessages\":[],\"errors\":{\"summary\":\"You must specify a summary.\"}}");

        TrackerApiException e = assertThrows(TrackerApiException.class,
                () -> client.exchange("POST", JiraApiPaths.ISSUE, null, Map.of("fields", Map.of())));

        assertEquals(400, e.getStatus());
        assertEquals("summary: You must specify a summary.", e.getMessage());
    }

    @Test
    void exchange_fallsBackToRawBodyAndReason() {
        engine.enqueueBytes(502, "Bad gateway".getBytes(StandardCharsets.UTF_8), "text/plain");
        engine.enqueueBytes(401, new byte[0], null);

        TrackerApiException raw = assertThrows(TrackerApiException.class,
                () -> client.exchange("GET", JiraApiPaths.SEARCH, null, null));
        TrackerApiException empty = assertThrows(TrackerApiException.class,
                () -> client.exchange("GET", JiraApiPaths.SEARCH, null, null));

        assertEquals("Bad gateway", raw.getMessage());
        assertEquals(401, empty.getStatus());
        assertTrue(empty.getMessage().startsWith("HTTP 401"));
    }

    @Test
    void exchange_mapsIoFailureToTransportError() {
        engine.enqueueFailure(new SocketTimeoutException("timeout"));

        TransportException e = assertThrows(TransportException.class,
                () -> client.exchange("GET", JiraApiPaths.SEARCH, null, null));

        assertTrue(e.getMessage().contains("timeout"));
        assertTrue(e.getCause() instanceof SocketTimeoutException);
    }

    @Test
    void exchange_rejectedByLimiterMakesNoHttpCall() {
        when(rateLimiter.acquire()).thenThrow(new RateLimitExceededException(Duration.ofSeconds(1)));

        assertThrows(RateLimitExceededException.class,
                () -> client.exchange("GET", JiraApiPaths.SEARCH, null, null));

        assertEquals(0, engine.getRequestCount());
    }

    @Test
    void exchange_returnsNullNodeForEmptyBody() {
        engine.enqueueBytes(204, new byte[0], null);

        JsonNode node = client.exchange("PUT", JiraApiPaths.issue("PROJ-1"), null, Map.of("fields", Map.of()));

        assertTrue(node.isNull());
        OkHttpMockEngine.RecordedRequest request = engine.takeRequest();
        assertEquals("PUT", request.method());
        assertTrue(request.contentType().startsWith("application/json"));
        assertEquals("{\"fields\":{}}", request.body());
    }

    @Test
    void exchange_keepsContextPathOfBaseUrl() {
        properties.setUrl("https://example.com/jira/");
        JiraHttpClient contextClient = newClient(properties);
        engine.enqueueJson(200, "{}");

        contextClient.exchange("GET", JiraApiPaths.SEARCH, Map.of("jql", "project = A"), null);

        OkHttpMockEngine.RecordedRequest request = engine.takeRequest();
        assertEquals("/jira/rest/api/2/search", request.path());
        assertEquals("project = A", request.queryParameter("jql"));
        assertEquals("https://example.com/jira/browse/PROJ-7", contextClient.browseUrl("PROJ-7"));
    }

    @Test
    void download_refusesForeignHostWithoutCalling() {
        assertThrows(ValidationException.class,
                () -> client.download("https://evil.example.org/secure/attachment/1/a.txt"));

        verify(rateLimiter, never()).acquire();
        assertEquals(0, engine.getRequestCount());
    }

    @Test
    void download_returnsRawBytes() {
        byte[] content = { 1, 2, 3 };
        engine.enqueueBytes(200, content, "application/octet-stream");

        byte[] downloaded = client.download(BASE_URL + "/secure/attachment/10/a.bin");

        assertArrayEquals(content, downloaded);
    }

    @Test
    void upload_sendsMultipartWithXsrfHeader() {
        engine.enqueueJson(200, "[{\"id\":\"20\",\"filename\":\"a.txt\"}]");

        JsonNode node = client.upload(JiraApiPaths.attachments("PROJ-2"), "a.txt",
                "hello".getBytes(StandardCharsets.UTF_8), "text/plain");

        assertEquals("20", node.get(0).path("id").asText());
        OkHttpMockEngine.RecordedRequest request = engine.takeRequest();
        assertEquals("/rest/api/2/issue/PROJ-2/attachments", request.path());
        assertEquals("no-check", request.headers().get("X-Atlassian-Token"));
        assertTrue(request.contentType().startsWith("multipart/form-data"));
        assertTrue(request.body().contains("filename=\"a.txt\""));
        assertTrue(request.body().contains("hello"));
    }

    @Test
    void constructor_requiresCredentials() {
        JiraProperties missingToken = new JiraProperties();
        missingToken.setUrl(BASE_URL);
        missingToken.setUsername("bot");

        assertThrows(ConfigurationException.class, () -> newClient(missingToken));

        JiraProperties badUrl = new JiraProperties();
        badUrl.setUrl("not a url");
        badUrl.setUsername("bot");
        badUrl.setApiToken("token");

        assertThrows(ConfigurationException.class, () -> newClient(badUrl));
    }
}
