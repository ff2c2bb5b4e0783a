package me.golemcore.jira.adapter.outbound.jira;

import me.golemcore.jira.domain.model.Comment;
import me.golemcore.jira.domain.model.CommentPage;
import me.golemcore.jira.domain.model.CreatedIssue;
import me.golemcore.jira.domain.model.Issue;
import me.golemcore.jira.domain.model.IssueSearchPage;
import me.golemcore.jira.domain.model.Project;
import me.golemcore.jira.domain.model.ProjectPage;
import me.golemcore.jira.domain.model.Worklog;
import me.golemcore.jira.infrastructure.config.JiraProperties;
import me.golemcore.jira.ratelimit.RateLimiter;
import me.golemcore.jira.testsupport.http.OkHttpMockEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JiraRestAdapterTest {

    private static final String BASE_URL = "https://jira.example.com";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OkHttpMockEngine engine;
    private JiraRestAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        RateLimiter rateLimiter = mock(RateLimiter.class);
        when(rateLimiter.acquire()).thenReturn(Duration.ZERO);
        JiraProperties properties = new JiraProperties();
        properties.setUrl(BASE_URL);
        properties.setUsername("bot");
        properties.setApiToken("token");
        OkHttpClient httpClient = new OkHttpClient.Builder().addInterceptor(engine).build();
        JiraHttpClient client = new JiraHttpClient(properties, httpClient, objectMapper, rateLimiter);
        adapter = new JiraRestAdapter(client, objectMapper);
    }

    @Test
    void getIssue_mapsFlattenedViewAndRawFields() {
        engine.enqueueJson(200, """
                {"id":"10001","key":"PROJ-1","self":"https://jira.example.com/rest/api/2/issue/10001",
                 "fields":{"summary":"Broken login","description":"Steps...",
                   "status":{"name":"Open"},"issuetype":{"id":"1","name":"Bug"},
                   "priority":{"id":"3","name":"Major"},
                   "assignee":{"name":"jdoe","displayName":"Jane Doe"},
                   "reporter":null,
                   "project":{"id":"100","key":"PROJ"},
                   "labels":["auth","ui"],
                   "created":"2024-01-01T10:00:00.000+0000",
                   "attachment":[{"id":"55","filename":"log.txt","mimeType":"text/plain","size":12,
                     "content":"https://jira.example.com/secure/attachment/55/log.txt"}],
                   "customfield_10010":5}}
                """);

        Issue issue = adapter.getIssue("PROJ-1", null);

        assertEquals("PROJ-1", issue.getKey());
        assertEquals("Broken login", issue.getSummary());
        assertEquals("Open", issue.getStatus());
        assertEquals("Bug", issue.getIssueType());
        assertEquals("Major", issue.getPriority());
        assertEquals("Jane Doe", issue.getAssignee());
        assertNull(issue.getReporter());
        assertEquals("PROJ", issue.getProjectKey());
        assertEquals(List.of("auth", "ui"), issue.getLabels());
        assertEquals(1, issue.getAttachments().size());
        assertEquals("https://jira.example.com/secure/attachment/55/log.txt",
                issue.getAttachments().get(0).getContentUrl());
        assertEquals(5, issue.getFields().get("customfield_10010"));
        assertTrue(issue.getFields().containsKey("reporter"));
        assertNull(engine.takeRequest().queryParameter("fields"));
    }

    @Test
    void searchIssues_passesPagingAndFieldsVerbatim() {
        engine.enqueueJson(200, """
                {"startAt":0,"maxResults":2,"total":5,
                 "issues":[{"key":"PROJ-1","fields":{"summary":"a"}},{"key":"PROJ-2","fields":{"summary":"b"}}]}
                """);

        IssueSearchPage page = adapter.searchIssues("project = PROJ", List.of("summary", "customfield_1"), 0, 2);

        assertEquals(5, page.getTotal());
        assertEquals(2, page.getIssues().size());
        assertTrue(page.isHasMore());
        OkHttpMockEngine.RecordedRequest request = engine.takeRequest();
        assertEquals("/rest/api/2/search", request.path());
        assertEquals("project = PROJ", request.queryParameter("jql"));
        assertEquals("summary,customfield_1", request.queryParameter("fields"));
        assertEquals("0", request.queryParameter("startAt"));
        assertEquals("2", request.queryParameter("maxResults"));
    }

    @Test
    void createIssue_wrapsFieldsAndBuildsBrowseUrl() throws Exception {
        engine.enqueueJson(201, "{\"id\":\"10002\",\"key\":\"PROJ-2\",\"self\":\"x\"}");

        CreatedIssue created = adapter.createIssue(Map.of("summary", "New"));

        assertEquals("PROJ-2", created.getKey());
        assertEquals(BASE_URL + "/browse/PROJ-2", created.getBrowseUrl());
        JsonNode body = objectMapper.readTree(engine.takeRequest().body());
        assertEquals("New", body.path("fields").path("summary").asText());
    }

    @Test
    void addComment_includesVisibilityOnlyWhenGiven() throws Exception {
        engine.enqueueJson(201, "{\"id\":\"1\",\"body\":\"hi\",\"author\":{\"displayName\":\"Bot\"}}");
        engine.enqueueJson(201, "{\"id\":\"2\",\"body\":\"secret\"}");

        Comment plain = adapter.addComment("PROJ-1", "hi", null);
        adapter.addComment("PROJ-1", "secret", Map.of("type", "role", "value", "Developers"));

        assertEquals("Bot", plain.getAuthor());
        assertFalse(objectMapper.readTree(engine.takeRequest().body()).has("visibility"));
        JsonNode restricted = objectMapper.readTree(engine.takeRequest().body());
        assertEquals("role", restricted.path("visibility").path("type").asText());
    }

    @Test
    void getComments_mapsPage() {
        engine.enqueueJson(200, """
                {"startAt":0,"maxResults":1,"total":3,"comments":[{"id":"7","body":"first"}]}
                """);

        CommentPage page = adapter.getComments("PROJ-1", 0, 1);

        assertEquals("PROJ-1", page.getIssueKey());
        assertEquals(3, page.getTotal());
        assertEquals("first", page.getComments().get(0).getBody());
        assertTrue(page.isHasMore());
        assertEquals("/rest/api/2/issue/PROJ-1/comment", engine.takeRequest().path());
    }

    @Test
    void addWorklog_sendsOnlyPresentValues() throws Exception {
        engine.enqueueJson(201, "{\"id\":\"900\",\"timeSpent\":\"2h\",\"timeSpentSeconds\":7200}");

        Worklog worklog = adapter.addWorklog("PROJ-1", "2h", null, "2024-03-01T09:00:00.000+0000");

        assertEquals(7200, worklog.getTimeSpentSeconds());
        JsonNode body = objectMapper.readTree(engine.takeRequest().body());
        assertEquals("2h", body.path("timeSpent").asText());
        assertFalse(body.has("comment"));
        assertEquals("2024-03-01T09:00:00.000+0000", body.path("started").asText());
    }

    @Test
    void createIssueLink_sendsTypeAndBothEnds() throws Exception {
        engine.enqueueBytes(201, new byte[0], null);

        adapter.createIssueLink("Cloners", "PROJ-1", "PROJ-2");

        OkHttpMockEngine.RecordedRequest request = engine.takeRequest();
        assertEquals("/rest/api/2/issueLink", request.path());
        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("Cloners", body.path("type").path("name").asText());
        assertEquals("PROJ-1", body.path("inwardIssue").path("key").asText());
        assertEquals("PROJ-2", body.path("outwardIssue").path("key").asText());
    }

    @Test
    void getProjects_requestsArchivedWhenAsked() {
        engine.enqueueJson(200, """
                {"startAt":0,"maxResults":50,"total":1,"isLast":true,
                 "values":[{"id":"1","key":"PROJ","name":"Project","projectTypeKey":"software",
                   "description":"Core platform work",
                   "lead":{"name":"jdoe","displayName":"Jane Doe"},
                   "projectCategory":{"name":"Core"},"archived":true}]}
                """);

        ProjectPage page = adapter.getProjects(true, 0, 50);

        assertFalse(page.isHasMore());
        Project project = page.getProjects().get(0);
        assertEquals("Core", project.getCategory());
        assertTrue(project.isArchived());
        assertEquals("Core platform work", project.getDescription());
        assertEquals("Jane Doe", project.getLead());
        assertEquals("https://jira.example.com/browse/PROJ", project.getUrl());
        OkHttpMockEngine.RecordedRequest request = engine.takeRequest();
        assertEquals("/rest/api/2/project/search", request.path());
        assertEquals("live,archived", request.queryParameter("status"));
        assertEquals("description,lead", request.queryParameter("expand"));
    }
}
