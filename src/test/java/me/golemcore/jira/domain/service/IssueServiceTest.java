package me.golemcore.jira.domain.service;

import me.golemcore.jira.domain.exception.TrackerApiException;
import me.golemcore.jira.domain.exception.TransportException;
import me.golemcore.jira.domain.model.Comment;
import me.golemcore.jira.domain.model.CreateIssueRequest;
import me.golemcore.jira.domain.model.CreatedIssue;
import me.golemcore.jira.domain.model.IssueSearchPage;
import me.golemcore.jira.domain.model.OperationResult;
import me.golemcore.jira.domain.model.StepStatus;
import me.golemcore.jira.domain.model.TrackerErrorKind;
import me.golemcore.jira.domain.model.UpdateIssueRequest;
import me.golemcore.jira.domain.model.UpdateIssueResult;
import me.golemcore.jira.infrastructure.config.JiraProperties;
import me.golemcore.jira.port.outbound.IssueTrackerPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class IssueServiceTest {

    private IssueTrackerPort trackerPort;
    private JiraProperties properties;
    private IssueService service;

    @BeforeEach
    void setUp() {
        trackerPort = mock(IssueTrackerPort.class);
        properties = new JiraProperties();
        service = new IssueService(trackerPort, new IssueFieldMapper(properties), properties);
    }

    @Test
    void searchIssues_rejectsBlankJqlWithoutCallingTracker() {
        OperationResult<IssueSearchPage> result = service.searchIssues("   ", null, null, null);

        assertFalse(result.isSuccess());
        assertEquals(TrackerErrorKind.VALIDATION, result.getError().getKind());
        verifyNoInteractions(trackerPort);
    }

    @Test
    void searchIssues_appliesDefaults() {
        IssueSearchPage page = IssueSearchPage.builder().issues(List.of()).total(0).build();
        when(trackerPort.searchIssues(anyString(), any(), anyInt(), anyInt())).thenReturn(page);

        OperationResult<IssueSearchPage> result = service.searchIssues(" project = PROJ ", null, null, null);

        assertTrue(result.isSuccess());
        verify(trackerPort).searchIssues("project = PROJ", properties.getSearch().getDefaultFields(), 0, 50);
    }

    @Test
    void searchIssues_rejectsOutOfRangePaging() {
        assertFalse(service.searchIssues("project = PROJ", null, null, 101).isSuccess());
        assertFalse(service.searchIssues("project = PROJ", null, -1, 10).isSuccess());
        verifyNoInteractions(trackerPort);
    }

    @Test
    void getIssue_returnsTrackerErrorInsteadOfThrowing() {
        when(trackerPort.getIssue(eq("PROJ-404"), any())).thenThrow(new TrackerApiException(404, "Not found"));

        OperationResult<?> result = service.getIssue("proj-404", null);

        assertFalse(result.isSuccess());
        assertEquals(TrackerErrorKind.TRACKER_API, result.getError().getKind());
        assertEquals(404, result.getError().getStatus());
    }

    @Test
    @SuppressWarnings("unchecked")
    void createIssue_buildsFieldsWithDefaultsAndCustomFields() {
        properties.setAssigneeIdentifier("accountId");
        when(trackerPort.createIssue(anyMap())).thenReturn(CreatedIssue.builder().key("PROJ-9").build());

        OperationResult<CreatedIssue> result = service.createIssue(CreateIssueRequest.builder()
                .projectKey("proj")
                .summary("  Login fails ")
                .assignee("5b10ac8d82e05b22cc7d4ef5")
                .labels(List.of("auth", " "))
                .customFields(Map.of("customfield_10010", 3))
                .build());

        assertTrue(result.isSuccess());
        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(trackerPort).createIssue(captor.capture());
        Map<String, Object> fields = captor.getValue();
        assertEquals(Map.of("key", "PROJ"), fields.get("project"));
        assertEquals("Login fails", fields.get("summary"));
        assertEquals(Map.of("name", "Task"), fields.get("issuetype"));
        assertEquals(Map.of("accountId", "5b10ac8d82e05b22cc7d4ef5"), fields.get("assignee"));
        assertEquals(List.of("auth"), fields.get("labels"));
        assertEquals(3, fields.get("customfield_10010"));
        assertFalse(fields.containsKey("priority"));
    }

    @Test
    void createIssue_requiresSummary() {
        OperationResult<CreatedIssue> result = service.createIssue(CreateIssueRequest.builder()
                .projectKey("PROJ")
                .summary(" ")
                .build());

        assertEquals(TrackerErrorKind.VALIDATION, result.getError().getKind());
        verifyNoInteractions(trackerPort);
    }

    @Test
    void updateIssue_withNothingToDoIsValidationError() {
        OperationResult<UpdateIssueResult> result = service.updateIssue(UpdateIssueRequest.builder()
                .issueKey("PROJ-1")
                .build());

        assertEquals(TrackerErrorKind.VALIDATION, result.getError().getKind());
        verifyNoInteractions(trackerPort);
    }

    @Test
    void updateIssue_reportsFieldSuccessAndCommentFailureSeparately() {
        when(trackerPort.addComment(eq("PROJ-1"), eq("Done"), isNull()))
                .thenThrow(new TrackerApiException(403, "No permission to comment"));

        OperationResult<UpdateIssueResult> result = service.updateIssue(UpdateIssueRequest.builder()
                .issueKey("proj-1")
                .summary("Renamed")
                .comment("Done")
                .build());

        assertTrue(result.isSuccess());
        UpdateIssueResult update = result.getValue();
        assertEquals("PROJ-1", update.getIssueKey());
        assertEquals(StepStatus.SUCCEEDED, update.getFieldUpdate().getStatus());
        assertEquals(StepStatus.FAILED, update.getComment().getStatus());
        assertEquals(403, update.getComment().getError().getStatus());
        verify(trackerPort).updateIssue("PROJ-1", Map.of("summary", "Renamed"));
    }

    @Test
    void updateIssue_commentOnlySkipsFieldUpdate() {
        when(trackerPort.addComment("PROJ-1", "Note", null)).thenReturn(Comment.builder().id("1").build());

        OperationResult<UpdateIssueResult> result = service.updateIssue(UpdateIssueRequest.builder()
                .issueKey("PROJ-1")
                .comment("Note")
                .build());

        assertEquals(StepStatus.SKIPPED, result.getValue().getFieldUpdate().getStatus());
        assertEquals(StepStatus.SUCCEEDED, result.getValue().getComment().getStatus());
        verify(trackerPort, never()).updateIssue(anyString(), anyMap());
    }

    @Test
    void updateIssue_allAttemptedStepsFailedReportsEachError() {
        doThrow(new TransportException("connection refused", new IOException("refused")))
                .when(trackerPort).updateIssue(anyString(), anyMap());
        when(trackerPort.addComment(anyString(), anyString(), isNull()))
                .thenThrow(new TrackerApiException(500, "boom"));

        OperationResult<UpdateIssueResult> result = service.updateIssue(UpdateIssueRequest.builder()
                .issueKey("PROJ-1")
                .priority("High")
                .comment("x")
                .build());

        assertTrue(result.isSuccess());
        UpdateIssueResult update = result.getValue();
        assertFalse(update.isAnySucceeded());
        assertEquals(StepStatus.FAILED, update.getFieldUpdate().getStatus());
        assertEquals(TrackerErrorKind.TRANSPORT, update.getFieldUpdate().getError().getKind());
        assertEquals(StepStatus.FAILED, update.getComment().getStatus());
        assertEquals(500, update.getComment().getError().getStatus());
        assertEquals(TrackerErrorKind.TRANSPORT, update.getFirstError().getKind());
    }
}
