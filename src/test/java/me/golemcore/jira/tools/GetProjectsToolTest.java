package me.golemcore.jira.tools;

import me.golemcore.jira.domain.model.OperationResult;
import me.golemcore.jira.domain.model.Project;
import me.golemcore.jira.domain.model.ProjectPage;
import me.golemcore.jira.domain.model.ToolResult;
import me.golemcore.jira.domain.service.ProjectService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class GetProjectsToolTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ProjectService projectService;
    private GetProjectsTool tool;

    @BeforeEach
    void setUp() {
        projectService = mock(ProjectService.class);
        tool = new GetProjectsTool(projectService, new JiraToolSupport(objectMapper));
    }

    @Test
    void execute_rendersProjectDetails() throws Exception {
        Project project = Project.builder()
                .id("1")
                .key("PROJ")
                .name("Project")
                .description("Core platform work")
                .lead("Jane Doe")
                .url("https://jira.example.com/browse/PROJ")
                .projectTypeKey("software")
                .archived(true)
                .build();
        when(projectService.getProjects(true, null, null)).thenReturn(OperationResult.success(ProjectPage.builder()
                .projects(List.of(project)).total(1).maxResults(50).build()));

        ToolResult result = tool.execute(Map.of("include_archived", true)).get();

        assertTrue(result.isSuccess());
        JsonNode rendered = objectMapper.readTree(result.getOutput()).path("projects").get(0);
        assertEquals("Core platform work", rendered.path("description").asText());
        assertEquals("Jane Doe", rendered.path("lead").asText());
        assertEquals("https://jira.example.com/browse/PROJ", rendered.path("url").asText());
        assertEquals("software", rendered.path("project_type_key").asText());
        assertTrue(rendered.path("archived").asBoolean());
    }

    @Test
    void execute_rejectsUnrecognisedBoolean() throws Exception {
        ToolResult result = tool.execute(Map.of("include_archived", "yes")).get();

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("include_archived"));
        verifyNoInteractions(projectService);
    }
}
