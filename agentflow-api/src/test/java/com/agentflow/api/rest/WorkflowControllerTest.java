package com.agentflow.api.rest;

import com.agentflow.core.exception.ConflictException;
import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.exception.WorkflowValidationException;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowStatus;
import com.agentflow.core.model.WorkflowStep;
import com.agentflow.core.model.WorkflowType;
import com.agentflow.core.repository.WorkflowQuery;
import com.agentflow.core.validation.ValidationResult;
import com.agentflow.core.validation.ViolationCode;
import com.agentflow.engine.service.WorkflowService;
import com.agentflow.engine.service.WorkflowService.WorkflowRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class WorkflowControllerTest {

    static final ObjectMapper MAPPER = Jackson2ObjectMapperBuilder.json()
        .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .build();

    @Mock
    private WorkflowService workflowService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new WorkflowController(workflowService))
            .setControllerAdvice(new ApiExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(MAPPER))
            .build();
    }

    @Test
    @DisplayName("POST /workflows creates a workflow and returns it with 201")
    void createWorkflow() throws Exception {
        when(workflowService.createWorkflow(any())).thenReturn(workflow("wf-1"));

        mockMvc.perform(post("/workflows")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {
                      "name": "research",
                      "workflow_type": "sequential",
                      "tags": ["ml"],
                      "steps": [
                        {"name": "fetch", "step_type": "task"},
                        {"name": "summarize", "step_type": "task", "dependencies": ["fetch"], "retry_count": 1}
                      ]
                    }
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value("wf-1"))
            .andExpect(jsonPath("$.workflow_type").value("sequential"))
            .andExpect(jsonPath("$.status").value("draft"))
            .andExpect(jsonPath("$.steps[1].dependencies[0]").value("fetch"));

        ArgumentCaptor<WorkflowRequest> request = ArgumentCaptor.forClass(WorkflowRequest.class);
        verify(workflowService).createWorkflow(request.capture());
        assertThat(request.getValue().workflowType()).isEqualTo(WorkflowType.SEQUENTIAL);
        assertThat(request.getValue().steps()).hasSize(2);
        assertThat(request.getValue().steps().get(1).retryCount()).isEqualTo(1);
        assertThat(request.getValue().steps().get(0).timeoutSeconds()).isNull();
    }

    @Test
    @DisplayName("Validation failures return 400 with every violation")
    void createInvalidWorkflow() throws Exception {
        ValidationResult result = ValidationResult.valid()
            .add(ViolationCode.REQUIRED, "name", "Workflow name is required")
            .add(ViolationCode.CYCLE, "steps", "Dependency cycle: a -> b -> a");
        when(workflowService.createWorkflow(any())).thenThrow(new WorkflowValidationException(result));

        mockMvc.perform(post("/workflows")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"workflow_type\": \"parallel\", \"steps\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value(WorkflowValidationException.ERROR_CODE))
            .andExpect(jsonPath("$.violations.length()").value(2))
            .andExpect(jsonPath("$.violations[1].code").value("CYCLE"))
            .andExpect(jsonPath("$.path").value("/workflows"));
    }

    @Test
    @DisplayName("Malformed bodies and unknown enum values are rejected with 400")
    void badRequests() throws Exception {
        mockMvc.perform(post("/workflows")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value(ApiExceptionHandler.BAD_REQUEST));

        mockMvc.perform(get("/workflows").param("workflow_type", "spiral"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value(ApiExceptionHandler.BAD_REQUEST));
    }

    @Test
    @DisplayName("GET /workflows passes filters and paging to the service")
    void listWorkflows() throws Exception {
        when(workflowService.listWorkflows(any())).thenReturn(List.of(workflow("wf-1")));

        mockMvc.perform(get("/workflows")
                .param("workflow_type", "parallel")
                .param("status", "active")
                .param("tags", "ml, nlp,")
                .param("limit", "5")
                .param("offset", "10"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value("wf-1"));

        verify(workflowService).listWorkflows(
            new WorkflowQuery(WorkflowType.PARALLEL, WorkflowStatus.ACTIVE, List.of("ml", "nlp"), 5, 10));
    }

    @Test
    @DisplayName("Unknown workflows return 404")
    void workflowNotFound() throws Exception {
        when(workflowService.getWorkflow("nope")).thenThrow(new NotFoundException("Workflow", "nope"));

        mockMvc.perform(get("/workflows/nope"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value(NotFoundException.ERROR_CODE));
    }

    @Test
    @DisplayName("DELETE returns 204, or 409 while executions are active")
    void deleteWorkflow() throws Exception {
        mockMvc.perform(delete("/workflows/wf-1")).andExpect(status().isNoContent());

        doThrow(new ConflictException("Workflow wf-2 has 1 pending or running executions"))
            .when(workflowService).deleteWorkflow("wf-2");
        mockMvc.perform(delete("/workflows/wf-2"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error_code").value(ConflictException.ERROR_CODE));
    }

    @Test
    @DisplayName("POST /workflows/{id}/execute returns 202 with the execution id")
    void executeWorkflow() throws Exception {
        UUID executionId = UUID.randomUUID();
        when(workflowService.executeWorkflow(eq("wf-1"), any(JsonNode.class))).thenReturn(executionId);

        mockMvc.perform(post("/workflows/wf-1/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"input_data\": {\"topic\": \"llm\"}}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.execution_id").value(executionId.toString()));
    }

    @Test
    @DisplayName("Executing without a body passes no input")
    void executeWithoutBody() throws Exception {
        when(workflowService.executeWorkflow(eq("wf-1"), isNull())).thenReturn(UUID.randomUUID());

        mockMvc.perform(post("/workflows/wf-1/execute")).andExpect(status().isAccepted());
    }

    private static Workflow workflow(String id) {
        return Workflow.builder()
            .id(id)
            .name("research")
            .workflowType(WorkflowType.SEQUENTIAL)
            .tags(Set.of("ml"))
            .step(WorkflowStep.builder().id("s1").name("fetch").stepType("task").build())
            .step(WorkflowStep.builder().id("s2").name("summarize").stepType("task").dependsOn("fetch").build())
            .build();
    }
}
