package com.agentflow.api.rest;

import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.model.ExecutionStatistics;
import com.agentflow.core.model.SystemStatistics;
import com.agentflow.core.model.WorkflowStatus;
import com.agentflow.core.model.WorkflowType;
import com.agentflow.engine.service.WorkflowService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class StatisticsControllerTest {

    @Mock
    private WorkflowService workflowService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new StatisticsController(workflowService))
            .setControllerAdvice(new ApiExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(WorkflowControllerTest.MAPPER))
            .build();
    }

    @Test
    @DisplayName("Workflow statistics include the success rate over finished executions")
    void workflowStatistics() throws Exception {
        when(workflowService.getWorkflowStatistics("wf-1"))
            .thenReturn(new ExecutionStatistics("wf-1", 5, 3, 1, 0, 1, 2.5));

        mockMvc.perform(get("/workflows/wf-1/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.workflow_id").value("wf-1"))
            .andExpect(jsonPath("$.execution_count").value(5))
            .andExpect(jsonPath("$.running_count").value(1))
            .andExpect(jsonPath("$.success_rate").value(0.75));
    }

    @Test
    @DisplayName("Statistics for an unknown workflow are not found")
    void unknownWorkflow() throws Exception {
        when(workflowService.getWorkflowStatistics("nope")).thenThrow(new NotFoundException("Workflow", "nope"));

        mockMvc.perform(get("/workflows/nope/stats")).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("System statistics list every type and status, zero when absent")
    void systemStatistics() throws Exception {
        when(workflowService.getSystemStatistics()).thenReturn(new SystemStatistics(
            3,
            Map.of(WorkflowType.PARALLEL, 2L, WorkflowType.LOOP, 1L),
            Map.of(WorkflowStatus.ACTIVE, 3L),
            new ExecutionStatistics(null, 10, 8, 2, 0, 0, 1.0)));

        mockMvc.perform(get("/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_workflows").value(3))
            .andExpect(jsonPath("$.workflows_by_type.parallel").value(2))
            .andExpect(jsonPath("$.workflows_by_type.sequential").value(0))
            .andExpect(jsonPath("$.workflows_by_status.active").value(3))
            .andExpect(jsonPath("$.success_rate").value(0.8));
    }
}
