package com.qa.coverage.controller;

import com.qa.coverage.dto.AutomationRunRequestDTO;
import com.qa.coverage.dto.ManualExecutionRequestDTO;
import com.qa.coverage.model.Automation;
import com.qa.coverage.model.ManualExecution;
import com.qa.coverage.service.ExecutionRecordService;
import com.qa.coverage.service.RecordNotFoundException;
import org.junit.Before;
import org.junit.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class ExecutionControllerTest {

    private ExecutionRecordService executionRecordService;
    private MockMvc mockMvc;

    @Before
    public void setUp() {
        executionRecordService = mock(ExecutionRecordService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new ExecutionController(executionRecordService)).build();
    }

    @Test
    public void createsManualExecution() throws Exception {
        ManualExecution saved = new ManualExecution();
        saved.setId(12L);
        saved.setTestCaseId(5L);
        saved.setResult("passed");
        when(executionRecordService.recordManualExecution(any(ManualExecutionRequestDTO.class))).thenReturn(saved);

        mockMvc.perform(post("/api/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"testCaseId\": 5, \"result\": \"passed\", \"executionDate\": \"2024-05-09T10:00:00Z\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(12))
                .andExpect(jsonPath("$.result").value("passed"));
    }

    @Test
    public void invalidManualExecutionIsBadRequest() throws Exception {
        when(executionRecordService.recordManualExecution(any(ManualExecutionRequestDTO.class)))
                .thenThrow(new IllegalArgumentException("testCaseId is required"));

        mockMvc.perform(post("/api/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"result\": \"passed\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value("testCaseId is required"));
    }

    @Test
    public void updatesAutomationRun() throws Exception {
        Automation saved = new Automation();
        saved.setIdAutomation(3L);
        saved.setTestCaseId(8L);
        saved.setLastRunResult("failed");
        when(executionRecordService.recordAutomationRun(eq(3L), any(AutomationRunRequestDTO.class))).thenReturn(saved);

        mockMvc.perform(put("/api/automations/3/last-run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"result\": \"failed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lastRunResult").value("failed"))
                .andExpect(jsonPath("$.testCaseId").value(8));
    }

    @Test
    public void unknownAutomationIsNotFound() throws Exception {
        when(executionRecordService.recordAutomationRun(eq(99L), any(AutomationRunRequestDTO.class)))
                .thenThrow(new RecordNotFoundException("Automation not found with id 99"));

        mockMvc.perform(put("/api/automations/99/last-run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"result\": \"passed\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    public void automationWithoutTestCaseStillAnswersOk() throws Exception {
        Automation saved = new Automation();
        saved.setIdAutomation(3L);
        saved.setLastRunResult("passed");
        when(executionRecordService.recordAutomationRun(eq(3L), any(AutomationRunRequestDTO.class))).thenReturn(saved);

        mockMvc.perform(put("/api/automations/3/last-run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"result\": \"passed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(3))
                .andExpect(jsonPath("$.testCaseId").isEmpty())
                .andExpect(jsonPath("$.lastRunResult").value("passed"));
    }
}
