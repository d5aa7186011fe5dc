package com.searchnexus.controller;

import com.searchnexus.exception.NexusErrorCode;
import com.searchnexus.exception.NexusException;
import com.searchnexus.model.LifecycleAction;
import com.searchnexus.model.LifecycleTask;
import com.searchnexus.model.ReconcileOutcome;
import com.searchnexus.service.LifecycleTaskService;
import com.searchnexus.service.NodeOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LifecycleController.class)
class LifecycleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LifecycleTaskService taskService;

    @MockBean
    private NodeOrchestrator orchestrator;

    @Test
    void timedOutTaskCarriesErrorCode() throws Exception {
        LifecycleTask task = new LifecycleTask();
        task.setTaskId("task-1");
        task.setNodeName("node-1");
        task.setAction(LifecycleAction.START);
        task.setStatus("timed_out");
        task.setOutcome(ReconcileOutcome.TIMED_OUT);
        task.setErrorCode("N-504");
        task.setAttempt(20);
        task.setMaxAttempts(20);
        when(taskService.get("task-1")).thenReturn(task);

        mockMvc.perform(get("/api/tasks/task-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("TIMED_OUT"))
                .andExpect(jsonPath("$.errorCode").value("N-504"))
                .andExpect(jsonPath("$.attempt").value(20));
    }

    @Test
    void expiredTaskIsNotFound() throws Exception {
        when(taskService.get("old")).thenThrow(new NexusException(NexusErrorCode.TASK_NOT_FOUND, "Task \"old\" not found"));

        mockMvc.perform(get("/api/tasks/old"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.reason").value("task_not_found"));
    }

    @Test
    void closingSessionReportsCancelledWaits() throws Exception {
        when(orchestrator.cancelSession("browser-tab-1")).thenReturn(2);

        mockMvc.perform(delete("/api/sessions/browser-tab-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("browser-tab-1"))
                .andExpect(jsonPath("$.cancelledWaits").value(2));
    }
}
