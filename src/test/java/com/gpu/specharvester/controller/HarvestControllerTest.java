package com.gpu.specharvester.controller;

import com.gpu.specharvester.dto.RunStartResult;
import com.gpu.specharvester.dto.RunStatus;
import com.gpu.specharvester.dto.RunSummary;
import com.gpu.specharvester.service.RunMode;
import com.gpu.specharvester.service.RunState;
import com.gpu.specharvester.service.RunSupervisor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HarvestController.class)
class HarvestControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RunSupervisor supervisor;

    @Test
    void testStartAccepted() throws Exception {
        when(supervisor.start(RunMode.FULL, null)).thenReturn(RunStartResult.accepted("Started full run"));

        mockMvc.perform(post("/api/harvester/run").param("mode", "full"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("started"))
                .andExpect(jsonPath("$.message").value("Started full run"));
    }

    @Test
    void testDefaultModeWithGpuFilter() throws Exception {
        when(supervisor.start(RunMode.DEFAULT, "Acme X1")).thenReturn(RunStartResult.accepted("Started default run"));

        mockMvc.perform(post("/api/harvester/run").param("gpu", "Acme X1"))
                .andExpect(status().isAccepted());

        verify(supervisor).start(RunMode.DEFAULT, "Acme X1");
    }

    @Test
    void testStartRejectedWhileRunning() throws Exception {
        when(supervisor.start(any(), isNull()))
                .thenReturn(RunStartResult.rejected("A default run is already in progress"));

        mockMvc.perform(post("/api/harvester/run").param("mode", "incremental"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("rejected"));
    }

    @Test
    void testUnknownModeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/harvester/run").param("mode", "weekly"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown run mode: weekly"));

        verifyNoInteractions(supervisor);
    }

    @Test
    void testStatus() throws Exception {
        RunSummary last = RunSummary.builder()
                .mode(RunMode.INCREMENTAL)
                .updatedReviews(4)
                .success(true)
                .build();
        when(supervisor.status()).thenReturn(new RunStatus(RunState.RUNNING, true, RunMode.FULL,
                "full update: updating reviews", 42, last));

        mockMvc.perform(get("/api/harvester/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.mode").value("FULL"))
                .andExpect(jsonPath("$.progress").value(42))
                .andExpect(jsonPath("$.lastSummary.updatedReviews").value(4))
                .andExpect(jsonPath("$.lastSummary.success").value(true));
    }
}
