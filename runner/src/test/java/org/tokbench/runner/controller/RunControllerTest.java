package org.tokbench.runner.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.tokbench.common.Language;
import org.tokbench.common.store.StoreException;
import org.tokbench.runner.service.BenchmarkRun;
import org.tokbench.runner.service.RunRequest;
import org.tokbench.runner.service.RunService;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class RunControllerTest {

    private RunService runService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        runService = mock(RunService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new RunController(runService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void startsRunWithRequestedParameters() throws Exception {
        BenchmarkRun run = mock(BenchmarkRun.class);
        when(run.getRunId()).thenReturn("run-1");
        when(run.getLanguage()).thenReturn(Language.ZH);
        when(run.getTokenizerIds()).thenReturn(List.of("jieba"));
        when(run.isResume()).thenReturn(false);
        when(runService.startRun(any())).thenReturn(run);

        mockMvc.perform(post("/api/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"language\":\"zh\",\"tokenizers\":[\"jieba\"],\"resume\":false}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.runId").value("run-1"))
                .andExpect(jsonPath("$.language").value("zh"))
                .andExpect(jsonPath("$.tokenizers[0]").value("jieba"));

        verify(runService).startRun(new RunRequest("zh", List.of("jieba"), null, false));
    }

    @Test
    void invalidRequestIsBadRequest() throws Exception {
        when(runService.startRun(any())).thenThrow(new IllegalArgumentException("Unknown tokenizer 'nope'"));

        mockMvc.perform(post("/api/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tokenizers\":[\"nope\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("Unknown tokenizer 'nope'"));
    }

    @Test
    void runInProgressIsConflict() throws Exception {
        when(runService.startRun(any())).thenThrow(new IllegalStateException("Run run-0 is still in progress"));

        mockMvc.perform(post("/api/runs"))
                .andExpect(status().isConflict());
    }

    @Test
    void storeFailureIsServerError() throws Exception {
        when(runService.startRun(any())).thenThrow(new StoreException("Failed to open store"));

        mockMvc.perform(post("/api/runs"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Internal Server Error"));
    }

    @Test
    void cancellingUnknownRunIsNotFound() throws Exception {
        when(runService.cancelRun("ghost")).thenReturn(false);
        when(runService.cancelRun("run-1")).thenReturn(true);

        mockMvc.perform(delete("/api/runs/ghost")).andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/runs/run-1")).andExpect(status().isAccepted());
    }
}
