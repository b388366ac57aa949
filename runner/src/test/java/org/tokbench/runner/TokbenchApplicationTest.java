package org.tokbench.runner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.tokbench.aggregator.model.RunReport;
import org.tokbench.aggregator.model.RunStatus;
import org.tokbench.runner.service.RunRequest;
import org.tokbench.runner.service.RunService;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TokbenchApplicationTest {

    @TempDir
    static Path dir;

    @DynamicPropertySource
    static void paths(DynamicPropertyRegistry registry) {
        registry.add("tokbench.run.store-path", () -> dir.resolve("store").toString());
        registry.add("tokbench.report.base-path", () -> dir.resolve("reports").toString());
    }

    @Autowired
    private RunService runService;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void runsBenchmarkAndServesResults() throws Exception {
        RunReport report = runService.runAndWait(new RunRequest(null, null, null, false));

        assertEquals(RunStatus.COMPLETED, report.status());
        assertEquals(2, report.pairs().size());
        assertTrue(Files.exists(dir.resolve("reports").resolve(report.runId() + ".json")));

        mockMvc.perform(get("/api/runs/{runId}", report.runId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.tokenizers[0].tokenizer").value("whitespace"))
                .andExpect(jsonPath("$.tokenizers[0].total_tokens").value(18))
                .andExpect(jsonPath("$.tokenizers[0].total_hits").value(12));

        mockMvc.perform(get("/api/aggregates/ur/whitespace"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_sentences").value(8))
                .andExpect(jsonPath("$.degenerate").value(2));
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        mockMvc.perform(get("/api/runs/{runId}", "missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void unsupportedLanguageIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/aggregates/fr/whitespace"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }
}
