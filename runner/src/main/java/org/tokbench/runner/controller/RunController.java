package org.tokbench.runner.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.tokbench.runner.service.BenchmarkRun;
import org.tokbench.runner.service.RunRequest;
import org.tokbench.runner.service.RunService;

import java.util.List;

@RestController
@RequestMapping("/api/runs")
public class RunController {

    private final RunService runService;

    public RunController(RunService runService) {
        this.runService = runService;
    }

    @PostMapping
    public ResponseEntity<RunResponse> start(@RequestBody(required = false) RunRequest request) {
        BenchmarkRun run = runService.startRun(request != null ? request : RunRequest.defaults());
        return ResponseEntity.accepted().body(RunResponse.of(run));
    }

    @DeleteMapping("/{runId}")
    public ResponseEntity<Void> cancel(@PathVariable String runId) {
        if (!runService.cancelRun(runId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.accepted().build();
    }

    public record RunResponse(
            String runId,
            String language,
            List<String> tokenizers,
            boolean resume
    ) {
        static RunResponse of(BenchmarkRun run) {
            return new RunResponse(run.getRunId(), run.getLanguage().code(), run.getTokenizerIds(), run.isResume());
        }
    }
}
