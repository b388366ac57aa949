package org.tokbench.runner.cli;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.tokbench.aggregator.model.PairSummary;
import org.tokbench.aggregator.model.RunReport;
import org.tokbench.aggregator.model.RunStatus;
import org.tokbench.runner.service.RunRequest;
import org.tokbench.runner.service.RunService;

import java.util.Locale;

@Component
@ConditionalOnProperty(prefix = "tokbench.run", name = "on-startup", havingValue = "true")
@Slf4j
public class BenchmarkCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    private final RunService runService;
    private volatile int exitCode = 1;

    public BenchmarkCommandLineRunner(RunService runService) {
        this.runService = runService;
    }

    @Override
    public void run(String... args) {
        RunReport report = runService.runAndWait(RunRequest.defaults());
        for (PairSummary pair : report.pairs()) {
            log.info("{} {}: hit_ratio={} hits={} tokens={} sentences={} degenerate={} skipped={} status={}",
                    report.language(), pair.tokenizerId(), String.format(Locale.ROOT, "%.6f", pair.hitRatio()),
                    pair.totalHits(), pair.totalTokens(), pair.totalSentences(), pair.degenerate(),
                    pair.skipped(), pair.status());
        }
        exitCode = report.status() == RunStatus.COMPLETED ? 0 : 1;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
