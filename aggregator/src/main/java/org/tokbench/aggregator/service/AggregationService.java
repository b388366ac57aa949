package org.tokbench.aggregator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.tokbench.aggregator.model.AggregateResult;
import org.tokbench.aggregator.model.PairSummary;
import org.tokbench.aggregator.model.RunAggregate;
import org.tokbench.aggregator.model.RunReport;
import org.tokbench.common.HitRecord;
import org.tokbench.common.Language;
import org.tokbench.common.ShardResult;
import org.tokbench.common.store.HitRecordStore;
import org.tokbench.common.store.StoreException;
import org.tokbench.common.store.StoreSnapshot;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

@Service
@Slf4j
public class AggregationService {

    private final HitRecordStore store;
    private final ObjectMapper objectMapper;
    private final Path reportsDir;
    private final int maxCompletedReports;
    private final Clock clock;

    private final Map<String, RunAggregate> runs = new ConcurrentHashMap<>();
    private final Map<String, RunReport> completedReports = new ConcurrentHashMap<>();
    private final Deque<String> completionOrder = new ConcurrentLinkedDeque<>();

    @Autowired
    public AggregationService(HitRecordStore store,
                              ObjectMapper objectMapper,
                              @Value("${tokbench.report.base-path:reports}") String reportsDir,
                              @Value("${tokbench.report.max-completed:200}") int maxCompletedReports) {
        this(store, objectMapper, Path.of(reportsDir), maxCompletedReports, Clock.systemUTC());
    }

    AggregationService(HitRecordStore store, ObjectMapper objectMapper, Path reportsDir,
                       int maxCompletedReports, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.reportsDir = reportsDir;
        this.maxCompletedReports = maxCompletedReports;
        this.clock = clock;
    }

    /**
     * Totals over everything committed for the pair when the call starts. Records
     * committed while the fold runs are not seen.
     */
    public AggregateResult aggregate(String namespace, Language language, String tokenizerId) {
        long hits = 0;
        long tokens = 0;
        long sentences = 0;
        long degenerate = 0;
        long skipped = 0;
        long checkpoint;
        try (StoreSnapshot snapshot = store.openSnapshot();
             StoreSnapshot.RecordCursor cursor = snapshot.scanAll(namespace, language, tokenizerId)) {
            while (cursor.hasNext()) {
                HitRecord record = cursor.next();
                switch (record.outcome()) {
                    case SCORED -> {
                        hits += record.hits();
                        tokens += record.tokens();
                        sentences++;
                    }
                    case DEGENERATE -> degenerate++;
                    case SKIPPED -> skipped++;
                }
            }
            checkpoint = snapshot.contiguousCheckpoint(namespace, language, tokenizerId);
        }
        return AggregateResult.of(namespace, language, tokenizerId, hits, tokens, sentences,
                degenerate, skipped, checkpoint);
    }

    public void startRun(RunAggregate run) {
        if (runs.putIfAbsent(run.getRunId(), run) != null) {
            throw new IllegalStateException("Run " + run.getRunId() + " is already registered");
        }
        log.info("Tracking run {}: {} tokenizers x {} shards", run.getRunId(),
                run.getTokenizerIds().size(), run.getShardsPerTokenizer());
    }

    public void handleShardResult(ShardResult result) {
        RunAggregate run = runs.get(result.runId());
        if (run == null) {
            log.warn("Dropping result of shard {} for unknown or closed run {}", result.shardIndex(), result.runId());
            return;
        }
        if (!run.addShardResult(result)) {
            log.debug("Duplicate result of {} shard {} ignored", result.tokenizerId(), result.shardIndex());
            return;
        }
        if (run.isComplete()) {
            finish(run, false);
        }
    }

    /**
     * Closes a run whose remaining shards will not report, for instance after it was
     * aborted. Returns the existing report if the run already completed.
     */
    public RunReport completeRun(String runId) {
        RunAggregate run = runs.get(runId);
        if (run == null) {
            RunReport report = completedReports.get(runId);
            if (report == null) {
                throw new IllegalArgumentException("Unknown run " + runId);
            }
            return report;
        }
        RunReport report = finish(run, true);
        return report != null ? report : completedReports.get(runId);
    }

    public Optional<RunReport> getReport(String runId) {
        RunReport completed = completedReports.get(runId);
        if (completed != null) {
            return Optional.of(completed);
        }
        RunAggregate run = runs.get(runId);
        if (run == null) {
            return Optional.empty();
        }
        return Optional.of(buildReport(run, false));
    }

    private RunReport finish(RunAggregate run, boolean closing) {
        if (!run.markReported()) {
            return null;
        }
        RunReport report = buildReport(run, closing);
        try {
            writeReportToFile(report);
        } catch (UncheckedIOException e) {
            log.error("Report of run {} kept in memory only", run.getRunId(), e);
        }
        storeCompletedReport(report);
        runs.remove(run.getRunId());
        log.info("Run {} finished with status {}", run.getRunId(), report.status());
        run.completion().complete(report);
        return report;
    }

    private RunReport buildReport(RunAggregate run, boolean closing) {
        List<PairSummary> pairs = new ArrayList<>();
        for (String tokenizerId : run.getTokenizerIds()) {
            AggregateResult aggregate;
            try {
                aggregate = aggregate(run.getNamespace(), run.getLanguage(), tokenizerId);
            } catch (StoreException e) {
                log.error("Totals of {} unavailable for run {}", tokenizerId, run.getRunId(), e);
                aggregate = AggregateResult.empty(run.getNamespace(), run.getLanguage(), tokenizerId);
            }
            pairs.add(PairSummary.of(aggregate, run.pairStatus(tokenizerId, closing),
                    run.shardsReported(tokenizerId), run.getShardsPerTokenizer(), run.pairError(tokenizerId)));
        }
        boolean finished = closing || run.isComplete();
        return new RunReport(run.getRunId(), run.getNamespace(), run.getLanguage().code(),
                run.runStatus(closing), run.isResumed(), run.getStartedAt(),
                finished ? clock.instant() : null, pairs);
    }

    private void writeReportToFile(RunReport report) {
        try {
            Files.createDirectories(reportsDir);
            Path out = reportsDir.resolve(report.runId() + ".json");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(out.toFile(), report);
            log.info("Report of run {} written to {}", report.runId(), out.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report for run " + report.runId(), e);
        }
    }

    private void storeCompletedReport(RunReport report) {
        completedReports.put(report.runId(), report);
        completionOrder.addLast(report.runId());

        while (completionOrder.size() > maxCompletedReports) {
            String evict = completionOrder.pollFirst();
            if (evict != null) {
                completedReports.remove(evict);
            }
        }
    }
}
