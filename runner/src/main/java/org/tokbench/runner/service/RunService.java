package org.tokbench.runner.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.tokbench.aggregator.model.RunAggregate;
import org.tokbench.aggregator.model.RunReport;
import org.tokbench.aggregator.service.AggregationService;
import org.tokbench.common.Language;
import org.tokbench.common.ShardResult;
import org.tokbench.common.ShardTask;
import org.tokbench.common.store.HitRecordStore;
import org.tokbench.common.store.StoreKeys;
import org.tokbench.runner.config.BenchmarkProperties;
import org.tokbench.runner.messaging.ShardDispatcher;
import org.tokbench.runner.messaging.ShardHandle;
import org.tokbench.runner.text.ShardPlanner;
import org.tokbench.worker.corpus.CorpusReader;
import org.tokbench.worker.tokenizer.TokenizerRegistry;
import org.tokbench.worker.vocabulary.VocabularyRegistry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

@Service
@Slf4j
public class RunService {

    private final BenchmarkProperties properties;
    private final HitRecordStore store;
    private final TokenizerRegistry tokenizerRegistry;
    private final VocabularyRegistry vocabularies;
    private final ShardDispatcher shardDispatcher;
    private final AggregationService aggregationService;

    private final AtomicReference<BenchmarkRun> active = new AtomicReference<>();

    public RunService(BenchmarkProperties properties,
                      HitRecordStore store,
                      TokenizerRegistry tokenizerRegistry,
                      VocabularyRegistry vocabularies,
                      ShardDispatcher shardDispatcher,
                      AggregationService aggregationService) {
        this.properties = properties;
        this.store = store;
        this.tokenizerRegistry = tokenizerRegistry;
        this.vocabularies = vocabularies;
        this.shardDispatcher = shardDispatcher;
        this.aggregationService = aggregationService;
    }

    public BenchmarkRun startRun(RunRequest request) {
        BenchmarkRun run = resolve(request);
        if (!active.compareAndSet(null, run)) {
            throw new IllegalStateException("Run " + active.get().getRunId() + " is still in progress");
        }
        try {
            launch(run);
        } catch (RuntimeException e) {
            active.compareAndSet(run, null);
            throw e;
        }
        return run;
    }

    /** Runs to the end and returns the final report. */
    public RunReport runAndWait(RunRequest request) {
        BenchmarkRun run = startRun(request);
        try {
            return run.completion().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelRun(run.getRunId());
            throw new IllegalStateException("Interrupted while waiting for run " + run.getRunId(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + run.getRunId() + " failed", e.getCause());
        }
    }

    /** @return {@code false} if no run with this id is in progress */
    public boolean cancelRun(String runId) {
        BenchmarkRun run = active.get();
        if (run == null || !run.getRunId().equals(runId)) {
            return false;
        }
        if (run.abort()) {
            log.warn("Run {} cancelled on request; resume continues from the last commits", runId);
        }
        return true;
    }

    /** Runs before the shard pool shuts down, so running shards stop at their next check. */
    @PreDestroy
    void cancelOnShutdown() {
        BenchmarkRun run = active.get();
        if (run != null && run.abort()) {
            log.warn("Run {} cancelled on shutdown; resume continues from the last commits", run.getRunId());
        }
    }

    public Optional<BenchmarkRun> activeRun() {
        return Optional.ofNullable(active.get());
    }

    private BenchmarkRun resolve(RunRequest request) {
        Language language = Language.fromCode(request.language() != null ? request.language() : properties.getLanguage());

        List<String> requested = request.tokenizers() != null && !request.tokenizers().isEmpty()
                ? request.tokenizers()
                : properties.getTokenizers();
        List<String> tokenizers = new ArrayList<>(new LinkedHashSet<>(requested));
        if (tokenizers.isEmpty()) {
            throw new IllegalArgumentException("No tokenizers configured, set tokbench.run.tokenizers");
        }
        for (String id : tokenizers) {
            if (!tokenizerRegistry.isKnown(id)) {
                throw new IllegalArgumentException("Unknown tokenizer '" + id + "', known: " + tokenizerRegistry.ids());
            }
        }

        int batchSize = request.batchSize() != null ? request.batchSize() : properties.getBatchSize();
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        boolean resume = request.resume() != null ? request.resume() : properties.isResume();

        String corpusLocation = properties.getCorpus().get(language.code());
        if (corpusLocation == null) {
            throw new IllegalArgumentException("No corpus configured for " + language.code()
                    + ", set tokbench.run.corpus." + language.code());
        }
        Path corpus = Path.of(corpusLocation);
        if (!Files.isReadable(corpus)) {
            throw new IllegalArgumentException("Corpus " + corpus + " is not readable");
        }
        if (vocabularies.find(language).isEmpty()) {
            throw new IllegalArgumentException("No vocabulary configured for " + language.code()
                    + ", set tokbench.vocabulary.locations." + language.code());
        }
        String namespace = StoreKeys.validSegment(properties.getNamespace(), "namespace");

        return new BenchmarkRun(UUID.randomUUID().toString(), namespace, language, tokenizers, batchSize, resume, corpus);
    }

    private void launch(BenchmarkRun run) {
        if (!run.isResume()) {
            store.resetNamespace(run.getNamespace());
        }
        long sentences;
        try {
            sentences = CorpusReader.countLines(run.getCorpus());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read corpus " + run.getCorpus(), e);
        }
        List<ShardPlanner.ShardRange> shards = new ShardPlanner(properties.getShardSize()).plan(sentences);

        RunAggregate aggregate = new RunAggregate(run.getRunId(), run.getNamespace(), run.getLanguage(),
                run.getTokenizerIds(), shards.size(), run.isResume(), Instant.now());
        aggregationService.startRun(aggregate);
        aggregate.completion().whenComplete((report, e) -> close(run, report, e));

        log.info("Run {} started: {} sentences of {} in {} shards, tokenizers {}, {}",
                run.getRunId(), sentences, run.getLanguage().code(), shards.size(), run.getTokenizerIds(),
                run.isResume() ? "resuming" : "fresh");

        List<CompletableFuture<ShardResult>> results = new ArrayList<>();
        for (String tokenizerId : run.getTokenizerIds()) {
            for (ShardPlanner.ShardRange shard : shards) {
                ShardTask task = new ShardTask(run.getRunId(), run.getNamespace(), run.getLanguage(), tokenizerId,
                        shard.index(), shards.size(), shard.start(), shard.end(), run.getCorpus(), run.getBatchSize());
                ShardHandle handle = shardDispatcher.dispatch(task);
                run.addShard(handle);
                if (run.isAborted()) {
                    handle.cancel();
                }
                handle.result().thenAccept(result -> {
                    if (result.isFatal() && run.abort()) {
                        log.error("Run {} aborted: {} failed on the store", run.getRunId(), task.describe());
                    }
                });
                results.add(handle.result());
            }
        }

        // A shard that died without a result never reaches the aggregator, so close the run here.
        CompletableFuture.allOf(results.toArray(new CompletableFuture[0]))
                .whenComplete((ignored, e) -> {
                    if (e != null || results.isEmpty()) {
                        closeIncomplete(run, e);
                    }
                });
    }

    private void closeIncomplete(BenchmarkRun run, Throwable cause) {
        if (cause != null) {
            log.error("Run {} lost a shard", run.getRunId(), cause);
        }
        try {
            aggregationService.completeRun(run.getRunId());
        } catch (RuntimeException e) {
            log.error("Run {} could not be closed", run.getRunId(), e);
            close(run, null, e);
        }
    }

    private void close(BenchmarkRun run, RunReport report, Throwable e) {
        active.compareAndSet(run, null);
        if (e != null) {
            run.completion().completeExceptionally(e);
        } else {
            log.info("Run {} closed with status {}", run.getRunId(), report.status());
            run.completion().complete(report);
        }
    }
}
