package org.tokbench.runner.service;

import org.tokbench.aggregator.model.RunReport;
import org.tokbench.common.Language;
import org.tokbench.runner.messaging.ShardHandle;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

public class BenchmarkRun {

    private final String runId;
    private final String namespace;
    private final Language language;
    private final List<String> tokenizerIds;
    private final int batchSize;
    private final boolean resume;
    private final Path corpus;

    private final List<ShardHandle> shards = new CopyOnWriteArrayList<>();
    private final AtomicBoolean aborted = new AtomicBoolean();
    private final CompletableFuture<RunReport> completion = new CompletableFuture<>();

    BenchmarkRun(String runId, String namespace, Language language, List<String> tokenizerIds,
                 int batchSize, boolean resume, Path corpus) {
        this.runId = runId;
        this.namespace = namespace;
        this.language = language;
        this.tokenizerIds = List.copyOf(tokenizerIds);
        this.batchSize = batchSize;
        this.resume = resume;
        this.corpus = corpus;
    }

    public String getRunId() {
        return runId;
    }

    public String getNamespace() {
        return namespace;
    }

    public Language getLanguage() {
        return language;
    }

    public List<String> getTokenizerIds() {
        return tokenizerIds;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public boolean isResume() {
        return resume;
    }

    public Path getCorpus() {
        return corpus;
    }

    public CompletableFuture<RunReport> completion() {
        return completion;
    }

    void addShard(ShardHandle handle) {
        shards.add(handle);
    }

    List<ShardHandle> getShards() {
        return shards;
    }

    /** Cancels every shard once. @return {@code false} if the run was already aborted */
    boolean abort() {
        if (!aborted.compareAndSet(false, true)) {
            return false;
        }
        shards.forEach(ShardHandle::cancel);
        return true;
    }

    public boolean isAborted() {
        return aborted.get();
    }
}
