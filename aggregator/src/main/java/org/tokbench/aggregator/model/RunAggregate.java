package org.tokbench.aggregator.model;

import org.tokbench.common.Language;
import org.tokbench.common.ShardResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

public class RunAggregate {

    private final String runId;
    private final String namespace;
    private final Language language;
    private final List<String> tokenizerIds;
    private final int shardsPerTokenizer;
    private final boolean resumed;
    private final Instant startedAt;

    private final Map<String, ShardResult> shards = new ConcurrentHashMap<>();
    private final AtomicBoolean reported = new AtomicBoolean();
    private final CompletableFuture<RunReport> completion = new CompletableFuture<>();

    public RunAggregate(String runId, String namespace, Language language, List<String> tokenizerIds,
                        int shardsPerTokenizer, boolean resumed, Instant startedAt) {
        this.runId = runId;
        this.namespace = namespace;
        this.language = language;
        this.tokenizerIds = List.copyOf(tokenizerIds);
        this.shardsPerTokenizer = shardsPerTokenizer;
        this.resumed = resumed;
        this.startedAt = startedAt;
    }

    /** @return {@code false} if this shard had already reported */
    public synchronized boolean addShardResult(ShardResult result) {
        if (!runId.equals(result.runId())) {
            throw new IllegalArgumentException("Result of run " + result.runId() + " delivered to run " + runId);
        }
        if (!tokenizerIds.contains(result.tokenizerId())) {
            throw new IllegalArgumentException("Tokenizer '" + result.tokenizerId() + "' is not part of run " + runId);
        }
        return shards.putIfAbsent(key(result.tokenizerId(), result.shardIndex()), result) == null;
    }

    public int expectedShards() {
        return tokenizerIds.size() * shardsPerTokenizer;
    }

    public boolean isComplete() {
        return shards.size() >= expectedShards();
    }

    /** Claims the right to write the final report. Only the first caller gets {@code true}. */
    public boolean markReported() {
        return reported.compareAndSet(false, true);
    }

    public int shardsReported(String tokenizerId) {
        return (int) shards.values().stream()
                .filter(r -> r.tokenizerId().equals(tokenizerId))
                .count();
    }

    /**
     * Most severe status among the tokenizer's shards. While shards are missing this is
     * {@code null}, unless the run is being closed, in which case they count as cancelled.
     */
    public ShardResult.Status pairStatus(String tokenizerId, boolean closing) {
        ShardResult.Status status = ShardResult.Status.COMPLETED;
        for (ShardResult result : shards.values()) {
            if (result.tokenizerId().equals(tokenizerId)) {
                status = status.worse(result.status());
            }
        }
        if (shardsReported(tokenizerId) < shardsPerTokenizer) {
            return closing ? status.worse(ShardResult.Status.CANCELLED) : null;
        }
        return status;
    }

    public String pairError(String tokenizerId) {
        return shards.values().stream()
                .filter(r -> r.tokenizerId().equals(tokenizerId) && r.error() != null)
                .sorted((a, b) -> Integer.compare(a.shardIndex(), b.shardIndex()))
                .map(ShardResult::error)
                .findFirst()
                .orElse(null);
    }

    public RunStatus runStatus(boolean closing) {
        if (!closing && !isComplete()) {
            return RunStatus.RUNNING;
        }
        RunStatus status = RunStatus.COMPLETED;
        for (String tokenizerId : tokenizerIds) {
            ShardResult.Status pair = pairStatus(tokenizerId, true);
            if (pair == ShardResult.Status.STORE_FAILED || pair == ShardResult.Status.FAILED) {
                return RunStatus.FAILED;
            }
            if (pair == ShardResult.Status.CANCELLED) {
                status = RunStatus.CANCELLED;
            }
        }
        return status;
    }

    public CompletableFuture<RunReport> completion() {
        return completion;
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

    public int getShardsPerTokenizer() {
        return shardsPerTokenizer;
    }

    public boolean isResumed() {
        return resumed;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    private static String key(String tokenizerId, int shardIndex) {
        return tokenizerId + "#" + shardIndex;
    }
}
