package org.tokbench.aggregator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.tokbench.common.ShardResult;

/**
 * Report line of one tokenizer. {@code status} is {@code null} while some of its
 * shards have not reported yet.
 */
public record PairSummary(
        @JsonProperty("tokenizer") String tokenizerId,
        ShardResult.Status status,
        @JsonProperty("hit_ratio") double hitRatio,
        @JsonProperty("total_sentences") long totalSentences,
        @JsonProperty("total_tokens") long totalTokens,
        @JsonProperty("total_hits") long totalHits,
        long skipped,
        long degenerate,
        long checkpoint,
        @JsonProperty("shards_reported") int shardsReported,
        int shards,
        String error
) {
    public static PairSummary of(AggregateResult aggregate, ShardResult.Status status,
                                 int shardsReported, int shards, String error) {
        return new PairSummary(aggregate.tokenizerId(), status, aggregate.hitRatio(),
                aggregate.totalSentences(), aggregate.totalTokens(), aggregate.totalHits(),
                aggregate.skipped(), aggregate.degenerate(), aggregate.checkpoint(),
                shardsReported, shards, error);
    }
}
