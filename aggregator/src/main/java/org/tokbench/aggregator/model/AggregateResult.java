package org.tokbench.aggregator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.tokbench.common.Language;

public record AggregateResult(
        String namespace,
        Language language,
        @JsonProperty("tokenizer") String tokenizerId,
        @JsonProperty("total_hits") long totalHits,
        @JsonProperty("total_tokens") long totalTokens,
        @JsonProperty("total_sentences") long totalSentences,
        long degenerate,
        long skipped,
        long checkpoint,
        @JsonProperty("hit_ratio") double hitRatio
) {
    public static AggregateResult of(String namespace, Language language, String tokenizerId,
                                     long totalHits, long totalTokens, long totalSentences,
                                     long degenerate, long skipped, long checkpoint) {
        double ratio = totalTokens == 0 ? 0.0 : (double) totalHits / totalTokens;
        return new AggregateResult(namespace, language, tokenizerId, totalHits, totalTokens,
                totalSentences, degenerate, skipped, checkpoint, ratio);
    }

    public static AggregateResult empty(String namespace, Language language, String tokenizerId) {
        return of(namespace, language, tokenizerId, 0, 0, 0, 0, 0, -1);
    }
}
