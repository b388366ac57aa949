package org.tokbench.aggregator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record RunReport(
        @JsonProperty("run_id") String runId,
        String namespace,
        String language,
        RunStatus status,
        boolean resumed,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt,
        @JsonProperty("tokenizers") List<PairSummary> pairs
) {
    public PairSummary pair(String tokenizerId) {
        return pairs.stream()
                .filter(p -> p.tokenizerId().equals(tokenizerId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No tokenizer '" + tokenizerId + "' in run " + runId));
    }
}
