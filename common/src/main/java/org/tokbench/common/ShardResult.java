package org.tokbench.common;

public record ShardResult(
        String runId,
        String namespace,
        Language language,
        String tokenizerId,
        int shardIndex,
        int totalShards,
        Status status,
        long committed,
        long scored,
        long degenerate,
        long skipped,
        long alreadyCommitted,
        long checkpoint,
        String error
) {
    /** Declared from least to most severe. */
    public enum Status {
        COMPLETED,
        CANCELLED,
        TOKENIZER_INIT_FAILED,
        FAILED,
        STORE_FAILED;

        public Status worse(Status other) {
            return other != null && other.ordinal() > ordinal() ? other : this;
        }
    }

    public boolean isFatal() {
        return status == Status.STORE_FAILED;
    }
}
