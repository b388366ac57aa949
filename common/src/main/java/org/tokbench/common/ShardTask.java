package org.tokbench.common;

import java.nio.file.Path;

public record ShardTask(
        String runId,
        String namespace,
        Language language,
        String tokenizerId,
        int shardIndex,
        int totalShards,
        long startOffset,
        long endOffset,
        Path corpus,
        int batchSize
) {
    public ShardTask {
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("Invalid shard range [" + startOffset + ", " + endOffset + ")");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
    }

    public long size() {
        return endOffset - startOffset;
    }

    public String describe() {
        return language.code() + "/" + tokenizerId + " shard " + shardIndex
                + " [" + startOffset + ", " + endOffset + ")";
    }
}
