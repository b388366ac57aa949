package org.tokbench.runner.text;

import java.util.ArrayList;
import java.util.List;

public class ShardPlanner {

    private final long shardSize;

    public ShardPlanner(long shardSize) {
        if (shardSize <= 0) {
            throw new IllegalArgumentException("Shard size must be positive: " + shardSize);
        }
        this.shardSize = shardSize;
    }

    public List<ShardRange> plan(long sentenceCount) {
        List<ShardRange> shards = new ArrayList<>();
        long start = 0;
        int index = 0;
        while (start < sentenceCount) {
            long end = Math.min(sentenceCount, start + shardSize);
            shards.add(new ShardRange(index++, start, end));
            start = end;
        }
        return shards;
    }

    public record ShardRange(int index, long start, long end) {}
}
