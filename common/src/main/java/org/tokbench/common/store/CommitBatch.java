package org.tokbench.common.store;

import org.tokbench.common.HitRecord;
import org.tokbench.common.Language;

import java.util.List;

public record CommitBatch(
        String namespace,
        Language language,
        String tokenizerId,
        long shardStart,
        long shardEnd,
        List<HitRecord> records,
        long checkpoint
) {
    public CommitBatch {
        records = List.copyOf(records);
    }
}
