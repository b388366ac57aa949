package org.tokbench.aggregator.model;

import org.junit.jupiter.api.Test;
import org.tokbench.common.Language;
import org.tokbench.common.ShardResult;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunAggregateTest {

    private final RunAggregate run = new RunAggregate("run-1", "default", Language.HI,
            List.of("whitespace", "breakiterator"), 2, true, Instant.EPOCH);

    @Test
    void completesWhenEveryTokenizerShardReported() {
        run.addShardResult(result("whitespace", 0, ShardResult.Status.COMPLETED));
        run.addShardResult(result("whitespace", 1, ShardResult.Status.COMPLETED));
        run.addShardResult(result("breakiterator", 0, ShardResult.Status.COMPLETED));
        assertFalse(run.isComplete());

        run.addShardResult(result("breakiterator", 1, ShardResult.Status.CANCELLED));

        assertTrue(run.isComplete());
        assertEquals(RunStatus.CANCELLED, run.runStatus(false));
    }

    @Test
    void pairStatusIsTheMostSevereShardStatus() {
        run.addShardResult(result("whitespace", 0, ShardResult.Status.CANCELLED));
        run.addShardResult(result("whitespace", 1, ShardResult.Status.FAILED));

        assertEquals(ShardResult.Status.FAILED, run.pairStatus("whitespace", false));
        assertNull(run.pairStatus("breakiterator", false));
        assertEquals(ShardResult.Status.CANCELLED, run.pairStatus("breakiterator", true));
        assertEquals(RunStatus.FAILED, run.runStatus(true));
    }

    @Test
    void reportIsClaimedOnce() {
        assertTrue(run.markReported());
        assertFalse(run.markReported());
    }

    @Test
    void rejectsResultsOfOtherRunsOrTokenizers() {
        ShardResult foreign = new ShardResult("run-2", "default", Language.HI, "whitespace", 0, 2,
                ShardResult.Status.COMPLETED, 0, 0, 0, 0, 0, -1, null);

        assertThrows(IllegalArgumentException.class, () -> run.addShardResult(foreign));
        assertThrows(IllegalArgumentException.class,
                () -> run.addShardResult(result("jieba", 0, ShardResult.Status.COMPLETED)));
    }

    private static ShardResult result(String tokenizerId, int shardIndex, ShardResult.Status status) {
        return new ShardResult("run-1", "default", Language.HI, tokenizerId, shardIndex, 2, status,
                0, 0, 0, 0, 0, -1, null);
    }
}
