package org.tokbench.runner.messaging;

import org.tokbench.common.ShardResult;
import org.tokbench.common.ShardTask;

import java.util.concurrent.CompletableFuture;

/**
 * A dispatched shard. Cancelling only raises a flag: the worker is never interrupted,
 * since an interrupt during a LevelDB write closes the store's files for good.
 */
public class ShardHandle {

    private final ShardTask task;
    private final CompletableFuture<ShardResult> result = new CompletableFuture<>();
    private volatile boolean cancelRequested;

    ShardHandle(ShardTask task) {
        this.task = task;
    }

    public ShardTask getTask() {
        return task;
    }

    public CompletableFuture<ShardResult> result() {
        return result;
    }

    public void cancel() {
        cancelRequested = true;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }
}
