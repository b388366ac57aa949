package org.tokbench.runner.messaging;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import org.tokbench.common.ShardTask;
import org.tokbench.worker.messaging.ShardListener;

@Service
public class ShardDispatcher {

    private final TaskExecutor shardExecutor;
    private final ShardListener shardListener;

    public ShardDispatcher(@Qualifier("shardExecutor") TaskExecutor shardExecutor, ShardListener shardListener) {
        this.shardExecutor = shardExecutor;
        this.shardListener = shardListener;
    }

    public ShardHandle dispatch(ShardTask task) {
        ShardHandle handle = new ShardHandle(task);
        shardExecutor.execute(() -> {
            if (handle.isCancelRequested()) {
                handle.result().complete(shardListener.handleCancelled(task));
                return;
            }
            try {
                handle.result().complete(shardListener.handleShard(task, handle::isCancelRequested));
            } catch (RuntimeException | Error e) {
                handle.result().completeExceptionally(e);
                throw e;
            }
        });
        return handle;
    }
}
