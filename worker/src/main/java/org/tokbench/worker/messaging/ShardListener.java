package org.tokbench.worker.messaging;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.tokbench.common.ShardResult;
import org.tokbench.common.ShardTask;
import org.tokbench.common.store.StoreException;
import org.tokbench.worker.service.ShardProcessingService;
import org.tokbench.worker.tokenizer.TokenizerAdapter;
import org.tokbench.worker.tokenizer.TokenizerInitException;
import org.tokbench.worker.tokenizer.TokenizerRegistry;

import java.util.HashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;

@Component
@Slf4j
public class ShardListener {

    private final ShardProcessingService shardProcessingService;
    private final TokenizerRegistry tokenizerRegistry;
    private final ApplicationEventPublisher eventPublisher;
    private final ThreadLocal<Map<String, TokenizerAdapter>> workerTokenizers = ThreadLocal.withInitial(HashMap::new);

    public ShardListener(ShardProcessingService shardProcessingService,
                         TokenizerRegistry tokenizerRegistry,
                         ApplicationEventPublisher eventPublisher) {
        this.shardProcessingService = shardProcessingService;
        this.tokenizerRegistry = tokenizerRegistry;
        this.eventPublisher = eventPublisher;
    }

    public ShardResult handleShard(ShardTask task, BooleanSupplier cancelRequested) {
        ShardResult result;
        try {
            result = shardProcessingService.processShard(task, tokenizerFor(task), cancelRequested);
        } catch (TokenizerInitException e) {
            log.error("{} not processed: {}", task.describe(), e.getMessage());
            result = failed(task, ShardResult.Status.TOKENIZER_INIT_FAILED, e);
        } catch (StoreException e) {
            log.error("{} aborted on store failure", task.describe(), e);
            result = failed(task, ShardResult.Status.STORE_FAILED, e);
        } catch (RuntimeException e) {
            log.error("{} failed", task.describe(), e);
            result = failed(task, ShardResult.Status.FAILED, e);
        }
        eventPublisher.publishEvent(result);
        return result;
    }

    public ShardResult handleCancelled(ShardTask task) {
        log.info("{} withdrawn before it started", task.describe());
        ShardResult result = new ShardResult(task.runId(), task.namespace(), task.language(), task.tokenizerId(),
                task.shardIndex(), task.totalShards(), ShardResult.Status.CANCELLED, 0, 0, 0, 0, 0, -1, "cancelled");
        eventPublisher.publishEvent(result);
        return result;
    }

    private TokenizerAdapter tokenizerFor(ShardTask task) {
        String key = task.tokenizerId() + "/" + task.language().code();
        Map<String, TokenizerAdapter> tokenizers = workerTokenizers.get();
        TokenizerAdapter tokenizer = tokenizers.get(key);
        if (tokenizer == null) {
            tokenizer = tokenizerRegistry.create(task.tokenizerId(), task.language());
            tokenizers.put(key, tokenizer);
        }
        return tokenizer;
    }

    private static ShardResult failed(ShardTask task, ShardResult.Status status, Exception e) {
        return new ShardResult(task.runId(), task.namespace(), task.language(), task.tokenizerId(),
                task.shardIndex(), task.totalShards(), status, 0, 0, 0, 0, 0, -1, e.getMessage());
    }
}
