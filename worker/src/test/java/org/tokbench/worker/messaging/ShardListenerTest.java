package org.tokbench.worker.messaging;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;
import org.tokbench.common.Language;
import org.tokbench.common.ShardResult;
import org.tokbench.common.ShardTask;
import org.tokbench.common.store.StoreException;
import org.tokbench.worker.service.ShardProcessingService;
import org.tokbench.worker.tokenizer.TokenizerAdapter;
import org.tokbench.worker.tokenizer.TokenizerInitException;
import org.tokbench.worker.tokenizer.TokenizerRegistry;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ShardListenerTest {

    private static final BooleanSupplier NOT_CANCELLED = () -> false;

    private ShardProcessingService processingService;
    private TokenizerRegistry tokenizerRegistry;
    private ApplicationEventPublisher eventPublisher;
    private ShardListener listener;

    @BeforeEach
    void setUp() {
        processingService = mock(ShardProcessingService.class);
        tokenizerRegistry = mock(TokenizerRegistry.class);
        eventPublisher = mock(ApplicationEventPublisher.class);
        listener = new ShardListener(processingService, tokenizerRegistry, eventPublisher);
        when(tokenizerRegistry.create(eq("jieba"), eq(Language.ZH)))
                .thenAnswer(invocation -> mock(TokenizerAdapter.class));
    }

    @Test
    void publishesResultOfProcessedShard() {
        ShardTask task = task(0);
        ShardResult expected = completed(task);
        when(processingService.processShard(eq(task), any(), any())).thenReturn(expected);

        ShardResult result = listener.handleShard(task, NOT_CANCELLED);

        assertSame(expected, result);
        verify(eventPublisher).publishEvent(expected);
    }

    @Test
    void passesCancellationFlagToProcessing() {
        ShardTask task = task(0);
        BooleanSupplier cancelRequested = () -> true;
        when(processingService.processShard(eq(task), any(), eq(cancelRequested))).thenReturn(completed(task));

        listener.handleShard(task, cancelRequested);

        verify(processingService).processShard(eq(task), any(), eq(cancelRequested));
    }

    @Test
    void reusesTokenizerWithinOneWorkerThread() {
        when(processingService.processShard(any(), any(), any())).thenAnswer(invocation -> completed(invocation.getArgument(0)));

        listener.handleShard(task(0), NOT_CANCELLED);
        listener.handleShard(task(1), NOT_CANCELLED);

        verify(tokenizerRegistry, times(1)).create("jieba", Language.ZH);
    }

    @Test
    void eachWorkerThreadGetsItsOwnTokenizer() throws Exception {
        when(processingService.processShard(any(), any(), any())).thenAnswer(invocation -> completed(invocation.getArgument(0)));

        listener.handleShard(task(0), NOT_CANCELLED);
        ExecutorService other = Executors.newSingleThreadExecutor();
        try {
            other.submit(() -> listener.handleShard(task(1), NOT_CANCELLED)).get();
        } finally {
            other.shutdown();
        }

        verify(tokenizerRegistry, times(2)).create("jieba", Language.ZH);
    }

    @Test
    void storeFailureIsReportedAsFatal() {
        ShardTask task = task(0);
        when(processingService.processShard(eq(task), any(), any())).thenThrow(new StoreException("disk full"));

        ShardResult result = listener.handleShard(task, NOT_CANCELLED);

        assertEquals(ShardResult.Status.STORE_FAILED, result.status());
        assertTrue(result.isFatal());
        verify(eventPublisher).publishEvent(result);
    }

    @Test
    void unknownTokenizerIsReportedAsInitFailure() {
        ShardTask task = new ShardTask("run-1", "default", Language.ZH, "nope", 0, 1, 0, 10, Path.of("zh.txt"), 5);
        when(tokenizerRegistry.create("nope", Language.ZH))
                .thenThrow(new TokenizerInitException("nope", Language.ZH, "Unknown tokenizer"));

        ShardResult result = listener.handleShard(task, NOT_CANCELLED);

        assertEquals(ShardResult.Status.TOKENIZER_INIT_FAILED, result.status());
        assertTrue(result.error().contains("Unknown tokenizer"));
    }

    @Test
    void unexpectedFailureDoesNotEscapeWorker() {
        ShardTask task = task(2);
        when(processingService.processShard(eq(task), any(), any())).thenThrow(new IllegalStateException("boom"));

        ShardResult result = listener.handleShard(task, NOT_CANCELLED);

        assertEquals(ShardResult.Status.FAILED, result.status());
        assertEquals(2, result.shardIndex());
    }

    private static ShardTask task(int shardIndex) {
        return new ShardTask("run-1", "default", Language.ZH, "jieba", shardIndex, 3,
                shardIndex * 10L, shardIndex * 10L + 10, Path.of("zh.txt"), 5);
    }

    private static ShardResult completed(ShardTask task) {
        return new ShardResult(task.runId(), task.namespace(), task.language(), task.tokenizerId(),
                task.shardIndex(), task.totalShards(), ShardResult.Status.COMPLETED,
                10, 10, 0, 0, 0, task.endOffset() - 1, null);
    }
}
