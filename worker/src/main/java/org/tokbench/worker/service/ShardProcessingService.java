package org.tokbench.worker.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.tokbench.common.CleanedSentence;
import org.tokbench.common.HitRecord;
import org.tokbench.common.Sentence;
import org.tokbench.common.ShardResult;
import org.tokbench.common.ShardTask;
import org.tokbench.common.TokenSequence;
import org.tokbench.common.store.CommitBatch;
import org.tokbench.common.store.HitRecordStore;
import org.tokbench.worker.clean.CleaningException;
import org.tokbench.worker.clean.TextCleaner;
import org.tokbench.worker.corpus.CorpusReader;
import org.tokbench.worker.corpus.LoadException;
import org.tokbench.worker.scoring.Scorer;
import org.tokbench.worker.tokenizer.ScriptTokenFilter;
import org.tokbench.worker.tokenizer.TokenizerAdapter;
import org.tokbench.worker.tokenizer.TokenizerInitException;
import org.tokbench.worker.tokenizer.TokenizerProperties;
import org.tokbench.worker.tokenizer.TokenizerRuntimeException;
import org.tokbench.worker.vocabulary.GroundTruthVocabulary;
import org.tokbench.worker.vocabulary.VocabularyRegistry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.ClosedByInterruptException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

@Service
@Slf4j
public class ShardProcessingService {

    private final HitRecordStore store;
    private final TextCleaner cleaner;
    private final Scorer scorer;
    private final VocabularyRegistry vocabularies;
    private final boolean scriptFilter;
    private final long logEvery;

    public ShardProcessingService(HitRecordStore store,
                                  TextCleaner cleaner,
                                  Scorer scorer,
                                  VocabularyRegistry vocabularies,
                                  TokenizerProperties tokenizerProperties,
                                  @Value("${tokbench.run.log-every:100000}") long logEvery) {
        this.store = store;
        this.cleaner = cleaner;
        this.scorer = scorer;
        this.vocabularies = vocabularies;
        this.scriptFilter = tokenizerProperties.isScriptFilter();
        this.logEvery = logEvery;
    }

    /**
     * Cancellation is cooperative: {@code cancelRequested} is polled before every
     * sentence and every commit, and a commit in progress is always finished.
     */
    public ShardResult processShard(ShardTask task, TokenizerAdapter tokenizer, BooleanSupplier cancelRequested) {
        GroundTruthVocabulary vocabulary = vocabularies.get(task.language());
        long resumeFrom = store.checkpoint(task.namespace(), task.language(), task.tokenizerId(), task.startOffset())
                .orElse(task.startOffset() - 1) + 1;
        ShardProgress progress = new ShardProgress(resumeFrom - task.startOffset(), resumeFrom - 1);

        if (resumeFrom >= task.endOffset()) {
            log.info("{} already committed, nothing to do", task.describe());
            return progress.toResult(task, ShardResult.Status.COMPLETED, null);
        }

        try {
            tokenizer.initialize();
        } catch (TokenizerInitException e) {
            log.error("{} not processed: {}", task.describe(), e.getMessage());
            return progress.toResult(task, ShardResult.Status.TOKENIZER_INIT_FAILED, e.getMessage());
        }

        if (resumeFrom > task.startOffset()) {
            log.info("{} resuming at offset {}", task.describe(), resumeFrom);
        } else {
            log.info("{} started", task.describe());
        }

        List<HitRecord> batch = new ArrayList<>(Math.min(task.batchSize(), (int) Math.min(task.size(), 1 << 16)));
        try (CorpusReader reader = CorpusReader.open(task.corpus(), task.language(), resumeFrom)) {
            long offset = resumeFrom;
            while (offset < task.endOffset()) {
                if (stopRequested(cancelRequested)) {
                    return cancel(task, progress, batch);
                }
                HitRecord record;
                try {
                    Sentence sentence = reader.next();
                    if (sentence == null) {
                        break;
                    }
                    record = evaluate(sentence, task, tokenizer, vocabulary);
                } catch (LoadException e) {
                    log.warn("{} skipping offset {}: {}", task.describe(), e.getOffset(), e.getMessage());
                    record = HitRecord.skipped(task.language(), task.tokenizerId(), e.getOffset());
                } catch (UncheckedIOException e) {
                    if (e.getCause() instanceof ClosedByInterruptException) {
                        return cancel(task, progress, batch);
                    }
                    throw e;
                }
                batch.add(record);
                offset++;

                if (batch.size() >= task.batchSize()) {
                    if (stopRequested(cancelRequested)) {
                        return cancel(task, progress, batch);
                    }
                    commit(task, batch, progress);
                }
            }
            if (!batch.isEmpty()) {
                if (stopRequested(cancelRequested)) {
                    return cancel(task, progress, batch);
                }
                commit(task, batch, progress);
            }
        } catch (ClosedByInterruptException e) {
            return cancel(task, progress, batch);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read corpus " + task.corpus(), e);
        }

        log.info("{} completed: {} committed ({} scored, {} degenerate, {} skipped), checkpoint {}",
                task.describe(), progress.committed, progress.scored, progress.degenerate,
                progress.skipped, progress.checkpoint);
        return progress.toResult(task, ShardResult.Status.COMPLETED, null);
    }

    HitRecord evaluate(Sentence sentence, ShardTask task, TokenizerAdapter tokenizer, GroundTruthVocabulary vocabulary) {
        CleanedSentence cleaned;
        try {
            cleaned = cleaner.clean(sentence);
        } catch (CleaningException e) {
            log.warn("{} skipping offset {}: {}", task.describe(), sentence.offset(), e.getMessage());
            return HitRecord.skipped(task.language(), task.tokenizerId(), sentence.offset());
        }
        if (cleaned.isDegenerate()) {
            return HitRecord.degenerate(task.language(), task.tokenizerId(), sentence.offset());
        }

        List<String> tokens;
        try {
            tokens = tokenizer.tokenize(cleaned.text());
        } catch (TokenizerRuntimeException e) {
            log.warn("{} skipping offset {}: {}", task.describe(), sentence.offset(), e.getMessage());
            return HitRecord.skipped(task.language(), task.tokenizerId(), sentence.offset());
        }
        if (scriptFilter) {
            tokens = ScriptTokenFilter.keepScriptTokens(tokens, task.language());
        }
        return scorer.score(new TokenSequence(task.language(), task.tokenizerId(), sentence.offset(), tokens), vocabulary);
    }

    private void commit(ShardTask task, List<HitRecord> batch, ShardProgress progress) {
        long checkpoint = batch.get(batch.size() - 1).offset();
        store.commit(new CommitBatch(task.namespace(), task.language(), task.tokenizerId(),
                task.startOffset(), task.endOffset(), batch, checkpoint));
        long before = progress.committed;
        progress.add(batch, checkpoint);
        batch.clear();
        if (logEvery > 0 && progress.committed / logEvery > before / logEvery) {
            log.info("{} progress: {} sentences committed, checkpoint {}",
                    task.describe(), progress.committed, checkpoint);
        }
    }

    private static boolean stopRequested(BooleanSupplier cancelRequested) {
        return cancelRequested.getAsBoolean() || Thread.currentThread().isInterrupted();
    }

    private ShardResult cancel(ShardTask task, ShardProgress progress, List<HitRecord> batch) {
        log.warn("{} cancelled, abandoning {} uncommitted sentences; checkpoint stays at {}",
                task.describe(), batch.size(), progress.checkpoint);
        batch.clear();
        return progress.toResult(task, ShardResult.Status.CANCELLED, "cancelled");
    }

    private static final class ShardProgress {
        private final long alreadyCommitted;
        private long committed;
        private long scored;
        private long degenerate;
        private long skipped;
        private long checkpoint;

        private ShardProgress(long alreadyCommitted, long checkpoint) {
            this.alreadyCommitted = alreadyCommitted;
            this.checkpoint = checkpoint;
        }

        private void add(List<HitRecord> batch, long newCheckpoint) {
            for (HitRecord record : batch) {
                switch (record.outcome()) {
                    case SCORED -> scored++;
                    case DEGENERATE -> degenerate++;
                    case SKIPPED -> skipped++;
                }
            }
            committed += batch.size();
            checkpoint = newCheckpoint;
        }

        private ShardResult toResult(ShardTask task, ShardResult.Status status, String error) {
            return new ShardResult(task.runId(), task.namespace(), task.language(), task.tokenizerId(),
                    task.shardIndex(), task.totalShards(), status, committed, scored, degenerate, skipped,
                    alreadyCommitted, checkpoint, error);
        }
    }
}
