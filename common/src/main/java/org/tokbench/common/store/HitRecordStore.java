package org.tokbench.common.store;

import lombok.extern.slf4j.Slf4j;
import org.iq80.leveldb.DB;
import org.iq80.leveldb.DBIterator;
import org.iq80.leveldb.Options;
import org.iq80.leveldb.WriteBatch;
import org.iq80.leveldb.WriteOptions;
import org.tokbench.common.HitRecord;
import org.tokbench.common.Language;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

import static org.iq80.leveldb.impl.Iq80DBFactory.factory;

/**
 * A batch of records and the checkpoint it advances to are written in one
 * {@link WriteBatch}. Writers are expected to be single per shard range.
 */
@Slf4j
public class HitRecordStore implements Closeable {

    private static final int DELETE_BATCH = 10_000;

    private final Path path;
    private final DB db;
    private final WriteOptions syncWrites = new WriteOptions().sync(true);
    private volatile boolean closed;

    HitRecordStore(Path path, DB db) {
        this.path = path;
        this.db = db;
    }

    public static HitRecordStore open(Path path) {
        try {
            Files.createDirectories(path);
            DB db = factory.open(path.toFile(), new Options().createIfMissing(true));
            log.info("Opened hit record store at {}", path.toAbsolutePath());
            return new HitRecordStore(path, db);
        } catch (IOException | RuntimeException e) {
            throw failure("Failed to open store at " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }

    public void commit(CommitBatch batch) {
        ensureOpen();
        if (batch.records().isEmpty()) {
            return;
        }
        if (Thread.currentThread().isInterrupted()) {
            // an interrupt during file I/O closes LevelDB's channels for every later caller
            throw new StoreException("Refusing to commit up to offset " + batch.checkpoint()
                    + " from an interrupted thread");
        }
        long previous = checkpoint(batch.namespace(), batch.language(), batch.tokenizerId(), batch.shardStart())
                .orElse(batch.shardStart() - 1);
        validate(batch, previous);

        try (WriteBatch writeBatch = db.createWriteBatch()) {
            for (HitRecord record : batch.records()) {
                writeBatch.put(
                        StoreKeys.record(batch.namespace(), record.language(), record.tokenizerId(), record.offset()),
                        RecordCodec.encodeRecord(record));
            }
            writeBatch.put(
                    StoreKeys.checkpoint(batch.namespace(), batch.language(), batch.tokenizerId(), batch.shardStart()),
                    RecordCodec.encodeOffset(batch.checkpoint()));
            db.write(writeBatch, syncWrites);
        } catch (IOException | RuntimeException e) {
            throw failure("Failed to commit batch up to offset " + batch.checkpoint()
                    + " for " + batch.language().code() + "/" + batch.tokenizerId(), e);
        }
    }

    public OptionalLong checkpoint(String namespace, Language language, String tokenizerId, long shardStart) {
        ensureOpen();
        try {
            byte[] value = db.get(StoreKeys.checkpoint(namespace, language, tokenizerId, shardStart));
            return value == null ? OptionalLong.empty() : OptionalLong.of(RecordCodec.decodeOffset(value));
        } catch (RuntimeException e) {
            throw failure("Failed to read checkpoint for " + language.code() + "/" + tokenizerId, e);
        }
    }

    /**
     * Highest offset {@code h} such that every offset in {@code [0, h]} is committed,
     * or -1 when offset 0 is not.
     */
    public long contiguousCheckpoint(String namespace, Language language, String tokenizerId) {
        ensureOpen();
        try (DBIterator it = db.iterator()) {
            return contiguousCheckpoint(it, namespace, language, tokenizerId);
        } catch (IOException | RuntimeException e) {
            throw failure("Failed to scan checkpoints for " + language.code() + "/" + tokenizerId, e);
        }
    }

    static long contiguousCheckpoint(DBIterator it, String namespace, Language language, String tokenizerId) {
        String prefix = StoreKeys.checkpointPrefix(namespace, language, tokenizerId);
        long next = 0;
        it.seek(StoreKeys.bytes(prefix));
        while (it.hasNext()) {
            Map.Entry<byte[], byte[]> entry = it.next();
            String key = StoreKeys.string(entry.getKey());
            // shards of an earlier layout may overlap the current ones
            if (!key.startsWith(prefix) || StoreKeys.offsetOf(key) > next) {
                break;
            }
            next = Math.max(next, RecordCodec.decodeOffset(entry.getValue()) + 1);
        }
        return next - 1;
    }

    public Optional<HitRecord> get(String namespace, Language language, String tokenizerId, long offset) {
        ensureOpen();
        try {
            byte[] value = db.get(StoreKeys.record(namespace, language, tokenizerId, offset));
            return value == null
                    ? Optional.empty()
                    : Optional.of(RecordCodec.decodeRecord(language, tokenizerId, offset, value));
        } catch (RuntimeException e) {
            throw failure("Failed to read record " + offset + " for "
                    + language.code() + "/" + tokenizerId, e);
        }
    }

    public StoreSnapshot openSnapshot() {
        ensureOpen();
        try {
            return new StoreSnapshot(db, db.getSnapshot());
        } catch (RuntimeException e) {
            throw failure("Failed to open store snapshot", e);
        }
    }

    /** Removes every record and checkpoint of a namespace. Only called before a clean run starts. */
    public long resetNamespace(String namespace) {
        ensureOpen();
        long deleted = 0;
        for (String kind : new String[]{StoreKeys.RECORD_PREFIX, StoreKeys.CHECKPOINT_PREFIX}) {
            deleted += deletePrefix(StoreKeys.namespacePrefix(kind, namespace));
        }
        log.info("Reset namespace '{}': {} keys deleted", namespace, deleted);
        return deleted;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            db.close();
            log.info("Closed hit record store at {}", path.toAbsolutePath());
        } catch (IOException | RuntimeException e) {
            throw failure("Failed to close store at " + path, e);
        }
    }

    private long deletePrefix(String prefix) {
        long deleted = 0;
        boolean more = true;
        while (more) {
            more = false;
            int pending = 0;
            try (DBIterator it = db.iterator(); WriteBatch batch = db.createWriteBatch()) {
                it.seek(StoreKeys.bytes(prefix));
                while (it.hasNext()) {
                    byte[] key = it.next().getKey();
                    if (!StoreKeys.string(key).startsWith(prefix)) {
                        break;
                    }
                    batch.delete(key);
                    if (++pending >= DELETE_BATCH) {
                        more = true;
                        break;
                    }
                }
                if (pending > 0) {
                    db.write(batch, syncWrites);
                }
            } catch (IOException | RuntimeException e) {
                throw failure("Failed to delete keys with prefix " + prefix, e);
            }
            deleted += pending;
        }
        return deleted;
    }

    private void validate(CommitBatch batch, long previous) {
        if (batch.checkpoint() < previous) {
            throw new StoreException("Checkpoint would move backwards from " + previous + " to " + batch.checkpoint());
        }
        if (batch.checkpoint() < batch.shardStart() || batch.checkpoint() >= batch.shardEnd()) {
            throw new StoreException("Checkpoint " + batch.checkpoint() + " outside shard ["
                    + batch.shardStart() + ", " + batch.shardEnd() + ")");
        }
        long expected = previous + 1;
        for (HitRecord record : batch.records()) {
            if (record.language() != batch.language() || !record.tokenizerId().equals(batch.tokenizerId())) {
                throw new StoreException("Record for " + record.language().code() + "/" + record.tokenizerId()
                        + " in a batch for " + batch.language().code() + "/" + batch.tokenizerId());
            }
            if (record.offset() != expected) {
                throw new StoreException("Batch is not contiguous: expected offset " + expected
                        + " but found " + record.offset());
            }
            expected++;
        }
        if (expected - 1 != batch.checkpoint()) {
            throw new StoreException("Batch ends at offset " + (expected - 1)
                    + " but checkpoint is " + batch.checkpoint());
        }
    }

    /** LevelDB reports I/O failures as plain runtime exceptions, so every one of them is a store failure. */
    static StoreException failure(String message, Exception e) {
        if (e instanceof StoreException) {
            return (StoreException) e;
        }
        return new StoreException(message, e);
    }

    private void ensureOpen() {
        if (closed) {
            throw new StoreException("Store at " + path + " is closed");
        }
    }
}
