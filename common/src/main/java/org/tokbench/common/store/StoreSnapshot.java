package org.tokbench.common.store;

import org.iq80.leveldb.DB;
import org.iq80.leveldb.DBIterator;
import org.iq80.leveldb.ReadOptions;
import org.iq80.leveldb.Snapshot;
import org.tokbench.common.HitRecord;
import org.tokbench.common.Language;

import java.io.Closeable;
import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

public class StoreSnapshot implements Closeable {

    private final DB db;
    private final Snapshot snapshot;
    private final ReadOptions readOptions;

    StoreSnapshot(DB db, Snapshot snapshot) {
        this.db = db;
        this.snapshot = snapshot;
        this.readOptions = new ReadOptions().snapshot(snapshot);
    }

    /** Records of one pair with offsets in the closed range {@code [fromOffset, toOffset]}, in offset order. */
    public RecordCursor scan(String namespace, Language language, String tokenizerId, long fromOffset, long toOffset) {
        String prefix = StoreKeys.recordPrefix(namespace, language, tokenizerId);
        DBIterator it;
        try {
            it = db.iterator(readOptions);
        } catch (RuntimeException e) {
            throw HitRecordStore.failure("Failed to scan records for " + language.code() + "/" + tokenizerId, e);
        }
        try {
            it.seek(StoreKeys.record(namespace, language, tokenizerId, Math.max(0, fromOffset)));
            return new RecordCursor(it, prefix, language, tokenizerId, toOffset);
        } catch (RuntimeException e) {
            closeQuietly(it, e);
            throw HitRecordStore.failure("Failed to scan records for " + language.code() + "/" + tokenizerId, e);
        }
    }

    public RecordCursor scanAll(String namespace, Language language, String tokenizerId) {
        return scan(namespace, language, tokenizerId, 0, Long.MAX_VALUE);
    }

    /** Same as {@link HitRecordStore#contiguousCheckpoint}, as of this snapshot. */
    public long contiguousCheckpoint(String namespace, Language language, String tokenizerId) {
        try (DBIterator it = db.iterator(readOptions)) {
            return HitRecordStore.contiguousCheckpoint(it, namespace, language, tokenizerId);
        } catch (IOException | RuntimeException e) {
            throw HitRecordStore.failure("Failed to scan checkpoints for " + language.code() + "/" + tokenizerId, e);
        }
    }

    @Override
    public void close() {
        try {
            snapshot.close();
        } catch (IOException | RuntimeException e) {
            throw HitRecordStore.failure("Failed to release store snapshot", e);
        }
    }

    private static void closeQuietly(DBIterator it, Exception failure) {
        try {
            it.close();
        } catch (IOException | RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    public static class RecordCursor implements Iterator<HitRecord>, Closeable {

        private final DBIterator it;
        private final String prefix;
        private final Language language;
        private final String tokenizerId;
        private final long toOffset;
        private HitRecord next;
        private boolean done;

        RecordCursor(DBIterator it, String prefix, Language language, String tokenizerId, long toOffset) {
            this.it = it;
            this.prefix = prefix;
            this.language = language;
            this.tokenizerId = tokenizerId;
            this.toOffset = toOffset;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (done) {
                return false;
            }
            try {
                if (!it.hasNext()) {
                    done = true;
                    return false;
                }
                Map.Entry<byte[], byte[]> entry = it.next();
                String key = StoreKeys.string(entry.getKey());
                if (!key.startsWith(prefix)) {
                    done = true;
                    return false;
                }
                long offset = StoreKeys.offsetOf(key);
                if (offset > toOffset) {
                    done = true;
                    return false;
                }
                next = RecordCodec.decodeRecord(language, tokenizerId, offset, entry.getValue());
                return true;
            } catch (RuntimeException e) {
                throw HitRecordStore.failure("Failed to read records for " + language.code() + "/" + tokenizerId, e);
            }
        }

        @Override
        public HitRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            HitRecord current = next;
            next = null;
            return current;
        }

        @Override
        public void close() {
            try {
                it.close();
            } catch (IOException | RuntimeException e) {
                throw HitRecordStore.failure("Failed to close record cursor", e);
            }
        }
    }
}
