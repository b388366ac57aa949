package org.tokbench.common.store;

import org.tokbench.common.HitRecord;
import org.tokbench.common.Language;

import java.nio.ByteBuffer;

final class RecordCodec {

    static final int RECORD_SIZE = Long.BYTES * 2 + 1;

    private RecordCodec() {
    }

    static byte[] encodeRecord(HitRecord record) {
        return ByteBuffer.allocate(RECORD_SIZE)
                .putLong(record.hits())
                .putLong(record.tokens())
                .put(record.outcome().code())
                .array();
    }

    static HitRecord decodeRecord(Language language, String tokenizerId, long offset, byte[] value) {
        if (value == null || value.length != RECORD_SIZE) {
            throw new StoreException("Corrupt hit record at " + language.code() + "/" + tokenizerId + "/" + offset);
        }
        ByteBuffer buf = ByteBuffer.wrap(value);
        long hits = buf.getLong();
        long tokens = buf.getLong();
        HitRecord.Outcome outcome = HitRecord.Outcome.fromCode(buf.get());
        return new HitRecord(language, tokenizerId, offset, hits, tokens, outcome);
    }

    static byte[] encodeOffset(long offset) {
        return ByteBuffer.allocate(Long.BYTES).putLong(offset).array();
    }

    static long decodeOffset(byte[] value) {
        if (value == null || value.length != Long.BYTES) {
            throw new StoreException("Corrupt checkpoint value");
        }
        return ByteBuffer.wrap(value).getLong();
    }
}
