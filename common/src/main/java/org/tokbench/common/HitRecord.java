package org.tokbench.common;

import java.util.Arrays;

public record HitRecord(
        Language language,
        String tokenizerId,
        long offset,
        long hits,
        long tokens,
        Outcome outcome
) {
    public HitRecord {
        if (hits < 0 || tokens < 0 || hits > tokens) {
            throw new IllegalArgumentException(
                    "Invalid hit record at offset " + offset + ": hits=" + hits + ", tokens=" + tokens);
        }
        if (outcome != Outcome.SCORED && tokens != 0) {
            throw new IllegalArgumentException(outcome + " record at offset " + offset + " must carry no tokens");
        }
    }

    public static HitRecord scored(Language language, String tokenizerId, long offset, long hits, long tokens) {
        return new HitRecord(language, tokenizerId, offset, hits, tokens, Outcome.SCORED);
    }

    public static HitRecord degenerate(Language language, String tokenizerId, long offset) {
        return new HitRecord(language, tokenizerId, offset, 0, 0, Outcome.DEGENERATE);
    }

    public static HitRecord skipped(Language language, String tokenizerId, long offset) {
        return new HitRecord(language, tokenizerId, offset, 0, 0, Outcome.SKIPPED);
    }

    public enum Outcome {
        SCORED((byte) 0),
        DEGENERATE((byte) 1),
        SKIPPED((byte) 2);

        private final byte code;

        Outcome(byte code) {
            this.code = code;
        }

        public byte code() {
            return code;
        }

        public static Outcome fromCode(byte code) {
            return Arrays.stream(values())
                    .filter(o -> o.code == code)
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown outcome code " + code));
        }
    }
}
