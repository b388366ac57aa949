package org.tokbench.worker.clean;

public class CleaningException extends RuntimeException {

    private final long offset;

    public CleaningException(long offset, String message) {
        super(message);
        this.offset = offset;
    }

    public long getOffset() {
        return offset;
    }
}
