package org.tokbench.worker.corpus;

public class LoadException extends RuntimeException {

    private final long offset;

    public LoadException(long offset, String message, Throwable cause) {
        super("Line " + offset + ": " + message, cause);
        this.offset = offset;
    }

    public long getOffset() {
        return offset;
    }
}
