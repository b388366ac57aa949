package org.tokbench.worker.tokenizer;

public class TokenizerRuntimeException extends RuntimeException {

    private final String tokenizerId;

    public TokenizerRuntimeException(String tokenizerId, String message, Throwable cause) {
        super("Tokenizer '" + tokenizerId + "' failed: " + message, cause);
        this.tokenizerId = tokenizerId;
    }

    public String getTokenizerId() {
        return tokenizerId;
    }
}
