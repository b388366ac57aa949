package org.tokbench.worker.tokenizer;

import org.tokbench.common.Language;

public class TokenizerInitException extends RuntimeException {

    private final String tokenizerId;

    public TokenizerInitException(String tokenizerId, Language language, String message) {
        this(tokenizerId, language, message, null);
    }

    public TokenizerInitException(String tokenizerId, Language language, String message, Throwable cause) {
        super("Tokenizer '" + tokenizerId + "' unavailable for "
                + (language == null ? "any language" : language.code()) + ": " + message, cause);
        this.tokenizerId = tokenizerId;
    }

    public String getTokenizerId() {
        return tokenizerId;
    }
}
