package org.tokbench.worker.tokenizer;

import org.tokbench.common.Language;

import java.util.List;

public interface TokenizerAdapter {

    String id();

    Language language();

    /**
     * Performs the one-time setup (models, dictionaries) if it has not happened yet.
     *
     * @throws TokenizerInitException if setup fails, now or on an earlier attempt
     */
    void initialize();

    /**
     * @throws TokenizerInitException    if setup fails
     * @throws TokenizerRuntimeException if the underlying library fails on this text
     */
    List<String> tokenize(String text);
}
