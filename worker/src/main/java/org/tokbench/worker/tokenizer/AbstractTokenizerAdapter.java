package org.tokbench.worker.tokenizer;

import lombok.extern.slf4j.Slf4j;
import org.tokbench.common.Language;

import java.util.ArrayList;
import java.util.List;

/**
 * Lazy, idempotent setup shared by all adapters. A failed setup is remembered and
 * reported again on every later call instead of being retried.
 */
@Slf4j
public abstract class AbstractTokenizerAdapter implements TokenizerAdapter {

    private final String id;
    protected final Language language;

    private volatile boolean initialized;
    private TokenizerInitException initFailure;

    protected AbstractTokenizerAdapter(String id, Language language) {
        this.id = id;
        this.language = language;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Language language() {
        return language;
    }

    @Override
    public final void initialize() {
        if (initialized) {
            return;
        }
        synchronized (this) {
            if (initialized) {
                return;
            }
            if (initFailure != null) {
                throw initFailure;
            }
            long started = System.currentTimeMillis();
            try {
                setUp();
            } catch (TokenizerInitException e) {
                initFailure = e;
                throw e;
            } catch (Exception e) {
                initFailure = new TokenizerInitException(id, language, e.getMessage(), e);
                throw initFailure;
            }
            initialized = true;
            log.info("Tokenizer '{}' for {} ready in {} ms", id, language.code(), System.currentTimeMillis() - started);
        }
    }

    @Override
    public final List<String> tokenize(String text) {
        initialize();
        List<String> raw;
        try {
            raw = doTokenize(text);
        } catch (TokenizerRuntimeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TokenizerRuntimeException(id, e.getMessage(), e);
        }
        List<String> tokens = new ArrayList<>(raw.size());
        for (String token : raw) {
            if (token != null && !token.isBlank()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    protected abstract void setUp() throws Exception;

    protected abstract List<String> doTokenize(String text);
}
