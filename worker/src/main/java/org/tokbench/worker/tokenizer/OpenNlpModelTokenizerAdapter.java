package org.tokbench.worker.tokenizer;

import lombok.extern.slf4j.Slf4j;
import opennlp.tools.tokenize.TokenizerME;
import opennlp.tools.tokenize.TokenizerModel;
import org.tokbench.common.Language;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Maximum-entropy tokenizer trained for the language. {@link TokenizerME} keeps
 * per-call state, so an instance must never be shared between threads.
 */
@Slf4j
public class OpenNlpModelTokenizerAdapter extends AbstractTokenizerAdapter {

    public static final String ID = "opennlp-model";

    private final String modelPath;
    private TokenizerME tokenizer;

    public OpenNlpModelTokenizerAdapter(Language language, String modelPath) {
        super(ID, language);
        this.modelPath = modelPath;
    }

    @Override
    protected void setUp() throws IOException {
        if (modelPath == null || modelPath.isBlank()) {
            throw new TokenizerInitException(ID, language,
                    "no model configured under tokbench.tokenizers.opennlp-model." + language.code());
        }
        Path path = Path.of(modelPath);
        if (!Files.isReadable(path)) {
            throw new TokenizerInitException(ID, language, "model not found at " + path.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(path)) {
            tokenizer = new TokenizerME(new TokenizerModel(in));
        }
        log.info("Loaded OpenNLP tokenizer model for {} from {}", language.code(), path);
    }

    @Override
    protected List<String> doTokenize(String text) {
        return Arrays.asList(tokenizer.tokenize(text));
    }
}
