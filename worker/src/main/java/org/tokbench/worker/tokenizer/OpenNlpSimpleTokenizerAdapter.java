package org.tokbench.worker.tokenizer;

import opennlp.tools.tokenize.SimpleTokenizer;
import opennlp.tools.tokenize.Tokenizer;
import org.tokbench.common.Language;

import java.util.Arrays;
import java.util.List;

public class OpenNlpSimpleTokenizerAdapter extends AbstractTokenizerAdapter {

    public static final String ID = "opennlp-simple";

    private Tokenizer tokenizer;

    public OpenNlpSimpleTokenizerAdapter(Language language) {
        super(ID, language);
    }

    @Override
    protected void setUp() {
        tokenizer = SimpleTokenizer.INSTANCE;
    }

    @Override
    protected List<String> doTokenize(String text) {
        return Arrays.asList(tokenizer.tokenize(text));
    }
}
