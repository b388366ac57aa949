package org.tokbench.worker.tokenizer;

import opennlp.tools.tokenize.Tokenizer;
import opennlp.tools.tokenize.WhitespaceTokenizer;
import org.tokbench.common.Language;

import java.util.Arrays;
import java.util.List;

public class WhitespaceTokenizerAdapter extends AbstractTokenizerAdapter {

    public static final String ID = "whitespace";

    private Tokenizer tokenizer;

    public WhitespaceTokenizerAdapter(Language language) {
        super(ID, language);
    }

    @Override
    protected void setUp() {
        tokenizer = WhitespaceTokenizer.INSTANCE;
    }

    @Override
    protected List<String> doTokenize(String text) {
        return Arrays.asList(tokenizer.tokenize(text));
    }
}
