package org.tokbench.worker.tokenizer;

import org.tokbench.common.Language;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;

public class BreakIteratorTokenizerAdapter extends AbstractTokenizerAdapter {

    public static final String ID = "breakiterator";

    private BreakIterator prototype;

    public BreakIteratorTokenizerAdapter(Language language) {
        super(ID, language);
    }

    @Override
    protected void setUp() {
        prototype = BreakIterator.getWordInstance(language.locale());
    }

    @Override
    protected List<String> doTokenize(String text) {
        BreakIterator words = (BreakIterator) prototype.clone();
        words.setText(text);
        List<String> tokens = new ArrayList<>();
        int start = words.first();
        for (int end = words.next(); end != BreakIterator.DONE; start = end, end = words.next()) {
            String segment = text.substring(start, end);
            if (hasLetterOrDigit(segment)) {
                tokens.add(segment);
            }
        }
        return tokens;
    }

    private static boolean hasLetterOrDigit(String segment) {
        return segment.codePoints().anyMatch(Character::isLetterOrDigit);
    }
}
