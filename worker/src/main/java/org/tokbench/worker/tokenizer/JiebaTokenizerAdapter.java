package org.tokbench.worker.tokenizer;

import com.huaban.analysis.jieba.JiebaSegmenter;
import org.tokbench.common.Language;

import java.util.List;

public class JiebaTokenizerAdapter extends AbstractTokenizerAdapter {

    public static final String ID = "jieba";

    private JiebaSegmenter segmenter;

    public JiebaTokenizerAdapter(Language language) {
        super(ID, language);
        if (language != Language.ZH) {
            throw new TokenizerInitException(ID, language, "jieba only segments Chinese");
        }
    }

    @Override
    protected void setUp() {
        segmenter = new JiebaSegmenter();
    }

    @Override
    protected List<String> doTokenize(String text) {
        return segmenter.sentenceProcess(text);
    }
}
