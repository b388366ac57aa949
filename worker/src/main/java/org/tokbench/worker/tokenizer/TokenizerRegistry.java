package org.tokbench.worker.tokenizer;

import org.springframework.stereotype.Component;
import org.tokbench.common.Language;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

@Component
public class TokenizerRegistry {

    private final Map<String, Function<Language, TokenizerAdapter>> factories = new LinkedHashMap<>();

    public TokenizerRegistry(TokenizerProperties properties) {
        factories.put(WhitespaceTokenizerAdapter.ID, WhitespaceTokenizerAdapter::new);
        factories.put(OpenNlpSimpleTokenizerAdapter.ID, OpenNlpSimpleTokenizerAdapter::new);
        factories.put(OpenNlpModelTokenizerAdapter.ID, language ->
                new OpenNlpModelTokenizerAdapter(language, properties.getOpennlpModel().get(language.code())));
        factories.put(BreakIteratorTokenizerAdapter.ID, BreakIteratorTokenizerAdapter::new);
        factories.put(JiebaTokenizerAdapter.ID, JiebaTokenizerAdapter::new);
    }

    public Set<String> ids() {
        return factories.keySet();
    }

    public boolean isKnown(String id) {
        return factories.containsKey(id);
    }

    public TokenizerAdapter create(String id, Language language) {
        Function<Language, TokenizerAdapter> factory = factories.get(id);
        if (factory == null) {
            throw new TokenizerInitException(id, language, "unknown tokenizer, expected one of " + ids());
        }
        return factory.apply(language);
    }
}
