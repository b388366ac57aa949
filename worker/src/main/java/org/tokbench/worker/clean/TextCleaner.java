package org.tokbench.worker.clean;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.tokbench.common.CleanedSentence;
import org.tokbench.common.Language;
import org.tokbench.common.Sentence;

import java.text.Normalizer;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

@Component
@Slf4j
public class TextCleaner {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final char REPLACEMENT_CHAR = '\uFFFD';

    private final Map<Language, CleaningRuleTable> tables = new EnumMap<>(Language.class);

    public TextCleaner(CleanerProperties properties) {
        for (Language language : Language.values()) {
            List<CleanerProperties.Rule> configured = properties.getRules().get(language.code());
            if (configured == null) {
                tables.put(language, CleaningRuleTable.defaults(language));
            } else {
                tables.put(language, new CleaningRuleTable(language, configured.stream()
                        .map(r -> CleaningRule.of(r.getName(), r.getPattern(), r.getAction()))
                        .toList()));
                log.info("Using {} configured cleaning rules for {}", configured.size(), language.code());
            }
        }
    }

    public CleanedSentence clean(Sentence sentence) {
        String text = sentence.text();
        rejectMalformed(text, sentence.offset());

        String cleaned = Normalizer.normalize(text, Normalizer.Form.NFC);
        cleaned = tables.get(sentence.language()).apply(cleaned);
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();

        return new CleanedSentence(cleaned, sentence.language(), sentence.offset());
    }

    public CleaningRuleTable tableFor(Language language) {
        return tables.get(language);
    }

    private void rejectMalformed(String text, long offset) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == REPLACEMENT_CHAR) {
                throw new CleaningException(offset, "replacement character at index " + i);
            }
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= text.length() || !Character.isLowSurrogate(text.charAt(i + 1))) {
                    throw new CleaningException(offset, "unpaired high surrogate at index " + i);
                }
                i++;
            } else if (Character.isLowSurrogate(c)) {
                throw new CleaningException(offset, "unpaired low surrogate at index " + i);
            }
        }
    }
}
