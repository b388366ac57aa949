package org.tokbench.worker.vocabulary;

import org.tokbench.common.Language;
import org.tokbench.common.TokenNormalizer;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

public final class GroundTruthVocabulary {

    private final Language language;
    private final Set<String> words;

    private GroundTruthVocabulary(Language language, Set<String> words) {
        this.language = language;
        this.words = words;
    }

    public static GroundTruthVocabulary of(Language language, Collection<String> rawWords) {
        Set<String> normalized = new HashSet<>(Math.max(16, rawWords.size() * 4 / 3));
        for (String word : rawWords) {
            String n = TokenNormalizer.normalize(word);
            if (!n.isEmpty()) {
                normalized.add(n);
            }
        }
        return new GroundTruthVocabulary(language, Set.copyOf(normalized));
    }

    public Language getLanguage() {
        return language;
    }

    /** Membership of a token that has already been normalized. */
    public boolean containsNormalized(String normalizedToken) {
        return words.contains(normalizedToken);
    }

    public boolean contains(String token) {
        return containsNormalized(TokenNormalizer.normalize(token));
    }

    public int size() {
        return words.size();
    }
}
