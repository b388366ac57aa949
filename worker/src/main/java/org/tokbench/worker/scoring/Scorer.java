package org.tokbench.worker.scoring;

import org.springframework.stereotype.Component;
import org.tokbench.common.HitRecord;
import org.tokbench.common.TokenNormalizer;
import org.tokbench.common.TokenSequence;
import org.tokbench.worker.vocabulary.GroundTruthVocabulary;

/**
 * Counts tokens whose normalized form is in the vocabulary. Every occurrence of a
 * token counts, so a repeated matching token contributes one hit per occurrence.
 */
@Component
public class Scorer {

    public HitRecord score(TokenSequence tokens, GroundTruthVocabulary vocabulary) {
        if (tokens.language() != vocabulary.getLanguage()) {
            throw new IllegalArgumentException("Tokens in " + tokens.language().code()
                    + " scored against the " + vocabulary.getLanguage().code() + " vocabulary");
        }
        if (tokens.isEmpty()) {
            return HitRecord.degenerate(tokens.language(), tokens.tokenizerId(), tokens.offset());
        }
        long hits = 0;
        for (String token : tokens.tokens()) {
            if (vocabulary.containsNormalized(TokenNormalizer.normalize(token))) {
                hits++;
            }
        }
        return HitRecord.scored(tokens.language(), tokens.tokenizerId(), tokens.offset(), hits, tokens.size());
    }
}
