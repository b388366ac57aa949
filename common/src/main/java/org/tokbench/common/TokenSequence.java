package org.tokbench.common;

import java.util.List;

public record TokenSequence(
        Language language,
        String tokenizerId,
        long offset,
        List<String> tokens
) {
    public TokenSequence {
        tokens = List.copyOf(tokens);
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }
}
