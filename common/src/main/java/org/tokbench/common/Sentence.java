package org.tokbench.common;

import java.util.Objects;

public record Sentence(
        String text,
        Language language,
        long offset
) {
    public Sentence {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(language, "language");
        if (offset < 0) {
            throw new IllegalArgumentException("Sentence offset must be non-negative: " + offset);
        }
    }
}
