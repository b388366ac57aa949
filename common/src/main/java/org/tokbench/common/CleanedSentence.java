package org.tokbench.common;

public record CleanedSentence(
        String text,
        Language language,
        long offset
) {
    /** Nothing left after cleaning. */
    public boolean isDegenerate() {
        return text.isEmpty();
    }
}
