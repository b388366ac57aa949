package org.tokbench.runner.service;

import java.util.List;

/** Parameters of one run; {@code null} fields take the configured default. */
public record RunRequest(
        String language,
        List<String> tokenizers,
        Integer batchSize,
        Boolean resume
) {
    public static RunRequest defaults() {
        return new RunRequest(null, null, null, null);
    }
}
