package org.tokbench.worker.tokenizer;

import org.tokbench.common.Language;

import java.util.List;

public final class ScriptTokenFilter {

    private ScriptTokenFilter() {
    }

    public static List<String> keepScriptTokens(List<String> tokens, Language language) {
        return tokens.stream()
                .filter(token -> token.codePoints().anyMatch(language::isScriptLetter))
                .toList();
    }
}
