package org.tokbench.worker.clean;

import org.tokbench.common.Language;
import org.tokbench.common.TokenNormalizer;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record CleaningRule(
        String name,
        Pattern pattern,
        RuleAction action
) {

    public static CleaningRule of(String name, String regex, RuleAction action) {
        return new CleaningRule(name, Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS), action);
    }

    /** Everything that is neither whitespace nor inside the language's script ranges. */
    public static CleaningRule outsideScript(Language language, RuleAction action) {
        StringBuilder regex = new StringBuilder("[^\\s");
        for (Language.ScriptRange range : language.scriptRanges()) {
            regex.append(String.format("\\x{%X}-\\x{%X}", range.start(), range.end()));
        }
        regex.append(']');
        return of("outside-" + language.code() + "-script", regex.toString(), action);
    }

    public String apply(String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) {
            return text;
        }
        return switch (action) {
            case DELETE -> m.replaceAll("");
            case SPACE -> m.replaceAll(" ");
            case FOLD_ARABIC -> m.replaceAll(match -> foldArabic(match.group()));
        };
    }

    private static String foldArabic(String match) {
        StringBuilder sb = new StringBuilder(match.length());
        for (int i = 0; i < match.length(); i++) {
            sb.append(TokenNormalizer.foldArabicLetter(match.charAt(i)));
        }
        return Matcher.quoteReplacement(sb.toString());
    }
}
