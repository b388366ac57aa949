package org.tokbench.worker.clean;

import org.tokbench.common.Language;

import java.util.List;

public record CleaningRuleTable(
        Language language,
        List<CleaningRule> rules
) {
    private static final CleaningRule HTML_TAGS = CleaningRule.of("html-tags", "<[^>]*>", RuleAction.SPACE);

    public CleaningRuleTable {
        rules = List.copyOf(rules);
    }

    public String apply(String text) {
        String result = text;
        for (CleaningRule rule : rules) {
            result = rule.apply(result);
        }
        return result;
    }

    public static CleaningRuleTable defaults(Language language) {
        return switch (language) {
            case UR -> new CleaningRuleTable(language, List.of(
                    HTML_TAGS,
                    CleaningRule.outsideScript(language, RuleAction.SPACE),
                    CleaningRule.of("punctuation", "[؟،۔٫٪.,\\-_*%?!#@=+|(){}\\[\\]'\"“”‘’]", RuleAction.SPACE),
                    CleaningRule.of("digits", "[۰-۹٠-٩0-9]", RuleAction.DELETE),
                    CleaningRule.of("harakat", "[\\x{064B}-\\x{065F}\\x{0670}]", RuleAction.DELETE),
                    CleaningRule.of("arabic-letter-forms", "[\\x{064A}\\x{0649}\\x{0643}\\x{0647}]", RuleAction.FOLD_ARABIC)));
            case ZH -> new CleaningRuleTable(language, List.of(
                    HTML_TAGS,
                    CleaningRule.outsideScript(language, RuleAction.SPACE),
                    CleaningRule.of("numerals", "[一二三四五六七八九零]", RuleAction.SPACE)));
            case HI -> new CleaningRuleTable(language, List.of(
                    HTML_TAGS,
                    CleaningRule.outsideScript(language, RuleAction.SPACE),
                    CleaningRule.of("danda", "[।॥]", RuleAction.SPACE),
                    CleaningRule.of("digits", "[०-९]", RuleAction.DELETE)));
        };
    }
}
