package org.tokbench.worker.clean;

import org.junit.jupiter.api.Test;
import org.tokbench.common.CleanedSentence;
import org.tokbench.common.Language;
import org.tokbench.common.Sentence;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextCleanerTest {

    private final TextCleaner cleaner = new TextCleaner(new CleanerProperties());

    @Test
    void urduDropsLatinRunsDigitsAndPunctuation() {
        CleanedSentence cleaned = clean("یہ ایک (test) جملہ ہے۔ 2024 ۱۲", Language.UR);

        assertEquals("یہ ایک جملہ ہے", cleaned.text());
    }

    @Test
    void urduFoldsArabicLettersAndDropsHarakat() {
        CleanedSentence cleaned = clean("\u0643\u0650\u062A\u0627\u0628", Language.UR);

        assertEquals("\u06A9\u062A\u0627\u0628", cleaned.text());
    }

    @Test
    void chineseKeepsOnlyHanCharacters() {
        CleanedSentence cleaned = clean("我的 ABC，电脑 42 很好！", Language.ZH);

        assertEquals("我的 电脑 很好", cleaned.text());
    }

    @Test
    void htmlTagsAreRemovedWithTheirAttributes() {
        CleanedSentence cleaned = clean("<span title=\"中文\">我的</span>电脑", Language.ZH);

        assertEquals("我的 电脑", cleaned.text());
    }

    @Test
    void hindiSplitsOnDandaAndDropsDigits() {
        CleanedSentence cleaned = clean("यह एक वाक्य है। १२३ abc", Language.HI);

        assertEquals("यह एक वाक्य है", cleaned.text());
    }

    @Test
    void noiseOnlySentenceIsDegenerate() {
        CleanedSentence cleaned = clean("hello world 123 !!!", Language.UR);

        assertTrue(cleaned.isDegenerate());
        assertEquals("", cleaned.text());
    }

    @Test
    void cleaningIsDeterministic() {
        Sentence sentence = new Sentence("یہ ایک (test) جملہ ہے", Language.UR, 7);

        assertEquals(cleaner.clean(sentence), cleaner.clean(sentence));
        assertEquals(7, cleaner.clean(sentence).offset());
    }

    @Test
    void replacementCharacterIsMalformed() {
        CleaningException e = assertThrows(CleaningException.class,
                () -> cleaner.clean(new Sentence("یہ \uFFFD ہے", Language.UR, 3)));

        assertEquals(3, e.getOffset());
    }

    @Test
    void unpairedSurrogateIsMalformed() {
        assertThrows(CleaningException.class,
                () -> cleaner.clean(new Sentence("我\uD800的", Language.ZH, 0)));
    }

    @Test
    void supplementaryHanCharactersSurvive() {
        CleanedSentence cleaned = clean("𠀀字", Language.ZH);

        assertEquals("𠀀字", cleaned.text());
    }

    @Test
    void configuredRulesReplaceDefaults() {
        CleanerProperties.Rule dropLatin = new CleanerProperties.Rule();
        dropLatin.setName("latin");
        dropLatin.setPattern("[A-Za-z]+");
        dropLatin.setAction(RuleAction.DELETE);
        CleanerProperties properties = new CleanerProperties();
        properties.setRules(Map.of("hi", List.of(dropLatin)));

        TextCleaner configured = new TextCleaner(properties);
        CleanedSentence cleaned = configured.clean(new Sentence("यह 42 abc है", Language.HI, 0));

        assertEquals("यह 42 है", cleaned.text());
        assertFalse(configured.tableFor(Language.UR).rules().isEmpty());
    }

    private CleanedSentence clean(String text, Language language) {
        return cleaner.clean(new Sentence(text, language, 0));
    }
}
