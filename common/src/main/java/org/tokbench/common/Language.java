package org.tokbench.common;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public enum Language {

    UR("ur", new Locale("ur"), List.of(
            new ScriptRange(0x0600, 0x06FF),
            new ScriptRange(0x0750, 0x077F),
            new ScriptRange(0xFB50, 0xFDFF),
            new ScriptRange(0xFE70, 0xFEFF))),

    ZH("zh", Locale.SIMPLIFIED_CHINESE, List.of(
            new ScriptRange(0x4E00, 0x9FFF),
            new ScriptRange(0x3400, 0x4DBF),
            new ScriptRange(0x20000, 0x2A6DF),
            new ScriptRange(0x2A700, 0x2B73F))),

    HI("hi", new Locale("hi"), List.of(
            new ScriptRange(0x0900, 0x097F)));

    private final String code;
    private final Locale locale;
    private final List<ScriptRange> scriptRanges;

    Language(String code, Locale locale, List<ScriptRange> scriptRanges) {
        this.code = code;
        this.locale = locale;
        this.scriptRanges = scriptRanges;
    }

    public String code() {
        return code;
    }

    public Locale locale() {
        return locale;
    }

    public List<ScriptRange> scriptRanges() {
        return scriptRanges;
    }

    public boolean inScript(int codePoint) {
        for (ScriptRange range : scriptRanges) {
            if (range.contains(codePoint)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A letter of this language's script, in the "other letter" category.
     * Marks and signs inside the range (harakat, matras) do not count.
     */
    public boolean isScriptLetter(int codePoint) {
        return Character.getType(codePoint) == Character.OTHER_LETTER && inScript(codePoint);
    }

    public static Language fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Language code must not be null");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(l -> l.code.equals(normalized) || l.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unsupported language '" + code + "', expected one of ur, zh, hi"));
    }

    public record ScriptRange(int start, int end) {
        public boolean contains(int codePoint) {
            return codePoint >= start && codePoint <= end;
        }
    }
}
