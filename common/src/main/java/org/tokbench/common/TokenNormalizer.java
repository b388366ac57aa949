package org.tokbench.common;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

public final class TokenNormalizer {

    private static final Pattern IGNORABLE =
            Pattern.compile("[\\u064B-\\u065F\\u0670\\u200B-\\u200D\\uFEFF]");

    private static final Map<Character, Character> ARABIC_TO_URDU = Map.of(
            '\u064A', '\u06CC',
            '\u0649', '\u06CC',
            '\u0643', '\u06A9',
            '\u0647', '\u06C1'
    );

    private TokenNormalizer() {
    }

    public static String normalize(String token) {
        if (token == null || token.isEmpty()) {
            return "";
        }
        String s = Normalizer.normalize(token, Normalizer.Form.NFKC);
        s = IGNORABLE.matcher(s).replaceAll("");
        s = foldArabicLetters(s);
        return s.toLowerCase(Locale.ROOT).trim();
    }

    public static char foldArabicLetter(char c) {
        return ARABIC_TO_URDU.getOrDefault(c, c);
    }

    private static String foldArabicLetters(String s) {
        StringBuilder sb = null;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            char folded = foldArabicLetter(c);
            if (folded != c && sb == null) {
                sb = new StringBuilder(s.length());
                sb.append(s, 0, i);
            }
            if (sb != null) {
                sb.append(folded);
            }
        }
        return sb == null ? s : sb.toString();
    }
}
