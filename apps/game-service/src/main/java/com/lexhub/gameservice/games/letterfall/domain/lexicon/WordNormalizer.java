package com.lexhub.gameservice.games.letterfall.domain.lexicon;

import java.text.Normalizer;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 单词/文本规范化：
 * - 去掉变音符号（é → e）；
 * - 统一小写（Locale.ROOT）；
 * - 常见 leet 替换（@/4→a, 0→o, 1/!→i, $/5→s, 7→t, 3→e）；
 * - 其余标点变为空格并压缩空白。
 */
public final class WordNormalizer {

    private static final Map<Character, Character> LEET = Map.of(
            '@', 'a', '4', 'a',
            '0', 'o',
            '1', 'i', '!', 'i',
            '$', 's', '5', 's',
            '7', 't',
            '3', 'e');

    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private WordNormalizer() {}

    public static String normalize(String text) {
        if (text == null || text.isBlank()) return "";
        String stripped = MARKS.matcher(Normalizer.normalize(text, Normalizer.Form.NFD)).replaceAll("");
        StringBuilder sb = new StringBuilder(stripped.length());
        for (int i = 0; i < stripped.length(); i++) {
            char lower = Character.toLowerCase(stripped.charAt(i));
            Character mapped = LEET.get(lower);
            if (mapped != null) lower = mapped;
            if (Character.isLetterOrDigit(lower) || lower == '_' || Character.isWhitespace(lower)) {
                sb.append(lower);
            } else {
                sb.append(' ');
            }
        }
        return SPACES.matcher(sb.toString()).replaceAll(" ").trim();
    }
}
