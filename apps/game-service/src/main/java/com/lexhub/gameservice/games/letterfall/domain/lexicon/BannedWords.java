package com.lexhub.gameservice.games.letterfall.domain.lexicon;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 屏蔽词判断。只在测验子系统中使用，核心扫描/消除路径从不查询。
 */
public interface BannedWords {

    boolean isBanned(String normalizedWord);

    /**
     * 文本中是否含有整词匹配的屏蔽词（按规范化后的空格分词）。
     */
    default boolean containsBanned(String text) {
        String normalized = WordNormalizer.normalize(text);
        if (normalized.isEmpty()) return false;
        for (String token : normalized.split(" ")) {
            if (isBanned(token)) return true;
        }
        return false;
    }

    static BannedWords none() {
        return w -> false;
    }

    static BannedWords of(Collection<String> words) {
        Set<String> set = new LinkedHashSet<>();
        for (String w : words) {
            String n = WordNormalizer.normalize(w);
            if (!n.isEmpty()) set.add(n);
        }
        return w -> w != null && set.contains(w);
    }
}
