package com.lexhub.gameservice.games.letterfall.domain.lexicon;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 词典：规范化单词的成员判断。
 * 词表缺失时应退化为空词典（永远不命中），而不是报错。
 */
public interface Dictionary {

    /** 是否包含该规范化单词 */
    boolean contains(String normalizedWord);

    /** 全部单词（只读，供测验抽取干扰项） */
    List<String> words();

    default int size() {
        return words().size();
    }

    static Dictionary empty() {
        return of(Collections.emptySet());
    }

    /** 由任意单词集合构建；每个词都会先规范化 */
    static Dictionary of(Collection<String> words) {
        Set<String> set = new LinkedHashSet<>();
        for (String w : words) {
            String n = WordNormalizer.normalize(w);
            if (!n.isEmpty()) set.add(n);
        }
        List<String> list = List.copyOf(set);
        return new Dictionary() {
            @Override
            public boolean contains(String normalizedWord) {
                return normalizedWord != null && set.contains(normalizedWord);
            }

            @Override
            public List<String> words() {
                return list;
            }
        };
    }
}
