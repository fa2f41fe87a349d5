package com.lexhub.gameservice.games.letterfall.infrastructure.lexicon;

import com.lexhub.gameservice.games.letterfall.domain.lexicon.DefinitionProvider;
import com.lexhub.gameservice.games.letterfall.domain.lexicon.WordNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 释义表：每行 "单词\t释义"，同一单词可出现多行。
 * 释义中的 '[' ']' '\'' 去掉；取不到返回空列表。
 */
public class ClasspathDefinitionProvider implements DefinitionProvider {

    private final Map<String, List<String>> definitions;

    public ClasspathDefinitionProvider(String location) {
        this(ClasspathWordList.readLines(location));
    }

    ClasspathDefinitionProvider(List<String> lines) {
        Map<String, List<String>> map = new HashMap<>();
        for (String line : lines) {
            int tab = line.indexOf('\t');
            if (tab <= 0) continue;
            String word = WordNormalizer.normalize(line.substring(0, tab));
            String def = clean(line.substring(tab + 1));
            if (word.isEmpty() || def.isEmpty()) continue;
            map.computeIfAbsent(word, k -> new ArrayList<>()).add(def);
        }
        this.definitions = map;
    }

    @Override
    public List<String> definitionsOf(String normalizedWord) {
        if (normalizedWord == null) return List.of();
        List<String> defs = definitions.get(normalizedWord);
        return defs == null ? List.of() : Collections.unmodifiableList(defs);
    }

    private static String clean(String raw) {
        return raw.replace("[", "").replace("]", "").replace("'", "").trim();
    }
}
