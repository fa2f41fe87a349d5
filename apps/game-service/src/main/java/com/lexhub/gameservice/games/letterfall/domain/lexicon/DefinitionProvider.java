package com.lexhub.gameservice.games.letterfall.domain.lexicon;

import java.util.List;

/**
 * 单词释义来源（测验用）。取不到时返回空列表。
 */
public interface DefinitionProvider {

    List<String> definitionsOf(String normalizedWord);
}
