package com.lexhub.gameservice.games.letterfall.domain.model;

import java.util.List;

/**
 * 释义测验：题目单词 + 四个选项（已洗牌）+ 正确选项。
 */
public record Quiz(String word, List<String> choices, String correctChoice) {

    public Quiz {
        choices = List.copyOf(choices);
    }
}
