package com.lexhub.gameservice.games.letterfall.domain.model;

import java.util.List;

/**
 * 一次扫描得到的候选单词。
 *
 * @param word       棋盘原文（大写）
 * @param normalized 规范化后的小写形式
 * @param vertical   是否为竖向
 * @param cells      占据的格子，按阅读顺序
 */
public record WordMatch(String word, String normalized, boolean vertical, List<Cell> cells) {

    public int length() {
        return word.length();
    }
}
