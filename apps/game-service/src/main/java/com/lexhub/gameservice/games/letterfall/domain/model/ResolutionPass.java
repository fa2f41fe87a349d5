package com.lexhub.gameservice.games.letterfall.domain.model;

import java.util.List;

/**
 * 一轮扫描-移除-下落的结果。
 *
 * @param accepted     本轮被接受并移除的单词
 * @param clearedCells 被清空的格子（移除时的位置，下落之前）
 * @param scoreGained  本轮得分
 * @param leveledUp    本轮后是否升级
 * @param quizWords    使累计移除数成为 5 的倍数的单词（依次）
 */
public record ResolutionPass(List<WordMatch> accepted,
                             List<Cell> clearedCells,
                             int scoreGained,
                             boolean leveledUp,
                             List<String> quizWords) {

    public static ResolutionPass none() {
        return new ResolutionPass(List.of(), List.of(), 0, false, List.of());
    }

    public boolean found() {
        return !accepted.isEmpty();
    }

    public List<String> words() {
        return accepted.stream().map(WordMatch::word).toList();
    }
}
