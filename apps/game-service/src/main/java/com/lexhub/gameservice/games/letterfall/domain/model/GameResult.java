package com.lexhub.gameservice.games.letterfall.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * 终局结果，终局时生成一次，交给排行榜/结算页等外部消费方。
 *
 * @param wordsCleared 本局消除的不同单词数
 * @param linesCleared 本局累计移除的单词次数
 */
public record GameResult(String identity,
                         int score,
                         int level,
                         int wordsCleared,
                         int linesCleared,
                         Duration duration,
                         Instant endedAt) {
}
