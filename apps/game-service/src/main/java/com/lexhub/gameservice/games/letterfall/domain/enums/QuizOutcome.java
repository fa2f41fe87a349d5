package com.lexhub.gameservice.games.letterfall.domain.enums;

/** 释义测验结果：答对加分 / 答错整盘上移并补一行 / 跳过无影响 */
public enum QuizOutcome {
    CORRECT,
    INCORRECT,
    SKIPPED
}
