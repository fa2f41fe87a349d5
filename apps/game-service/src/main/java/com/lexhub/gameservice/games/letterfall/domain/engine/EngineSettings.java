package com.lexhub.gameservice.games.letterfall.domain.engine;

import com.lexhub.gameservice.games.letterfall.domain.constants.GameConstants;
import com.lexhub.gameservice.games.letterfall.domain.model.ComboState;

/**
 * 引擎可调参数（来自配置文件 letterfall.*）。
 *
 * @param cols           棋盘列数
 * @param rows           棋盘行数
 * @param comboDecayMs   连击衰减窗口
 * @param comboGrowth    每级连击的倍率增量
 * @param comboStart     起始倍率
 * @param comboMax       最大倍率
 * @param quizBonus      测验答对奖励分
 * @param softDropFactor 软降时重力累积倍数
 */
public record EngineSettings(int cols,
                             int rows,
                             int comboDecayMs,
                             double comboGrowth,
                             double comboStart,
                             double comboMax,
                             int quizBonus,
                             int softDropFactor) {

    public static EngineSettings defaults() {
        return new EngineSettings(GameConstants.DEFAULT_COLS, GameConstants.DEFAULT_ROWS,
                9000, 0.5, 1.0, 4.0, 50, 5);
    }

    public ComboState newCombo() {
        return new ComboState(comboDecayMs, comboGrowth, comboStart, comboMax);
    }
}
