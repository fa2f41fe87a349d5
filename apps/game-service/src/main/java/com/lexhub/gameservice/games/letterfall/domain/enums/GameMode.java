package com.lexhub.gameservice.games.letterfall.domain.enums;

/** 对局模式状态机 */
public enum GameMode {

    PLAYING,   // 正常进行（重力/输入生效）
    PAUSED,    // 暂停（至少有一个暂停原因）
    QUIZ,      // 释义测验进行中（重力/输入冻结）
    GAME_OVER  // 终局（新方块出生即碰撞），只能重开
}
