package com.lexhub.gameservice.games.letterfall.domain.enums;

import com.lexhub.gameservice.games.letterfall.domain.constants.GameMessages;

import java.util.Locale;

/** 玩家输入指令 */
public enum PlayerCommand {

    LEFT,
    RIGHT,
    ROTATE,
    HARD_DROP,
    HOLD,
    SOFT_DROP_ON,
    SOFT_DROP_OFF;

    /** 忽略大小写解析，未知指令抛 IllegalArgumentException */
    public static PlayerCommand parse(String raw) {
        if (raw == null) throw new IllegalArgumentException(GameMessages.formatUnknownCommand("null"));
        try {
            return PlayerCommand.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(GameMessages.formatUnknownCommand(raw), e);
        }
    }
}
