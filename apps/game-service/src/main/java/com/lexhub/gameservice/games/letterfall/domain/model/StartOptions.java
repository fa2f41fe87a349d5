package com.lexhub.gameservice.games.letterfall.domain.model;

import com.lexhub.gameservice.games.letterfall.domain.constants.GameConstants;
import com.lexhub.gameservice.games.letterfall.domain.enums.Difficulty;

/**
 * 开局选项：玩家身份、起始等级、难度。
 */
public record StartOptions(String identity, int startingLevel, Difficulty difficulty) {

    public static StartOptions standard(String identity) {
        return new StartOptions(identity, 1, Difficulty.STANDARD);
    }

    /** 起始等级夹到 [1, 20]，难度缺省为 STANDARD，身份去空白 */
    public StartOptions normalized() {
        int lv = Math.max(GameConstants.MIN_START_LEVEL, Math.min(GameConstants.MAX_START_LEVEL, startingLevel));
        Difficulty d = difficulty == null ? Difficulty.STANDARD : difficulty;
        String id = identity == null ? "" : identity.trim();
        return new StartOptions(id, lv, d);
    }
}
