package com.lexhub.gameservice.games.letterfall.interfaces.http.dto;

import com.lexhub.gameservice.games.letterfall.domain.enums.Difficulty;
import com.lexhub.gameservice.games.letterfall.domain.model.StartOptions;
import lombok.Data;

import java.util.Locale;

/**
 * 开局请求体（可省略，全部取默认值）。
 */
@Data
public class StartRunRequest {
    /** 起始等级 1..20，缺省 1 */
    private Integer startingLevel;
    /** CASUAL / STANDARD / HARD / INSANE，缺省 STANDARD */
    private String difficulty;

    public StartOptions toOptions(String identity) {
        int level = startingLevel == null ? 1 : startingLevel;
        Difficulty d = Difficulty.STANDARD;
        if (difficulty != null && !difficulty.isBlank()) {
            try {
                d = Difficulty.valueOf(difficulty.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("不支持的难度：" + difficulty, e);
            }
        }
        return new StartOptions(identity, level, d);
    }
}
