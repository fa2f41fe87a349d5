package com.lexhub.gameservice.games.letterfall.domain.enums;

/** 难度预设：决定开局重力间隔 */
public enum Difficulty {

    CASUAL(750),
    STANDARD(600),
    HARD(480),
    INSANE(380);

    private final int initialGravityMs;

    Difficulty(int initialGravityMs) {
        this.initialGravityMs = initialGravityMs;
    }

    public int initialGravityMs() {
        return initialGravityMs;
    }
}
