package com.lexhub.gameservice.games.letterfall.domain.model;

import com.lexhub.gameservice.games.letterfall.domain.enums.GameMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 对局只读视图（给前端渲染 HUD 与棋盘）。
 * 由 RunState 的拷贝构造，不持有任何可变引用。
 */
public record RunView(String identity,
                      GameMode mode,
                      int score,
                      int level,
                      int gravityIntervalMs,
                      int wordsFoundSinceLevelUp,
                      int minWordLength,
                      int comboStep,
                      double comboMultiplier,
                      List<String> board,
                      PieceView current,
                      PieceView next,
                      PieceView held,
                      boolean holdUsed,
                      Set<String> pauseReasons,
                      boolean quizPending,
                      int wordsRemoved) {

    public static RunView of(String identity, RunState s, boolean quizPending) {
        Grid g = s.getGrid();
        List<String> rows = new ArrayList<>(g.rows());
        for (int y = 0; y < g.rows(); y++) rows.add(g.row(y));
        return new RunView(identity,
                s.getMode(),
                s.getScore(),
                s.getLevel(),
                s.getGravityIntervalMs(),
                s.getWordsFoundSinceLevelUp(),
                s.minWordLength(),
                s.getCombo().step(),
                s.getCombo().multiplier(),
                List.copyOf(rows),
                PieceView.of(s.getCurrent()),
                PieceView.of(s.getNext()),
                PieceView.of(s.getHeld()),
                s.isHoldUsed(),
                Set.copyOf(s.pauseReasons()),
                quizPending,
                s.getRemovedWords().size());
    }
}
