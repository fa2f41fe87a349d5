package com.lexhub.gameservice.games.letterfall.domain.model;

import com.lexhub.gameservice.engine.core.GameState;
import com.lexhub.gameservice.games.letterfall.domain.constants.GameConstants;
import com.lexhub.gameservice.games.letterfall.domain.enums.GameMode;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 单局对局状态：整局的“单一事实来源”。
 * - 持有棋盘 Grid、当前/下一个/暂存方块；
 * - 分数、等级、重力间隔、本级已消单词数；
 * - foundWords：本局已消除的单词（规范化小写），用于不重复规则；
 * - removedWords：按顺序记录的全部被移除单词（棋盘原文），用于测验节奏；
 * - 模式与暂停原因集合。
 * 设计说明
 * - RunState 不做规则校验，只承载状态；规则在 rule 包，流程在 LetterfallEngine。
 * - 只应由引擎的公开操作修改，外部读取请勿直接改写。
 */
@Getter
@Setter
public class RunState implements GameState {

    private final Grid grid;
    private final ComboState combo;

    private Piece current;
    private Piece next;
    private Piece held;
    private boolean holdUsed;

    private int score;
    private int level = 1;
    private int gravityIntervalMs = GameConstants.DEFAULT_GRAVITY_MS;
    private int wordsFoundSinceLevelUp;

    private final Set<String> foundWords = new LinkedHashSet<>();
    private final List<String> removedWords = new ArrayList<>();

    private GameMode mode = GameMode.PLAYING;

    /** 暂停原因（忽略大小写）；为空时才允许从 PAUSED 恢复 */
    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> pauseReasons = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

    private Instant startedAt = Instant.EPOCH;

    public RunState(Grid grid, ComboState combo) {
        this.grid = grid;
        this.combo = combo;
    }

    // --------- 派生读方法 ----------
    public int minWordLength() { return GameConstants.minWordLength(level); }

    // --------- 暂停原因 ----------
    public boolean addPauseReason(String reason) { return pauseReasons.add(reason); }

    public boolean removePauseReason(String reason) { return pauseReasons.remove(reason); }

    public boolean hasPauseReasons() { return !pauseReasons.isEmpty(); }

    public void clearPauseReasons() { pauseReasons.clear(); }

    public Set<String> pauseReasons() { return Collections.unmodifiableSet(pauseReasons); }

    /** 深拷贝：棋盘、方块、单词记录、连击状态全部复制 */
    @Override
    public RunState copy() {
        RunState s = new RunState(grid.copy(), combo.copy());
        s.current = current == null ? null : current.copy();
        s.next = next == null ? null : next.copy();
        s.held = held == null ? null : held.copy();
        s.holdUsed = holdUsed;
        s.score = score;
        s.level = level;
        s.gravityIntervalMs = gravityIntervalMs;
        s.wordsFoundSinceLevelUp = wordsFoundSinceLevelUp;
        s.foundWords.addAll(foundWords);
        s.removedWords.addAll(removedWords);
        s.mode = mode;
        s.pauseReasons.addAll(pauseReasons);
        s.startedAt = startedAt;
        return s;
    }
}
