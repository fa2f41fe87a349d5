package com.lexhub.gameservice.games.letterfall.domain.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * SessionSnapshot
 * -------------------------------------------------------
 * 单局对局的可持久化快照（挂起/恢复用）。
 * - boardRows：rows 个长度为 cols 的字符串，'.' 表示空位；
 * - 方块只存紧凑描述，见 {@link PieceSnapshot}；
 * - 创建后与运行中的对局不共享任何可变对象。
 * -------------------------------------------------------
 */
@Data
public class SessionSnapshot {
    /** 当前格式版本 */
    public static final int CURRENT_VERSION = 1;

    /** 格式版本 */
    private int version = CURRENT_VERSION;
    /** 保存时间（epoch 毫秒） */
    private long savedAtEpochMs;
    /** 玩家身份（比较时忽略大小写） */
    private String identity;

    // 进度
    private int score;
    private int level;
    private int gravityIntervalMs;
    private int wordsFoundSinceLevelUp;
    private boolean holdUsed;

    /** 棋盘，自上而下逐行 */
    private List<String> boardRows = new ArrayList<>();

    /** 不重复规则 + 测验节奏 */
    private List<String> foundWords = new ArrayList<>();
    private List<String> removedWords = new ArrayList<>();

    // 方块
    private PieceSnapshot current;
    private PieceSnapshot next;
    private PieceSnapshot hold;
}
