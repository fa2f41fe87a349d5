package com.lexhub.gameservice.games.letterfall.domain.constants;

/**
 * 玩法常量与派生规则。
 * 可调参数（棋盘尺寸、连击参数、奖励分）在 EngineSettings 中，这里只放固定规则。
 */
public final class GameConstants {

    private GameConstants() {}

    /** 默认棋盘列数 */
    public static final int DEFAULT_COLS = 10;
    /** 默认棋盘行数 */
    public static final int DEFAULT_ROWS = 33;

    /** 新局初始重力间隔（毫秒），对应 STANDARD 难度 */
    public static final int DEFAULT_GRAVITY_MS = 600;
    /** 升级后重力间隔下限 */
    public static final int MIN_GRAVITY_MS = 120;
    /** 恢复存档时允许的最小重力间隔 */
    public static final int RESTORE_MIN_GRAVITY_MS = 60;
    /** 每级需要消除的单词数 */
    public static final int WORDS_PER_LEVEL = 10;
    /** 升级后重力间隔的缩放系数 */
    public static final double GRAVITY_DECAY = 0.90;

    /** 每累计移除多少个单词触发一次释义测验 */
    public static final int QUIZ_EVERY_WORDS = 5;

    /** 开局等级上下限 */
    public static final int MIN_START_LEVEL = 1;
    public static final int MAX_START_LEVEL = 20;

    /** 一次消除达到该格数视为大消除 */
    public static final int BIG_CLEAR_CELLS = 4;

    /** 计分基础倍率 */
    public static final double BASE_SCORE_MULTIPLIER = 1.0;

    /** 不重复阈值：最短单词长度达到 5 后，同一局内单词不再重复计分 */
    public static final int NO_REPEAT_MIN_LENGTH = 5;

    /** 当前等级下的最短单词长度：3 + min(2, level / 10) */
    public static int minWordLength(int level) {
        return 3 + Math.min(2, level / 10);
    }

    /** 当前等级是否开启不重复规则 */
    public static boolean noRepeats(int level) {
        return minWordLength(level) >= NO_REPEAT_MIN_LENGTH;
    }
}
