package com.lexhub.gameservice.games.letterfall.domain.constants;

/**
 * 游戏相关的消息常量
 * 统一管理异常与接口返回的提示消息，避免硬编码
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 状态错误 ==========

    /** 对方块在非法位置执行锁定 */
    public static final String ILLEGAL_LOCK = "方块当前位置不合法，不能锁定";

    /** 当前没有待回答的测验 */
    public static final String NO_QUIZ = "当前没有待回答的测验";

    /** 结算进行中，不能生成快照 */
    public static final String RESOLVING = "正在结算单词，请稍后再试";

    /** 对局已结束 */
    public static final String GAME_OVER = "对局已结束，请重新开始";

    /** 该玩家没有进行中的对局 */
    public static final String RUN_NOT_FOUND = "没有进行中的对局：%s";

    public static String formatRunNotFound(String identity) {
        return String.format(RUN_NOT_FOUND, identity);
    }

    // ========== 参数错误 ==========

    /** 缺少玩家身份 */
    public static final String IDENTITY_REQUIRED = "缺少玩家身份";

    /** 暂停原因为空 */
    public static final String REASON_REQUIRED = "暂停原因不能为空";

    /** 不支持的指令 */
    public static final String UNKNOWN_COMMAND = "不支持的指令：%s";

    public static String formatUnknownCommand(String command) {
        return String.format(UNKNOWN_COMMAND, command);
    }

    // ========== 测验 ==========

    /** 取不到释义时的正确选项占位 */
    public static final String NO_DEFINITION = "No definition";

    /** 干扰项不足时的占位 */
    public static final String DECOY_PLACEHOLDER = "—";
}
