package com.lexhub.gameservice.games.letterfall.domain.enums;

/**
 * 存档恢复失败原因。任何一种都按“没有可恢复的对局”处理：丢弃存档并开新局。
 */
public enum RestoreFailure {
    /** 没有存档 */
    NOT_FOUND,
    /** 无法解析或内容不合法 */
    CORRUPT,
    /** 格式版本不一致 */
    VERSION_MISMATCH,
    /** 存档身份与当前玩家不一致 */
    IDENTITY_MISMATCH,
    /** 超出新鲜度窗口，或保存时间在未来（时钟漂移） */
    STALE,
    /** 棋盘尺寸不一致 */
    DIMENSION_MISMATCH,
    /** 当前方块恢复后与棋盘冲突 */
    COLLISION
}
