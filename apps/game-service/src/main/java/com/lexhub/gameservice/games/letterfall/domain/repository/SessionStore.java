package com.lexhub.gameservice.games.letterfall.domain.repository;

import java.util.Optional;

/**
 * SessionStore
 * ----------------------------------------
 * 对局存档的字节级仓储接口
 * - 只负责读写一段不透明字节，不关心内容格式；
 * - 写入必须“要么完整可读，要么读不到”，不能留下半截文件；
 * - 当前实现：Redis（默认）与本地文件。
 * ----------------------------------------
 */
public interface SessionStore {

    /**
     * 读取存档
     * @param identity 玩家身份
     * @return 存档字节（不存在则 empty）
     */
    Optional<byte[]> read(String identity);

    /**
     * 写入存档（覆盖）
     * @param identity 玩家身份
     * @param bytes    存档字节
     */
    void write(String identity, byte[] bytes);

    /**
     * 删除存档
     * @param identity 玩家身份
     */
    void clear(String identity);
}
