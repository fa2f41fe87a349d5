package com.lexhub.gameservice.games.letterfall.infrastructure.redis;

import java.util.Locale;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "letterfall:";

    private RedisKeys() {}

    // ---- 单人对局存档（身份忽略大小写） ----
    public static String session(String identity) {
        return PFX + "session:" + identity.trim().toLowerCase(Locale.ROOT);
    }
}
