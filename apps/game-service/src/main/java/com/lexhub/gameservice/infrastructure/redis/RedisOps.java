package com.lexhub.gameservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 公用 Redis 工具类：
 * - 封装常用 String/Key/TTL 操作
 * - 仅提供“原语级”方法；业务键名放在 Repo/Service 层组织
 * - 将来切换到哨兵/集群/云Redis时无需改代码
 */
@Component
@RequiredArgsConstructor
public class RedisOps {
    /** 字符串模板 */
    private final StringRedisTemplate strRedis;

    // -------------- String --------------
    /**
     * 写入键值（带 TTL），SET EX 单条命令即原子
     */
    public boolean setEx(String key, String val, Duration ttl) {
        strRedis.opsForValue().set(key, val, ttl);
        return true;
    }

    /**
     * 读取字符串值，不存在返回 null
     */
    public String get(String key) {
        return strRedis.opsForValue().get(key);
    }

    // -------------- Key --------------
    /**
     * 删除 Key
     */
    public Boolean del(String key) {
        return strRedis.delete(key);
    }
}
