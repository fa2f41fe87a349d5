package com.lexhub.gameservice.infrastructure.redis;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * RedisConfig
 * -------------------------------------------------------
 * 全局 Redis 连接配置类（通用基础设施层）
 * -------------------------------------------------------
 * Responsibilities:
 *  - 提供统一的 StringRedisTemplate Bean；
 *  - 会话存档本身已是 JSON 文本，Key/Value 都按字符串序列化，便于 redis-cli 直接查看；
 *  - 可在任意微服务中复用，无业务耦合。
 */
@Configuration
public class RedisConfig {

    /**
     * 纯字符串操作模板（StringRedisTemplate）
     *
     * @param factory Redis 连接工厂（Lettuce）
     * @return StringRedisTemplate Bean
     */
    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory factory) {
        return new StringRedisTemplate(factory);
    }
}
