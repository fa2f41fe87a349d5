package com.lexhub.gameservice.games.letterfall.infrastructure.redis.repo;

import com.lexhub.gameservice.games.letterfall.domain.repository.SessionStore;
import com.lexhub.gameservice.games.letterfall.infrastructure.redis.RedisKeys;
import com.lexhub.gameservice.infrastructure.redis.RedisOps;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * RedisSessionStore
 * -------------------------------------------------------
 * 会话存档的 Redis 实现（默认）。
 * - 每个身份一个键：letterfall:session:{identity}；
 * - 值为 UTF-8 JSON 文本，带 TTL，过期即视为没有存档；
 * - SET EX 是单条命令，写入天然原子，不会出现半截存档。
 */
@Repository
@ConditionalOnProperty(name = "letterfall.session.store", havingValue = "redis", matchIfMissing = true)
public class RedisSessionStore implements SessionStore {

    private final RedisOps ops;
    private final Duration ttl;

    public RedisSessionStore(RedisOps ops,
                             @Value("${letterfall.session.ttl-minutes:30}") long ttlMinutes) {
        this.ops = ops;
        this.ttl = Duration.ofMinutes(ttlMinutes);
    }

    @Override
    public Optional<byte[]> read(String identity) {
        String json = ops.get(RedisKeys.session(identity));
        return json == null ? Optional.empty() : Optional.of(json.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public void write(String identity, byte[] bytes) {
        ops.setEx(RedisKeys.session(identity), new String(bytes, StandardCharsets.UTF_8), ttl);
    }

    @Override
    public void clear(String identity) {
        ops.del(RedisKeys.session(identity));
    }
}
