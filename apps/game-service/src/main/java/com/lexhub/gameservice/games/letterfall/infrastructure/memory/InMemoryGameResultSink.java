package com.lexhub.gameservice.games.letterfall.infrastructure.memory;

import com.lexhub.gameservice.games.letterfall.domain.model.GameResult;
import com.lexhub.gameservice.games.letterfall.domain.repository.GameResultSink;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内结果交接：每个身份只保留最近一次结果，取走即清除。
 */
@Component
public class InMemoryGameResultSink implements GameResultSink {

    private final Map<String, GameResult> latest = new ConcurrentHashMap<>();

    @Override
    public void publish(GameResult result) {
        latest.put(key(result.identity()), result);
    }

    @Override
    public Optional<GameResult> take(String identity) {
        return Optional.ofNullable(latest.remove(key(identity)));
    }

    private static String key(String identity) {
        return identity == null ? "" : identity.trim().toLowerCase(Locale.ROOT);
    }
}
