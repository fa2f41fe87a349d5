package com.lexhub.gameservice.games.letterfall.domain.model;

import com.lexhub.gameservice.games.letterfall.domain.engine.EngineSettings;
import com.lexhub.gameservice.games.letterfall.domain.engine.LetterfallEngine;
import com.lexhub.gameservice.games.letterfall.domain.lexicon.Dictionary;
import com.lexhub.gameservice.games.letterfall.support.MutableClock;
import com.lexhub.gameservice.games.letterfall.support.ScriptedPieceSource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.lexhub.gameservice.games.letterfall.support.Fixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;

class PlayerRunTest {

    private final PlayerRun run = new PlayerRun("alice",
            new LetterfallEngine(EngineSettings.defaults(), new ScriptedPieceSource(), Dictionary.empty(), new MutableClock(T0)));

    @Test
    void eventBufferDropsTheOldestBeyondItsCap() {
        List<EngineEvent> burst = new ArrayList<>();
        for (int level = 1; level <= PlayerRun.MAX_BUFFERED_EVENTS + 10; level++) burst.add(EngineEvent.levelUp(level));

        run.bufferEvents(burst);
        List<EngineEvent> taken = run.takeEvents();

        assertThat(taken).hasSize(PlayerRun.MAX_BUFFERED_EVENTS);
        assertThat(taken.get(0).level()).isEqualTo(11);
        assertThat(run.takeEvents()).isEmpty();
    }

    @Test
    void markDirtyRecordsTheTime() {
        run.markDirty(1234);

        assertThat(run.isDirty()).isTrue();
        assertThat(run.getLastDirtyAtMs()).isEqualTo(1234);
    }
}
