package com.lexhub.gameservice.games.letterfall.domain.session;

import com.lexhub.gameservice.games.letterfall.domain.dto.SessionSnapshot;
import com.lexhub.gameservice.games.letterfall.domain.engine.EngineSettings;
import com.lexhub.gameservice.games.letterfall.domain.enums.GameMode;
import com.lexhub.gameservice.games.letterfall.domain.enums.RestoreFailure;
import com.lexhub.gameservice.games.letterfall.domain.model.Cell;
import com.lexhub.gameservice.games.letterfall.domain.model.RunState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;

import static com.lexhub.gameservice.games.letterfall.support.Fixtures.T0;
import static com.lexhub.gameservice.games.letterfall.support.Fixtures.chars;
import static com.lexhub.gameservice.games.letterfall.support.Fixtures.emptyRun;
import static com.lexhub.gameservice.games.letterfall.support.Fixtures.iPiece;
import static com.lexhub.gameservice.games.letterfall.support.Fixtures.oPiece;
import static com.lexhub.gameservice.games.letterfall.support.Fixtures.writeRow;
import static org.assertj.core.api.Assertions.assertThat;

class SessionSnapshotterTest {

    private final SessionSnapshotter snapshotter = new SessionSnapshotter(EngineSettings.defaults());

    private RunState run;

    @BeforeEach
    void setUp() {
        run = emptyRun(iPiece("WORD"), oPiece("ABCD"));
    }

    private RestoreResult restoreAfter(SessionSnapshot dto, Duration elapsed) {
        return snapshotter.restore(dto, "alice", T0.plus(elapsed));
    }

    private RestoreFailure failureOf(SessionSnapshot dto) {
        RestoreResult result = restoreAfter(dto, Duration.ofMinutes(1));
        assertThat(result.isRestored()).isFalse();
        return result.failure();
    }

    @Test
    void roundTripRestoresTheWholeRun() {
        run.setScore(120);
        run.setLevel(3);
        run.setGravityIntervalMs(480);
        run.setWordsFoundSinceLevelUp(4);
        run.setHoldUsed(true);
        run.setHeld(oPiece("HOLD"));
        run.getFoundWords().add("cat");
        run.getRemovedWords().add("CAT");
        writeRow(run.getGrid(), 0, 32, "QXZ");
        run.getCurrent().move(run.getGrid(), -2, 0);
        run.getCurrent().move(run.getGrid(), 0, 10);

        SessionSnapshot dto = snapshotter.snapshot(run, "alice", T0);
        RestoreResult result = restoreAfter(dto, Duration.ofMinutes(5));

        assertThat(result.isRestored()).isTrue();
        RunState s = result.state();
        assertThat(s.getScore()).isEqualTo(120);
        assertThat(s.getLevel()).isEqualTo(3);
        assertThat(s.getGravityIntervalMs()).isEqualTo(480);
        assertThat(s.getWordsFoundSinceLevelUp()).isEqualTo(4);
        assertThat(s.isHoldUsed()).isTrue();
        assertThat(s.getFoundWords()).containsExactly("cat");
        assertThat(s.getRemovedWords()).containsExactly("CAT");
        assertThat(s.getGrid().row(32)).isEqualTo("QXZ.......");
        assertThat(s.getCurrent().cells()).containsExactlyElementsOf(run.getCurrent().cells());
        assertThat(s.getCurrent().letters()).containsExactly('W', 'O', 'R', 'D');
        assertThat(s.getNext().letters()).containsExactly('A', 'B', 'C', 'D');
        assertThat(s.getHeld().letters()).containsExactly('H', 'O', 'L', 'D');
        assertThat(s.getMode()).isEqualTo(GameMode.PAUSED);
        assertThat(s.hasPauseReasons()).isFalse();
        assertThat(s.getStartedAt()).isEqualTo(T0.plus(Duration.ofMinutes(5)));
    }

    @Test
    void snapshotDoesNotShareMutableState() {
        SessionSnapshot dto = snapshotter.snapshot(run, "alice", T0);
        run.getGrid().place(0, 0, 'A');
        run.getFoundWords().add("later");

        assertThat(dto.getBoardRows().get(0)).isEqualTo("..........");
        assertThat(dto.getFoundWords()).isEmpty();
    }

    @Test
    void identityComparisonIgnoresCaseAndWhitespace() {
        SessionSnapshot dto = snapshotter.snapshot(run, "Alice", T0);

        assertThat(snapshotter.restore(dto, "  alice ", T0.plusSeconds(1)).isRestored()).isTrue();
        assertThat(snapshotter.restore(dto, "bob", T0.plusSeconds(1)).failure())
                .isEqualTo(RestoreFailure.IDENTITY_MISMATCH);
        assertThat(snapshotter.restore(dto, "  ", T0.plusSeconds(1)).failure())
                .isEqualTo(RestoreFailure.IDENTITY_MISMATCH);
    }

    @Test
    void rejectsOtherVersions() {
        SessionSnapshot dto = snapshotter.snapshot(run, "alice", T0);
        dto.setVersion(2);

        assertThat(failureOf(dto)).isEqualTo(RestoreFailure.VERSION_MISMATCH);
    }

    @Test
    void freshnessWindowIsTenMinutesInclusive() {
        SessionSnapshot dto = snapshotter.snapshot(run, "alice", T0);

        assertThat(restoreAfter(dto, Duration.ofMinutes(10)).isRestored()).isTrue();
        assertThat(restoreAfter(dto, Duration.ofMinutes(11)).failure()).isEqualTo(RestoreFailure.STALE);
    }

    @Test
    void snapshotsFromTheFutureAreStale() {
        SessionSnapshot dto = snapshotter.snapshot(run, "alice", T0.plusSeconds(1));

        assertThat(snapshotter.restore(dto, "alice", T0).failure()).isEqualTo(RestoreFailure.STALE);
    }

    @Test
    void rejectsWrongRowCount() {
        SessionSnapshot dto = snapshotter.snapshot(run, "alice", T0);
        dto.getBoardRows().remove(0);

        assertThat(failureOf(dto)).isEqualTo(RestoreFailure.DIMENSION_MISMATCH);
    }

    @Test
    void rejectsWrongRowWidth() {
        SessionSnapshot dto = snapshotter.snapshot(run, "alice", T0);
        dto.getBoardRows().set(5, ".........");

        assertThat(failureOf(dto)).isEqualTo(RestoreFailure.DIMENSION_MISMATCH);
    }

    @Test
    void rejectsNonLetterCells() {
        SessionSnapshot dto = snapshotter.snapshot(run, "alice", T0);
        dto.getBoardRows().set(32, "a.........");

        assertThat(failureOf(dto)).isEqualTo(RestoreFailure.CORRUPT);
    }

    @Test
    void rejectsMissingPieces() {
        SessionSnapshot dto = snapshotter.snapshot(run, "alice", T0);
        dto.setNext(null);

        assertThat(failureOf(dto)).isEqualTo(RestoreFailure.CORRUPT);
    }

    @Test
    void rejectsPieceWithMismatchedLetters() {
        SessionSnapshot dto = snapshotter.snapshot(run, "alice", T0);
        dto.getCurrent().setLetters(new ArrayList<>(chars("WOR")));

        assertThat(failureOf(dto)).isEqualTo(RestoreFailure.CORRUPT);
    }

    @Test
    void rejectsMalformedHold() {
        SessionSnapshot dto = snapshotter.snapshot(run, "alice", T0);
        dto.setHold(SessionSnapshotter.snapshotPiece(oPiece("HOLD")));
        dto.getHold().setLetters(new ArrayList<>(chars("HO1D")));

        assertThat(failureOf(dto)).isEqualTo(RestoreFailure.CORRUPT);
    }

    @Test
    void blockedSpawnIsACollision() {
        SessionSnapshot dto = snapshotter.snapshot(run, "alice", T0);
        dto.getBoardRows().set(0, ".....Q....");

        assertThat(failureOf(dto)).isEqualTo(RestoreFailure.COLLISION);
    }

    @Test
    void blockedPathStopsAtTheFurthestLegalPosition() {
        run.getCurrent().move(run.getGrid(), 0, 25);
        SessionSnapshot dto = snapshotter.snapshot(run, "alice", T0);
        dto.getBoardRows().set(20, "QQQQQQQQQQ");

        RestoreResult result = restoreAfter(dto, Duration.ofMinutes(1));

        assertThat(result.isRestored()).isTrue();
        assertThat(result.state().getCurrent().cells())
                .containsExactly(new Cell(5, 19), new Cell(6, 19), new Cell(7, 19), new Cell(8, 19));
    }

    @Test
    void clampsOutOfRangeNumbers() {
        SessionSnapshot dto = snapshotter.snapshot(run, "alice", T0);
        dto.setLevel(0);
        dto.setGravityIntervalMs(10);
        dto.setScore(-5);
        dto.setWordsFoundSinceLevelUp(-3);

        RunState s = restoreAfter(dto, Duration.ofMinutes(1)).state();

        assertThat(s.getLevel()).isEqualTo(1);
        assertThat(s.getGravityIntervalMs()).isEqualTo(60);
        assertThat(s.getScore()).isZero();
        assertThat(s.getWordsFoundSinceLevelUp()).isZero();
    }

    @Test
    void nullSnapshotIsCorrupt() {
        assertThat(snapshotter.restore(null, "alice", Instant.now()).failure()).isEqualTo(RestoreFailure.CORRUPT);
    }
}
