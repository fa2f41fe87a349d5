package com.lexhub.gameservice.games.letterfall.domain.session;

import com.lexhub.gameservice.games.letterfall.domain.constants.GameConstants;
import com.lexhub.gameservice.games.letterfall.domain.dto.PieceSnapshot;
import com.lexhub.gameservice.games.letterfall.domain.dto.SessionSnapshot;
import com.lexhub.gameservice.games.letterfall.domain.engine.EngineSettings;
import com.lexhub.gameservice.games.letterfall.domain.enums.GameMode;
import com.lexhub.gameservice.games.letterfall.domain.enums.RestoreFailure;
import com.lexhub.gameservice.games.letterfall.domain.lexicon.WordNormalizer;
import com.lexhub.gameservice.games.letterfall.domain.model.Cell;
import com.lexhub.gameservice.games.letterfall.domain.model.Grid;
import com.lexhub.gameservice.games.letterfall.domain.model.Piece;
import com.lexhub.gameservice.games.letterfall.domain.model.RunState;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 对局快照的生成与恢复。
 * <p>
 * 恢复是“全有或全无”：校验全部通过后才返回一份新建的 RunState，
 * 任何一步失败都只返回失败原因，不触碰调用方现有的对局。
 * <p>
 * 校验顺序：版本 → 身份 → 新鲜度（10 分钟，且不能为负）→ 棋盘尺寸 → 内容 → 当前方块碰撞。
 */
public class SessionSnapshotter {

    /** 存档新鲜度窗口 */
    public static final Duration FRESHNESS = Duration.ofMinutes(10);

    private final EngineSettings settings;

    public SessionSnapshotter(EngineSettings settings) {
        this.settings = settings;
    }

    /**
     * 生成快照（深拷贝，不与 s 共享可变对象）。
     */
    public SessionSnapshot snapshot(RunState s, String identity, Instant now) {
        SessionSnapshot dto = new SessionSnapshot();
        dto.setVersion(SessionSnapshot.CURRENT_VERSION);
        dto.setSavedAtEpochMs(now.toEpochMilli());
        dto.setIdentity(identity == null ? "" : identity.trim());

        dto.setScore(s.getScore());
        dto.setLevel(s.getLevel());
        dto.setGravityIntervalMs(s.getGravityIntervalMs());
        dto.setWordsFoundSinceLevelUp(s.getWordsFoundSinceLevelUp());
        dto.setHoldUsed(s.isHoldUsed());

        Grid g = s.getGrid();
        List<String> rows = new ArrayList<>(g.rows());
        for (int y = 0; y < g.rows(); y++) rows.add(g.row(y));
        dto.setBoardRows(rows);

        dto.setFoundWords(new ArrayList<>(s.getFoundWords()));
        dto.setRemovedWords(new ArrayList<>(s.getRemovedWords()));

        dto.setCurrent(snapshotPiece(s.getCurrent()));
        dto.setNext(snapshotPiece(s.getNext()));
        dto.setHold(snapshotPiece(s.getHeld()));
        return dto;
    }

    /**
     * 从快照恢复。
     *
     * @param dto      快照
     * @param identity 当前调用方身份
     * @param now      当前时间
     */
    public RestoreResult restore(SessionSnapshot dto, String identity, Instant now) {
        if (dto == null) return RestoreResult.failed(RestoreFailure.CORRUPT);

        if (dto.getVersion() != SessionSnapshot.CURRENT_VERSION) {
            return RestoreResult.failed(RestoreFailure.VERSION_MISMATCH);
        }

        String expected = identity == null ? "" : identity.trim();
        String saved = dto.getIdentity() == null ? "" : dto.getIdentity().trim();
        if (expected.isEmpty() || !expected.equalsIgnoreCase(saved)) {
            return RestoreResult.failed(RestoreFailure.IDENTITY_MISMATCH);
        }

        Duration age = Duration.ofMillis(now.toEpochMilli() - dto.getSavedAtEpochMs());
        if (age.isNegative() || age.compareTo(FRESHNESS) > 0) {
            return RestoreResult.failed(RestoreFailure.STALE);
        }

        List<String> rows = dto.getBoardRows();
        if (rows == null || rows.size() != settings.rows()) {
            return RestoreResult.failed(RestoreFailure.DIMENSION_MISMATCH);
        }
        for (String row : rows) {
            if (row == null || row.length() != settings.cols()) {
                return RestoreResult.failed(RestoreFailure.DIMENSION_MISMATCH);
            }
        }

        Grid grid = new Grid(settings.cols(), settings.rows());
        for (int y = 0; y < rows.size(); y++) {
            String row = rows.get(y);
            for (int x = 0; x < row.length(); x++) {
                char c = row.charAt(x);
                if (c == Grid.EMPTY) continue;
                if (!Grid.isLetter(c)) return RestoreResult.failed(RestoreFailure.CORRUPT);
                grid.place(x, y, c);
            }
        }

        RunState s = new RunState(grid, settings.newCombo());
        s.setScore(Math.max(0, dto.getScore()));
        s.setLevel(Math.max(1, dto.getLevel()));
        s.setGravityIntervalMs(Math.max(GameConstants.RESTORE_MIN_GRAVITY_MS, dto.getGravityIntervalMs()));
        s.setWordsFoundSinceLevelUp(Math.max(0, dto.getWordsFoundSinceLevelUp()));
        s.setHoldUsed(dto.isHoldUsed());
        if (dto.getFoundWords() != null) {
            for (String w : dto.getFoundWords()) {
                String n = WordNormalizer.normalize(w);
                if (!n.isEmpty()) s.getFoundWords().add(n);
            }
        }
        if (dto.getRemovedWords() != null) {
            for (String w : dto.getRemovedWords()) {
                if (w != null) s.getRemovedWords().add(w);
            }
        }

        if (dto.getCurrent() == null || dto.getNext() == null) {
            return RestoreResult.failed(RestoreFailure.CORRUPT);
        }
        Piece current = restorePiece(dto.getCurrent(), grid);
        Piece next = restorePiece(dto.getNext(), grid);
        Piece held = dto.getHold() == null ? null : restorePiece(dto.getHold(), grid);
        if (current == null || next == null || (dto.getHold() != null && held == null)) {
            return RestoreResult.failed(RestoreFailure.CORRUPT);
        }

        // 当前方块恢复后必须处于合法位置，否则存档视为过期/损坏
        if (!current.canMove(grid, 0, 0)) {
            return RestoreResult.failed(RestoreFailure.COLLISION);
        }

        s.setCurrent(current);
        s.setNext(next);
        s.setHeld(held);
        // 恢复后先暂停，但不登记任何原因，由上层直接恢复
        s.setMode(GameMode.PAUSED);
        s.setStartedAt(now);
        return RestoreResult.restored(s);
    }

    // ----------- private helpers -----------

    static PieceSnapshot snapshotPiece(Piece piece) {
        if (piece == null) return null;
        Cell min = piece.minCorner();
        PieceSnapshot snap = new PieceSnapshot();
        snap.setMinX(min.x());
        snap.setMinY(min.y());
        List<Cell> offsets = new ArrayList<>(piece.size());
        for (Cell c : piece.cells()) offsets.add(new Cell(c.x() - min.x(), c.y() - min.y()));
        snap.setOffsets(offsets);
        snap.setLetters(new ArrayList<>(piece.letters()));
        return snap;
    }

    /**
     * 以快照偏移为形状新建方块，放到出生点后用同一个合法性检查的 move
     * 先沿 x 再沿 y 逐格挪到保存的最小角；某一步走不动就停在已到达的最远合法位置。
     * 描述本身不合法时返回 null。
     */
    private static Piece restorePiece(PieceSnapshot snap, Grid grid) {
        List<Cell> offsets = snap.getOffsets();
        List<Character> letters = snap.getLetters();
        if (offsets == null || letters == null || offsets.isEmpty() || offsets.size() != letters.size()) {
            return null;
        }
        for (int i = 0; i < offsets.size(); i++) {
            Character c = letters.get(i);
            if (offsets.get(i) == null || c == null || !Grid.isLetter(c)) return null;
        }

        Piece piece = new Piece(offsets, letters);
        piece.resetToSpawn(grid);

        Cell min = piece.minCorner();
        int dx = snap.getMinX() - min.x();
        int dy = snap.getMinY() - min.y();
        if (stepMove(piece, grid, dx, 0)) {
            stepMove(piece, grid, 0, dy);
        }
        return piece;
    }

    private static boolean stepMove(Piece p, Grid grid, int dxTotal, int dyTotal) {
        int sx = Integer.signum(dxTotal);
        for (int i = 0; i < Math.abs(dxTotal); i++) {
            if (!p.move(grid, sx, 0)) return false;
        }
        int sy = Integer.signum(dyTotal);
        for (int i = 0; i < Math.abs(dyTotal); i++) {
            if (!p.move(grid, 0, sy)) return false;
        }
        return true;
    }
}
