package com.lexhub.gameservice.games.letterfall.support;

import com.lexhub.gameservice.games.letterfall.domain.dto.SessionSnapshot;
import com.lexhub.gameservice.games.letterfall.domain.engine.EngineSettings;
import com.lexhub.gameservice.games.letterfall.domain.model.Grid;
import com.lexhub.gameservice.games.letterfall.domain.model.Piece;
import com.lexhub.gameservice.games.letterfall.domain.model.RunState;
import com.lexhub.gameservice.games.letterfall.domain.piece.ShapeCatalog;
import com.lexhub.gameservice.games.letterfall.domain.session.SessionSnapshotter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** 测试公共构造方法 */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private Fixtures() {}

    /** 水平 I 形方块，字母按给定顺序 */
    public static Piece iPiece(String letters) {
        return new Piece(ShapeCatalog.I, chars(letters));
    }

    public static Piece oPiece(String letters) {
        return new Piece(ShapeCatalog.O, chars(letters));
    }

    public static List<Character> chars(String s) {
        List<Character> out = new ArrayList<>(s.length());
        for (char c : s.toCharArray()) out.add(c);
        return out;
    }

    /** 在第 y 行从 x0 开始写入一串字母 */
    public static void writeRow(Grid g, int x0, int y, String letters) {
        for (int i = 0; i < letters.length(); i++) g.place(x0 + i, y, letters.charAt(i));
    }

    /** 在第 x 列从 y0 开始自上而下写入一串字母 */
    public static void writeColumn(Grid g, int x, int y0, String letters) {
        for (int i = 0; i < letters.length(); i++) g.place(x, y0 + i, letters.charAt(i));
    }

    /** 默认尺寸的空对局，当前方块已放在出生点 */
    public static RunState emptyRun(Piece current, Piece next) {
        EngineSettings s = EngineSettings.defaults();
        RunState run = new RunState(new Grid(s.cols(), s.rows()), s.newCombo());
        current.resetToSpawn(run.getGrid());
        run.setCurrent(current);
        run.setNext(next);
        return run;
    }

    /** 把手工构造的对局做成快照（保存时间 = at） */
    public static SessionSnapshot snapshotOf(RunState run, String identity, Instant at) {
        return new SessionSnapshotter(EngineSettings.defaults()).snapshot(run, identity, at);
    }
}
