package com.lexhub.gameservice.games.letterfall.domain.engine;

import com.lexhub.gameservice.games.letterfall.domain.constants.GameConstants;
import com.lexhub.gameservice.games.letterfall.domain.constants.GameMessages;
import com.lexhub.gameservice.games.letterfall.domain.dto.SessionSnapshot;
import com.lexhub.gameservice.games.letterfall.domain.enums.GameMode;
import com.lexhub.gameservice.games.letterfall.domain.enums.PlayerCommand;
import com.lexhub.gameservice.games.letterfall.domain.enums.QuizOutcome;
import com.lexhub.gameservice.games.letterfall.domain.enums.RestoreFailure;
import com.lexhub.gameservice.games.letterfall.domain.lexicon.Dictionary;
import com.lexhub.gameservice.games.letterfall.domain.model.Cell;
import com.lexhub.gameservice.games.letterfall.domain.model.EngineEvent;
import com.lexhub.gameservice.games.letterfall.domain.model.GameResult;
import com.lexhub.gameservice.games.letterfall.domain.model.Grid;
import com.lexhub.gameservice.games.letterfall.domain.model.Piece;
import com.lexhub.gameservice.games.letterfall.domain.model.ResolutionPass;
import com.lexhub.gameservice.games.letterfall.domain.model.RunState;
import com.lexhub.gameservice.games.letterfall.domain.model.StartOptions;
import com.lexhub.gameservice.games.letterfall.domain.piece.PieceSource;
import com.lexhub.gameservice.games.letterfall.domain.rule.WordResolver;
import com.lexhub.gameservice.games.letterfall.domain.session.RestoreResult;
import com.lexhub.gameservice.games.letterfall.domain.session.SessionSnapshotter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * LetterfallEngine
 * -------------------------------------------------------
 * 单局引擎：模式状态机 + 重力驱动 + 锁定后的级联结算。
 * - tick(dtMs) 是唯一的时间输入；
 * - 输入指令只在 PLAYING 且不在结算中时生效，否则忽略并返回 false；
 * - 暂停通过具名原因管理（忽略大小写），原因集合清空才恢复；
 * - 对外通知以 EngineEvent 形式排队，由调用方每帧取走。
 * 非线程安全：并发访问由上层（每局一个监视器）保证。
 * -------------------------------------------------------
 */
@Slf4j
public class LetterfallEngine {

    /** 测验进行中使用的内部暂停原因 */
    public static final String QUIZ_REASON = "quiz";

    private final EngineSettings settings;
    private final PieceSource pieces;
    private final WordResolver resolver;
    private final SessionSnapshotter snapshotter;
    private final Clock clock;

    private RunState state;
    private String identity = "";

    /** 重力累积（毫秒） */
    private long gravityAccMs;
    private boolean softDrop;
    private boolean resolving;
    private String pendingQuizWord;
    private GameResult lastResult;

    /** 状态变更计数，供自动保存判断“是否有新改动” */
    private long revision;

    private final List<EngineEvent> events = new ArrayList<>();

    public LetterfallEngine(EngineSettings settings, PieceSource pieces, Dictionary dictionary, Clock clock) {
        this.settings = settings;
        this.pieces = pieces;
        this.resolver = new WordResolver(dictionary);
        this.snapshotter = new SessionSnapshotter(settings);
        this.clock = clock;
        restart(StartOptions.standard(""));
    }

    // ===================== 生命周期 =====================

    /** 重新开局：棋盘、连击、方块、计数、暂停原因、测验全部重置并进入 PLAYING */
    public void restart(StartOptions options) {
        StartOptions o = (options == null ? StartOptions.standard("") : options).normalized();
        RunState s = new RunState(new Grid(settings.cols(), settings.rows()), settings.newCombo());
        s.setLevel(o.startingLevel());
        s.setGravityIntervalMs(o.difficulty().initialGravityMs());
        s.setStartedAt(clock.instant());

        Piece first = pieces.nextPiece();
        first.resetToSpawn(s.getGrid());
        s.setCurrent(first);
        s.setNext(pieces.nextPiece());

        this.state = s;
        this.identity = o.identity();
        resetTransient();
        this.lastResult = null;
        events.clear();
        touch();
        log.debug("开局 identity={} level={} gravity={}ms", identity, s.getLevel(), s.getGravityIntervalMs());
    }

    /**
     * 从快照恢复。成功才替换当前对局；失败时现有对局保持原样。
     *
     * @return 失败原因；成功时为 empty
     */
    public Optional<RestoreFailure> restore(SessionSnapshot snapshot, String identity) {
        RestoreResult result = snapshotter.restore(snapshot, identity, clock.instant());
        if (!result.isRestored()) {
            return Optional.of(result.failure());
        }
        this.state = result.state();
        this.identity = identity.trim();
        resetTransient();
        this.lastResult = null;
        events.clear();
        touch();
        return Optional.empty();
    }

    /** 生成快照；结算进行中不允许 */
    public SessionSnapshot snapshot() {
        if (resolving) throw new IllegalStateException(GameMessages.RESOLVING);
        return snapshotter.snapshot(state, identity, clock.instant());
    }

    // ===================== 输入 =====================

    public boolean moveLeft() {
        return acceptsInput() && mutated(state.getCurrent().move(state.getGrid(), -1, 0));
    }

    public boolean moveRight() {
        return acceptsInput() && mutated(state.getCurrent().move(state.getGrid(), 1, 0));
    }

    public boolean rotate() {
        return acceptsInput() && mutated(state.getCurrent().tryRotate(state.getGrid()));
    }

    /** 直接落到底并锁定 */
    public boolean hardDrop() {
        if (!acceptsInput()) return false;
        state.getCurrent().hardDrop(state.getGrid());
        lockAndResolve();
        gravityAccMs = 0;
        return true;
    }

    /**
     * 暂存交换：每次锁定之间只允许一次。
     * 暂存位为空时当前方块进入暂存，下一个方块顶上并补一个新的“下一个”。
     */
    public boolean holdSwap() {
        if (!acceptsInput() || state.isHoldUsed()) return false;
        Grid g = state.getGrid();
        Piece active = state.getCurrent();
        Piece incoming;
        if (state.getHeld() == null) {
            incoming = state.getNext();
            state.setNext(pieces.nextPiece());
        } else {
            incoming = state.getHeld();
        }
        active.resetToSpawn(g);
        incoming.resetToSpawn(g);
        state.setHeld(active);
        state.setCurrent(incoming);
        state.setHoldUsed(true);
        gravityAccMs = 0;
        touch();
        if (!incoming.canMove(g, 0, 0)) {
            gameOver();
        }
        return true;
    }

    public void setSoftDrop(boolean on) {
        this.softDrop = on;
    }

    /** 统一入口：HTTP 指令映射到具体操作 */
    public boolean apply(PlayerCommand command) {
        return switch (command) {
            case LEFT -> moveLeft();
            case RIGHT -> moveRight();
            case ROTATE -> rotate();
            case HARD_DROP -> hardDrop();
            case HOLD -> holdSwap();
            case SOFT_DROP_ON -> {
                setSoftDrop(true);
                yield true;
            }
            case SOFT_DROP_OFF -> {
                setSoftDrop(false);
                yield true;
            }
        };
    }

    // ===================== 时间 =====================

    /**
     * 推进 dtMs 毫秒。只在 PLAYING 且不在结算中时推进连击衰减和重力；
     * 下落失败即锁定，并结束本次 tick 的步进。
     */
    public void tick(long dtMs) {
        if (dtMs <= 0 || state.getMode() != GameMode.PLAYING || resolving) return;

        state.getCombo().update(dtMs);

        int interval = Math.max(1, state.getGravityIntervalMs());
        gravityAccMs += dtMs * (softDrop ? settings.softDropFactor() : 1);
        while (gravityAccMs >= interval) {
            gravityAccMs -= interval;
            if (!state.getCurrent().move(state.getGrid(), 0, 1)) {
                lockAndResolve();
                gravityAccMs = 0;
                break;
            }
            touch();
        }
    }

    // ===================== 暂停 =====================

    public void addPauseReason(String reason) {
        if (reason == null || reason.isBlank()) throw new IllegalArgumentException(GameMessages.REASON_REQUIRED);
        state.addPauseReason(reason.trim());
        if (state.getMode() == GameMode.PLAYING) {
            changeMode(GameMode.PAUSED);
        }
    }

    /** 移除一个原因；原因集合清空且处于 PAUSED 时恢复 PLAYING */
    public void removePauseReason(String reason) {
        if (reason == null || reason.isBlank()) throw new IllegalArgumentException(GameMessages.REASON_REQUIRED);
        state.removePauseReason(reason.trim());
        if (state.getMode() == GameMode.PAUSED && !state.hasPauseReasons()) {
            gravityAccMs = 0;
            changeMode(GameMode.PLAYING);
        }
    }

    // ===================== 测验 =====================

    public Optional<String> pendingQuiz() {
        return Optional.ofNullable(pendingQuizWord);
    }

    /**
     * 回答测验。答对加分；答错整盘上移一行并在底行填入随机字母；跳过不变。
     * 之后若仍有其它暂停原因则回到 PAUSED，否则 PLAYING。
     */
    public void answerQuiz(QuizOutcome outcome) {
        if (pendingQuizWord == null || state.getMode() != GameMode.QUIZ) {
            throw new IllegalStateException(GameMessages.NO_QUIZ);
        }
        pendingQuizWord = null;
        state.removePauseReason(QUIZ_REASON);

        switch (outcome) {
            case CORRECT -> {
                state.setScore(state.getScore() + settings.quizBonus());
                events.add(EngineEvent.quizCorrect());
            }
            case INCORRECT -> {
                Grid g = state.getGrid();
                g.shiftUp();
                int bottom = g.rows() - 1;
                for (int x = 0; x < g.cols(); x++) g.place(x, bottom, pieces.nextLetter());
                events.add(EngineEvent.quizWrong());
            }
            case SKIPPED -> { }
        }
        touch();

        if (outcome == QuizOutcome.INCORRECT && !state.getCurrent().canMove(state.getGrid(), 0, 0)) {
            gameOver();
            return;
        }
        gravityAccMs = 0;
        changeMode(state.hasPauseReasons() ? GameMode.PAUSED : GameMode.PLAYING);
    }

    // ===================== 查询 =====================

    public GameMode mode() {
        return state.getMode();
    }

    public boolean isResolving() {
        return resolving;
    }

    /** 只读视图：返回深拷贝 */
    public RunState state() {
        return state.copy();
    }

    public String identity() {
        return identity;
    }

    public long revision() {
        return revision;
    }

    public Optional<GameResult> lastResult() {
        return Optional.ofNullable(lastResult);
    }

    /** 取走并清空事件队列 */
    public List<EngineEvent> drainEvents() {
        List<EngineEvent> out = List.copyOf(events);
        events.clear();
        return out;
    }

    // ===================== 内部流程 =====================

    private boolean acceptsInput() {
        return state.getMode() == GameMode.PLAYING && !resolving;
    }

    private boolean mutated(boolean changed) {
        if (changed) touch();
        return changed;
    }

    private void touch() {
        revision++;
    }

    private void resetTransient() {
        gravityAccMs = 0;
        softDrop = false;
        resolving = false;
        pendingQuizWord = null;
    }

    private void changeMode(GameMode mode) {
        if (state.getMode() == mode) return;
        state.setMode(mode);
        events.add(EngineEvent.modeChanged(mode));
        touch();
    }

    /** 锁定当前方块 → 级联结算直到稳定 → 生成下一个方块 */
    private void lockAndResolve() {
        resolving = true;
        try {
            Piece p = state.getCurrent();
            List<Cell> locked = new ArrayList<>(p.cells());
            p.lockTo(state.getGrid());
            state.setHoldUsed(false);
            events.add(EngineEvent.pieceLocked(locked));

            String quizWord = cascade();
            spawnNext();

            if (quizWord != null && state.getMode() == GameMode.PLAYING && pendingQuizWord == null) {
                pendingQuizWord = quizWord;
                // 测验期间松开软降，答完按常速下落
                softDrop = false;
                state.addPauseReason(QUIZ_REASON);
                events.add(EngineEvent.quizRequested(quizWord));
                changeMode(GameMode.QUIZ);
            }
        } finally {
            resolving = false;
            touch();
        }
    }

    /** @return 本次级联中第一个触发测验的单词；没有则为 null */
    private String cascade() {
        String quizWord = null;
        while (true) {
            double eff = state.getCombo().effectiveMultiplier(GameConstants.BASE_SCORE_MULTIPLIER);
            ResolutionPass pass = resolver.resolvePass(state, eff);
            if (!pass.found()) break;

            state.getCombo().onClear();
            events.add(EngineEvent.wordsCleared(pass.words(), pass.clearedCells()));
            if (pass.clearedCells().size() >= GameConstants.BIG_CLEAR_CELLS) {
                events.add(EngineEvent.bigClear(pass.clearedCells()));
            }
            if (pass.leveledUp()) {
                events.add(EngineEvent.levelUp(state.getLevel()));
                log.debug("升级 identity={} level={}", identity, state.getLevel());
            }
            if (quizWord == null && !pass.quizWords().isEmpty()) {
                quizWord = pass.quizWords().get(0);
            }
        }
        return quizWord;
    }

    private void spawnNext() {
        Piece p = state.getNext();
        p.resetToSpawn(state.getGrid());
        state.setCurrent(p);
        state.setNext(pieces.nextPiece());
        if (!p.canMove(state.getGrid(), 0, 0)) {
            gameOver();
        }
    }

    private void gameOver() {
        Instant now = clock.instant();
        state.clearPauseReasons();
        pendingQuizWord = null;
        softDrop = false;
        state.setMode(GameMode.GAME_OVER);
        lastResult = new GameResult(identity,
                state.getScore(),
                state.getLevel(),
                state.getFoundWords().size(),
                state.getRemovedWords().size(),
                Duration.between(state.getStartedAt(), now),
                now);
        events.add(EngineEvent.gameOver(lastResult));
        touch();
        log.info("对局结束 identity={} score={} level={}", identity, lastResult.score(), lastResult.level());
    }
}
