package com.lexhub.gameservice.games.letterfall.service.impl;

import com.lexhub.gameservice.games.letterfall.application.QuizService;
import com.lexhub.gameservice.games.letterfall.application.SessionAutoSaver;
import com.lexhub.gameservice.games.letterfall.domain.constants.GameMessages;
import com.lexhub.gameservice.games.letterfall.domain.dto.SessionSnapshot;
import com.lexhub.gameservice.games.letterfall.domain.engine.EngineSettings;
import com.lexhub.gameservice.games.letterfall.domain.engine.LetterfallEngine;
import com.lexhub.gameservice.games.letterfall.domain.enums.GameMode;
import com.lexhub.gameservice.games.letterfall.domain.enums.PlayerCommand;
import com.lexhub.gameservice.games.letterfall.domain.enums.QuizOutcome;
import com.lexhub.gameservice.games.letterfall.domain.enums.RestoreFailure;
import com.lexhub.gameservice.games.letterfall.domain.lexicon.Dictionary;
import com.lexhub.gameservice.games.letterfall.domain.model.EngineEvent;
import com.lexhub.gameservice.games.letterfall.domain.model.GameResult;
import com.lexhub.gameservice.games.letterfall.domain.model.PlayerRun;
import com.lexhub.gameservice.games.letterfall.domain.model.Quiz;
import com.lexhub.gameservice.games.letterfall.domain.model.RunView;
import com.lexhub.gameservice.games.letterfall.domain.model.StartOptions;
import com.lexhub.gameservice.games.letterfall.domain.piece.RandomPieceSource;
import com.lexhub.gameservice.games.letterfall.domain.random.RandomSource;
import com.lexhub.gameservice.games.letterfall.domain.repository.GameResultSink;
import com.lexhub.gameservice.games.letterfall.domain.repository.SessionStore;
import com.lexhub.gameservice.games.letterfall.domain.session.SessionCodec;
import com.lexhub.gameservice.games.letterfall.service.LetterfallService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LetterfallServiceImpl
 * -------------------------------------------------------
 * 每个玩家身份一局，内存中以 PlayerRun 管理：
 * - 引擎调用一律在 synchronized(run) 内完成；
 * - 每次调用引擎后统一做善后（afterMutation）：搬运事件、出题、标记改动、交出结算结果；
 * - 存档读写通过 SessionStore（Redis / 文件），编码通过 SessionCodec。
 * -------------------------------------------------------
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LetterfallServiceImpl implements LetterfallService {

    /** 恢复存档时使用的暂停原因 */
    static final String RESTORE_REASON = "restore";
    /** 帧循环异常时挂起对局的暂停原因 */
    static final String SYSTEM_REASON = "system";
    /** 停机挂起使用的暂停原因 */
    static final String LIFECYCLE_REASON = "lifecycle";

    private final Map<String, PlayerRun> runs = new ConcurrentHashMap<>();

    private final EngineSettings settings;
    private final Dictionary dictionary;
    private final RandomSource randomSource;
    private final Clock clock;
    private final SessionStore sessionStore;
    private final SessionCodec sessionCodec;
    private final SessionAutoSaver autoSaver;
    private final QuizService quizService;
    private final GameResultSink resultSink;

    // ===================== 开局 / 恢复 =====================

    @Override
    public RunView startOrResume(StartOptions options) {
        StartOptions o = requireOptions(options);
        String key = key(o.identity());
        PlayerRun existing = runs.get(key);
        if (existing != null) {
            synchronized (existing) {
                if (existing.getEngine().mode() != GameMode.GAME_OVER) {
                    return viewOf(existing);
                }
            }
        }

        LetterfallEngine engine = newEngine();
        Optional<RestoreFailure> failure = tryRestore(engine, o.identity());
        if (failure.isEmpty()) {
            // 恢复成功：引擎处于无原因的 PAUSED，直接恢复
            engine.removePauseReason(RESTORE_REASON);
            log.info("已从存档恢复对局 identity={}", o.identity());
        } else {
            if (failure.get() != RestoreFailure.NOT_FOUND) {
                log.info("存档不可用 identity={} reason={}，清除并开新局", o.identity(), failure.get());
            }
            sessionStore.clear(o.identity());
            engine.restart(o);
        }
        PlayerRun run = new PlayerRun(o.identity(), engine);
        synchronized (run) {
            afterMutation(run);
            runs.put(key, run);
            return viewOf(run);
        }
    }

    @Override
    public RunView restart(StartOptions options) {
        StartOptions o = requireOptions(options);
        sessionStore.clear(o.identity());
        LetterfallEngine engine = newEngine();
        engine.restart(o);
        PlayerRun run = new PlayerRun(o.identity(), engine);
        synchronized (run) {
            afterMutation(run);
            runs.put(key(o.identity()), run);
            return viewOf(run);
        }
    }

    // ===================== 查询 =====================

    @Override
    public RunView view(String identity) {
        PlayerRun run = requireRun(identity);
        synchronized (run) {
            return viewOf(run);
        }
    }

    @Override
    public Optional<Quiz> quiz(String identity) {
        PlayerRun run = requireRun(identity);
        synchronized (run) {
            return Optional.ofNullable(run.getQuiz());
        }
    }

    @Override
    public List<EngineEvent> drainEvents(String identity) {
        PlayerRun run = requireRun(identity);
        synchronized (run) {
            run.bufferEvents(run.getEngine().drainEvents());
            return run.takeEvents();
        }
    }

    @Override
    public Optional<GameResult> takeResult(String identity) {
        requireIdentity(identity);
        return resultSink.take(identity.trim());
    }

    // ===================== 输入 =====================

    @Override
    public boolean command(String identity, PlayerCommand command) {
        PlayerRun run = requireRun(identity);
        synchronized (run) {
            if (run.getEngine().mode() == GameMode.GAME_OVER) {
                throw new IllegalStateException(GameMessages.GAME_OVER);
            }
            boolean applied = run.getEngine().apply(command);
            afterMutation(run);
            return applied;
        }
    }

    @Override
    public RunView pause(String identity, String reason) {
        PlayerRun run = requireRun(identity);
        synchronized (run) {
            run.getEngine().addPauseReason(reason);
            afterMutation(run);
            return viewOf(run);
        }
    }

    @Override
    public RunView resume(String identity, String reason) {
        PlayerRun run = requireRun(identity);
        synchronized (run) {
            run.getEngine().removePauseReason(reason);
            afterMutation(run);
            return viewOf(run);
        }
    }

    @Override
    public QuizOutcome answerQuiz(String identity, String choice, boolean skip) {
        PlayerRun run = requireRun(identity);
        synchronized (run) {
            Quiz quiz = run.getQuiz();
            if (quiz == null) throw new IllegalStateException(GameMessages.NO_QUIZ);
            QuizOutcome outcome = skip ? QuizOutcome.SKIPPED : quizService.judge(quiz, choice);
            run.getEngine().answerQuiz(outcome);
            run.setQuiz(null);
            afterMutation(run);
            log.debug("测验作答 identity={} word={} outcome={}", run.getIdentity(), quiz.word(), outcome);
            return outcome;
        }
    }

    // ===================== 存档 =====================

    @Override
    public boolean save(String identity) {
        return autoSaver.saveNow(requireRun(identity));
    }

    @Override
    public void abandon(String identity) {
        requireIdentity(identity);
        PlayerRun run = runs.remove(key(identity));
        if (run != null) {
            // 先置位再清存档：并发中的写入在复查时会看到标记
            synchronized (run) {
                run.setAbandoned(true);
            }
        }
        sessionStore.clear(identity.trim());
        if (run != null) log.info("放弃对局 identity={}", run.getIdentity());
    }

    // ===================== 帧循环 =====================

    @Override
    public void tickAll(long dtMs) {
        for (PlayerRun run : runs.values()) {
            synchronized (run) {
                try {
                    run.getEngine().tick(dtMs);
                    afterMutation(run);
                } catch (RuntimeException e) {
                    // 单局异常不影响其它对局：挂起该局等待人工恢复
                    log.error("推进对局失败 identity={}，已挂起", run.getIdentity(), e);
                    run.getEngine().addPauseReason(SYSTEM_REASON);
                }
            }
        }
    }

    @Override
    public int autosaveAll() {
        int saved = 0;
        for (PlayerRun run : runs.values()) {
            if (autoSaver.tryAutosave(run)) saved++;
        }
        return saved;
    }

    @Override
    public void suspendAll() {
        for (PlayerRun run : runs.values()) {
            synchronized (run) {
                if (run.getEngine().mode() == GameMode.GAME_OVER) continue;
                run.getEngine().addPauseReason(LIFECYCLE_REASON);
                afterMutation(run);
            }
            autoSaver.saveNow(run);
        }
        log.info("已挂起并保存在线对局 {} 个", runs.size());
    }

    // ===================== 内部 =====================

    private LetterfallEngine newEngine() {
        return new LetterfallEngine(settings, new RandomPieceSource(randomSource), dictionary, clock);
    }

    private Optional<RestoreFailure> tryRestore(LetterfallEngine engine, String identity) {
        Optional<byte[]> bytes;
        try {
            bytes = sessionStore.read(identity);
        } catch (RuntimeException e) {
            log.warn("读取存档失败 identity={}: {}", identity, e.getMessage());
            return Optional.of(RestoreFailure.CORRUPT);
        }
        if (bytes.isEmpty()) return Optional.of(RestoreFailure.NOT_FOUND);
        Optional<SessionSnapshot> snap = sessionCodec.decode(bytes.get());
        if (snap.isEmpty()) return Optional.of(RestoreFailure.CORRUPT);
        return engine.restore(snap.get(), identity);
    }

    /**
     * 调用引擎之后的统一善后。调用方须持有 run 的监视器。
     */
    private void afterMutation(PlayerRun run) {
        LetterfallEngine engine = run.getEngine();
        run.bufferEvents(engine.drainEvents());

        if (engine.pendingQuiz().isPresent() && run.getQuiz() == null) {
            run.setQuiz(quizService.build(engine.pendingQuiz().get()));
        } else if (engine.pendingQuiz().isEmpty()) {
            run.setQuiz(null);
        }

        long revision = engine.revision();
        if (revision != run.getLastSeenRevision()) {
            run.setLastSeenRevision(revision);
            run.markDirty(clock.millis());
        }

        if (engine.mode() == GameMode.GAME_OVER && !run.isResultPublished()) {
            run.setResultPublished(true);
            run.setDirty(false);
            engine.lastResult().ifPresent(resultSink::publish);
            sessionStore.clear(run.getIdentity());
        }
    }

    private RunView viewOf(PlayerRun run) {
        LetterfallEngine engine = run.getEngine();
        return RunView.of(run.getIdentity(), engine.state(), run.getQuiz() != null);
    }

    private PlayerRun requireRun(String identity) {
        requireIdentity(identity);
        PlayerRun run = runs.get(key(identity));
        if (run == null) throw new NoSuchElementException(GameMessages.formatRunNotFound(identity.trim()));
        return run;
    }

    private static StartOptions requireOptions(StartOptions options) {
        if (options == null) throw new IllegalArgumentException(GameMessages.IDENTITY_REQUIRED);
        StartOptions o = options.normalized();
        requireIdentity(o.identity());
        return o;
    }

    private static void requireIdentity(String identity) {
        if (identity == null || identity.isBlank()) throw new IllegalArgumentException(GameMessages.IDENTITY_REQUIRED);
    }

    private static String key(String identity) {
        return identity.trim().toLowerCase(Locale.ROOT);
    }
}
