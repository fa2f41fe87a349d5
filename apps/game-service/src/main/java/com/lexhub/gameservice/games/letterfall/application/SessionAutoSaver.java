package com.lexhub.gameservice.games.letterfall.application;

import com.lexhub.gameservice.games.letterfall.domain.dto.SessionSnapshot;
import com.lexhub.gameservice.games.letterfall.domain.engine.LetterfallEngine;
import com.lexhub.gameservice.games.letterfall.domain.enums.GameMode;
import com.lexhub.gameservice.games.letterfall.domain.model.PlayerRun;
import com.lexhub.gameservice.games.letterfall.domain.repository.SessionStore;
import com.lexhub.gameservice.games.letterfall.domain.session.SessionCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * SessionAutoSaver
 * -------------------------------------------------
 * 对局存档写入策略：
 * - 防抖：最后一次改动后至少静置 debounce 才保存，避免存到正在变化的局面；
 * - 节流：两次保存之间至少间隔 throttle；
 * - 单写者：每局一把 saveLock，拿不到就跳过本轮；
 * - 结算中、测验中、已结束的对局不自动保存；手动保存遇到已结束的对局会清掉存档。
 * 快照在对局监视器内生成，编码与写入在监视器外进行，不阻塞帧循环。
 * 写入后重新进入监视器复查：期间对局已结束或被放弃，则撤销刚写的存档。
 */
@Slf4j
@Component
public class SessionAutoSaver {

    private final SessionStore store;
    private final SessionCodec codec;
    private final Clock clock;
    private final long debounceMs;
    private final long throttleMs;

    public SessionAutoSaver(SessionStore store,
                            SessionCodec codec,
                            Clock clock,
                            @Value("${letterfall.autosave.debounce-ms:1500}") long debounceMs,
                            @Value("${letterfall.autosave.throttle-ms:30000}") long throttleMs) {
        this.store = store;
        this.codec = codec;
        this.clock = clock;
        this.debounceMs = debounceMs;
        this.throttleMs = throttleMs;
    }

    /**
     * 周期检查时调用：满足条件才写一次。
     *
     * @return 是否真的写入了存档
     */
    public boolean tryAutosave(PlayerRun run) {
        long now = clock.millis();
        if (!eligible(run, now)) return false;
        if (!run.getSaveLock().tryLock()) return false;
        try {
            SessionSnapshot snap;
            long revision;
            synchronized (run) {
                // 拿到锁后再确认一次，状态可能已变化
                if (!eligible(run, now)) return false;
                snap = run.getEngine().snapshot();
                revision = run.getEngine().revision();
            }
            return persist(run, snap, revision, now);
        } finally {
            run.getSaveLock().unlock();
        }
    }

    /**
     * 手动保存（切后台、主动保存）：忽略防抖与节流。
     */
    public boolean saveNow(PlayerRun run) {
        if (!run.getSaveLock().tryLock()) return false;
        try {
            long now = clock.millis();
            SessionSnapshot snap;
            long revision;
            synchronized (run) {
                LetterfallEngine engine = run.getEngine();
                if (engine.mode() == GameMode.GAME_OVER) {
                    store.clear(run.getIdentity());
                    return false;
                }
                if (engine.isResolving()) return false;
                snap = engine.snapshot();
                revision = engine.revision();
            }
            return persist(run, snap, revision, now);
        } finally {
            run.getSaveLock().unlock();
        }
    }

    boolean eligible(PlayerRun run, long now) {
        if (!run.isDirty()) return false;
        LetterfallEngine engine = run.getEngine();
        GameMode mode = engine.mode();
        if (mode == GameMode.GAME_OVER || mode == GameMode.QUIZ || engine.isResolving()) return false;
        if (now - run.getLastDirtyAtMs() < debounceMs) return false;
        return now - run.getLastSavedAtMs() >= throttleMs;
    }

    private boolean persist(PlayerRun run, SessionSnapshot snap, long revision, long now) {
        try {
            store.write(run.getIdentity(), codec.encode(snap));
        } catch (RuntimeException e) {
            log.warn("保存存档失败 identity={}: {}", run.getIdentity(), e.getMessage());
            return false;
        }
        synchronized (run) {
            if (run.isAbandoned() || run.getEngine().mode() == GameMode.GAME_OVER) {
                discard(run);
                return false;
            }
            run.setLastSavedAtMs(now);
            // 写入期间又有新改动则保持 dirty，下一轮再存
            if (run.getEngine().revision() == revision) run.setDirty(false);
        }
        log.debug("存档已保存 identity={} revision={}", run.getIdentity(), revision);
        return true;
    }

    private void discard(PlayerRun run) {
        try {
            store.clear(run.getIdentity());
            log.debug("对局已结束或放弃，撤销存档 identity={}", run.getIdentity());
        } catch (RuntimeException e) {
            log.warn("撤销存档失败 identity={}: {}", run.getIdentity(), e.getMessage());
        }
    }
}
