package com.lexhub.gameservice.games.letterfall.domain.model;

import com.lexhub.gameservice.games.letterfall.domain.engine.LetterfallEngine;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单个玩家的在线对局（内存态）。
 * - engine 的所有调用都在 synchronized(this) 内进行；
 * - saveLock 保证同一对局同一时刻只有一个存档写入者；
 * - 事件缓冲有上限，前端长时间不取时丢弃最旧的事件。
 */
@Getter
public class PlayerRun {

    /** 事件缓冲上限 */
    public static final int MAX_BUFFERED_EVENTS = 256;

    private final String identity;
    private final LetterfallEngine engine;
    private final ReentrantLock saveLock = new ReentrantLock();

    @Getter(lombok.AccessLevel.NONE)
    private final Deque<EngineEvent> events = new ArrayDeque<>();

    /** 当前展示的测验；引擎有待答测验时才非空 */
    @Setter
    private Quiz quiz;

    /** 结算结果是否已交出（每局只交一次） */
    @Setter
    private boolean resultPublished;

    /** 已被放弃；在监视器内置位，之后的存档写入都要撤销 */
    @Setter
    private boolean abandoned;

    // ---- 自动保存 ----
    @Setter
    private long lastSeenRevision = -1;
    @Setter
    private boolean dirty;
    @Setter
    private long lastDirtyAtMs;
    @Setter
    private long lastSavedAtMs = Long.MIN_VALUE / 2;

    public PlayerRun(String identity, LetterfallEngine engine) {
        this.identity = identity;
        this.engine = engine;
    }

    /** 记一次改动 */
    public void markDirty(long nowMs) {
        this.dirty = true;
        this.lastDirtyAtMs = nowMs;
    }

    public void bufferEvents(List<EngineEvent> drained) {
        for (EngineEvent e : drained) {
            if (events.size() >= MAX_BUFFERED_EVENTS) events.pollFirst();
            events.addLast(e);
        }
    }

    public List<EngineEvent> takeEvents() {
        List<EngineEvent> out = new ArrayList<>(events);
        events.clear();
        return out;
    }
}
