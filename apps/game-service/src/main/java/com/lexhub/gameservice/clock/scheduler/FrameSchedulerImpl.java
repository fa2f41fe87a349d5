package com.lexhub.gameservice.clock.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * FrameSchedulerImpl
 * ---------------------------------------
 * 通用帧调度器的默认实现。
 *
 * 职责：
 *  - 使用 ScheduledThreadPoolExecutor 按固定周期调度；
 *  - 以 System.nanoTime 计算每拍 dt，并夹到 [0, maxDtMs]；
 *  - 回调异常只记日志，不让周期任务被线程池静默取消。
 *
 * 不做的事：
 *  - 不做任何业务逻辑。
 */
public class FrameSchedulerImpl implements FrameScheduler {

    private static final Logger log = LoggerFactory.getLogger(FrameSchedulerImpl.class);

    private final ScheduledThreadPoolExecutor scheduler;
    private final LongSupplier nanoClock;

    // key -> 任务句柄
    private final ConcurrentMap<String, ScheduledFuture<?>> activeTasks = new ConcurrentHashMap<>();

    public FrameSchedulerImpl(ScheduledThreadPoolExecutor scheduler) {
        this(scheduler, System::nanoTime);
    }

    FrameSchedulerImpl(ScheduledThreadPoolExecutor scheduler, LongSupplier nanoClock) {
        this.scheduler = scheduler;
        this.nanoClock = nanoClock;
    }

    @Override
    public void start(String key, long periodMs, long maxDtMs, FrameListener listener) {
        // 防止重复任务：先取消老任务
        stop(key);
        FrameTask task = new FrameTask(key, maxDtMs, listener, nanoClock.getAsLong());
        ScheduledFuture<?> fut = scheduler.scheduleAtFixedRate(task, periodMs, periodMs, TimeUnit.MILLISECONDS);
        activeTasks.put(key, fut);
        log.info("帧任务已启动 key={} period={}ms maxDt={}ms", key, periodMs, maxDtMs);
    }

    @Override
    public void stop(String key) {
        ScheduledFuture<?> f = activeTasks.remove(key);
        if (f != null) {
            f.cancel(false);
            log.info("帧任务已停止 key={}", key);
        }
    }

    @Override
    public boolean isRunning(String key) {
        ScheduledFuture<?> f = activeTasks.get(key);
        return f != null && !f.isDone();
    }

    @Override
    public void stopAll() {
        for (String key : activeTasks.keySet()) stop(key);
    }

    /**
     * 单个周期任务：记住上一拍的单调时间。
     */
    final class FrameTask implements Runnable {
        private final String key;
        private final long maxDtMs;
        private final FrameListener listener;
        private long lastNanos;

        FrameTask(String key, long maxDtMs, FrameListener listener, long startNanos) {
            this.key = key;
            this.maxDtMs = maxDtMs;
            this.listener = listener;
            this.lastNanos = startNanos;
        }

        @Override
        public void run() {
            long now = nanoClock.getAsLong();
            long dt = TimeUnit.NANOSECONDS.toMillis(now - lastNanos);
            // 只推进已计入的整毫秒，余数留给下一拍
            lastNanos += TimeUnit.MILLISECONDS.toNanos(dt);
            long clamped = Math.max(0, Math.min(maxDtMs, dt));
            if (dt > maxDtMs) lastNanos = now;
            try {
                listener.onFrame(clamped);
            } catch (RuntimeException e) {
                log.error("帧回调异常 key={}", key, e);
            }
        }
    }
}
