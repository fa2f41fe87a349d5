package com.lexhub.gameservice.clock.scheduler;

/**
 * FrameScheduler
 * ---------------------------------------
 * 通用的“固定节拍调度器”接口，完全独立于具体业务。
 *
 * 设计目标：
 *  - 按 key 启动/停止周期任务；
 *  - 每一拍回调实际经过的毫秒数（按单调时钟测量并夹到上限），
 *    调度抖动或 GC 停顿不会让上层一次推进过多时间。
 */
public interface FrameScheduler {

    /**
     * FrameListener
     * ---------------------------------------
     * 每一拍回调一次。
     */
    interface FrameListener {
        /**
         * @param dtMs 距上一拍经过的毫秒数，范围 [0, maxDtMs]
         */
        void onFrame(long dtMs);
    }

    /**
     * 启动（或重启）指定 key 的周期任务。
     *
     * @param key      任务键
     * @param periodMs 周期（毫秒）
     * @param maxDtMs  单拍 dt 上限
     * @param listener 回调
     */
    void start(String key, long periodMs, long maxDtMs, FrameListener listener);

    /** 停止指定 key 的任务（不打断正在执行的一拍） */
    void stop(String key);

    boolean isRunning(String key);

    /** 停止全部任务 */
    void stopAll();
}
