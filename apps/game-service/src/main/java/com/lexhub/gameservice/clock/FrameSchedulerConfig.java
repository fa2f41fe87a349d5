package com.lexhub.gameservice.clock;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 帧时钟线程池。
 * 只承载两类周期任务：每 16ms 一次的对局帧推进，以及每 15s 一次的自动保存检查。
 * 帧任务以 fixed-rate 提交，漏掉的帧由下一帧的 dt 补上（dt 上限 100ms），池满时丢弃新任务。
 * 线程数取 scheduler.frame.corePoolSize，默认 2：帧循环与存档检查各占一条。
 */
@Configuration
public class FrameSchedulerConfig {

    @Value("${scheduler.frame.corePoolSize:2}")
    private int corePoolSize;

    @Bean(name = "frameExecutor")
    public ScheduledThreadPoolExecutor frameExecutor() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "frame-" + seq.getAndIncrement());
                // 关机时由 FrameLoopCoordinator 先挂起并保存对局，线程本身不阻止 JVM 退出
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(corePoolSize, tf, new ThreadPoolExecutor.DiscardPolicy());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
