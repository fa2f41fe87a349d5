package com.lexhub.gameservice.games.letterfall.application;

import com.lexhub.gameservice.clock.scheduler.FrameScheduler;
import com.lexhub.gameservice.games.letterfall.service.LetterfallService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * FrameLoopCoordinator
 * -------------------------------------------------
 * 帧循环业务协调器（应用编排层）：把通用帧调度器与 Letterfall 对局服务对接。
 *
 * 职责与边界：
 * 1) 应用启动（ApplicationReady）后注册两个周期任务：
 *    - 帧任务：约 16ms 一拍，dt 夹到 [0, 100]，推进全部在线对局；
 *    - 自动保存检查：每 15 秒一次，具体是否写入由 SessionAutoSaver 的防抖/节流决定；
 * 2) 应用关闭前停止调度，并把在线对局挂起保存。
 *
 * 本类不管理线程池，也不参与规则判断。
 */
@Component
@RequiredArgsConstructor
public class FrameLoopCoordinator {

    private static final Logger log = LoggerFactory.getLogger(FrameLoopCoordinator.class);

    static final String FRAME_KEY = "letterfall:frame";
    static final String AUTOSAVE_KEY = "letterfall:autosave";

    private final FrameScheduler scheduler;
    private final LetterfallService letterfallService;

    @Value("${letterfall.frame.period-ms:16}")
    // 帧周期
    private long framePeriodMs;

    @Value("${letterfall.frame.max-dt-ms:100}")
    // 单帧最大推进量
    private long maxDtMs;

    @Value("${letterfall.autosave.check-interval-ms:15000}")
    // 自动保存检查周期
    private long autosaveIntervalMs;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("协调器启动：注册帧循环与自动保存检查");
        scheduler.start(FRAME_KEY, framePeriodMs, maxDtMs, letterfallService::tickAll);
        scheduler.start(AUTOSAVE_KEY, autosaveIntervalMs, autosaveIntervalMs, dt -> {
            int saved = letterfallService.autosaveAll();
            if (saved > 0) log.debug("自动保存完成 {} 局", saved);
        });
    }

    @PreDestroy
    public void onShutdown() {
        scheduler.stop(FRAME_KEY);
        scheduler.stop(AUTOSAVE_KEY);
        letterfallService.suspendAll();
    }
}
