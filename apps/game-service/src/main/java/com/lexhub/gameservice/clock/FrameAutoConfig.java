package com.lexhub.gameservice.clock;

import com.lexhub.gameservice.clock.scheduler.FrameScheduler;
import com.lexhub.gameservice.clock.scheduler.FrameSchedulerImpl;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * FrameAutoConfig
 * ---------------------------------------
 * 将调度线程池注入到通用帧调度器中，不关心任何业务细节。
 */
@Configuration
public class FrameAutoConfig {

    @Bean
    public FrameScheduler frameScheduler(@Qualifier("frameExecutor") ScheduledThreadPoolExecutor frameExecutor) {
        return new FrameSchedulerImpl(frameExecutor);
    }
}
