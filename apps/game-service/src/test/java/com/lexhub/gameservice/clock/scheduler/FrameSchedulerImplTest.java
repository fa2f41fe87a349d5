package com.lexhub.gameservice.clock.scheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FrameSchedulerImplTest {

    @Mock
    private ScheduledThreadPoolExecutor executor;
    @Mock
    private ScheduledFuture<Object> future;

    private final AtomicLong nanos = new AtomicLong();
    private FrameSchedulerImpl scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new FrameSchedulerImpl(executor, nanos::get);
        doReturn(future).when(executor).scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), eq(TimeUnit.MILLISECONDS));
    }

    private Runnable startAndCapture(FrameScheduler.FrameListener listener) {
        scheduler.start("frame", 16, 100, listener);
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(executor).scheduleAtFixedRate(task.capture(), eq(16L), eq(16L), eq(TimeUnit.MILLISECONDS));
        return task.getValue();
    }

    private void advanceMs(long ms) {
        nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(ms));
    }

    @Test
    void reportsElapsedMillisClampedToTheMaximum() {
        List<Long> seen = new ArrayList<>();
        Runnable task = startAndCapture(seen::add);

        advanceMs(16);
        task.run();
        advanceMs(500);
        task.run();
        advanceMs(17);
        task.run();

        assertThat(seen).containsExactly(16L, 100L, 17L);
    }

    @Test
    void listenerFailureDoesNotEscapeTheTask() {
        Runnable task = startAndCapture(dt -> {
            throw new IllegalStateException("boom");
        });
        advanceMs(16);

        assertThatCode(task::run).doesNotThrowAnyException();
    }

    @Test
    void restartingAKeyCancelsThePreviousTask() {
        scheduler.start("frame", 16, 100, dt -> { });
        scheduler.start("frame", 16, 100, dt -> { });

        verify(future).cancel(false);
        verify(executor, times(2)).scheduleAtFixedRate(any(Runnable.class), eq(16L), eq(16L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void stopAndRunningState() {
        when(future.isDone()).thenReturn(false);
        scheduler.start("frame", 16, 100, dt -> { });
        assertThat(scheduler.isRunning("frame")).isTrue();

        scheduler.stopAll();

        verify(future).cancel(false);
        assertThat(scheduler.isRunning("frame")).isFalse();
        assertThat(scheduler.isRunning("other")).isFalse();
    }
}
