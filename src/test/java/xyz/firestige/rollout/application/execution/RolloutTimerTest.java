package xyz.firestige.rollout.application.execution;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

@Tag("unit")
@DisplayName("RolloutTimer 单元测试")
class RolloutTimerTest {

    private ScheduledExecutorService scheduler;
    private ExecutorService pipeline;
    private RolloutTimer timer;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "timer-thread"));
        pipeline = Executors.newSingleThreadExecutor(r -> new Thread(r, "pipeline-thread"));
        timer = new RolloutTimer(scheduler, pipeline);
    }

    @AfterEach
    void tearDown() {
        pipeline.shutdownNow();
        scheduler.shutdownNow();
    }

    @Test
    @DisplayName("场景: 到期后的续体运行在流水线执行器上")
    void continuationsRunOnPipelineExecutor() throws Exception {
        // When
        String thread = timer.delay(Duration.ofMillis(20))
                .thenApply(v -> Thread.currentThread().getName())
                .get(2, TimeUnit.SECONDS);

        // Then
        assertEquals("pipeline-thread", thread);
    }

    @Test
    @DisplayName("场景: 取消唤醒同样在流水线执行器上，不占用定时线程")
    void cancellationWakeUpRunsOnPipelineExecutor() throws Exception {
        // Given
        RolloutCancellation cancellation = new RolloutCancellation();
        CompletableFuture<String> woken = timer.delay(Duration.ofMinutes(5), cancellation)
                .thenApply(elapsed -> elapsed + "@" + Thread.currentThread().getName());

        // When
        cancellation.request("Cancelled", null);

        // Then
        assertThat(woken.get(2, TimeUnit.SECONDS)).isEqualTo("false@pipeline-thread");
    }

    @Test
    @DisplayName("场景: 已请求取消时直接返回，零时长直接到期")
    void shortCircuits() {
        RolloutCancellation cancellation = new RolloutCancellation();
        assertThat(timer.delay(Duration.ZERO, cancellation)).isCompletedWithValue(true);

        cancellation.request("Cancelled", null);
        CompletableFuture<Boolean> cancelled = timer.delay(Duration.ofMinutes(1), cancellation);
        assertThat(cancelled).isDone();
        assertFalse(cancelled.join());
    }
}
