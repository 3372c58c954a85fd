package xyz.firestige.rollout.application.execution;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.rollout.domain.port.DeployResult;
import xyz.firestige.rollout.domain.shared.vo.TargetId;
import xyz.firestige.rollout.domain.target.Target;
import xyz.firestige.rollout.testutil.RecordingDeployer;
import xyz.firestige.rollout.testutil.RolloutTestHarness;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@DisplayName("TargetDispatcher 单元测试")
class TargetDispatcherTest {

    private ScheduledExecutorService scheduler;
    private ExecutorService ioPool;
    private TargetDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(2);
        ioPool = Executors.newFixedThreadPool(16);
        RolloutTimer timer = new RolloutTimer(scheduler);
        dispatcher = new TargetDispatcher(new ExternalCallExecutor(ioPool, timer), timer, Duration.ofMillis(5));
    }

    @AfterEach
    void tearDown() {
        ioPool.shutdownNow();
        scheduler.shutdownNow();
    }

    private static TargetDispatcher.DispatchOptions options(int concurrency, int maxAttempts, boolean stopOnFailure) {
        return new TargetDispatcher.DispatchOptions("部署", concurrency, maxAttempts, Duration.ofSeconds(2),
                stopOnFailure, null);
    }

    @Test
    @DisplayName("场景: 全部成功")
    void allSucceed() throws Exception {
        RecordingDeployer deployer = new RecordingDeployer();

        StageDeployReport report = dispatcher.dispatch(RolloutTestHarness.targets(5), t -> deployer.apply(t, "v2"),
                options(2, 1, false), TargetDispatcher.DispatchListener.NONE).get(5, TimeUnit.SECONDS);

        assertThat(report.succeeded()).hasSize(5);
        assertThat(report.hasFailures()).isFalse();
        assertThat(report.successRatio()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("场景: 并发度不超过配置")
    void respectsConcurrency() throws Exception {
        RecordingDeployer deployer = new RecordingDeployer().withLatency(30);

        dispatcher.dispatch(RolloutTestHarness.targets(12), t -> deployer.apply(t, "v2"),
                options(3, 1, false), TargetDispatcher.DispatchListener.NONE).get(10, TimeUnit.SECONDS);

        assertThat(deployer.getCalls()).hasSize(12);
        assertThat(deployer.getMaxInFlight()).isLessThanOrEqualTo(3);
    }

    @Test
    @DisplayName("场景: 失败后按次数重试")
    void retriesFailedTargets() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        TargetDispatcher.TargetAction flaky = t -> calls.incrementAndGet() < 3
                ? DeployResult.failure("暂时失败")
                : DeployResult.success();

        StageDeployReport report = dispatcher.dispatch(List.of(Target.of("t1")), flaky,
                options(1, 3, false), TargetDispatcher.DispatchListener.NONE).get(5, TimeUnit.SECONDS);

        assertThat(calls.get()).isEqualTo(3);
        assertThat(report.succeeded()).containsExactly(TargetId.of("t1"));
    }

    @Test
    @DisplayName("场景: 异常等同于失败结果")
    void exceptionCountsAsFailure() throws Exception {
        RecordingDeployer deployer = new RecordingDeployer().throwOn("t2", "v2");

        StageDeployReport report = dispatcher.dispatch(RolloutTestHarness.targets(3), t -> deployer.apply(t, "v2"),
                options(3, 1, false), TargetDispatcher.DispatchListener.NONE).get(5, TimeUnit.SECONDS);

        assertThat(report.failed()).containsOnlyKeys(TargetId.of("t2"));
        assertThat(report.failed().get(TargetId.of("t2"))).contains("IllegalStateException");
        assertThat(report.successRatio()).isEqualTo(2.0 / 3.0);
    }

    @Test
    @DisplayName("场景: 超时的调用记为失败")
    void timeoutCountsAsFailure() throws Exception {
        TargetDispatcher.TargetAction slow = t -> {
            Thread.sleep(5_000);
            return DeployResult.success();
        };
        TargetDispatcher.DispatchOptions options = new TargetDispatcher.DispatchOptions("部署", 1, 1,
                Duration.ofMillis(50), false, null);

        StageDeployReport report = dispatcher.dispatch(List.of(Target.of("t1")), slow, options,
                TargetDispatcher.DispatchListener.NONE).get(5, TimeUnit.SECONDS);

        assertThat(report.failed().get(TargetId.of("t1"))).contains("超时");
    }

    @Test
    @DisplayName("场景: stopOnFailure 时失败后不再派发新目标")
    void stopsDispatchingAfterFailure() throws Exception {
        RecordingDeployer deployer = new RecordingDeployer().failOn("t1", "v2");

        StageDeployReport report = dispatcher.dispatch(RolloutTestHarness.targets(5), t -> deployer.apply(t, "v2"),
                options(1, 1, true), TargetDispatcher.DispatchListener.NONE).get(5, TimeUnit.SECONDS);

        assertThat(deployer.getCalls()).hasSize(1);
        assertThat(report.skipped()).hasSize(4);
    }

    @Test
    @DisplayName("场景: 停止请求后剩余目标被跳过，监听器只收到已派发的目标")
    void stopRequestSkipsRemaining() throws Exception {
        AtomicBoolean stop = new AtomicBoolean(false);
        AtomicInteger before = new AtomicInteger();
        TargetDispatcher.DispatchListener listener = new TargetDispatcher.DispatchListener() {
            @Override
            public void beforeDispatch(Target target) {
                before.incrementAndGet();
            }

            @Override
            public void onSuccess(Target target) {
                stop.set(true);
            }
        };
        TargetDispatcher.DispatchOptions options = new TargetDispatcher.DispatchOptions("部署", 1, 1,
                Duration.ofSeconds(1), false, stop::get);

        StageDeployReport report = dispatcher.dispatch(RolloutTestHarness.targets(4), t -> DeployResult.success(),
                options, listener).get(5, TimeUnit.SECONDS);

        assertThat(before.get()).isEqualTo(1);
        assertThat(report.succeeded()).hasSize(1);
        assertThat(report.skipped()).hasSize(3);
    }
}
