package xyz.firestige.rollout.facade.converter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.rollout.domain.health.HealthSnapshot;
import xyz.firestige.rollout.domain.health.HealthThresholds;
import xyz.firestige.rollout.domain.rollout.RolloutSpec;
import xyz.firestige.rollout.domain.strategy.BlueGreenStrategy;
import xyz.firestige.rollout.domain.strategy.CanaryStrategy;
import xyz.firestige.rollout.domain.strategy.DirectStrategy;
import xyz.firestige.rollout.domain.strategy.RollingStrategy;
import xyz.firestige.rollout.domain.strategy.RolloutStrategy;
import xyz.firestige.rollout.domain.strategy.StrategyType;
import xyz.firestige.rollout.domain.target.Target;
import xyz.firestige.rollout.domain.target.TargetEnvironment;
import xyz.firestige.rollout.facade.dto.RolloutRequest;
import xyz.firestige.rollout.facade.dto.StrategyRequest;
import xyz.firestige.rollout.facade.dto.TargetRequest;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
@DisplayName("RolloutRequestConverter 测试")
class RolloutRequestConverterTest {

    @Test
    @DisplayName("场景: 未填写的字段使用各策略默认值")
    void strategyDefaults() {
        RolloutStrategy direct = RolloutRequestConverter.toStrategy(new StrategyRequest(StrategyType.DIRECT));
        RolloutStrategy canary = RolloutRequestConverter.toStrategy(new StrategyRequest(StrategyType.CANARY));
        RolloutStrategy rolling = RolloutRequestConverter.toStrategy(new StrategyRequest(StrategyType.ROLLING));
        RolloutStrategy blueGreen = RolloutRequestConverter.toStrategy(new StrategyRequest(StrategyType.BLUE_GREEN));

        assertEquals(DirectStrategy.defaults(), direct);
        assertEquals(CanaryStrategy.defaults(), canary);
        assertEquals(RollingStrategy.defaults(), rolling);
        assertEquals(BlueGreenStrategy.defaults(), blueGreen);
    }

    @Test
    @DisplayName("场景: 金丝雀参数与健康阈值完整映射")
    void canaryFields() {
        // Given
        StrategyRequest request = new StrategyRequest(StrategyType.CANARY);
        request.setInitialPercentage(5);
        request.setIncrementPercentage(25);
        request.setEvaluationWindow(Duration.ofMinutes(2));
        request.setSuccessRateMin(0.95);
        request.setMetricMaxima(Map.of(HealthSnapshot.ERROR_RATE, 0.01));
        request.setAbortOnAnyTargetFailure(true);
        request.setMaxConcurrency(4);

        // When
        CanaryStrategy strategy = (CanaryStrategy) RolloutRequestConverter.toStrategy(request);

        // Then
        assertEquals(5, strategy.initialPercentage());
        assertEquals(25, strategy.incrementPercentage());
        assertEquals(Duration.ofMinutes(2), strategy.evaluationWindow());
        assertEquals(HealthThresholds.of(0.95, Map.of(HealthSnapshot.ERROR_RATE, 0.01)), strategy.thresholds());
        assertTrue(strategy.abortOnAnyTargetFailure());
        assertEquals(4, strategy.maxConcurrency());
    }

    @Test
    @DisplayName("场景: 直接发布可以开启健康检查，滚动发布保留显式顺序")
    void directAndRollingFields() {
        StrategyRequest direct = new StrategyRequest(StrategyType.DIRECT);
        direct.setSkipHealthChecks(false);
        StrategyRequest rolling = new StrategyRequest(StrategyType.ROLLING);
        rolling.setOrder(List.of("b", "a"));
        rolling.setBatchSize(2);
        rolling.setPauseBetweenStages(Duration.ofSeconds(30));

        assertFalse(((DirectStrategy) RolloutRequestConverter.toStrategy(direct)).skipHealthChecks());
        RollingStrategy strategy = (RollingStrategy) RolloutRequestConverter.toStrategy(rolling);
        assertThat(strategy.order()).containsExactly("b", "a");
        assertEquals(2, strategy.batchSize());
        assertEquals(Duration.ofSeconds(30), strategy.pauseBetweenStages());
    }

    @Test
    @DisplayName("场景: 目标的分桶键默认取 ID，环境不区分大小写")
    void targetDefaults() {
        Target plain = RolloutRequestConverter.toTarget(TargetRequest.of("cluster-1"));
        Target staged = RolloutRequestConverter.toTarget(new TargetRequest("cluster-2", "bucket-x", " staging "));

        assertEquals("cluster-1", plain.bucketKey());
        assertEquals(TargetEnvironment.PRODUCTION, plain.environment());
        assertEquals("bucket-x", staged.bucketKey());
        assertEquals(TargetEnvironment.STAGING, staged.environment());

        assertThatThrownBy(() -> RolloutRequestConverter.toTarget(new TargetRequest("c", null, "moon")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("场景: 完整请求转换为 RolloutSpec")
    void toSpec() {
        RolloutRequest request = new RolloutRequest();
        request.setSubjectId("checkout-flag");
        request.setTargetVersion("on");
        request.setPreviousVersion("off");
        request.setStrategy(new StrategyRequest(StrategyType.CANARY));
        request.setTargets(List.of(TargetRequest.of("t1"), TargetRequest.of("t2")));
        request.setAutoRollbackEnabled(false);

        RolloutSpec spec = RolloutRequestConverter.toSpec(request);

        assertEquals("checkout-flag", spec.subjectId().getValue());
        assertEquals("on", spec.targetVersion());
        assertEquals("off", spec.previousVersion());
        assertThat(spec.targets()).extracting(t -> t.id().getValue()).containsExactly("t1", "t2");
        assertFalse(spec.autoRollbackEnabled());
    }
}
