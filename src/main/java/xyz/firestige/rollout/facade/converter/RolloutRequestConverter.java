package xyz.firestige.rollout.facade.converter;

import xyz.firestige.rollout.domain.health.HealthThresholds;
import xyz.firestige.rollout.domain.rollout.RolloutSpec;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;
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

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Rollout 请求转换器（防腐层）
 * <p>
 * 将外部 DTO 转换为领域入参，未设置的策略字段取策略默认值
 */
public class RolloutRequestConverter {

    private RolloutRequestConverter() {
    }

    /**
     * @throws IllegalArgumentException 字段取值不合法（如未知环境、百分比越界）
     */
    public static RolloutSpec toSpec(RolloutRequest request) {
        List<Target> targets = request.getTargets().stream()
                .map(RolloutRequestConverter::toTarget)
                .collect(Collectors.toList());
        return new RolloutSpec(
                SubjectId.of(request.getSubjectId()),
                request.getTargetVersion(),
                request.getPreviousVersion(),
                toStrategy(request.getStrategy()),
                targets,
                request.isAutoRollbackEnabled());
    }

    public static Target toTarget(TargetRequest request) {
        String bucketKey = request.getBucketKey() == null || request.getBucketKey().isBlank()
                ? request.getId()
                : request.getBucketKey();
        TargetEnvironment environment = request.getEnvironment() == null || request.getEnvironment().isBlank()
                ? TargetEnvironment.PRODUCTION
                : TargetEnvironment.valueOf(request.getEnvironment().trim().toUpperCase(Locale.ROOT));
        return Target.of(request.getId(), bucketKey, environment);
    }

    public static RolloutStrategy toStrategy(StrategyRequest request) {
        StrategyType type = request.getType();
        HealthThresholds thresholds = toThresholds(request);
        boolean abortOnAny = request.getAbortOnAnyTargetFailure() != null
                ? request.getAbortOnAnyTargetFailure()
                : type.isDefaultAbortOnAnyTargetFailure();
        int maxConcurrency = request.getMaxConcurrency() != null ? request.getMaxConcurrency() : 0;

        switch (type) {
            case DIRECT:
                boolean skip = request.getSkipHealthChecks() == null || request.getSkipHealthChecks();
                return new DirectStrategy(skip, thresholds, abortOnAny, maxConcurrency);
            case CANARY:
                return new CanaryStrategy(
                        orDefault(request.getInitialPercentage(), CanaryStrategy.DEFAULT_INITIAL_PERCENTAGE),
                        orDefault(request.getIncrementPercentage(), CanaryStrategy.DEFAULT_INCREMENT_PERCENTAGE),
                        request.getEvaluationWindow(),
                        thresholds, abortOnAny, maxConcurrency);
            case ROLLING:
                return new RollingStrategy(
                        request.getOrder(),
                        orDefault(request.getBatchSize(), 1),
                        request.getEvaluationWindow(),
                        request.getPauseBetweenStages(),
                        thresholds, abortOnAny, maxConcurrency);
            case BLUE_GREEN:
                return new BlueGreenStrategy(
                        request.getValidationPeriod(),
                        request.getPostSwitchMonitoringPeriod(),
                        request.getRetentionPeriod(),
                        thresholds, abortOnAny, maxConcurrency);
            default:
                throw new IllegalArgumentException("不支持的策略类型: " + type);
        }
    }

    private static HealthThresholds toThresholds(StrategyRequest request) {
        double successRateMin = request.getSuccessRateMin() != null
                ? request.getSuccessRateMin()
                : HealthThresholds.DEFAULT_SUCCESS_RATE_MIN;
        return HealthThresholds.of(successRateMin, request.getMetricMaxima());
    }

    private static int orDefault(Integer value, int defaultValue) {
        return value != null ? value : defaultValue;
    }
}
