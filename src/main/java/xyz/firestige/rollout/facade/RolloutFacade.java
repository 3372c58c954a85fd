package xyz.firestige.rollout.facade;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.application.coordinator.RolloutCoordinator;
import xyz.firestige.rollout.application.coordinator.RolloutOperationResult;
import xyz.firestige.rollout.application.coordinator.StartResult;
import xyz.firestige.rollout.application.exposure.FlagExposureResolver;
import xyz.firestige.rollout.domain.rollout.RolloutSnapshot;
import xyz.firestige.rollout.domain.rollout.RolloutSpec;
import xyz.firestige.rollout.domain.shared.exception.ErrorType;
import xyz.firestige.rollout.domain.shared.exception.FailureInfo;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.facade.converter.RolloutRequestConverter;
import xyz.firestige.rollout.facade.dto.RolloutRequest;
import xyz.firestige.rollout.facade.exception.RolloutConflictException;
import xyz.firestige.rollout.facade.exception.RolloutNotFoundException;
import xyz.firestige.rollout.facade.exception.RolloutOperationException;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rollout Facade
 * <p>
 * 职责：
 * 1. 参数校验（快速失败）
 * 2. DTO 转换：外部 DTO → 领域入参
 * 3. 调用协调器
 * 4. 异常转换：协调器 Result → Facade 异常
 * <p>
 * 返回 void（发起和查询除外），通过异常机制处理错误
 */
public class RolloutFacade {

    private static final Logger logger = LoggerFactory.getLogger(RolloutFacade.class);

    private final RolloutCoordinator coordinator;
    private final FlagExposureResolver exposureResolver;
    private final Validator validator;

    public RolloutFacade(RolloutCoordinator coordinator, FlagExposureResolver exposureResolver, Validator validator) {
        this.coordinator = coordinator;
        this.exposureResolver = exposureResolver;
        this.validator = validator;
    }

    /**
     * 发起 Rollout
     *
     * @return 新 Rollout 的 ID
     * @throws IllegalArgumentException  请求格式校验失败
     * @throws RolloutConflictException  主体已有进行中的 Rollout
     * @throws RolloutOperationException 协调器拒绝
     */
    public String startRollout(RolloutRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("请求不能为空");
        }
        logger.info("[Facade] 发起 Rollout: subject={}, targets={}", request.getSubjectId(),
                request.getTargets() != null ? request.getTargets().size() : 0);

        Set<ConstraintViolation<RolloutRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String errorDetail = violations.stream()
                    .map(v -> String.format("[%s] %s", v.getPropertyPath(), v.getMessage()))
                    .sorted()
                    .collect(Collectors.joining("; "));
            logger.warn("[Facade] RolloutRequest 格式校验失败: {}", errorDetail);
            throw new IllegalArgumentException("RolloutRequest 格式校验失败: " + errorDetail);
        }

        RolloutSpec spec;
        try {
            spec = RolloutRequestConverter.toSpec(request);
        } catch (IllegalArgumentException e) {
            logger.warn("[Facade] RolloutRequest 转换失败: {}", e.getMessage());
            throw new IllegalArgumentException("RolloutRequest 转换失败: " + e.getMessage(), e);
        }

        StartResult result = coordinator.start(spec);
        switch (result.getOutcome()) {
            case ACCEPTED:
                logger.info("[Facade] Rollout 已受理: rolloutId={}", result.getRolloutId().getValue());
                return result.getRolloutId().getValue();
            case ALREADY_IN_PROGRESS:
                FailureInfo conflict = result.getFailureInfo();
                throw new RolloutConflictException(conflict.getErrorMessage(), conflict,
                        result.getRolloutId() != null ? result.getRolloutId().getValue() : null);
            default:
                FailureInfo failureInfo = result.getFailureInfo();
                throw new RolloutOperationException(
                        failureInfo != null ? failureInfo.getErrorMessage() : "Rollout 发起失败", failureInfo);
        }
    }

    /**
     * 取消 Rollout，已部署的目标会被回滚
     */
    public void cancelRollout(String rolloutId) {
        logger.info("[Facade] 取消 Rollout: {}", rolloutId);
        RolloutOperationResult result = coordinator.cancel(RolloutId.of(rolloutId));
        handleOperationResult(result, "取消 Rollout");
        logger.info("[Facade] Rollout 取消请求已受理: {}", rolloutId);
    }

    /**
     * 人工回滚
     *
     * @throws RolloutConflictException Rollout 正由其他协调器实例执行
     */
    public void rollbackRollout(String rolloutId, String reason) {
        logger.info("[Facade] 回滚 Rollout: {}, reason={}", rolloutId, reason);
        RolloutOperationResult result = coordinator.rollback(RolloutId.of(rolloutId), reason);
        handleOperationResult(result, "回滚 Rollout");
        logger.info("[Facade] Rollout 回滚请求已受理: {}", rolloutId);
    }

    /**
     * 查询 Rollout 状态
     */
    public RolloutStatusInfo queryRolloutStatus(String rolloutId) {
        logger.debug("[Facade] 查询 Rollout 状态: {}", rolloutId);
        return RolloutStatusInfo.fromSnapshot(load(rolloutId));
    }

    /**
     * 解析某个上下文此刻应看到的开关值
     */
    public String resolveFlagValue(String rolloutId, String contextKey) {
        return exposureResolver.resolve(load(rolloutId), contextKey);
    }

    // ========== 私有辅助方法 ==========

    private RolloutSnapshot load(String rolloutId) {
        return coordinator.status(RolloutId.of(rolloutId))
                .orElseThrow(() -> new RolloutNotFoundException("Rollout 不存在: " + rolloutId));
    }

    private void handleOperationResult(RolloutOperationResult result, String operation) {
        if (!result.isSuccess()) {
            String message = result.getMessage();
            if (message != null && message.contains("不存在")) {
                throw new RolloutNotFoundException(message);
            }
            FailureInfo failureInfo = result.getFailureInfo();
            if (failureInfo != null && failureInfo.getErrorType() == ErrorType.ALREADY_IN_PROGRESS) {
                throw new RolloutConflictException(operation + "失败: " + message, failureInfo, result.getRolloutId());
            }
            throw new RolloutOperationException(operation + "失败: " + message, result.getFailureInfo());
        }
    }
}
