package xyz.firestige.rollout.application.execution;

import xyz.firestige.rollout.domain.port.Deployer;
import xyz.firestige.rollout.domain.port.HealthEvaluator;
import xyz.firestige.rollout.domain.port.TrafficSwitcher;
import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.domain.shared.event.DomainEventPublisher;
import xyz.firestige.rollout.infrastructure.metrics.MetricsRegistry;

import java.time.Duration;

/**
 * Rollout 执行流水线共享的协作者
 *
 * @param deployRetryAttempts     apply 失败后的重试次数（不含首次）
 * @param deployTimeout           单次 apply/route 超时
 * @param healthEvaluationTimeout 单次健康快照超时
 */
public record ExecutionServices(Deployer deployer,
                                HealthEvaluator healthEvaluator,
                                TrafficSwitcher trafficSwitcher,
                                RolloutRepository repository,
                                DomainEventPublisher eventPublisher,
                                MetricsRegistry metrics,
                                RolloutTimer timer,
                                ExternalCallExecutor callExecutor,
                                TargetDispatcher dispatcher,
                                RollbackController rollbackController,
                                int deployRetryAttempts,
                                Duration deployTimeout,
                                Duration healthEvaluationTimeout) {
}
