package xyz.firestige.rollout.domain.port;

import xyz.firestige.rollout.domain.health.HealthSnapshot;
import xyz.firestige.rollout.domain.target.Target;

import java.util.List;

/**
 * 健康评估器（由宿主实现）
 * <p>
 * 根据遥测数据计算活跃目标的健康快照。抛出异常或超时视为健康检查不通过。
 */
@FunctionalInterface
public interface HealthEvaluator {

    HealthSnapshot snapshot(List<Target> activeTargets) throws Exception;
}
