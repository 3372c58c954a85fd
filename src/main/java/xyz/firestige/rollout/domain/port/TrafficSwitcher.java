package xyz.firestige.rollout.domain.port;

import xyz.firestige.rollout.domain.target.Target;

/**
 * 流量切换器（蓝绿发布必需，由宿主实现）
 * <p>
 * 将目标的流量整体路由到指定槽位。回滚蓝绿发布时路由回 {@link TrafficSlot#BLUE}，不重新部署。
 */
@FunctionalInterface
public interface TrafficSwitcher {

    DeployResult route(Target target, TrafficSlot slot) throws Exception;
}
