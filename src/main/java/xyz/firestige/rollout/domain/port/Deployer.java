package xyz.firestige.rollout.domain.port;

import xyz.firestige.rollout.domain.target.Target;

/**
 * 目标部署器（由宿主实现）
 * <p>
 * 将指定版本（软件版本或序列化后的开关值）应用到单个目标。
 * 要求幂等：引擎按至少一次语义调用，超时、重试、回滚都会重复调用。
 * 调用在引擎的共享 IO 线程池上执行，超时后线程会被中断。
 * 抛出的任何异常等同于返回失败结果。
 */
@FunctionalInterface
public interface Deployer {

    DeployResult apply(Target target, String version) throws Exception;
}
