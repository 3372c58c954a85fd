package xyz.firestige.rollout.domain.shared.event;

import java.util.List;

/**
 * 领域事件发布器接口
 * <p>
 * 领域层依赖抽象，具体传输机制（Spring 本地事件总线、MQ 等）由基础设施层实现
 */
public interface DomainEventPublisher {

    /**
     * 发布单个领域事件
     *
     * @param event 领域事件对象
     */
    void publish(Object event);

    /**
     * 批量发布领域事件
     *
     * @param events 领域事件列表
     */
    default void publishAll(List<?> events) {
        if (events != null) {
            events.forEach(this::publish);
        }
    }
}
