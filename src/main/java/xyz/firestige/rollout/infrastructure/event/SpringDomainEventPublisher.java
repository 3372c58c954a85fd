package xyz.firestige.rollout.infrastructure.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import xyz.firestige.rollout.domain.shared.event.DomainEventPublisher;

/**
 * Spring 本地事件总线实现（单机部署）
 * <p>
 * 监听方通过 {@code @EventListener} 订阅 Rollout 事件；监听方抛出的异常只记录日志，
 * 不影响发布流程。
 */
public class SpringDomainEventPublisher implements DomainEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(SpringDomainEventPublisher.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(Object event) {
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("领域事件监听方处理失败: {}", event, e);
        }
    }
}
