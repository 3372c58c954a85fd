package xyz.firestige.rollout.infrastructure.event;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;
import xyz.firestige.rollout.domain.rollout.event.RolloutCompletedEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutStartedEvent;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;
import xyz.firestige.rollout.domain.strategy.StrategyType;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@Tag("unit")
@DisplayName("SpringDomainEventPublisher 测试")
class SpringDomainEventPublisherTest {

    private final RolloutId rolloutId = RolloutId.of("r1");
    private final SubjectId subjectId = SubjectId.of("operator-a");

    @Test
    @DisplayName("场景: 事件按顺序转发到 Spring 事件总线")
    void forwardsEvents() {
        ApplicationEventPublisher delegate = mock(ApplicationEventPublisher.class);
        SpringDomainEventPublisher publisher = new SpringDomainEventPublisher(delegate);
        RolloutStartedEvent started = new RolloutStartedEvent(rolloutId, subjectId, StrategyType.CANARY, 4, "v2");
        RolloutCompletedEvent completed = new RolloutCompletedEvent(rolloutId, subjectId, Duration.ofSeconds(3));

        publisher.publishAll(List.of(started, completed));

        verify(delegate).publishEvent((Object) started);
        verify(delegate).publishEvent((Object) completed);
    }

    @Test
    @DisplayName("场景: 监听方异常不影响发布流程")
    void listenerFailureIsContained() {
        ApplicationEventPublisher delegate = mock(ApplicationEventPublisher.class);
        doThrow(new IllegalStateException("listener broken")).when(delegate).publishEvent(any(Object.class));
        SpringDomainEventPublisher publisher = new SpringDomainEventPublisher(delegate);

        assertDoesNotThrow(() -> publisher.publishAll(List.of(
                new RolloutCompletedEvent(rolloutId, subjectId, Duration.ZERO),
                new RolloutCompletedEvent(rolloutId, subjectId, Duration.ZERO))));
        verify(delegate, times(2)).publishEvent(any(Object.class));
    }
}
