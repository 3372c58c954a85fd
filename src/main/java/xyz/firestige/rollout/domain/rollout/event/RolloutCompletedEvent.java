package xyz.firestige.rollout.domain.rollout.event;

import xyz.firestige.rollout.domain.rollout.RolloutStatus;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;

import java.time.Duration;

/**
 * Rollout 完成事件
 */
public class RolloutCompletedEvent extends RolloutEvent {

    private final Duration duration;

    public RolloutCompletedEvent(RolloutId rolloutId, SubjectId subjectId, Duration duration) {
        super(rolloutId, subjectId, RolloutStatus.COMPLETED);
        this.duration = duration;
        setMessage("发布完成，耗时 " + duration);
    }

    public Duration getDuration() {
        return duration;
    }
}
