package xyz.firestige.rollout.domain.rollout.event;

import xyz.firestige.rollout.domain.rollout.RolloutStatus;
import xyz.firestige.rollout.domain.shared.exception.FailureInfo;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Rollout 领域事件基类
 * 由聚合在状态转换时收集，持久化成功后统一发布
 */
public abstract class RolloutEvent {

    private final String eventId;
    private final RolloutId rolloutId;
    private final SubjectId subjectId;
    private final RolloutStatus status;
    private final LocalDateTime timestamp;
    private String message;
    private FailureInfo failureInfo;

    protected RolloutEvent(RolloutId rolloutId, SubjectId subjectId, RolloutStatus status) {
        this.eventId = UUID.randomUUID().toString();
        this.rolloutId = rolloutId;
        this.subjectId = subjectId;
        this.status = status;
        this.timestamp = LocalDateTime.now();
    }

    public String getEventName() {
        return this.getClass().getSimpleName();
    }

    public String getEventId() {
        return eventId;
    }

    public RolloutId getRolloutId() {
        return rolloutId;
    }

    public SubjectId getSubjectId() {
        return subjectId;
    }

    public RolloutStatus getStatus() {
        return status;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public void setFailureInfo(FailureInfo failureInfo) {
        this.failureInfo = failureInfo;
    }

    @Override
    public String toString() {
        return getEventName() + "{" +
                "eventId='" + eventId + '\'' +
                ", rolloutId=" + rolloutId +
                ", subjectId=" + subjectId +
                ", status=" + status +
                ", timestamp=" + timestamp +
                '}';
    }
}
