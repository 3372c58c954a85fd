package xyz.firestige.rollout.application.execution;

import org.slf4j.MDC;
import xyz.firestige.rollout.domain.rollout.Rollout;

/**
 * 日志上下文：rolloutId / subjectId
 */
final class RolloutMdc implements AutoCloseable {

    static final String ROLLOUT_ID = "rolloutId";
    static final String SUBJECT_ID = "subjectId";

    private RolloutMdc(Rollout rollout) {
        MDC.put(ROLLOUT_ID, rollout.getRolloutId().getValue());
        MDC.put(SUBJECT_ID, rollout.getSubjectId().getValue());
    }

    static RolloutMdc of(Rollout rollout) {
        return new RolloutMdc(rollout);
    }

    @Override
    public void close() {
        MDC.remove(ROLLOUT_ID);
        MDC.remove(SUBJECT_ID);
    }
}
