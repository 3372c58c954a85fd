package xyz.firestige.rollout.application.coordinator;

import xyz.firestige.rollout.domain.rollout.RolloutSnapshot;
import xyz.firestige.rollout.domain.shared.exception.ErrorType;
import xyz.firestige.rollout.domain.shared.exception.FailureInfo;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;

import java.util.concurrent.CompletableFuture;

/**
 * 发起 Rollout 的结果
 * <ul>
 *   <li>ACCEPTED：已受理，附带 rolloutId 和结束时完成的 Future</li>
 *   <li>ALREADY_IN_PROGRESS：同一主体已有活跃 Rollout，附带其 ID，未做任何变更</li>
 *   <li>REJECTED：入参校验失败</li>
 * </ul>
 */
public final class StartResult {

    public enum Outcome {
        ACCEPTED,
        ALREADY_IN_PROGRESS,
        REJECTED
    }

    private final Outcome outcome;
    private final RolloutId rolloutId;
    private final CompletableFuture<RolloutSnapshot> completion;
    private final FailureInfo failureInfo;

    private StartResult(Outcome outcome, RolloutId rolloutId, CompletableFuture<RolloutSnapshot> completion,
                        FailureInfo failureInfo) {
        this.outcome = outcome;
        this.rolloutId = rolloutId;
        this.completion = completion;
        this.failureInfo = failureInfo;
    }

    public static StartResult accepted(RolloutId rolloutId, CompletableFuture<RolloutSnapshot> completion) {
        return new StartResult(Outcome.ACCEPTED, rolloutId, completion, null);
    }

    /**
     * @param holder 正在占用主体的 Rollout（可能为 null，例如锁已过期但索引未清理）
     */
    public static StartResult alreadyInProgress(RolloutId holder) {
        String message = holder != null ? "主体已有进行中的 Rollout: " + holder.getValue() : "主体已有进行中的 Rollout";
        return new StartResult(Outcome.ALREADY_IN_PROGRESS, holder, null,
                FailureInfo.of(ErrorType.ALREADY_IN_PROGRESS, message));
    }

    public static StartResult rejected(FailureInfo failureInfo) {
        return new StartResult(Outcome.REJECTED, null, null, failureInfo);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isAccepted() {
        return outcome == Outcome.ACCEPTED;
    }

    /**
     * ACCEPTED 时为新 Rollout 的 ID；ALREADY_IN_PROGRESS 时为占用者的 ID
     */
    public RolloutId getRolloutId() {
        return rolloutId;
    }

    public CompletableFuture<RolloutSnapshot> getCompletion() {
        return completion;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    @Override
    public String toString() {
        return "StartResult{" +
                "outcome=" + outcome +
                ", rolloutId=" + rolloutId +
                ", failureInfo=" + failureInfo +
                '}';
    }
}
