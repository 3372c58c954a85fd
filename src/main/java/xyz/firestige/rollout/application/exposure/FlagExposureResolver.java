package xyz.firestige.rollout.application.exposure;

import xyz.firestige.rollout.domain.bucketing.TargetBucketing;
import xyz.firestige.rollout.domain.rollout.RolloutSnapshot;
import xyz.firestige.rollout.domain.rollout.RolloutStatus;
import xyz.firestige.rollout.domain.shared.vo.TargetId;
import xyz.firestige.rollout.domain.target.TargetStatus;

/**
 * Feature Flag 曝光解析
 * <p>
 * 计算某个用户/请求上下文此刻应看到的开关值：
 * <ul>
 *   <li>Rollout 已完成：新值</li>
 *   <li>上下文本身是 Rollout 的目标：目标已部署（ACTIVE/HEALTHY）时为新值，否则为旧值</li>
 *   <li>发布中：bucket(key) 小于已放量的最高百分比时为新值</li>
 *   <li>回滚失败：未能恢复的目标仍运行新值，其余上下文为旧值</li>
 *   <li>其余情况（规划中、回滚中、已回滚）：旧值</li>
 * </ul>
 */
public class FlagExposureResolver {

    public String resolve(RolloutSnapshot snapshot, String contextKey) {
        if (contextKey == null || contextKey.isBlank()) {
            throw new IllegalArgumentException("contextKey 不能为空");
        }
        if (snapshot.status() == RolloutStatus.COMPLETED) {
            return snapshot.targetVersion();
        }
        if (snapshot.status() == RolloutStatus.FAILED) {
            return snapshot.unrevertedTargets().contains(TargetId.of(contextKey))
                    ? snapshot.targetVersion()
                    : snapshot.previousVersion();
        }
        if (snapshot.status() != RolloutStatus.DEPLOYING) {
            return snapshot.previousVersion();
        }
        TargetStatus targetStatus = snapshot.targetStatus(TargetId.of(contextKey));
        if (targetStatus != null) {
            return targetStatus.isDeployed() ? snapshot.targetVersion() : snapshot.previousVersion();
        }
        int percentage = snapshot.exposedPercentage();
        return TargetBucketing.isIncluded(contextKey, percentage)
                ? snapshot.targetVersion()
                : snapshot.previousVersion();
    }

    public boolean isExposed(RolloutSnapshot snapshot, String contextKey) {
        return snapshot.targetVersion().equals(resolve(snapshot, contextKey));
    }
}
