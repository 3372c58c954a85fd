package xyz.firestige.rollout.domain.rollout;

import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;

import java.util.List;
import java.util.Optional;

/**
 * Rollout 仓储
 * <p>
 * 以 rolloutId 为主键保存快照，并维护主体 → 活跃 Rollout 的索引。
 * 每次状态转换后由协调器调用 {@link #save(RolloutSnapshot)}。
 */
public interface RolloutRepository {

    void save(RolloutSnapshot snapshot);

    Optional<RolloutSnapshot> findById(RolloutId rolloutId);

    /**
     * 查询主体当前的非终态 Rollout
     */
    Optional<RolloutSnapshot> findActiveBySubject(SubjectId subjectId);

    /**
     * 查询所有非终态 Rollout（重启恢复使用）
     */
    List<RolloutSnapshot> findAllActive();

    void remove(RolloutId rolloutId);
}
