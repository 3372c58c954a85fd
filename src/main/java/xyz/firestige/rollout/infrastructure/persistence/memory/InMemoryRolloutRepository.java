package xyz.firestige.rollout.infrastructure.persistence.memory;

import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.domain.rollout.RolloutSnapshot;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Rollout 仓储内存实现（单实例部署、测试）
 */
public class InMemoryRolloutRepository implements RolloutRepository {

    private final ConcurrentMap<RolloutId, RolloutSnapshot> rollouts = new ConcurrentHashMap<>();
    private final ConcurrentMap<SubjectId, RolloutId> activeBySubject = new ConcurrentHashMap<>();

    @Override
    public void save(RolloutSnapshot snapshot) {
        if (snapshot == null) {
            return;
        }
        rollouts.put(snapshot.rolloutId(), snapshot);
        if (snapshot.isTerminal()) {
            activeBySubject.remove(snapshot.subjectId(), snapshot.rolloutId());
        } else {
            activeBySubject.put(snapshot.subjectId(), snapshot.rolloutId());
        }
    }

    @Override
    public Optional<RolloutSnapshot> findById(RolloutId rolloutId) {
        if (rolloutId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rollouts.get(rolloutId));
    }

    @Override
    public Optional<RolloutSnapshot> findActiveBySubject(SubjectId subjectId) {
        if (subjectId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(activeBySubject.get(subjectId)).flatMap(this::findById);
    }

    @Override
    public List<RolloutSnapshot> findAllActive() {
        return rollouts.values().stream().filter(s -> !s.isTerminal()).toList();
    }

    @Override
    public void remove(RolloutId rolloutId) {
        if (rolloutId == null) {
            return;
        }
        RolloutSnapshot removed = rollouts.remove(rolloutId);
        if (removed != null) {
            activeBySubject.remove(removed.subjectId(), rolloutId);
        }
    }

    public int size() {
        return rollouts.size();
    }
}
