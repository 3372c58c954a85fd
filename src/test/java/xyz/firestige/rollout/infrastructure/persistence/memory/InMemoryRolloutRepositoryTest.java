package xyz.firestige.rollout.infrastructure.persistence.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.rollout.domain.rollout.RolloutSnapshot;
import xyz.firestige.rollout.domain.rollout.RolloutStatus;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;
import xyz.firestige.rollout.testutil.Snapshots;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
@DisplayName("InMemoryRolloutRepository 测试")
class InMemoryRolloutRepositoryTest {

    private InMemoryRolloutRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRolloutRepository();
    }

    @Test
    @DisplayName("场景: 活跃 Rollout 可按主体查询，终态后移出活跃索引")
    void activeIndexFollowsStatus() {
        // Given
        RolloutSnapshot active = Snapshots.deploying("r1", "operator-a").toSnapshot();
        repository.save(active);

        // Then
        assertThat(repository.findActiveBySubject(SubjectId.of("operator-a")))
                .get().extracting(RolloutSnapshot::rolloutId).isEqualTo(RolloutId.of("r1"));
        assertThat(repository.findAllActive()).hasSize(1);

        // When: 同一个 Rollout 进入终态
        repository.save(Snapshots.rolledBack("r1", "operator-a"));

        // Then
        assertThat(repository.findActiveBySubject(SubjectId.of("operator-a"))).isEmpty();
        assertThat(repository.findAllActive()).isEmpty();
        assertThat(repository.findById(RolloutId.of("r1"))).get()
                .extracting(RolloutSnapshot::status).isEqualTo(RolloutStatus.ROLLED_BACK);
    }

    @Test
    @DisplayName("场景: 删除后不可再查询")
    void remove() {
        repository.save(Snapshots.deploying("r1", "operator-a").toSnapshot());
        repository.save(Snapshots.deploying("r2", "operator-b").toSnapshot());

        repository.remove(RolloutId.of("r1"));

        assertEquals(1, repository.size());
        assertThat(repository.findById(RolloutId.of("r1"))).isEmpty();
        assertThat(repository.findActiveBySubject(SubjectId.of("operator-a"))).isEmpty();
        assertThat(repository.findActiveBySubject(SubjectId.of("operator-b"))).isPresent();
    }

    @Test
    @DisplayName("场景: 空参数安全处理")
    void nullSafe() {
        repository.save(null);
        repository.remove(null);

        assertThat(repository.findById(null)).isEmpty();
        assertThat(repository.findActiveBySubject(null)).isEmpty();
        assertEquals(0, repository.size());
    }
}
