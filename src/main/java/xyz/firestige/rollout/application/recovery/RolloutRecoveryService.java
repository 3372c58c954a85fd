package xyz.firestige.rollout.application.recovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import xyz.firestige.rollout.application.coordinator.RolloutCoordinator;
import xyz.firestige.rollout.application.coordinator.StartResult;
import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.domain.rollout.RolloutSnapshot;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 重启恢复
 * <p>
 * 应用启动完成后加载未结束的 Rollout（PLANNING / DEPLOYING / ROLLING_BACK），
 * 对主体租约已失效的 Rollout 重新获取租约并全部回滚。进程内的执行状态无法恢复，因此不尝试继续正向发布。
 * <p>
 * 租约仍被其他实例持有的 Rollout 会被跳过；配置了扫描间隔时定期重新扫描，
 * 持有者崩溃、租约过期后由存活的实例接管回滚。
 */
public class RolloutRecoveryService implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(RolloutRecoveryService.class);

    private final RolloutRepository repository;
    private final RolloutCoordinator coordinator;
    private final ScheduledExecutorService scheduler;
    private final Duration scanInterval;
    private ScheduledFuture<?> scanTask;

    public RolloutRecoveryService(RolloutRepository repository, RolloutCoordinator coordinator) {
        this(repository, coordinator, null, null);
    }

    /**
     * @param scanInterval 周期扫描间隔，null 或非正数表示只在启动时扫描一次
     */
    public RolloutRecoveryService(RolloutRepository repository, RolloutCoordinator coordinator,
                                  ScheduledExecutorService scheduler, Duration scanInterval) {
        this.repository = repository;
        this.coordinator = coordinator;
        this.scheduler = scheduler;
        this.scanInterval = scanInterval;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        recoverAll();
        startPeriodicScan();
    }

    /**
     * @return 已受理恢复的 Rollout 结果
     */
    public List<StartResult> recoverAll() {
        List<RolloutSnapshot> active = repository.findAllActive();
        if (active.isEmpty()) {
            log.debug("[Recovery] 没有需要恢复的 Rollout");
            return List.of();
        }
        List<StartResult> results = new ArrayList<>();
        for (RolloutSnapshot snapshot : active) {
            StartResult result = coordinator.recover(snapshot);
            if (result.isAccepted()) {
                log.warn("[Recovery] 接管未结束的 Rollout 并回滚: rolloutId={}, status={}",
                        snapshot.rolloutId().getValue(), snapshot.status());
                results.add(result);
            } else if (result.getOutcome() == StartResult.Outcome.ALREADY_IN_PROGRESS) {
                log.debug("[Recovery] Rollout {} 的租约仍被持有，跳过", snapshot.rolloutId().getValue());
            } else {
                log.warn("[Recovery] 跳过 Rollout {}: {}", snapshot.rolloutId().getValue(),
                        result.getFailureInfo() != null ? result.getFailureInfo().getErrorMessage() : result.getOutcome());
            }
        }
        return results;
    }

    public synchronized void startPeriodicScan() {
        if (scanTask != null || scheduler == null || scanInterval == null
                || scanInterval.isZero() || scanInterval.isNegative()) {
            return;
        }
        long millis = scanInterval.toMillis();
        scanTask = scheduler.scheduleWithFixedDelay(this::recoverQuietly, millis, millis, TimeUnit.MILLISECONDS);
        log.info("[Recovery] 周期扫描已启动, interval={}", scanInterval);
    }

    public synchronized void stop() {
        if (scanTask != null) {
            scanTask.cancel(false);
            scanTask = null;
        }
    }

    // 异常会终止周期任务，这里只记录
    void recoverQuietly() {
        try {
            recoverAll();
        } catch (RuntimeException e) {
            log.error("[Recovery] 周期扫描异常", e);
        }
    }
}
