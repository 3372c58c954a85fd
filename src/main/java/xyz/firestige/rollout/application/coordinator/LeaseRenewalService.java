package xyz.firestige.rollout.application.coordinator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 主体租约定时续期
 * <p>
 * 以 lockTtl / 3 为周期续期本实例所有运行中 Rollout 的租约，
 * 长时间的观察窗口或挂起等待不会导致租约过期。
 */
public class LeaseRenewalService {

    private static final Logger log = LoggerFactory.getLogger(LeaseRenewalService.class);

    private final DefaultRolloutCoordinator coordinator;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private ScheduledFuture<?> task;

    public LeaseRenewalService(DefaultRolloutCoordinator coordinator, ScheduledExecutorService scheduler,
                               Duration lockTtl) {
        this.coordinator = coordinator;
        this.scheduler = scheduler;
        long millis = Math.max(1000L, lockTtl.toMillis() / 3);
        this.interval = Duration.ofMillis(millis);
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        long millis = interval.toMillis();
        task = scheduler.scheduleAtFixedRate(this::renewQuietly, millis, millis, TimeUnit.MILLISECONDS);
        log.info("主体租约续期已启动, interval={}", interval);
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }

    public Duration getInterval() {
        return interval;
    }

    // 异常会终止周期任务，这里只记录
    void renewQuietly() {
        try {
            coordinator.renewLeases();
        } catch (RuntimeException e) {
            log.error("主体租约续期异常", e);
        }
    }
}
