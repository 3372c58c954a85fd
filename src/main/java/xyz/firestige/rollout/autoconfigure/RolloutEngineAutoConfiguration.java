package xyz.firestige.rollout.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import xyz.firestige.rollout.application.coordinator.DefaultRolloutCoordinator;
import xyz.firestige.rollout.application.coordinator.LeaseRenewalService;
import xyz.firestige.rollout.application.execution.ExecutionServices;
import xyz.firestige.rollout.application.execution.ExternalCallExecutor;
import xyz.firestige.rollout.application.execution.RollbackController;
import xyz.firestige.rollout.application.execution.RolloutTimer;
import xyz.firestige.rollout.application.execution.TargetDispatcher;
import xyz.firestige.rollout.application.exposure.FlagExposureResolver;
import xyz.firestige.rollout.application.recovery.RolloutRecoveryService;
import xyz.firestige.rollout.config.RolloutProperties;
import xyz.firestige.rollout.domain.port.Deployer;
import xyz.firestige.rollout.domain.port.HealthEvaluator;
import xyz.firestige.rollout.domain.port.TrafficSwitcher;
import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.domain.shared.event.DomainEventPublisher;
import xyz.firestige.rollout.domain.stage.StagePlanner;
import xyz.firestige.rollout.facade.RolloutFacade;
import xyz.firestige.rollout.infrastructure.event.SpringDomainEventPublisher;
import xyz.firestige.rollout.infrastructure.lock.LeaseOwner;
import xyz.firestige.rollout.infrastructure.lock.SubjectLockManager;
import xyz.firestige.rollout.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.rollout.infrastructure.metrics.MicrometerMetricsRegistry;
import xyz.firestige.rollout.infrastructure.metrics.NoopMetricsRegistry;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rollout 引擎自动配置
 * <p>
 * 需要应用提供 {@link Deployer} 和 {@link HealthEvaluator}；蓝绿发布另需 {@link TrafficSwitcher}。
 * 所有 Bean 都支持用户覆盖。
 */
@AutoConfiguration(after = {RolloutPersistenceAutoConfiguration.class, ValidationAutoConfiguration.class})
@ConditionalOnBean({Deployer.class, HealthEvaluator.class})
@EnableConfigurationProperties(RolloutProperties.class)
public class RolloutEngineAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(RolloutEngineAutoConfiguration.class);

    // ========== 基础设施 ==========

    @Bean
    @ConditionalOnMissingBean(DomainEventPublisher.class)
    public DomainEventPublisher rolloutDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        logger.info("[AutoConfig] 装配 SpringDomainEventPublisher");
        return new SpringDomainEventPublisher(applicationEventPublisher);
    }

    /**
     * 存在 Micrometer MeterRegistry 时使用 Micrometer，否则 Noop
     */
    @Bean
    @ConditionalOnMissingBean(MetricsRegistry.class)
    public MetricsRegistry rolloutMetricsRegistry(ObjectProvider<MeterRegistry> meterRegistryProvider) {
        MeterRegistry mr = meterRegistryProvider.getIfAvailable();
        if (mr != null) {
            logger.info("[AutoConfig] 装配 MicrometerMetricsRegistry");
            return new MicrometerMetricsRegistry(mr);
        }
        return new NoopMetricsRegistry();
    }

    /**
     * 定时器线程：观察窗口、重试退避、超时检测的到期触发，以及租约续期、恢复扫描
     */
    @Bean(name = "rolloutScheduler", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "rolloutScheduler")
    public ScheduledExecutorService rolloutScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(2, daemonThreads("rollout-timer-"));
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    /**
     * 外部调用线程池，大小即全局并发上限（所有 Rollout 共享）
     */
    @Bean(name = "rolloutIoExecutor", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "rolloutIoExecutor")
    public ExecutorService rolloutIoExecutor(RolloutProperties properties) {
        int ceiling = properties.getGlobalConcurrencyCeiling();
        logger.info("[AutoConfig] 创建外部调用线程池, globalConcurrencyCeiling={}", ceiling);
        return new ThreadPoolExecutor(ceiling, ceiling, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), daemonThreads("rollout-io-"));
    }

    /**
     * 流水线线程：Stage 推进、健康门禁判定、快照持久化与事件发布
     */
    @Bean(name = "rolloutPipelineExecutor", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "rolloutPipelineExecutor")
    public ExecutorService rolloutPipelineExecutor(RolloutProperties properties) {
        int threads = properties.getPipelineThreads();
        return new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), daemonThreads("rollout-pipeline-"));
    }

    @Bean
    @ConditionalOnMissingBean
    public RolloutTimer rolloutTimer(@Qualifier("rolloutScheduler") ScheduledExecutorService rolloutScheduler,
                                     @Qualifier("rolloutPipelineExecutor") ExecutorService rolloutPipelineExecutor) {
        return new RolloutTimer(rolloutScheduler, rolloutPipelineExecutor);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExternalCallExecutor externalCallExecutor(@Qualifier("rolloutIoExecutor") ExecutorService rolloutIoExecutor,
                                                     RolloutTimer rolloutTimer) {
        return new ExternalCallExecutor(rolloutIoExecutor, rolloutTimer);
    }

    @Bean
    @ConditionalOnMissingBean
    public TargetDispatcher targetDispatcher(ExternalCallExecutor externalCallExecutor, RolloutTimer rolloutTimer,
                                             RolloutProperties properties) {
        return new TargetDispatcher(externalCallExecutor, rolloutTimer, properties.getRetryBackoff());
    }

    // ========== 领域服务 ==========

    @Bean
    @ConditionalOnMissingBean
    public StagePlanner stagePlanner(RolloutProperties properties) {
        return new StagePlanner(properties.getDirectHealthCheckWindow());
    }

    @Bean
    @ConditionalOnMissingBean
    public FlagExposureResolver flagExposureResolver() {
        return new FlagExposureResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public RollbackController rollbackController(TargetDispatcher targetDispatcher, Deployer deployer,
                                                 ObjectProvider<TrafficSwitcher> trafficSwitcherProvider,
                                                 RolloutProperties properties) {
        return new RollbackController(targetDispatcher, deployer, trafficSwitcherProvider.getIfAvailable(),
                properties.getRollbackRetryAttempts(), properties.getDeployTimeout());
    }

    // ========== 应用服务 ==========

    @Bean
    @ConditionalOnMissingBean
    public ExecutionServices rolloutExecutionServices(Deployer deployer,
                                                      HealthEvaluator healthEvaluator,
                                                      ObjectProvider<TrafficSwitcher> trafficSwitcherProvider,
                                                      RolloutRepository rolloutRepository,
                                                      DomainEventPublisher rolloutDomainEventPublisher,
                                                      MetricsRegistry rolloutMetricsRegistry,
                                                      RolloutTimer rolloutTimer,
                                                      ExternalCallExecutor externalCallExecutor,
                                                      TargetDispatcher targetDispatcher,
                                                      RollbackController rollbackController,
                                                      RolloutProperties properties) {
        TrafficSwitcher trafficSwitcher = trafficSwitcherProvider.getIfAvailable();
        if (trafficSwitcher == null) {
            logger.info("[AutoConfig] 未配置 TrafficSwitcher，蓝绿发布不可用");
        }
        return new ExecutionServices(deployer, healthEvaluator, trafficSwitcher, rolloutRepository,
                rolloutDomainEventPublisher, rolloutMetricsRegistry, rolloutTimer, externalCallExecutor,
                targetDispatcher, rollbackController, properties.getDeployRetryAttempts(),
                properties.getDeployTimeout(), properties.getHealthEvaluationTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public DefaultRolloutCoordinator rolloutCoordinator(StagePlanner stagePlanner,
                                                        SubjectLockManager subjectLockManager,
                                                        ExecutionServices rolloutExecutionServices,
                                                        RolloutProperties properties) {
        String instanceId = properties.getInstanceId();
        if (instanceId == null || instanceId.isBlank()) {
            instanceId = LeaseOwner.randomInstanceId();
        }
        logger.info("[AutoConfig] 装配 DefaultRolloutCoordinator, instanceId={}, lockTtl={}", instanceId,
                properties.getLockTtl());
        return new DefaultRolloutCoordinator(stagePlanner, subjectLockManager, rolloutExecutionServices,
                properties.getLockTtl(), instanceId);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnMissingBean
    public LeaseRenewalService leaseRenewalService(DefaultRolloutCoordinator rolloutCoordinator,
                                                   @Qualifier("rolloutScheduler") ScheduledExecutorService rolloutScheduler,
                                                   RolloutProperties properties) {
        return new LeaseRenewalService(rolloutCoordinator, rolloutScheduler, properties.getLockTtl());
    }

    @Bean(destroyMethod = "stop")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "rollout.recovery", name = "enabled", havingValue = "true", matchIfMissing = true)
    public RolloutRecoveryService rolloutRecoveryService(RolloutRepository rolloutRepository,
                                                         DefaultRolloutCoordinator rolloutCoordinator,
                                                         @Qualifier("rolloutScheduler") ScheduledExecutorService rolloutScheduler,
                                                         RolloutProperties properties) {
        logger.info("[AutoConfig] 启用重启恢复, scanInterval={}", properties.getRecovery().getScanInterval());
        return new RolloutRecoveryService(rolloutRepository, rolloutCoordinator, rolloutScheduler,
                properties.getRecovery().getScanInterval());
    }

    // ========== Facade ==========

    @Bean
    @ConditionalOnMissingBean
    public RolloutFacade rolloutFacade(DefaultRolloutCoordinator rolloutCoordinator,
                                       FlagExposureResolver flagExposureResolver,
                                       ObjectProvider<Validator> validatorProvider) {
        Validator validator = validatorProvider.getIfAvailable(
                () -> Validation.buildDefaultValidatorFactory().getValidator());
        return new RolloutFacade(rolloutCoordinator, flagExposureResolver, validator);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        return new ThreadFactory() {
            private final AtomicLong idx = new AtomicLong();

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + idx.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        };
    }
}
