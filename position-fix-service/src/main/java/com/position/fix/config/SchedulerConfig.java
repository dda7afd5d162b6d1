// com/position/fix/config/SchedulerConfig.java
package com.position.fix.config;

import com.position.fix.metrics.SchedulerMetrics;
import com.position.fix.provider.ProviderErrorMapper;
import com.position.fix.provider.PushLocationProvider;
import com.position.fix.scheduler.OneShotRequestScheduler;
import com.position.fix.scheduler.deadline.DeadlineManager;
import com.position.fix.scheduler.deadline.ScheduledDeadlineManager;
import com.position.fix.tracking.LoggingPositionEventSink;
import com.position.fix.tracking.PositionEventSink;
import com.position.fix.tracking.TrackingDemandRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Wires the one-shot request scheduler and its collaborators.
 *
 * <p>Two thread pools are involved: a task scheduler that fires request deadlines and a bounded
 * executor that delivers results and sink notifications outside the scheduler's lock.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class SchedulerConfig {

    private final SchedulerProperties schedulerProperties;

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "positioningDeadlineScheduler")
    public ThreadPoolTaskScheduler positioningDeadlineScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(schedulerProperties.getDeadline().getPoolSize());
        scheduler.setThreadNamePrefix("positioning-deadline-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();

        log.info("Initialized deadline scheduler - poolSize: {}", schedulerProperties.getDeadline().getPoolSize());
        return scheduler;
    }

    /**
     * Bounded executor delivering fix results and event sink notifications.
     */
    @Bean(name = "positioningDispatchExecutor")
    public ThreadPoolTaskExecutor positioningDispatchExecutor() {
        SchedulerProperties.Dispatch dispatch = schedulerProperties.getDispatch();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(dispatch.getWorkers());
        executor.setMaxPoolSize(dispatch.getWorkers());
        executor.setQueueCapacity(dispatch.getQueueCapacity());
        executor.setThreadNamePrefix("positioning-dispatch-");
        executor.setKeepAliveSeconds(60);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setRejectedExecutionHandler(new DispatchRejectedExecutionHandler());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Initialized dispatch executor - workers: {}, queueCapacity: {}",
            dispatch.getWorkers(), dispatch.getQueueCapacity());
        return executor;
    }

    @Bean
    public DeadlineManager deadlineManager(
            @Qualifier("positioningDeadlineScheduler") ThreadPoolTaskScheduler positioningDeadlineScheduler,
            Clock clock) {
        return new ScheduledDeadlineManager(positioningDeadlineScheduler, clock);
    }

    @Bean
    public PushLocationProvider pushLocationProvider() {
        return new PushLocationProvider(schedulerProperties.getProvider().getInitialAuthorization());
    }

    @Bean
    public TrackingDemandRegistry trackingDemandRegistry() {
        return new TrackingDemandRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public PositionEventSink positionEventSink() {
        return new LoggingPositionEventSink();
    }

    @Bean
    public SchedulerMetrics schedulerMetrics(MeterRegistry meterRegistry) {
        return new SchedulerMetrics(meterRegistry);
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public OneShotRequestScheduler oneShotRequestScheduler(
            PushLocationProvider locationProvider,
            DeadlineManager deadlineManager,
            TrackingDemandRegistry trackingDemandRegistry,
            PositionEventSink positionEventSink,
            ProviderErrorMapper providerErrorMapper,
            SchedulerMetrics schedulerMetrics,
            @Qualifier("positioningDispatchExecutor") ThreadPoolTaskExecutor positioningDispatchExecutor,
            Clock clock) {
        return new OneShotRequestScheduler(locationProvider, deadlineManager, trackingDemandRegistry,
            positionEventSink, providerErrorMapper, schedulerMetrics, positioningDispatchExecutor, clock,
            schedulerProperties);
    }

    /**
     * Logs dispatch queue overflow and hands the rejection back to the scheduler, which then
     * delivers on the calling thread.
     */
    private static class DispatchRejectedExecutionHandler implements RejectedExecutionHandler {

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            log.warn("Positioning dispatch queue is full - rejecting task. " +
                    "Active threads: {}, Queue size: {}, Pool size: {}",
                executor.getActiveCount(), executor.getQueue().size(), executor.getPoolSize());

            throw new RejectedExecutionException("Positioning dispatch queue is full. " +
                "Active threads: " + executor.getActiveCount() +
                ", Queue size: " + executor.getQueue().size());
        }
    }
}
