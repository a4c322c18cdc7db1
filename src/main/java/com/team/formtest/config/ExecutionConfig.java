package com.team.formtest.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Test run executor settings.
 */
@Configuration
@ConfigurationProperties(prefix = "form-test.execution")
@Getter
@Setter
public class ExecutionConfig {

    /** Maximum number of runs in RUNNING at the same time */
    private int maxConcurrentRuns = 2;

    /** Pending run queue bound, 0 means unbounded */
    private int queueCapacity = 0;

    /** Per-run timeout, measured from the moment a worker picks the run up */
    private int runTimeoutSeconds = 120;

    /** Extra time given to a timed-out run before it is force-terminated */
    private int hardTimeoutGraceSeconds = 15;

    @Bean(name = "formRunExecutor")
    public ThreadPoolTaskExecutor formRunExecutor() {
        return buildRunExecutor(maxConcurrentRuns, queueCapacity);
    }

    /**
     * Fixed-size pool with a FIFO queue: runs beyond the concurrency limit wait in
     * submission order. Spring initializes the bean; standalone callers must call
     * {@link ThreadPoolTaskExecutor#initialize()} themselves.
     */
    public static ThreadPoolTaskExecutor buildRunExecutor(int maxConcurrentRuns, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxConcurrentRuns);
        executor.setMaxPoolSize(maxConcurrentRuns);
        executor.setQueueCapacity(queueCapacity > 0 ? queueCapacity : Integer.MAX_VALUE);
        executor.setThreadNamePrefix("form-run-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean(name = "runWatchdogScheduler")
    public ThreadPoolTaskScheduler runWatchdogScheduler() {
        return buildWatchdogScheduler();
    }

    /**
     * Single thread for the per-run timeout timers. Cancelled timers leave the queue at once.
     */
    public static ThreadPoolTaskScheduler buildWatchdogScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("run-watchdog-");
        scheduler.setDaemon(true);
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
