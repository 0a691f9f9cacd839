package com.shipyard.orchestrator.config;

import com.shipyard.orchestrator.recovery.BackoffCalculator;
import com.shipyard.orchestrator.recovery.RecoveryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Thread pools, clock and recovery policy wiring.
 *
 * Fixed-size pools cap how many status polls and recovery actions run at
 * once.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties({RecoveryProperties.class, DetectorProperties.class, PipelineProperties.class})
public class OrchestratorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BackoffCalculator backoffCalculator(RecoveryProperties properties) {
        return new BackoffCalculator(properties);
    }

    @Bean
    public RecoveryPolicy recoveryPolicy(RecoveryProperties properties, BackoffCalculator backoff) {
        return new RecoveryPolicy(properties, backoff);
    }

    /** Runs recovery actions; one episode's work is serialized on top of it by the engine. */
    @Bean
    public ThreadPoolTaskExecutor recoveryExecutor(RecoveryProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkerThreads());
        executor.setMaxPoolSize(properties.getWorkerThreads());
        executor.setThreadNamePrefix("recovery-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    /** Runs status polls so a slow runtime call never delays the detector tick. */
    @Bean
    public ThreadPoolTaskExecutor detectorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setThreadNamePrefix("detector-");
        executor.initialize();
        return executor;
    }

    /** Drives the detector tick and delayed retries. */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("shipyard-sched-");
        scheduler.initialize();
        return scheduler;
    }
}
