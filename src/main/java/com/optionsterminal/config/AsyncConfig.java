package com.optionsterminal.config;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools: one executor for multi-leg order fan-out, one scheduler shared by all
 * relay loops. Broker REST calls never run here; they run on the session's pacing lane.
 */
@Configuration
public class AsyncConfig {

    private final GatewayProperties gatewayProperties;

    public AsyncConfig(GatewayProperties gatewayProperties) {
        this.gatewayProperties = gatewayProperties;
    }

    @Bean("legExecutor")
    public ThreadPoolTaskExecutor legExecutor() {
        int poolSize = gatewayProperties.getOrders().getLegPoolSize();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("order-leg-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean("relayScheduler")
    public ThreadPoolTaskScheduler relayScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(gatewayProperties.getRelay().getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("tick-relay-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
