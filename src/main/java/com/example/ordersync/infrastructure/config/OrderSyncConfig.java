package com.example.ordersync.infrastructure.config;

import com.example.ordersync.domain.policy.OrderStatusTransitionPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Beans for the synchronization engine and batch processing.
 */
@Configuration
public class OrderSyncConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OrderStatusTransitionPolicy orderStatusTransitionPolicy() {
        return new OrderStatusTransitionPolicy();
    }

    /**
     * Worker pool running one synchronization per message.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService orderSyncExecutor(@Value("${order-sync.batch.parallelism:8}") int parallelism) {
        return Executors.newFixedThreadPool(parallelism, namedThreads("order-sync-"));
    }

    /**
     * Timer thread used by the time limiter to cancel slow synchronizations.
     */
    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService orderSyncScheduler() {
        return Executors.newSingleThreadScheduledExecutor(namedThreads("order-sync-timer-"));
    }

    private static CustomizableThreadFactory namedThreads(String prefix) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(prefix);
        threadFactory.setDaemon(true);
        return threadFactory;
    }
}
