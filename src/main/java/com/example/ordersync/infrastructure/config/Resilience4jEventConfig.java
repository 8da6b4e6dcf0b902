package com.example.ordersync.infrastructure.config;

import io.github.resilience4j.core.registry.EntryAddedEvent;
import io.github.resilience4j.core.registry.EntryRemovedEvent;
import io.github.resilience4j.core.registry.EntryReplacedEvent;
import io.github.resilience4j.core.registry.RegistryEventConsumer;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Attaches logging to every time limiter the registry creates.
 * The Resilience4j auto-configuration hands registry events to {@link RegistryEventConsumer} beans.
 */
@Configuration
public class Resilience4jEventConfig {

    private static final Logger log = LoggerFactory.getLogger(Resilience4jEventConfig.class);

    @Bean
    public RegistryEventConsumer<TimeLimiter> timeLimiterEventLogger() {
        return new RegistryEventConsumer<>() {
            @Override
            public void onEntryAddedEvent(EntryAddedEvent<TimeLimiter> entryAddedEvent) {
                attach(entryAddedEvent.getAddedEntry());
            }

            @Override
            public void onEntryRemovedEvent(EntryRemovedEvent<TimeLimiter> entryRemoveEvent) {
                log.info("[TL_REMOVED] name={}", entryRemoveEvent.getRemovedEntry().getName());
            }

            @Override
            public void onEntryReplacedEvent(EntryReplacedEvent<TimeLimiter> entryReplacedEvent) {
                attach(entryReplacedEvent.getNewEntry());
            }
        };
    }

    private static void attach(TimeLimiter timeLimiter) {
        String name = timeLimiter.getName();
        log.info("[TL_REGISTERED] name={}, timeout={}ms, cancelRunningFuture={}",
                name,
                timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis(),
                timeLimiter.getTimeLimiterConfig().shouldCancelRunningFuture());

        timeLimiter.getEventPublisher().onTimeout(event ->
                log.warn("[TIMEOUT] {} cut off a sync after {}ms", name,
                        timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis()));
        timeLimiter.getEventPublisher().onError(event ->
                log.debug("[TL_ERROR] {} sync failed: {}", name, event.getThrowable().toString()));
    }
}
