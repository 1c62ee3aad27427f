package com.acme.correlation.config;

import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Single-threaded scheduler shared by entry expiry and wait polling, so both run
 * serialized the way an event loop would run them.
 */
@Factory
public class CorrelationSchedulerFactory {

    public static final String NAME = "correlation";

    @Singleton
    @Named(NAME)
    @Bean(preDestroy = "shutdown")
    public ScheduledExecutorService correlationScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "callback-correlation");
            t.setDaemon(true);
            return t;
        });
    }
}
