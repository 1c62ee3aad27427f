package com.acme.correlation.core;

import com.acme.correlation.config.CorrelationConfig;
import com.acme.correlation.config.CorrelationSchedulerFactory;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Holds one {@link CorrelationTable} per {@link Namespace}. Created once and shared by
 * the listener and every waiter.
 */
@Singleton
public class CorrelationContext {
    private final Map<Namespace, CorrelationTable> tables = new EnumMap<>(Namespace.class);
    private final ScheduledExecutorService scheduler;

    @Inject
    public CorrelationContext(CorrelationConfig config,
                              @Named(CorrelationSchedulerFactory.NAME) ScheduledExecutorService scheduler) {
        this(config.getRetention(), scheduler);
    }

    public CorrelationContext(Duration retention, ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
        for (Namespace ns : Namespace.values()) {
            tables.put(ns, new CorrelationTable(ns, scheduler, retention));
        }
    }

    public CorrelationTable table(Namespace namespace) {
        return tables.get(namespace);
    }

    public ScheduledExecutorService scheduler() {
        return scheduler;
    }

    public void clear() {
        tables.values().forEach(CorrelationTable::clear);
    }
}
