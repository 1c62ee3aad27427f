package com.acme.correlation.core;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outcomes of one namespace keyed by correlation id. The listener writes, a waiter
 * consumes, and anything left behind expires after the retention window.
 */
public class CorrelationTable {
    private static final Logger LOG = LoggerFactory.getLogger(CorrelationTable.class);

    private final Namespace namespace;
    private final Map<Long, Entry> entries = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private final long retentionMillis;

    public CorrelationTable(Namespace namespace, ScheduledExecutorService scheduler, Duration retention) {
        this.namespace = namespace;
        this.scheduler = scheduler;
        this.retentionMillis = retention.toMillis();
    }

    public Namespace namespace() {
        return namespace;
    }

    /**
     * Stores the outcome for {@code id}, replacing any unconsumed one, and schedules
     * removal of this exact entry once the retention window elapses.
     */
    public void record(long id, CallbackOutcome outcome) {
        var entry = new Entry(outcome);
        var previous = entries.put(id, entry);
        if (previous != null) {
            LOG.debug("{} id {} overwritten: {} -> {}", namespace, id, previous.outcome, outcome);
        }
        try {
            scheduler.schedule(() -> expire(id, entry), retentionMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // an entry without an expiry timer would never leave the table
            entries.remove(id, entry);
            throw e;
        }
    }

    public Optional<CallbackOutcome> take(long id) {
        var entry = entries.remove(id);
        return entry == null ? Optional.empty() : Optional.of(entry.outcome);
    }

    public Optional<CallbackOutcome> peek(long id) {
        var entry = entries.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.outcome);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    private void expire(long id, Entry entry) {
        // a consumed or replaced entry is left alone
        if (entries.remove(id, entry)) {
            LOG.debug("{} id {} expired unclaimed after {} ms", namespace, id, retentionMillis);
        }
    }

    // identity equality so expiry only ever removes the entry it was scheduled for
    private static final class Entry {
        private final CallbackOutcome outcome;

        private Entry(CallbackOutcome outcome) {
            this.outcome = outcome;
        }
    }
}
