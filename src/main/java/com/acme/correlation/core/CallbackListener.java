package com.acme.correlation.core;

import com.acme.correlation.spi.CallbackDetails;
import com.acme.correlation.spi.CallbackSource;
import com.acme.correlation.spi.Subscription;
import jakarta.inject.Singleton;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single process-wide subscriber to the engine callbacks. Routes terminal notifications
 * into the correlation table of every namespace whose id field they carry.
 */
@Singleton
public class CallbackListener {
    private static final Logger LOG = LoggerFactory.getLogger(CallbackListener.class);

    private final CallbackSource source;
    private final CorrelationContext context;
    private final AtomicBoolean started = new AtomicBoolean();
    private volatile Subscription subscription;

    public CallbackListener(CallbackSource source, CorrelationContext context) {
        this.source = source;
        this.context = context;
    }

    /**
     * Subscribes to the callback source. Only the first call has an effect.
     *
     * @return true if this call performed the subscription
     */
    public boolean start() {
        if (!started.compareAndSet(false, true)) {
            return false;
        }
        try {
            subscription = source.subscribe(this::onCallback);
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }
        LOG.info("Callback correlation listener subscribed");
        return true;
    }

    public boolean isStarted() {
        return subscription != null;
    }

    void onCallback(String message, CallbackDetails details) {
        // must not throw: the source would drop or break the only subscription
        try {
            if (message == null || details == null) {
                return;
            }
            for (Namespace ns : Namespace.values()) {
                var id = ns.idOf(details);
                if (id.isEmpty()) {
                    continue;
                }
                var outcome = ns.outcomeOf(message);
                if (outcome.isEmpty()) {
                    LOG.trace("Ignoring non-terminal callback {} for {} {}", message, ns.idField(), id.get());
                    continue;
                }
                context.table(ns).record(id.get(), outcome.get());
                LOG.debug("Recorded {} for {} {}", outcome.get(), ns.idField(), id.get());
            }
        } catch (RuntimeException e) {
            LOG.error("Failed to correlate callback {}: {}", message, e.getMessage(), e);
        }
    }
}
