package com.acme.correlation.core;

import com.acme.correlation.config.CorrelationConfig;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Waits for the outcome of a request by its correlation id. Returned futures never
 * complete exceptionally; a timeout resolves to {@link CallbackOutcome#FAILED}.
 *
 * <p>Ids are unique per request. Two waiters on the same id are not prevented: only one
 * of them sees the entry and the other times out.
 */
@Singleton
public class CorrelationService {
    private static final Logger LOG = LoggerFactory.getLogger(CorrelationService.class);

    private final CorrelationContext context;
    private final CorrelationConfig config;
    private final long pollIntervalMillis;

    public CorrelationService(CorrelationContext context, CorrelationConfig config) {
        this.context = context;
        this.config = config;
        this.pollIntervalMillis = Math.max(1, config.getPollIntervalMillis());
    }

    public CompletableFuture<CallbackOutcome> waitForController(long ctrlId) {
        return waitForOutcome(Namespace.CONTROLLER, ctrlId);
    }

    /**
     * Screencap requests are controller actions with a shorter default wait.
     */
    public CompletableFuture<CallbackOutcome> waitForScreencap(long ctrlId) {
        return waitForOutcome(Namespace.CONTROLLER, ctrlId, config.getScreencapWait());
    }

    public CompletableFuture<CallbackOutcome> waitForResource(long resId) {
        return waitForOutcome(Namespace.RESOURCE, resId);
    }

    public CompletableFuture<CallbackOutcome> waitForOutcome(Namespace namespace, long id) {
        Objects.requireNonNull(namespace, "namespace");
        return waitForOutcome(namespace, id, config.defaultWait(namespace));
    }

    public CompletableFuture<CallbackOutcome> waitForOutcome(Namespace namespace, long id, Duration timeout) {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must not be negative: " + timeout);
        }

        var table = context.table(namespace);

        // The callback may already have arrived
        var cached = table.take(id);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get());
        }

        var result = new CompletableFuture<CallbackOutcome>();
        long started = System.nanoTime();
        long timeoutNanos = timeout.toNanos();

        var poll = context.scheduler().scheduleAtFixedRate(() -> {
            if (result.isDone()) {
                return;
            }
            try {
                var hit = table.take(id);
                if (hit.isPresent()) {
                    result.complete(hit.get());
                } else if (System.nanoTime() - started > timeoutNanos) {
                    LOG.warn("Timed out after {} ms waiting for {} {}",
                        timeout.toMillis(), namespace.idField(), id);
                    result.complete(CallbackOutcome.FAILED);
                }
            } catch (RuntimeException e) {
                LOG.error("Polling for {} {} failed: {}", namespace.idField(), id, e.getMessage(), e);
                result.complete(CallbackOutcome.FAILED);
            }
        }, pollIntervalMillis, pollIntervalMillis, TimeUnit.MILLISECONDS);

        result.whenComplete((outcome, error) -> poll.cancel(false));
        return result;
    }
}
