package com.acme.correlation.bus;

import com.acme.correlation.core.Jsons;
import com.acme.correlation.spi.CallbackDetails;
import com.acme.correlation.spi.CallbackHandler;
import com.acme.correlation.spi.CallbackSource;
import com.acme.correlation.spi.Subscription;
import jakarta.inject.Singleton;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process push channel for engine callbacks. The engine bridge emits
 * {@code (message, detailsJson)} pairs; subscribers receive the parsed details.
 */
@Singleton
public class LocalCallbackBus implements CallbackSource {
    private static final Logger LOG = LoggerFactory.getLogger(LocalCallbackBus.class);

    private final List<CallbackHandler> handlers = new CopyOnWriteArrayList<>();

    @Override
    public Subscription subscribe(CallbackHandler handler) {
        Objects.requireNonNull(handler, "handler");
        handlers.add(handler);
        var closed = new AtomicBoolean();
        return () -> {
            if (closed.compareAndSet(false, true)) {
                handlers.remove(handler);
            }
        };
    }

    public void emit(String message, String detailsJson) {
        LOG.debug("Callback: {} {}", message, detailsJson);
        emit(message, parseDetails(detailsJson));
    }

    public void emit(String message, CallbackDetails details) {
        var effective = details == null ? CallbackDetails.empty() : details;
        for (CallbackHandler handler : handlers) {
            try {
                handler.onCallback(message, effective);
            } catch (RuntimeException e) {
                LOG.error("Callback handler failed for {}: {}", message, e.getMessage(), e);
            }
        }
    }

    public int subscriberCount() {
        return handlers.size();
    }

    private static CallbackDetails parseDetails(String detailsJson) {
        if (detailsJson == null || detailsJson.isBlank()) {
            return CallbackDetails.empty();
        }
        try {
            var parsed = Jsons.fromJson(detailsJson, CallbackDetails.class);
            return parsed == null ? CallbackDetails.empty() : parsed;
        } catch (RuntimeException e) {
            LOG.warn("Failed to parse callback details: {}", detailsJson);
            return CallbackDetails.empty();
        }
    }
}
