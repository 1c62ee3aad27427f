package com.acme.correlation.core;

import jakarta.inject.Singleton;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Instances that already had their one automatic reconnect attempt.
 */
@Singleton
public class ReconnectAttempts {
    private final Set<String> attempted = ConcurrentHashMap.newKeySet();

    /**
     * @return true if this call recorded the attempt, false if one was already recorded
     */
    public boolean markAttempted(String instanceId) {
        return attempted.add(instanceId);
    }

    public boolean hasAttempted(String instanceId) {
        return attempted.contains(instanceId);
    }

    /** Forget the instance, typically once it is destroyed. */
    public void clear(String instanceId) {
        attempted.remove(instanceId);
    }

    public void clearAll() {
        attempted.clear();
    }
}
