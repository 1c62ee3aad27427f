package com.acme.correlation.core;

import com.acme.correlation.spi.CallbackDetails;
import java.util.Optional;
import java.util.function.Function;

/**
 * Categories of correlated requests. Each owns one table, one id field of the callback
 * details and a pair of terminal message kinds.
 */
public enum Namespace {
    CONTROLLER("Controller.Action", "ctrl_id", CallbackDetails::ctrl),
    RESOURCE("Resource.Loading", "res_id", CallbackDetails::res),
    TASKER("Tasker.Task", "task_id", CallbackDetails::task);

    private final String prefix;
    private final String idField;
    private final String succeededMessage;
    private final String failedMessage;
    private final Function<CallbackDetails, Optional<Long>> idExtractor;

    Namespace(String prefix, String idField, Function<CallbackDetails, Optional<Long>> idExtractor) {
        this.prefix = prefix;
        this.idField = idField;
        this.succeededMessage = prefix + ".Succeeded";
        this.failedMessage = prefix + ".Failed";
        this.idExtractor = idExtractor;
    }

    public String prefix() {
        return prefix;
    }

    public String idField() {
        return idField;
    }

    public Optional<Long> idOf(CallbackDetails details) {
        return idExtractor.apply(details);
    }

    /**
     * Maps a message kind to an outcome. Empty for anything but this namespace's
     * terminal kinds, e.g. {@code Controller.Action.Starting}.
     */
    public Optional<CallbackOutcome> outcomeOf(String message) {
        if (succeededMessage.equals(message)) {
            return Optional.of(CallbackOutcome.SUCCEEDED);
        }
        if (failedMessage.equals(message)) {
            return Optional.of(CallbackOutcome.FAILED);
        }
        return Optional.empty();
    }
}
