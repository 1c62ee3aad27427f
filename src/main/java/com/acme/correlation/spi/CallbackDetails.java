package com.acme.correlation.spi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Optional;

/**
 * Correlation fields carried by a callback. Every field is optional; the engine sends
 * whichever ids apply to the message kind.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CallbackDetails(
    @JsonProperty("ctrl_id") Long ctrlId,
    @JsonProperty("res_id") Long resId,
    @JsonProperty("task_id") Long taskId
) {
    private static final CallbackDetails EMPTY = new CallbackDetails(null, null, null);

    public static CallbackDetails empty() {
        return EMPTY;
    }

    public static CallbackDetails controller(long ctrlId) {
        return new CallbackDetails(ctrlId, null, null);
    }

    public static CallbackDetails resource(long resId) {
        return new CallbackDetails(null, resId, null);
    }

    public static CallbackDetails tasker(long taskId) {
        return new CallbackDetails(null, null, taskId);
    }

    public Optional<Long> ctrl() {
        return Optional.ofNullable(ctrlId);
    }

    public Optional<Long> res() {
        return Optional.ofNullable(resId);
    }

    public Optional<Long> task() {
        return Optional.ofNullable(taskId);
    }
}
