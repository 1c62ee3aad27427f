package com.acme.correlation.spi;

/**
 * Push channel of engine completion notifications, multiplexed for every in-flight request.
 */
public interface CallbackSource {
    Subscription subscribe(CallbackHandler handler);
}
