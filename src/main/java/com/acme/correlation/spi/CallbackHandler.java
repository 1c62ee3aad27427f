package com.acme.correlation.spi;

@FunctionalInterface
public interface CallbackHandler {
    void onCallback(String message, CallbackDetails details);
}
