package com.acme.correlation.spi;

/**
 * Handle returned by {@link CallbackSource#subscribe}. Closing it more than once is a no-op.
 */
public interface Subscription extends AutoCloseable {
    @Override
    void close();
}
