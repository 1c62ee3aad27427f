package com.acme.correlation.core;

import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;

@Singleton
@Requires(property = "correlation.listener.auto-start", notEquals = "false")
public class CallbackListenerStarter implements ApplicationEventListener<StartupEvent> {
    private final CallbackListener listener;

    public CallbackListenerStarter(CallbackListener listener) {
        this.listener = listener;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        listener.start();
    }
}
