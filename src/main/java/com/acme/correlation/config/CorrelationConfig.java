package com.acme.correlation.config;

import com.acme.correlation.core.Namespace;
import io.micronaut.context.annotation.ConfigurationProperties;
import java.time.Duration;

/**
 * Retention, polling and default wait settings for callback correlation.
 */
@ConfigurationProperties("correlation")
public class CorrelationConfig {

    private Duration retention = Duration.ofSeconds(30);
    private Duration pollInterval = Duration.ofMillis(50);
    private Duration controllerWait = Duration.ofSeconds(30);
    private Duration screencapWait = Duration.ofSeconds(10);
    private Duration resourceWait = Duration.ofSeconds(30);
    private Duration taskerWait = Duration.ofSeconds(30);

    public Duration getRetention() {
        return retention;
    }

    public void setRetention(Duration retention) {
        this.retention = retention;
    }

    public long getRetentionMillis() {
        return retention.toMillis();
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public long getPollIntervalMillis() {
        return pollInterval.toMillis();
    }

    public Duration getControllerWait() {
        return controllerWait;
    }

    public void setControllerWait(Duration controllerWait) {
        this.controllerWait = controllerWait;
    }

    public Duration getScreencapWait() {
        return screencapWait;
    }

    public void setScreencapWait(Duration screencapWait) {
        this.screencapWait = screencapWait;
    }

    public Duration getResourceWait() {
        return resourceWait;
    }

    public void setResourceWait(Duration resourceWait) {
        this.resourceWait = resourceWait;
    }

    public Duration getTaskerWait() {
        return taskerWait;
    }

    public void setTaskerWait(Duration taskerWait) {
        this.taskerWait = taskerWait;
    }

    public Duration defaultWait(Namespace namespace) {
        return switch (namespace) {
            case CONTROLLER -> controllerWait;
            case RESOURCE -> resourceWait;
            case TASKER -> taskerWait;
        };
    }
}
