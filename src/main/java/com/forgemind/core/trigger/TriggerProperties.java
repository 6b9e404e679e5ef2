package com.forgemind.core.trigger;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "forgemind.trigger")
public class TriggerProperties {

    private double successRateThreshold = 0.80;
    private Duration successWindow = Duration.ofDays(30);
    private int minExecutions = 50;
    /** Executions since the last evolution that trigger a run on their own. */
    private int executionVolume = 50;
    private Duration maxInterval = Duration.ofDays(30);
    private int negativeFeedbackThreshold = 3;
    private boolean sweepEnabled = false;
    private Duration sweepInterval = Duration.ofHours(1);

    public double getSuccessRateThreshold() {
        return successRateThreshold;
    }

    public void setSuccessRateThreshold(double successRateThreshold) {
        this.successRateThreshold = successRateThreshold;
    }

    public Duration getSuccessWindow() {
        return successWindow;
    }

    public void setSuccessWindow(Duration successWindow) {
        this.successWindow = successWindow;
    }

    public int getMinExecutions() {
        return minExecutions;
    }

    public void setMinExecutions(int minExecutions) {
        this.minExecutions = minExecutions;
    }

    public int getExecutionVolume() {
        return executionVolume;
    }

    public void setExecutionVolume(int executionVolume) {
        this.executionVolume = executionVolume;
    }

    public Duration getMaxInterval() {
        return maxInterval;
    }

    public void setMaxInterval(Duration maxInterval) {
        this.maxInterval = maxInterval;
    }

    public int getNegativeFeedbackThreshold() {
        return negativeFeedbackThreshold;
    }

    public void setNegativeFeedbackThreshold(int negativeFeedbackThreshold) {
        this.negativeFeedbackThreshold = negativeFeedbackThreshold;
    }

    public boolean isSweepEnabled() {
        return sweepEnabled;
    }

    public void setSweepEnabled(boolean sweepEnabled) {
        this.sweepEnabled = sweepEnabled;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }
}
