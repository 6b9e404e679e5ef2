package com.forgemind.core.registry;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "forgemind.registry")
public class RegistryProperties {

    /** Minimum time in STAGING before promotion to ACTIVE. */
    private Duration minSoak = Duration.ofHours(24);

    /** Failed staging attempts that regress a behavior from TESTING to DRAFT. */
    private int maxTestFailures = 3;

    public Duration getMinSoak() {
        return minSoak;
    }

    public void setMinSoak(Duration minSoak) {
        this.minSoak = minSoak;
    }

    public int getMaxTestFailures() {
        return maxTestFailures;
    }

    public void setMaxTestFailures(int maxTestFailures) {
        this.maxTestFailures = maxTestFailures;
    }
}
