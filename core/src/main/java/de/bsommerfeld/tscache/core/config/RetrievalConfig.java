package de.bsommerfeld.tscache.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Orchestrator parameters. Values are persisted in config.toml and loaded at
 * startup.
 */
public class RetrievalConfig {

    /** Provider quotas reset hourly; one minute of slack on top. */
    @JsonProperty("cooldown-minutes")
    private long cooldownMinutes = 61;

    @JsonProperty("max-rate-limit-retries")
    private int maxRateLimitRetries = 1;

    @JsonProperty("automated")
    private boolean automated = true;

    public long getCooldownMinutes() {
        return cooldownMinutes;
    }

    public void setCooldownMinutes(long cooldownMinutes) {
        this.cooldownMinutes = cooldownMinutes;
    }

    public int getMaxRateLimitRetries() {
        return maxRateLimitRetries;
    }

    public void setMaxRateLimitRetries(int maxRateLimitRetries) {
        this.maxRateLimitRetries = maxRateLimitRetries;
    }

    public boolean isAutomated() {
        return automated;
    }

    public void setAutomated(boolean automated) {
        this.automated = automated;
    }
}
