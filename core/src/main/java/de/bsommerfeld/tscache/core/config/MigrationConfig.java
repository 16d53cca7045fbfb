package de.bsommerfeld.tscache.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public class MigrationConfig {

    public static final int MIN_WINDOW_SECONDS = 1;
    public static final int MAX_WINDOW_SECONDS = 3600;

    @JsonProperty("window-seconds")
    private int windowSeconds = 120;

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }
}
