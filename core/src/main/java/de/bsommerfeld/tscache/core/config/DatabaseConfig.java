package de.bsommerfeld.tscache.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot database location. An empty path means
 * {@code <appData>/tscache.db}.
 */
public class DatabaseConfig {

    @JsonProperty("path")
    private String path = "";

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }
}
