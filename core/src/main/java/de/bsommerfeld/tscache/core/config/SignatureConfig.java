package de.bsommerfeld.tscache.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public class SignatureConfig {

    @JsonProperty("include-volatile-params")
    private boolean includeVolatileParams = false;

    public boolean isIncludeVolatileParams() {
        return includeVolatileParams;
    }

    public void setIncludeVolatileParams(boolean includeVolatileParams) {
        this.includeVolatileParams = includeVolatileParams;
    }
}
