package de.bsommerfeld.tscache.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * MECE aggregation settings. An empty definitions directory means
 * {@code <appData>/contexts}.
 */
public class AggregationConfig {

    @JsonProperty("multi-dimension-policy")
    private MultiDimensionPolicy multiDimensionPolicy = MultiDimensionPolicy.REFUSE;

    @JsonProperty("definitions-dir")
    private String definitionsDir = "";

    public MultiDimensionPolicy getMultiDimensionPolicy() {
        return multiDimensionPolicy;
    }

    public void setMultiDimensionPolicy(MultiDimensionPolicy multiDimensionPolicy) {
        this.multiDimensionPolicy = multiDimensionPolicy;
    }

    public String getDefinitionsDir() {
        return definitionsDir;
    }

    public void setDefinitionsDir(String definitionsDir) {
        this.definitionsDir = definitionsDir;
    }
}
