package de.bsommerfeld.tscache.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Each field is one TOML table; unknown keys are
 * ignored so older files keep loading after a section is removed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalConfig {

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("retrieval")
    private RetrievalConfig retrieval = new RetrievalConfig();

    @JsonProperty("signature")
    private SignatureConfig signature = new SignatureConfig();

    @JsonProperty("aggregation")
    private AggregationConfig aggregation = new AggregationConfig();

    @JsonProperty("migration")
    private MigrationConfig migration = new MigrationConfig();

    public DatabaseConfig getDatabase() {
        return database;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public SignatureConfig getSignature() {
        return signature;
    }

    public AggregationConfig getAggregation() {
        return aggregation;
    }

    public MigrationConfig getMigration() {
        return migration;
    }
}
