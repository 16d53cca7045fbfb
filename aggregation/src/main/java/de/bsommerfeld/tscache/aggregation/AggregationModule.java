package de.bsommerfeld.tscache.aggregation;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.tscache.aggregation.definition.DefinitionHistory;
import de.bsommerfeld.tscache.aggregation.definition.JsonDefinitionHistory;
import de.bsommerfeld.tscache.core.config.ConfigLoader;
import de.bsommerfeld.tscache.core.config.GlobalConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Binds the definition history to the JSON directory named by
 * {@code aggregation.definitions-dir}.
 */
public class AggregationModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationModule.class);

    @Provides
    @Singleton
    DefinitionHistory definitionHistory(GlobalConfig config) {
        Path dir = ConfigLoader.resolveDefinitionsDir(config);
        LOG.info("Reading context definitions from {}", dir.toAbsolutePath());
        return new JsonDefinitionHistory(dir);
    }
}
