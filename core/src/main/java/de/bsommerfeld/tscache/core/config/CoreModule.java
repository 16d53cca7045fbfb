package de.bsommerfeld.tscache.core.config;

import com.google.inject.AbstractModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Binds the loaded configuration, its sections and the wall clock. Every
 * other module expects this one to be installed.
 */
public class CoreModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(CoreModule.class);

    private final GlobalConfig config;
    private final Clock clock;

    /** Loads {@code config.toml} from the application data directory. */
    public CoreModule() {
        this(ConfigLoader.loadDefault(), Clock.systemUTC());
    }

    public CoreModule(GlobalConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    @Override
    protected void configure() {
        LOG.debug("Binding configuration and clock ({})", clock);
        bind(GlobalConfig.class).toInstance(config);
        bind(DatabaseConfig.class).toInstance(config.getDatabase());
        bind(RetrievalConfig.class).toInstance(config.getRetrieval());
        bind(SignatureConfig.class).toInstance(config.getSignature());
        bind(AggregationConfig.class).toInstance(config.getAggregation());
        bind(MigrationConfig.class).toInstance(config.getMigration());
        bind(Clock.class).toInstance(clock);
    }
}
