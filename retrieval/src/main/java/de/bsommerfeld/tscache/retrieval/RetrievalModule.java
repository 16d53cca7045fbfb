package de.bsommerfeld.tscache.retrieval;

import com.google.inject.AbstractModule;

/**
 * Binds the default write path. The host application binds
 * {@link de.bsommerfeld.tscache.retrieval.provider.ProviderClient}.
 */
public class RetrievalModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(SliceExecutor.class).to(FetchAndStoreExecutor.class);
        bind(Cooldown.class).to(SleepingCooldown.class);
    }
}
