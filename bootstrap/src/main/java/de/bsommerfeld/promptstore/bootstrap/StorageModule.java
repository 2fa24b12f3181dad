package de.bsommerfeld.promptstore.bootstrap;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.promptstore.core.config.StorageOptions;
import de.bsommerfeld.promptstore.core.host.HostEnvironment;
import de.bsommerfeld.promptstore.core.host.SystemHostEnvironment;
import de.bsommerfeld.promptstore.core.settings.LegacyDatabaseHandler;
import de.bsommerfeld.promptstore.db.legacy.LegacyFileImporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice wiring for the storage components.
 */
public class StorageModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(StorageModule.class);

    private final StorageOptions options;
    private final HostEnvironment environment;

    /**
     * Options from system properties, environment from the running JVM.
     */
    public StorageModule() {
        this(null, new SystemHostEnvironment());
    }

    public StorageModule(StorageOptions options, HostEnvironment environment) {
        this.options = options;
        this.environment = environment;
    }

    @Override
    protected void configure() {
        bind(HostEnvironment.class).toInstance(environment);
        bind(LegacyDatabaseHandler.class).to(LegacyFileImporter.class);
    }

    @Provides
    @Singleton
    StorageOptions storageOptions() {
        try {
            StorageOptions resolved = options != null ? options : StorageOptions.fromSystem();
            LOG.info("Storage options: extension '{}', database '{}'",
                    resolved.extensionName(), resolved.databaseFileName());
            return resolved;
        } catch (IllegalArgumentException e) {
            throw new RuntimeException("Failed to load storage configuration", e);
        }
    }
}
