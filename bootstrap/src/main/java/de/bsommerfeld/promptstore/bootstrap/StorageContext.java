package de.bsommerfeld.promptstore.bootstrap;

import com.google.inject.Guice;
import de.bsommerfeld.promptstore.core.config.StorageOptions;
import de.bsommerfeld.promptstore.core.event.StorageEventBus;
import de.bsommerfeld.promptstore.core.host.HostEnvironment;
import de.bsommerfeld.promptstore.core.host.RootResolver;
import de.bsommerfeld.promptstore.core.relocate.AtomicRelocator;
import de.bsommerfeld.promptstore.core.settings.SettingsStore;
import de.bsommerfeld.promptstore.core.storage.DataDirectoryManager;
import de.bsommerfeld.promptstore.db.legacy.LegacyFileImporter;
import de.bsommerfeld.promptstore.db.legacy.LegacyFileInspector;
import de.bsommerfeld.promptstore.db.migration.SchemaMigrator;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * Every storage component for one host, created together. Hold on to one
 * instance per process; a second instance repeats root discovery.
 */
@Singleton
public class StorageContext {

    private final StorageOptions options;
    private final RootResolver rootResolver;
    private final DataDirectoryManager directories;
    private final SettingsStore settings;
    private final AtomicRelocator relocator;
    private final SchemaMigrator migrator;
    private final LegacyFileImporter importer;
    private final LegacyFileInspector inspector;
    private final StorageEventBus eventBus;

    @Inject
    public StorageContext(StorageOptions options, RootResolver rootResolver, DataDirectoryManager directories,
            SettingsStore settings, AtomicRelocator relocator, SchemaMigrator migrator,
            LegacyFileImporter importer, LegacyFileInspector inspector, StorageEventBus eventBus) {
        this.options = options;
        this.rootResolver = rootResolver;
        this.directories = directories;
        this.settings = settings;
        this.relocator = relocator;
        this.migrator = migrator;
        this.importer = importer;
        this.inspector = inspector;
        this.eventBus = eventBus;
    }

    public static StorageContext create() {
        return Guice.createInjector(new StorageModule()).getInstance(StorageContext.class);
    }

    public static StorageContext create(StorageOptions options, HostEnvironment environment) {
        return Guice.createInjector(new StorageModule(options, environment)).getInstance(StorageContext.class);
    }

    public StorageOptions options() {
        return options;
    }

    public RootResolver rootResolver() {
        return rootResolver;
    }

    public DataDirectoryManager directories() {
        return directories;
    }

    public SettingsStore settings() {
        return settings;
    }

    public AtomicRelocator relocator() {
        return relocator;
    }

    public SchemaMigrator migrator() {
        return migrator;
    }

    public LegacyFileImporter importer() {
        return importer;
    }

    public LegacyFileInspector inspector() {
        return inspector;
    }

    public StorageEventBus eventBus() {
        return eventBus;
    }
}
