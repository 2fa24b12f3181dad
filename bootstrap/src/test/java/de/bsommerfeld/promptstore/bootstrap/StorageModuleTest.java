package de.bsommerfeld.promptstore.bootstrap;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.promptstore.core.config.StorageOptions;
import de.bsommerfeld.promptstore.core.event.StorageEventBus;
import de.bsommerfeld.promptstore.core.host.HostEnvironment;
import de.bsommerfeld.promptstore.core.settings.LegacyDatabaseHandler;
import de.bsommerfeld.promptstore.core.storage.DataDirectoryManager;
import de.bsommerfeld.promptstore.db.legacy.LegacyFileImporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StorageModuleTest {

    @TempDir
    Path tempDir;

    private HostEnvironment environment;

    @BeforeEach
    void setUp() {
        environment = mock(HostEnvironment.class);
        when(environment.getenv(StorageOptions.ROOT_OVERRIDE_VARIABLE)).thenReturn(Optional.of(tempDir.toString()));
    }

    @Test
    void injector_shouldShareSingletons() {
        Injector injector = Guice.createInjector(new StorageModule(StorageOptions.defaults(), environment));

        assertSame(injector.getInstance(DataDirectoryManager.class), injector.getInstance(DataDirectoryManager.class));
        assertSame(injector.getInstance(StorageEventBus.class), injector.getInstance(StorageEventBus.class));
        assertSame(injector.getInstance(StorageOptions.class), injector.getInstance(StorageOptions.class));
    }

    @Test
    void injector_shouldBindLegacyHandlerToImporter() {
        Injector injector = Guice.createInjector(new StorageModule(StorageOptions.defaults(), environment));

        assertSame(injector.getInstance(LegacyFileImporter.class), injector.getInstance(LegacyDatabaseHandler.class));
    }

    @Test
    void create_shouldWireContextAgainstGivenHost() throws Exception {
        StorageContext context = StorageContext.create(StorageOptions.defaults(), environment);

        assertEquals(tempDir, context.rootResolver().resolve().path());
        assertEquals(tempDir.resolve("user/default/PromptManager"), context.directories().getDataDir(false));
    }

    @Test
    void storageOptions_shouldFallBackToSystemOptions() {
        Injector injector = Guice.createInjector(new StorageModule(null, environment));

        assertEquals(StorageOptions.DEFAULT_DATABASE_FILE, injector.getInstance(StorageOptions.class).databaseFileName());
    }
}
