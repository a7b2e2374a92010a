package de.bsommerfeld.tachobridge.app;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.tachobridge.connection.BrowserLauncher;
import de.bsommerfeld.tachobridge.core.config.ApplicationMode;
import de.bsommerfeld.tachobridge.core.config.ConfigLoader;
import de.bsommerfeld.tachobridge.core.config.GlobalConfig;
import de.bsommerfeld.tachobridge.core.util.StorageUtils;
import de.bsommerfeld.tachobridge.store.CardRegistry;
import de.bsommerfeld.tachobridge.store.CredentialStore;
import de.bsommerfeld.tachobridge.store.FileCardRegistry;
import de.bsommerfeld.tachobridge.store.FileCredentialStore;
import de.bsommerfeld.tachobridge.store.InMemoryCardRegistry;
import de.bsommerfeld.tachobridge.store.InMemoryCredentialStore;
import jakarta.inject.Named;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Guice module wiring the bridge.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final GlobalConfig config;
    private final ApplicationMode mode;

    /** Loads {@code config.toml} from the application data directory. */
    public AppModule() {
        this(loadConfig(StorageUtils.getConfigFile()), ApplicationMode.get());
    }

    public AppModule(GlobalConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        bind(GlobalConfig.class).toInstance(config);

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application Mode initialized: {}", mode);
        if (mode.isTest()) {
            // TEST MODE: nothing touches the disk
            bind(CredentialStore.class).to(InMemoryCredentialStore.class);
            bind(CardRegistry.class).to(InMemoryCardRegistry.class);
        } else {
            bind(CredentialStore.class).to(FileCredentialStore.class);
            bind(CardRegistry.class).to(FileCardRegistry.class);
        }

        bind(BrowserLauncher.class).to(DesktopBrowserLauncher.class);
        bind(Clock.class).toInstance(Clock.systemUTC());
    }

    /** The single thread every connection command, poll tick and sync pass runs on. */
    @Provides
    @Singleton
    @Named("connection")
    ScheduledExecutorService connectionExecutor() {
        return Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("connection-%d")
                .setDaemon(true)
                .build());
    }

    @Provides
    @Named("connection")
    Executor connectionExecutorView(@Named("connection") ScheduledExecutorService executor) {
        return executor;
    }

    private static GlobalConfig loadConfig(Path configFile) {
        LOG.info("Loading Configuration from: {}", configFile.toAbsolutePath());
        try {
            return ConfigLoader.load(configFile);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load Application Configuration", e);
        }
    }
}
