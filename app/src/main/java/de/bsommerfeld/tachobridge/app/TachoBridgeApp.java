package de.bsommerfeld.tachobridge.app;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.name.Names;
import de.bsommerfeld.tachobridge.connection.ConnectionController;
import de.bsommerfeld.tachobridge.connection.ConnectionEvents.CardsSynchronized;
import de.bsommerfeld.tachobridge.connection.ConnectionEvents.ConnectionStatusChanged;
import de.bsommerfeld.tachobridge.connection.ConnectionStatus;
import de.bsommerfeld.tachobridge.core.event.ApplicationEventBus;
import de.bsommerfeld.tachobridge.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Headless entry point. Restores the connection and connects when no
 * credentials exist; the process then keeps the bridge registration and the
 * card registry current until it is stopped.
 */
public final class TachoBridgeApp {

    static {
        // Logback resolves LOG_DIR when the first logger is created
        Path logDir = StorageUtils.getLogsDir();
        try {
            Files.createDirectories(logDir);
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (Exception e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(TachoBridgeApp.class);

    private TachoBridgeApp() {
    }

    public static void main(String[] args) throws InterruptedException {
        LOG.info("Initializing...");
        Injector injector = Guice.createInjector(new AppModule());

        ApplicationEventBus eventBus = injector.getInstance(ApplicationEventBus.class);
        eventBus.register(new StatusLogger());

        ConnectionController controller = injector.getInstance(ConnectionController.class);
        ScheduledExecutorService executor = injector.getInstance(
                Key.get(ScheduledExecutorService.class, Names.named("connection")));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down...");
            controller.pausePolling();
            executor.shutdown();
        }, "shutdown"));

        controller.initialize().thenCompose(ignored -> {
            if (controller.status() == ConnectionStatus.NEEDS_LOGIN && !controller.isOutdated()) {
                return controller.connect();
            }
            return CompletableFuture.<Void>completedFuture(null);
        }).join();

        while (!executor.awaitTermination(1, TimeUnit.HOURS)) {
            LOG.debug("Bridge running, status {}", controller.status());
        }
    }

    /** Mirrors user-facing status texts into the log. */
    static final class StatusLogger {

        @Subscribe
        public void onStatus(ConnectionStatusChanged event) {
            LOG.info("[{}] {}", event.status(), event.message());
        }

        @Subscribe
        public void onCards(CardsSynchronized event) {
            LOG.info("Card registry synchronized ({} changes)", event.plan().size());
        }
    }
}
