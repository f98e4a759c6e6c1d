package de.bsommerfeld.layerkit.app;

import de.bsommerfeld.layerkit.app.config.AppModule;
import de.bsommerfeld.layerkit.core.di.ServiceContainer;
import de.bsommerfeld.layerkit.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Process entry point. Prepares the log directory before the first logger
 * is created, builds the container and hands over to {@link LayerkitApp}.
 */
public final class AppMain {

    static {
        // LOG_DIR must be set before logback initializes
        Path logDir = StorageUtils.getLogsDir(StorageUtils.APP_NAME);
        try {
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (Exception e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(AppMain.class);

    private AppMain() {
    }

    public static void main(String[] args) {
        int exitCode;
        try (ServiceContainer container = LayerkitApp.createContainer(new AppModule())) {
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            exitCode = new LayerkitApp(container, in, System.out).run(args);
        } catch (Exception e) {
            LOG.error("Startup failed", e);
            System.err.println("Startup failed: " + e.getMessage());
            exitCode = LayerkitApp.EXIT_FAILED;
        }
        System.exit(exitCode);
    }
}
