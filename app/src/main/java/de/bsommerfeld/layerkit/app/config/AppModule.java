package de.bsommerfeld.layerkit.app.config;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import de.bsommerfeld.layerkit.auth.data.AuthLocalDataSource;
import de.bsommerfeld.layerkit.auth.data.AuthRemoteDataSource;
import de.bsommerfeld.layerkit.auth.data.FileAuthLocalDataSource;
import de.bsommerfeld.layerkit.auth.data.HttpAuthRemoteDataSource;
import de.bsommerfeld.layerkit.auth.data.InMemoryAuthLocalDataSource;
import de.bsommerfeld.layerkit.auth.data.TestAuthRemoteDataSource;
import de.bsommerfeld.layerkit.core.config.ApplicationMode;
import de.bsommerfeld.layerkit.core.config.ConfigLoader;
import de.bsommerfeld.layerkit.core.config.GlobalConfig;
import de.bsommerfeld.layerkit.core.event.ApplicationEventBus;
import de.bsommerfeld.layerkit.core.network.NetworkInfo;
import de.bsommerfeld.layerkit.core.network.SocketNetworkInfo;
import de.bsommerfeld.layerkit.core.network.StaticNetworkInfo;
import de.bsommerfeld.layerkit.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice module for configuration and I/O adapters. Everything that differs
 * between PROD and TEST mode is decided here; repositories and use cases are
 * registered on the container on top of it.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final GlobalConfig config;
    private final ApplicationMode mode;
    private final Path sessionFile;

    /** Loads {@code config.toml} from the app-data directory and reads the mode from the environment. */
    public AppModule() {
        this(null, ApplicationMode.get(), StorageUtils.getSessionFile(StorageUtils.APP_NAME));
    }

    public AppModule(GlobalConfig config, ApplicationMode mode, Path sessionFile) {
        this.config = config;
        this.mode = mode;
        this.sessionFile = sessionFile;
    }

    @Override
    protected void configure() {
        GlobalConfig resolved = config != null ? config : loadConfig();
        bind(GlobalConfig.class).toInstance(resolved);
        bind(ApplicationMode.class).toInstance(mode);
        bind(ApplicationEventBus.class);

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application Mode initialized: {}", mode);
        if (mode == ApplicationMode.TEST) {
            // Nothing leaves the process: fixed connectivity, stub API, session in memory
            bind(NetworkInfo.class).toInstance(StaticNetworkInfo.online());
            bind(AuthRemoteDataSource.class).to(TestAuthRemoteDataSource.class);
            bind(AuthLocalDataSource.class).to(InMemoryAuthLocalDataSource.class).in(Singleton.class);
        } else {
            bind(NetworkInfo.class).to(SocketNetworkInfo.class);
            bind(AuthRemoteDataSource.class).to(HttpAuthRemoteDataSource.class);
            bind(AuthLocalDataSource.class).toInstance(new FileAuthLocalDataSource(sessionFile));
        }
    }

    private static GlobalConfig loadConfig() {
        try {
            Path configPath = StorageUtils.getConfigFile(StorageUtils.APP_NAME);
            return ConfigLoader.load(configPath);
        } catch (Exception e) {
            // Config is vital, fail fast
            throw new RuntimeException("Failed to load Application Configuration", e);
        }
    }
}
