package de.bsommerfeld.layerkit.app.config;

import de.bsommerfeld.layerkit.app.LayerkitApp;
import de.bsommerfeld.layerkit.auth.data.AuthLocalDataSource;
import de.bsommerfeld.layerkit.auth.data.AuthRemoteDataSource;
import de.bsommerfeld.layerkit.auth.data.FileAuthLocalDataSource;
import de.bsommerfeld.layerkit.auth.data.HttpAuthRemoteDataSource;
import de.bsommerfeld.layerkit.auth.data.InMemoryAuthLocalDataSource;
import de.bsommerfeld.layerkit.auth.data.TestAuthRemoteDataSource;
import de.bsommerfeld.layerkit.core.config.ApplicationMode;
import de.bsommerfeld.layerkit.core.config.GlobalConfig;
import de.bsommerfeld.layerkit.core.di.ServiceContainer;
import de.bsommerfeld.layerkit.core.network.NetworkInfo;
import de.bsommerfeld.layerkit.core.network.SocketNetworkInfo;
import de.bsommerfeld.layerkit.core.network.StaticNetworkInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppModuleTest {

    @TempDir
    Path tempDir;

    @Test
    void testMode_shouldBindInProcessAdapters() {
        try (ServiceContainer container = container(ApplicationMode.TEST)) {
            assertInstanceOf(StaticNetworkInfo.class, container.resolve(NetworkInfo.class));
            assertInstanceOf(TestAuthRemoteDataSource.class, container.resolve(AuthRemoteDataSource.class));
            assertInstanceOf(InMemoryAuthLocalDataSource.class, container.resolve(AuthLocalDataSource.class));
            assertSame(container.resolve(AuthLocalDataSource.class), container.resolve(AuthLocalDataSource.class));
            assertEquals(ApplicationMode.TEST, container.resolve(ApplicationMode.class));
        }
    }

    @Test
    void prodMode_shouldBindNetworkAdapters() {
        try (ServiceContainer container = container(ApplicationMode.PROD)) {
            assertInstanceOf(SocketNetworkInfo.class, container.resolve(NetworkInfo.class));
            assertInstanceOf(HttpAuthRemoteDataSource.class, container.resolve(AuthRemoteDataSource.class));
            assertInstanceOf(FileAuthLocalDataSource.class, container.resolve(AuthLocalDataSource.class));
            assertSame(container.resolve(NetworkInfo.class), container.resolve(NetworkInfo.class));
        }
    }

    @Test
    void suppliedConfig_shouldBeBoundAsIs() {
        GlobalConfig config = new GlobalConfig();
        config.getApi().setBaseUrl("http://localhost:9000");

        try (ServiceContainer container = LayerkitApp.createContainer(
                new AppModule(config, ApplicationMode.TEST, tempDir.resolve("session.json")))) {
            assertSame(config, container.resolve(GlobalConfig.class));
        }
    }

    private ServiceContainer container(ApplicationMode mode) {
        return LayerkitApp.createContainer(new AppModule(new GlobalConfig(), mode, tempDir.resolve("session.json")));
    }
}
