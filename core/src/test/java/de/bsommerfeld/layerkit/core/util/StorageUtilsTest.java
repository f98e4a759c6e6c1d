package de.bsommerfeld.layerkit.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @Test
    void getAppDataDir_shouldBeAbsoluteAndNamedAfterApp() {
        Path dir = StorageUtils.getAppDataDir("test-app");

        assertTrue(dir.isAbsolute());
        assertEquals("test-app", dir.getFileName().toString());
    }

    @Test
    void getAppDataDir_shouldProducePlatformSpecificPath() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        String os = System.getProperty("os.name", "").toLowerCase();

        if (os.contains("mac") || os.contains("darwin")) {
            assertTrue(dir.toString().contains("Library/Application Support"));
        } else if (os.contains("win")) {
            assertTrue(dir.toString().contains("AppData") || dir.toString().contains("Roaming"));
        } else {
            String xdg = System.getenv("XDG_DATA_HOME");
            assertTrue(dir.toString().contains(xdg != null && !xdg.isEmpty() ? xdg : ".local/share"));
        }
    }

    @Test
    void getLogsDir_shouldBeSubdirOfAppDataDir() {
        assertEquals(StorageUtils.getAppDataDir("test-app").resolve("logs"),
                StorageUtils.getLogsDir("test-app"));
    }

    @Test
    void getConfigFile_shouldPointToTomlInAppDataDir() {
        Path file = StorageUtils.getConfigFile("test-app");

        assertEquals(StorageUtils.getAppDataDir("test-app"), file.getParent());
        assertEquals("config.toml", file.getFileName().toString());
    }

    @Test
    void getSessionFile_shouldPointToJsonInAppDataDir() {
        Path file = StorageUtils.getSessionFile("test-app");

        assertEquals(StorageUtils.getAppDataDir("test-app"), file.getParent());
        assertEquals("session.json", file.getFileName().toString());
    }
}
