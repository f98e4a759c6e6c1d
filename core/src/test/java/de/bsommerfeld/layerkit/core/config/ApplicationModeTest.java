package de.bsommerfeld.layerkit.core.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationModeTest {

    private String original;

    @BeforeEach
    void rememberProperty() {
        original = System.getProperty(ApplicationMode.PROPERTY);
    }

    @AfterEach
    void restoreProperty() {
        if (original != null)
            System.setProperty(ApplicationMode.PROPERTY, original);
        else
            System.clearProperty(ApplicationMode.PROPERTY);
    }

    @Test
    void get_shouldNeverReturnNull() {
        System.clearProperty(ApplicationMode.PROPERTY);
        // Without the property the env var decides, PROD if unset
        assertNotNull(ApplicationMode.get());
    }

    @Test
    void get_shouldResolveFromSystemProperty() {
        System.setProperty(ApplicationMode.PROPERTY, "TEST");
        assertEquals(ApplicationMode.TEST, ApplicationMode.get());
    }

    @Test
    void get_shouldBeCaseInsensitive() {
        System.setProperty(ApplicationMode.PROPERTY, " test ");
        assertEquals(ApplicationMode.TEST, ApplicationMode.get());
    }

    @Test
    void get_shouldDefaultToProdForInvalidValue() {
        System.setProperty(ApplicationMode.PROPERTY, "STAGING");
        assertEquals(ApplicationMode.PROD, ApplicationMode.get());
    }

    @Test
    void isTest_shouldOnlyHoldForTestMode() {
        assertTrue(ApplicationMode.TEST.isTest());
        assertFalse(ApplicationMode.PROD.isTest());
    }
}
