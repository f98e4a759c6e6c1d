package de.bsommerfeld.layerkit.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running mode of the application. TEST swaps every I/O adapter (remote API,
 * session file, connectivity probe) for an in-process stand-in.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    static final String PROPERTY = "layerkit.mode";
    static final String ENV = "LAYERKIT_MODE";

    /**
     * Reads the mode from the {@code layerkit.mode} system property, then the
     * {@code LAYERKIT_MODE} environment variable. Missing or unknown values
     * resolve to PROD.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty(PROPERTY);
        if (mode == null || mode.isBlank()) {
            mode = System.getenv(ENV);
        }
        if (mode == null || mode.isBlank()) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}', falling back to PROD.", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
