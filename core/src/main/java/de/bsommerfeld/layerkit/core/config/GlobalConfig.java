package de.bsommerfeld.layerkit.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Unknown keys are ignored so older binaries can
 * read newer files.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("api")
    private ApiConfig api = new ApiConfig();

    @JsonProperty("network")
    private NetworkConfig network = new NetworkConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    public ApiConfig getApi() {
        return api;
    }

    public NetworkConfig getNetwork() {
        return network;
    }
}
