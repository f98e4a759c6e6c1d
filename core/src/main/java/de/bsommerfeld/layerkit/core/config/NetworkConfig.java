package de.bsommerfeld.layerkit.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code [network]} section: target of the connectivity probe. An empty host
 * and a port of 0 mean "derive from {@code api.base-url}".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NetworkConfig {

    @JsonProperty("probe-host")
    private String probeHost = "";

    @JsonProperty("probe-port")
    private int probePort = 0;

    @JsonProperty("probe-timeout-millis")
    private int probeTimeoutMillis = 1500;

    public String getProbeHost() {
        return probeHost;
    }

    public void setProbeHost(String probeHost) {
        this.probeHost = probeHost;
    }

    public int getProbePort() {
        return probePort;
    }

    public void setProbePort(int probePort) {
        this.probePort = probePort;
    }

    public int getProbeTimeoutMillis() {
        return probeTimeoutMillis;
    }

    public void setProbeTimeoutMillis(int probeTimeoutMillis) {
        this.probeTimeoutMillis = probeTimeoutMillis;
    }
}
