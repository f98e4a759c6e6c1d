package de.bsommerfeld.layerkit.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * {@code [api]} section: where the remote data sources send their requests.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiConfig {

    @JsonProperty("base-url")
    private String baseUrl = "https://api.example.com";

    @JsonProperty("connect-timeout-seconds")
    private int connectTimeoutSeconds = 10;

    @JsonProperty("request-timeout-seconds")
    private int requestTimeoutSeconds = 30;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public int getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    @JsonIgnore
    public Duration getConnectTimeout() {
        return Duration.ofSeconds(connectTimeoutSeconds);
    }

    @JsonIgnore
    public Duration getRequestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }
}
