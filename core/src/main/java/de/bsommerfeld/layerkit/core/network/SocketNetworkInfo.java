package de.bsommerfeld.layerkit.core.network;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Singleton;
import de.bsommerfeld.layerkit.core.config.ApiConfig;
import de.bsommerfeld.layerkit.core.config.GlobalConfig;
import de.bsommerfeld.layerkit.core.config.NetworkConfig;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Production {@link NetworkInfo}: reachability means a TCP connection to the
 * probe target can be opened within the configured timeout.
 *
 * <p>
 * The probe target defaults to the host and port of the API base URL, so
 * "connected" answers the question the repositories actually care about.
 * {@code [network] probe-host / probe-port} override it.
 *
 * <p>
 * Probes run on a small daemon pool and never block the caller. The pool is
 * shut down by {@link #close()}, which the container calls on teardown.
 */
@Singleton
public class SocketNetworkInfo implements NetworkInfo, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SocketNetworkInfo.class);

    private final String host;
    private final int port;
    private final int timeoutMillis;
    private final ExecutorService probeExecutor = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder()
                    .setNameFormat("network-probe-%d")
                    .setDaemon(true)
                    .build());

    @Inject
    public SocketNetworkInfo(GlobalConfig config) {
        this(resolveHost(config.getApi(), config.getNetwork()),
                resolvePort(config.getApi(), config.getNetwork()),
                config.getNetwork().getProbeTimeoutMillis());
    }

    SocketNetworkInfo(String host, int port, int timeoutMillis) {
        this.host = host;
        this.port = port;
        this.timeoutMillis = timeoutMillis;
        LOG.info("Connectivity probe target: {}:{} (timeout {} ms)", host, port, timeoutMillis);
    }

    @Override
    public CompletableFuture<Boolean> isConnected() {
        return CompletableFuture.supplyAsync(this::probe, probeExecutor);
    }

    private boolean probe() {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), timeoutMillis);
            return true;
        } catch (IOException e) {
            LOG.debug("Connectivity probe to {}:{} failed: {}", host, port, e.getMessage());
            return false;
        }
    }

    /**
     * Stops the probe pool, waiting briefly for in-flight probes.
     */
    @Override
    public void close() {
        probeExecutor.shutdown();
        try {
            if (!probeExecutor.awaitTermination(timeoutMillis + 1000L, TimeUnit.MILLISECONDS)) {
                probeExecutor.shutdownNow();
                LOG.warn("Connectivity probe pool forced shutdown (timed out).");
            }
        } catch (InterruptedException e) {
            probeExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    String host() {
        return host;
    }

    int port() {
        return port;
    }

    static String resolveHost(ApiConfig api, NetworkConfig network) {
        String override = network.getProbeHost();
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        String host = URI.create(api.getBaseUrl()).getHost();
        if (host == null) {
            throw new IllegalArgumentException("API base URL has no host: " + api.getBaseUrl());
        }
        return host;
    }

    static int resolvePort(ApiConfig api, NetworkConfig network) {
        if (network.getProbePort() > 0) {
            return network.getProbePort();
        }
        URI uri = URI.create(api.getBaseUrl());
        if (uri.getPort() > 0) {
            return uri.getPort();
        }
        return "http".equalsIgnoreCase(uri.getScheme()) ? 80 : 443;
    }
}
