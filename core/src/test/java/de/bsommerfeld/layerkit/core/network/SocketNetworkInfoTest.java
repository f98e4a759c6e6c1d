package de.bsommerfeld.layerkit.core.network;

import de.bsommerfeld.layerkit.core.config.ApiConfig;
import de.bsommerfeld.layerkit.core.config.GlobalConfig;
import de.bsommerfeld.layerkit.core.config.NetworkConfig;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.ServerSocket;

import static org.junit.jupiter.api.Assertions.*;

class SocketNetworkInfoTest {

    @Test
    void isConnected_shouldReturnTrueForListeningPort() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
                SocketNetworkInfo networkInfo = new SocketNetworkInfo("127.0.0.1", server.getLocalPort(), 1000)) {
            assertTrue(networkInfo.isConnected().join());
        }
    }

    @Test
    void isConnected_shouldReturnFalseForClosedPort() throws Exception {
        int port;
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = server.getLocalPort();
        }

        try (SocketNetworkInfo networkInfo = new SocketNetworkInfo("127.0.0.1", port, 500)) {
            assertFalse(networkInfo.isConnected().join());
        }
    }

    @Test
    void constructor_shouldProbeApiHostByDefault() {
        GlobalConfig config = new GlobalConfig();
        config.getApi().setBaseUrl("http://auth.example.org:8443/v1");

        try (SocketNetworkInfo networkInfo = new SocketNetworkInfo(config)) {
            assertEquals("auth.example.org", networkInfo.host());
            assertEquals(8443, networkInfo.port());
        }
    }

    @Test
    void resolveHost_shouldDeriveFromBaseUrl() {
        ApiConfig api = new ApiConfig();
        api.setBaseUrl("https://auth.example.org/v1");

        assertEquals("auth.example.org", SocketNetworkInfo.resolveHost(api, new NetworkConfig()));
    }

    @Test
    void resolveHost_shouldPreferOverride() {
        ApiConfig api = new ApiConfig();
        NetworkConfig network = new NetworkConfig();
        network.setProbeHost(" probe.internal ");

        assertEquals("probe.internal", SocketNetworkInfo.resolveHost(api, network));
    }

    @Test
    void resolvePort_shouldUseSchemeDefaults() {
        ApiConfig api = new ApiConfig();
        NetworkConfig network = new NetworkConfig();

        api.setBaseUrl("https://auth.example.org");
        assertEquals(443, SocketNetworkInfo.resolvePort(api, network));

        api.setBaseUrl("http://auth.example.org");
        assertEquals(80, SocketNetworkInfo.resolvePort(api, network));

        api.setBaseUrl("http://localhost:8080/api");
        assertEquals(8080, SocketNetworkInfo.resolvePort(api, network));
    }

    @Test
    void resolvePort_shouldPreferOverride() {
        NetworkConfig network = new NetworkConfig();
        network.setProbePort(53);

        assertEquals(53, SocketNetworkInfo.resolvePort(new ApiConfig(), network));
    }
}
