package de.bsommerfeld.layerkit.core.network;

import java.util.concurrent.CompletableFuture;

/**
 * Answers whether the remote side is reachable right now. Every call performs
 * a fresh check; implementations must not cache the answer.
 */
public interface NetworkInfo {

    CompletableFuture<Boolean> isConnected();
}
