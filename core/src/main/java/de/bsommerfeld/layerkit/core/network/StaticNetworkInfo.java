package de.bsommerfeld.layerkit.core.network;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link NetworkInfo} with a fixed answer. Bound in TEST mode, where no probe
 * traffic should leave the machine, and used as a test double.
 */
public class StaticNetworkInfo implements NetworkInfo {

    private final boolean connected;
    private final AtomicInteger checks = new AtomicInteger();

    public StaticNetworkInfo(boolean connected) {
        this.connected = connected;
    }

    public static StaticNetworkInfo online() {
        return new StaticNetworkInfo(true);
    }

    public static StaticNetworkInfo offline() {
        return new StaticNetworkInfo(false);
    }

    @Override
    public CompletableFuture<Boolean> isConnected() {
        checks.incrementAndGet();
        return CompletableFuture.completedFuture(connected);
    }

    /** Number of times {@link #isConnected()} has been called. */
    public int checkCount() {
        return checks.get();
    }
}
