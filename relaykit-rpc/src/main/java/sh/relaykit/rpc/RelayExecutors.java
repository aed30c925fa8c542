// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors used by the relay client.
 */
public final class RelayExecutors {

    private RelayExecutors() {
    }

    /**
     * Creates an unbounded pool of daemon threads named {@code relaykit-io-N}
     * for blocking HTTP calls. Idle threads are reclaimed after a minute.
     */
    public static ExecutorService newIoBoundExecutor() {
        final AtomicInteger counter = new AtomicInteger();
        final ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "relaykit-io-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }
}
