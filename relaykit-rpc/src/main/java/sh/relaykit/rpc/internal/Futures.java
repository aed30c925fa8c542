// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc.internal;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for {@link java.util.concurrent.CompletableFuture} failures.
 *
 * <p>
 * <strong>Internal Use Only.</strong>
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} layers.
     */
    public static Throwable unwrap(final Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Rethrows {@code error} so that the dependent stage fails with it as the
     * cause.
     */
    public static CompletionException propagate(final Throwable error) {
        return error instanceof CompletionException completion ? completion : new CompletionException(error);
    }
}
