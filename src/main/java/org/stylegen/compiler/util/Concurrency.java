package org.stylegen.compiler.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Helpers for joining the futures of parallel compile work.
 */
public final class Concurrency {

    private Concurrency() {
    }

    /**
     * Waits for a future and rethrows the original unchecked exception instead of the
     * {@link CompletionException} wrapper, so compile errors keep their type.
     *
     * @param future The future to wait for.
     * @param <T>    The result type.
     * @return The result.
     */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
