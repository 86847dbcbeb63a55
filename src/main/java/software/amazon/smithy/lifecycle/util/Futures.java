/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Helpers for working with {@link CompletableFuture}s.
 */
public final class Futures {
    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private Futures() {
    }

    /**
     * @return A completed future with no value
     */
    public static CompletableFuture<Void> done() {
        return DONE;
    }

    /**
     * Calls {@code supplier}, turning a synchronous throw into a failed future, and
     * a null future into a completed one.
     *
     * @param supplier Supplies the future, may throw
     * @param <T> Type of the future's value
     * @return The supplied future
     */
    public static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> supplier) {
        try {
            CompletableFuture<T> future = supplier.get();
            return future == null ? CompletableFuture.completedFuture(null) : future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * @param error An error a future completed with
     * @return The actual cause, without {@link CompletionException} or
     *  {@link ExecutionException} wrappers
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
