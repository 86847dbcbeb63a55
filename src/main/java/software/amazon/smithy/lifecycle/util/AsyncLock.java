/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * A non-reentrant mutual exclusion lock for asynchronous actions.
 *
 * <p>The lock is held until the future returned by an action completes,
 * regardless of which thread ends up completing it. Nothing blocks while waiting.
 *
 * <p>Waiting actions are started from a loop on the thread that released the
 * lock, never from inside the completion of the previous action, so a long queue
 * of actions that complete synchronously doesn't grow the stack.
 */
public final class AsyncLock {
    private final Deque<Runnable> waiting = new ArrayDeque<>();
    private final Deque<Runnable> granted = new ArrayDeque<>();
    private boolean held;
    private boolean draining;

    /**
     * Runs {@code action} once every previously submitted action has completed.
     *
     * @param action The action to run while holding the lock
     * @param <T> The result type of the action
     * @return A future completing with the result of the action
     */
    public <T> CompletableFuture<T> withLock(Supplier<CompletableFuture<T>> action) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Runnable start = () -> Futures.call(action).whenComplete((value, error) -> {
            release();
            if (error != null) {
                result.completeExceptionally(error);
            } else {
                result.complete(value);
            }
        });

        synchronized (this) {
            if (held) {
                waiting.add(start);
                return result;
            }
            held = true;
        }

        start.run();
        return result;
    }

    /**
     * @return Whether an action is running or waiting for the lock
     */
    public synchronized boolean isLocked() {
        return held;
    }

    private void release() {
        synchronized (this) {
            Runnable next = waiting.poll();
            if (next == null) {
                held = false;
                return;
            }
            granted.add(next);
            if (draining) {
                // A draining loop is already running and starts it
                return;
            }
            draining = true;
        }

        while (true) {
            Runnable next;
            synchronized (this) {
                next = granted.poll();
                if (next == null) {
                    draining = false;
                    return;
                }
            }
            next.run();
        }
    }
}
