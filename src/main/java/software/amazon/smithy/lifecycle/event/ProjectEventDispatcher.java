/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.event;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;
import java.util.logging.Logger;
import software.amazon.smithy.lifecycle.util.Futures;

/**
 * Notifies {@link ProjectListener}s of an event one at a time, in the order they
 * were added, waiting for each listener's future before notifying the next.
 *
 * <p>Listeners added or removed during a dispatch don't affect that dispatch.
 * A listener that throws, or whose future fails, fails the whole dispatch and the
 * remaining listeners are not notified.
 */
public final class ProjectEventDispatcher {
    private static final Logger LOGGER = Logger.getLogger(ProjectEventDispatcher.class.getName());

    private final List<ProjectListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * @param listener The listener to add
     */
    public void addListener(ProjectListener listener) {
        listeners.add(listener);
    }

    /**
     * @param listener The listener to remove
     * @return Whether the listener was present
     */
    public boolean removeListener(ProjectListener listener) {
        return listeners.remove(listener);
    }

    /**
     * @param handler The listener method to call
     * @param event The event to pass to each listener
     * @param <E> The type of event
     * @return A future completing once every listener is done with the event
     */
    public <E> CompletableFuture<Void> dispatch(
            BiFunction<ProjectListener, E, CompletableFuture<Void>> handler,
            E event
    ) {
        LOGGER.finest(() -> "Dispatching " + event);

        CompletableFuture<Void> result = Futures.done();
        for (ProjectListener listener : List.copyOf(listeners)) {
            result = result.thenCompose(unused -> Futures.call(() -> handler.apply(listener, event)));
        }
        return result;
    }
}
