/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.refresh;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Base {@link ProjectRefresher} that keeps track of update listeners and of
 * whether it is subscribed.
 *
 * <p>Implementations call {@link #notifyUpdated()} when they detect a change;
 * notifications are dropped while unsubscribed.
 */
public abstract class AbstractProjectRefresher implements ProjectRefresher {
    private final String location;
    private final List<Consumer<String>> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean subscribed;

    protected AbstractProjectRefresher(String location) {
        this.location = location;
    }

    @Override
    public final String location() {
        return location;
    }

    @Override
    public void subscribe() {
        subscribed = true;
        onSubscribe();
    }

    @Override
    public void unsubscribe() {
        subscribed = false;
        onUnsubscribe();
    }

    @Override
    public void addUpdateListener(Consumer<String> listener) {
        listeners.add(listener);
    }

    @Override
    public void removeUpdateListener(Consumer<String> listener) {
        listeners.remove(listener);
    }

    /**
     * @return Whether the refresher is currently subscribed
     */
    public boolean isSubscribed() {
        return subscribed;
    }

    /**
     * @return The number of update listeners
     */
    public int listenerCount() {
        return listeners.size();
    }

    protected void onSubscribe() {
    }

    protected void onUnsubscribe() {
    }

    protected final void notifyUpdated() {
        if (!subscribed) {
            return;
        }
        for (Consumer<String> listener : listeners) {
            listener.accept(location);
        }
    }
}
