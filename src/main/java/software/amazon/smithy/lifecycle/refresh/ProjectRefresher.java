/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.refresh;

import java.util.function.Consumer;

/**
 * Watches a project location for external modification.
 *
 * <p>A refresher does nothing until {@link #subscribe()} is called, and stops
 * notifying after {@link #unsubscribe()}.
 */
public interface ProjectRefresher {
    /**
     * @return The location being watched
     */
    String location();

    /**
     * Starts watching the location.
     */
    void subscribe();

    /**
     * Stops watching the location.
     */
    void unsubscribe();

    /**
     * @param listener Called with the location whenever it was modified
     */
    void addUpdateListener(Consumer<String> listener);

    /**
     * @param listener The listener to remove
     */
    void removeUpdateListener(Consumer<String> listener);
}
