/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

/**
 * Receives updates from a {@link ProjectStateTracker}.
 */
public interface ProjectStateListener {
    /**
     * @param state A copy of the state right after it was updated
     */
    void onStateUpdated(ProjectState state);

    /**
     * @param refreshingActiveProject Whether the active project is now being refreshed
     */
    default void onRefreshingActiveProjectUpdated(boolean refreshingActiveProject) {
    }
}
