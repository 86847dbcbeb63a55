/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Tracks the {@link ProjectState} of every location a {@link ProjectManager} has
 * touched.
 *
 * <p>States are created lazily and kept after a project is closed, a stale state
 * for a closed location is idle.
 */
public final class ProjectStateTracker {
    private static final Logger LOGGER = Logger.getLogger(ProjectStateTracker.class.getName());

    private final Map<String, ProjectState> states = new ConcurrentHashMap<>();
    private final List<ProjectStateListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean refreshingActiveProject;

    /**
     * @param location The location to get the state of
     * @return A copy of the current state of {@code location}
     */
    public ProjectState getState(String location) {
        ProjectState state = stateFor(location);
        synchronized (state) {
            return state.copy();
        }
    }

    /**
     * Applies {@code update} to the live state of {@code location}, then notifies
     * listeners with a copy of the result.
     *
     * @param location The location to update the state of
     * @param update The update to apply
     */
    public void updateState(String location, Consumer<ProjectState> update) {
        ProjectState state = stateFor(location);
        ProjectState snapshot;
        synchronized (state) {
            update.accept(state);
            snapshot = state.copy();
        }

        LOGGER.finest(() -> "Updated state " + snapshot);
        for (ProjectStateListener listener : listeners) {
            listener.onStateUpdated(snapshot.copy());
        }
    }

    /**
     * @return Whether the active project is currently being refreshed
     */
    public boolean isRefreshingActiveProject() {
        return refreshingActiveProject;
    }

    void setRefreshingActiveProject(boolean refreshingActiveProject) {
        if (this.refreshingActiveProject == refreshingActiveProject) {
            return;
        }

        this.refreshingActiveProject = refreshingActiveProject;
        for (ProjectStateListener listener : listeners) {
            listener.onRefreshingActiveProjectUpdated(refreshingActiveProject);
        }
    }

    /**
     * @param listener The listener to notify of state updates
     */
    public void addListener(ProjectStateListener listener) {
        listeners.add(listener);
    }

    /**
     * @param listener The listener to stop notifying
     */
    public void removeListener(ProjectStateListener listener) {
        listeners.remove(listener);
    }

    private ProjectState stateFor(String location) {
        return states.computeIfAbsent(Locations.normalize(location), key -> new ProjectState(location));
    }
}
