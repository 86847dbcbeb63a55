/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

/**
 * The transitions a single project location is currently going through.
 *
 * <p>Instances handed out by {@link ProjectStateTracker} are copies, mutating
 * them has no effect on the tracked state.
 */
public final class ProjectState {
    private final String location;
    private boolean loading;
    private boolean saving;
    private boolean refreshing;
    private boolean activating;
    private boolean deactivating;
    private boolean closing;

    /**
     * @param location The location this state is for
     */
    public ProjectState(String location) {
        this.location = location;
    }

    private ProjectState(ProjectState other) {
        this.location = other.location;
        this.loading = other.loading;
        this.saving = other.saving;
        this.refreshing = other.refreshing;
        this.activating = other.activating;
        this.deactivating = other.deactivating;
        this.closing = other.closing;
    }

    /**
     * @return A copy of this state
     */
    public ProjectState copy() {
        return new ProjectState(this);
    }

    public String getLocation() {
        return location;
    }

    public boolean isLoading() {
        return loading;
    }

    public void setLoading(boolean loading) {
        this.loading = loading;
    }

    public boolean isSaving() {
        return saving;
    }

    public void setSaving(boolean saving) {
        this.saving = saving;
    }

    public boolean isRefreshing() {
        return refreshing;
    }

    public void setRefreshing(boolean refreshing) {
        this.refreshing = refreshing;
    }

    public boolean isActivating() {
        return activating;
    }

    public void setActivating(boolean activating) {
        this.activating = activating;
    }

    public boolean isDeactivating() {
        return deactivating;
    }

    public void setDeactivating(boolean deactivating) {
        this.deactivating = deactivating;
    }

    public boolean isClosing() {
        return closing;
    }

    public void setClosing(boolean closing) {
        this.closing = closing;
    }

    /**
     * @return Whether no transition is in progress for the location
     */
    public boolean isIdle() {
        return !(loading || saving || refreshing || activating || deactivating || closing);
    }

    @Override
    public String toString() {
        return "ProjectState{"
                + "location='" + location + '\''
                + ", loading=" + loading
                + ", saving=" + saving
                + ", refreshing=" + refreshing
                + ", activating=" + activating
                + ", deactivating=" + deactivating
                + ", closing=" + closing
                + '}';
    }
}
