/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.event;

import software.amazon.smithy.lifecycle.project.Project;

/**
 * Fired before the active project changes. Any listener may cancel the change.
 */
public final class ProjectUpdatingCancelEvent extends ProjectUpdatedEvent {
    private volatile boolean canceled;

    public ProjectUpdatingCancelEvent(Project oldProject, Project newProject) {
        super(oldProject, newProject);
    }

    /**
     * Cancels the change.
     */
    public void cancel() {
        this.canceled = true;
    }

    /**
     * @param canceled Whether the change should be canceled
     */
    public void setCanceled(boolean canceled) {
        this.canceled = canceled;
    }

    /**
     * @return Whether a listener canceled the change
     */
    public boolean isCanceled() {
        return canceled;
    }
}
