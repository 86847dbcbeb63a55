/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.event;

import software.amazon.smithy.lifecycle.project.Project;

/**
 * Fired before a transition starts. Any listener may cancel the transition, which
 * is checked once every listener has been notified.
 */
public class ProjectCancelEvent extends ProjectEvent {
    private volatile boolean canceled;

    public ProjectCancelEvent(String location) {
        super(location);
    }

    public ProjectCancelEvent(Project project) {
        super(project);
    }

    /**
     * Cancels the transition.
     */
    public void cancel() {
        this.canceled = true;
    }

    /**
     * @param canceled Whether the transition should be canceled
     */
    public void setCanceled(boolean canceled) {
        this.canceled = canceled;
    }

    /**
     * @return Whether a listener canceled the transition
     */
    public boolean isCanceled() {
        return canceled;
    }
}
