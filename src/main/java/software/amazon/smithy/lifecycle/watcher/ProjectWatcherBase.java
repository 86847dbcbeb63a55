/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.watcher;

import java.util.Objects;
import software.amazon.smithy.lifecycle.event.ProjectListener;
import software.amazon.smithy.lifecycle.project.ProjectManager;

/**
 * Base for listeners that react to project events by driving the same
 * {@link ProjectManager} they listen to. The watcher adds itself as a listener
 * when constructed.
 */
public abstract class ProjectWatcherBase implements ProjectListener {
    private final ProjectManager projectManager;

    protected ProjectWatcherBase(ProjectManager projectManager) {
        this.projectManager = Objects.requireNonNull(projectManager);
        projectManager.addListener(this);
    }

    protected final ProjectManager projectManager() {
        return projectManager;
    }

    /**
     * Stops listening to the project manager.
     */
    public void detach() {
        projectManager.removeListener(this);
    }
}
