/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.event;

import software.amazon.smithy.lifecycle.project.Project;

/**
 * Fired when the active project changed. A null {@link #newProject()} means the
 * previously active project was deactivated.
 */
public class ProjectUpdatedEvent {
    private final Project oldProject;
    private final Project newProject;

    public ProjectUpdatedEvent(Project oldProject, Project newProject) {
        this.oldProject = oldProject;
        this.newProject = newProject;
    }

    /**
     * @return The project that was active before, or null
     */
    public Project oldProject() {
        return oldProject;
    }

    /**
     * @return The project that is active after, or null
     */
    public Project newProject() {
        return newProject;
    }

    /**
     * @return Whether this is a deactivation
     */
    public boolean isDeactivation() {
        return newProject == null;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{old=" + location(oldProject) + ", new=" + location(newProject) + "}";
    }

    private static String location(Project project) {
        return project == null ? null : "'" + project.location() + "'";
    }
}
