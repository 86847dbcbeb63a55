/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.event;

import software.amazon.smithy.lifecycle.project.Project;

/**
 * A transition that happened, or is about to happen, for a project location.
 *
 * <p>{@link #project()} is null while the location is still being loaded.
 */
public class ProjectEvent {
    private final String location;
    private final Project project;

    public ProjectEvent(String location) {
        this(location, null);
    }

    public ProjectEvent(Project project) {
        this(project.location(), project);
    }

    protected ProjectEvent(String location, Project project) {
        this.location = location;
        this.project = project;
    }

    /**
     * @return The location of the project
     */
    public String location() {
        return location;
    }

    /**
     * @return The project, or null if it hasn't been read yet
     */
    public Project project() {
        return project;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{location='" + location + "'}";
    }
}
