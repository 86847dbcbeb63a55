/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * The projects registered with a {@link ProjectManager}, keyed by location, and
 * the active one among them.
 *
 * <p>Locations are compared case-insensitively and iteration follows registration
 * order. The active project is always either null or a registered project: it
 * can only be set to a registered project, and unregistering the active project
 * clears it.
 *
 * <p>Every method is atomic with respect to the others.
 */
final class ProjectRegistry {
    private static final Logger LOGGER = Logger.getLogger(ProjectRegistry.class.getName());

    private final Map<String, Project> projects = new LinkedHashMap<>();
    private Project active;

    /**
     * @param location Location of the project to get
     * @return The project registered at {@code location}, or null
     */
    synchronized Project get(String location) {
        return projects.get(Locations.normalize(location));
    }

    /**
     * @param project The project to check
     * @return Whether {@code project} itself is registered at its location
     */
    synchronized boolean contains(Project project) {
        Project registered = projects.get(Locations.normalize(project.location()));
        return registered != null && Objects.equals(registered, project);
    }

    /**
     * Registers {@code project}, replacing any project registered at the same
     * location. A replacement keeps the position of the project it replaces.
     *
     * @param project The project to register
     * @return The project that was replaced, or null
     */
    synchronized Project register(Project project) {
        Project replaced = projects.put(Locations.normalize(project.location()), project);
        if (replaced != null && replaced == active) {
            active = null;
        }
        return replaced;
    }

    /**
     * Registers {@code project} unless a project at another location is
     * registered, keeping at most one registered location.
     *
     * @param project The project to register
     * @return The project that was replaced, or null
     * @throws SingleDocumentModeException If another location is registered
     */
    synchronized Project registerOnly(Project project) {
        if (!projects.isEmpty() && !projects.containsKey(Locations.normalize(project.location()))) {
            throw new SingleDocumentModeException(project.location());
        }
        return register(project);
    }

    /**
     * @param location Location of the project to unregister
     * @return The project that was unregistered, or null
     */
    synchronized Project unregister(String location) {
        Project removed = projects.remove(Locations.normalize(location));
        if (removed != null && removed == active) {
            LOGGER.warning(() -> "Unregistered project '" + location + "' while it was still active");
            active = null;
        }
        return removed;
    }

    /**
     * @return A snapshot of the registered projects, in registration order
     */
    synchronized List<Project> snapshot() {
        return List.copyOf(projects.values());
    }

    synchronized int size() {
        return projects.size();
    }

    synchronized boolean isEmpty() {
        return projects.isEmpty();
    }

    synchronized Project active() {
        return active;
    }

    /**
     * @param project The project to make active, or null to clear the active project
     * @throws IllegalStateException If {@code project} isn't registered
     */
    synchronized void setActive(Project project) {
        if (project != null && !contains(project)) {
            throw new IllegalStateException("Project '" + project.location() + "' is not registered");
        }
        active = project;
    }
}
