/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

/**
 * A file-backed unit of application state, identified by its location.
 *
 * <p>Everything other than the location is opaque to the {@link ProjectManager}.
 * Locations are compared case-insensitively.
 */
public interface Project {
    /**
     * @return The location the project was read from, never null
     */
    String location();
}
