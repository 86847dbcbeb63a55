/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

import java.util.List;

/**
 * Provides the locations to load when a {@link ProjectManager} is initialized.
 */
@FunctionalInterface
public interface ProjectInitializer {
    /**
     * @return The locations to load, in order
     */
    List<String> initialLocations();

    /**
     * @return An initializer without any locations
     */
    static ProjectInitializer empty() {
        return List::of;
    }
}
