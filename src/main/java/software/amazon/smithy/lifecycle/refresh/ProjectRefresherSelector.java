/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.refresh;

/**
 * Picks the {@link ProjectRefresher} to use for a location.
 */
@FunctionalInterface
public interface ProjectRefresherSelector {
    /**
     * @param location The location that was just registered
     * @return A new refresher for {@code location}, or null to not watch it
     */
    ProjectRefresher getRefresher(String location);

    /**
     * @return A selector that never watches anything
     */
    static ProjectRefresherSelector none() {
        return location -> null;
    }
}
