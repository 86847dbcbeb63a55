/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

import java.util.concurrent.CompletableFuture;

/**
 * Migrates locations holding an old project format before they are loaded.
 */
public interface ProjectUpgrader {
    /**
     * @param location The location about to be loaded
     * @return A future completing with whether it needs to be upgraded first
     */
    CompletableFuture<Boolean> requiresUpgrade(String location);

    /**
     * @param location The location to upgrade
     * @return A future completing with the location of the upgraded project
     */
    CompletableFuture<String> upgrade(String location);

    /**
     * @return An upgrader that never upgrades
     */
    static ProjectUpgrader none() {
        return new ProjectUpgrader() {
            @Override
            public CompletableFuture<Boolean> requiresUpgrade(String location) {
                return CompletableFuture.completedFuture(false);
            }

            @Override
            public CompletableFuture<String> upgrade(String location) {
                return CompletableFuture.completedFuture(location);
            }
        };
    }
}
