/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.serialization;

import java.util.concurrent.CompletableFuture;
import software.amazon.smithy.lifecycle.project.Project;

/**
 * Writes a {@link Project} to a location.
 */
@FunctionalInterface
public interface ProjectWriter {
    /**
     * @param project The project to write
     * @param location The location to write to, which may differ from the project's
     * @return A future completing with whether the project was written
     */
    CompletableFuture<Boolean> write(Project project, String location);
}
