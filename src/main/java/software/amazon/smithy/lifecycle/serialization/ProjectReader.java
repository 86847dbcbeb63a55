/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.serialization;

import java.util.concurrent.CompletableFuture;
import software.amazon.smithy.lifecycle.project.Project;

/**
 * Reads a {@link Project} from a location.
 */
@FunctionalInterface
public interface ProjectReader {
    /**
     * @param location The location to read from
     * @return A future completing with the read project, or failing if it couldn't be read
     */
    CompletableFuture<Project> read(String location);
}
