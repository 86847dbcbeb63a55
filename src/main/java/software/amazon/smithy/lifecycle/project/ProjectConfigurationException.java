/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

/**
 * Thrown when the manager isn't wired with a collaborator it needs, like a reader
 * or writer for a location.
 *
 * <p>Unlike other failures this one is not reported through a failed event, it
 * completes the operation's future exceptionally.
 */
public final class ProjectConfigurationException extends RuntimeException {
    public ProjectConfigurationException(String message) {
        super(message);
    }
}
