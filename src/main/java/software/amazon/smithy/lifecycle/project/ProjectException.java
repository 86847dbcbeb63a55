/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

/**
 * Thrown when a project transition can't be completed for a given location.
 */
public class ProjectException extends RuntimeException {
    private final String location;

    public ProjectException(String location, String message) {
        super(message);
        this.location = location;
    }

    public ProjectException(String location, String message, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    /**
     * @return The location of the project the transition was for
     */
    public String getLocation() {
        return location;
    }
}
