/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

/**
 * Thrown when loading a second project while in {@link ManagementMode#SINGLE_DOCUMENT}.
 */
public final class SingleDocumentModeException extends ProjectException {
    public SingleDocumentModeException(String location) {
        super(location, "Cannot load project '" + location + "', currently in single document mode");
    }
}
