/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

import software.amazon.smithy.lifecycle.validation.ValidationResult;

/**
 * Thrown when a validator rejected a location or a loaded project.
 */
public final class ProjectValidationException extends ProjectException {
    private final ValidationResult validationResult;

    public ProjectValidationException(String location, String message, ValidationResult validationResult) {
        super(location, message);
        this.validationResult = validationResult;
    }

    /**
     * @return The result that rejected the project
     */
    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
