/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.event;

import java.util.Optional;
import software.amazon.smithy.lifecycle.project.Project;
import software.amazon.smithy.lifecycle.validation.ValidationResult;

/**
 * Fired when a transition failed.
 *
 * <p>A writer that rejected a save without throwing produces an event without
 * an exception.
 */
public final class ProjectErrorEvent extends ProjectEvent {
    private final Throwable exception;
    private final ValidationResult validationResult;

    public ProjectErrorEvent(String location, Project project, Throwable exception, ValidationResult validationResult) {
        super(location, project);
        this.exception = exception;
        this.validationResult = validationResult;
    }

    /**
     * @return The failure, if there was one
     */
    public Optional<Throwable> exception() {
        return Optional.ofNullable(exception);
    }

    /**
     * @return The validation result of the transition, if validation ran
     */
    public Optional<ValidationResult> validationResult() {
        return Optional.ofNullable(validationResult);
    }
}
