/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.validation;

import java.util.concurrent.CompletableFuture;
import software.amazon.smithy.lifecycle.project.Project;

/**
 * Decides whether a project may be loaded, before and after it is read.
 *
 * <p>Every method passes by default.
 */
public interface ProjectValidator {
    /**
     * Checked only when loading a new location, not when refreshing.
     *
     * @param location The location about to be loaded
     * @return A future completing with whether loading may start
     */
    default CompletableFuture<Boolean> canStartLoading(String location) {
        return CompletableFuture.completedFuture(true);
    }

    /**
     * @param location The location about to be read
     * @return A future completing with the validation result
     */
    default CompletableFuture<ValidationResult> validateBeforeLoading(String location) {
        return CompletableFuture.completedFuture(ValidationResult.empty());
    }

    /**
     * @param project The project that was just read
     * @return A future completing with the validation result
     */
    default CompletableFuture<ValidationResult> validateLoaded(Project project) {
        return CompletableFuture.completedFuture(ValidationResult.empty());
    }

    /**
     * @return A validator that accepts everything
     */
    static ProjectValidator acceptAll() {
        return new ProjectValidator() {
        };
    }
}
