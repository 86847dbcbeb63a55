/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.validation;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Only allows loading locations that are paths of existing regular files.
 */
public class FileExistsProjectValidator implements ProjectValidator {
    private static final Logger LOGGER = Logger.getLogger(FileExistsProjectValidator.class.getName());

    @Override
    public CompletableFuture<Boolean> canStartLoading(String location) {
        return CompletableFuture.completedFuture(isExistingFile(location));
    }

    @Override
    public CompletableFuture<ValidationResult> validateBeforeLoading(String location) {
        if (isExistingFile(location)) {
            return CompletableFuture.completedFuture(ValidationResult.empty());
        }
        return CompletableFuture.completedFuture(ValidationResult.error("File '" + location + "' does not exist"));
    }

    private static boolean isExistingFile(String location) {
        try {
            Path path = Paths.get(location);
            return Files.isRegularFile(path);
        } catch (InvalidPathException e) {
            LOGGER.fine(() -> "Location '" + location + "' is not a valid path: " + e.getMessage());
            return false;
        }
    }
}
