/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * How many projects a {@link ProjectManager} may hold at once.
 */
public enum ManagementMode {
    /**
     * At most one project is registered at a time.
     */
    SINGLE_DOCUMENT("singleDocument"),

    /**
     * Any number of projects may be registered, one of which is active.
     */
    MULTIPLE_DOCUMENTS("multipleDocuments");

    /**
     * The config values of all {@link ManagementMode}s.
     */
    public static final List<String> ALL_VALUES = Arrays.stream(ManagementMode.values())
            .map(ManagementMode::value)
            .toList();

    private final String value;

    ManagementMode(String value) {
        this.value = value;
    }

    /**
     * @return The value used for this mode in configuration files
     */
    public String value() {
        return value;
    }

    /**
     * @param value The configured value, matched case-insensitively
     * @return The matching mode, if any
     */
    public static Optional<ManagementMode> fromValue(String value) {
        for (ManagementMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
