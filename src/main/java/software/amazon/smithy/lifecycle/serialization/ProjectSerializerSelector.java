/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.serialization;

/**
 * Picks the {@link ProjectReader} and {@link ProjectWriter} to use for a location.
 */
public interface ProjectSerializerSelector {
    /**
     * @param location The location to read
     * @return The reader for {@code location}, or null if there is none
     */
    ProjectReader getReader(String location);

    /**
     * @param location The location to write
     * @return The writer for {@code location}, or null if there is none
     */
    ProjectWriter getWriter(String location);

    /**
     * @param reader The reader to use for every location
     * @param writer The writer to use for every location
     * @return A selector that always returns {@code reader} and {@code writer}
     */
    static ProjectSerializerSelector of(ProjectReader reader, ProjectWriter writer) {
        return new ProjectSerializerSelector() {
            @Override
            public ProjectReader getReader(String location) {
                return reader;
            }

            @Override
            public ProjectWriter getWriter(String location) {
                return writer;
            }
        };
    }
}
