/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

/**
 * A project that is only its location. Instances are compared by identity, so a
 * re-read project is distinguishable from the one it replaced.
 */
public final class StubProject implements Project {
    private final String location;

    public StubProject(String location) {
        this.location = location;
    }

    @Override
    public String location() {
        return location;
    }

    @Override
    public String toString() {
        return "StubProject{" + location + "}";
    }
}
