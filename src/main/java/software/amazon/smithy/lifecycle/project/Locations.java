/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

import java.util.Locale;

final class Locations {
    private Locations() {
    }

    static String normalize(String location) {
        return location.toLowerCase(Locale.ROOT);
    }

    static boolean same(String first, String second) {
        return first != null && first.equalsIgnoreCase(second);
    }

    static String requireLocation(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Project location must not be blank");
        }
        return location;
    }
}
