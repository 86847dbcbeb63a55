/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

import software.amazon.smithy.lifecycle.refresh.AbstractProjectRefresher;

public final class StubRefresher extends AbstractProjectRefresher {
    public volatile boolean failOnSubscribe;
    public volatile int unsubscribeCount;

    public StubRefresher(String location) {
        super(location);
    }

    @Override
    protected void onSubscribe() {
        if (failOnSubscribe) {
            throw new IllegalStateException("Cannot watch " + location());
        }
    }

    @Override
    protected void onUnsubscribe() {
        unsubscribeCount++;
    }

    /**
     * Simulates a modification of the location by someone else.
     */
    public void modifiedExternally() {
        notifyUpdated();
    }
}
