/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Test;

public class FuturesTest {
    @Test
    public void callTurnsThrowsIntoFailedFutures() {
        CompletableFuture<String> future = Futures.call(() -> {
            throw new IllegalArgumentException();
        });

        assertThat(future.isCompletedExceptionally(), is(true));
    }

    @Test
    public void callTurnsNullIntoCompletedFuture() {
        CompletableFuture<String> future = Futures.call(() -> null);

        assertThat(future.join(), nullValue());
    }

    @Test
    public void unwrapsNestedWrappers() {
        IllegalStateException cause = new IllegalStateException();

        Throwable unwrapped = Futures.unwrap(new CompletionException(new ExecutionException(cause)));

        assertThat(unwrapped, sameInstance(cause));
    }
}
