/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;

public class AsyncLockTest {
    @Test
    public void runsActionsOneAfterTheOther() {
        AsyncLock lock = new AsyncLock();
        List<String> order = new CopyOnWriteArrayList<>();
        CompletableFuture<Void> gate = new CompletableFuture<>();

        CompletableFuture<String> first = lock.withLock(() -> {
            order.add("first started");
            return gate.thenApply(unused -> {
                order.add("first done");
                return "first";
            });
        });
        CompletableFuture<String> second = lock.withLock(() -> {
            order.add("second started");
            return CompletableFuture.completedFuture("second");
        });

        assertThat(lock.isLocked(), is(true));
        assertThat(second.isDone(), is(false));

        gate.complete(null);

        assertThat(first.join(), equalTo("first"));
        assertThat(second.join(), equalTo("second"));
        assertThat(order, contains("first started", "first done", "second started"));
        assertThat(lock.isLocked(), is(false));
    }

    @Test
    public void releasesAfterFailure() {
        AsyncLock lock = new AsyncLock();

        CompletableFuture<String> failed = lock.withLock(() -> {
            throw new IllegalStateException("Failed");
        });
        CompletableFuture<String> next = lock.withLock(() -> CompletableFuture.completedFuture("next"));

        CompletionException e = assertThrows(CompletionException.class, failed::join);
        assertThat(e.getCause(), instanceOf(IllegalStateException.class));
        assertThat(next.join(), equalTo("next"));
    }

    @Test
    public void drainsLongQueueBehindGatedAction() {
        AsyncLock lock = new AsyncLock();
        CompletableFuture<Void> gate = new CompletableFuture<>();
        lock.withLock(() -> gate);
        List<CompletableFuture<Integer>> queued = new ArrayList<>();
        for (int i = 0; i < 5000; i++) {
            int value = i;
            queued.add(lock.withLock(() -> CompletableFuture.completedFuture(value)));
        }

        gate.complete(null);

        for (int i = 0; i < queued.size(); i++) {
            assertThat(queued.get(i).isDone(), is(true));
            assertThat(queued.get(i).join(), equalTo(i));
        }
        assertThat(lock.isLocked(), is(false));
        assertThat(lock.withLock(() -> CompletableFuture.completedFuture("after")).join(), equalTo("after"));
    }
}
