/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import software.amazon.smithy.lifecycle.event.ProjectCancelEvent;
import software.amazon.smithy.lifecycle.event.ProjectErrorEvent;
import software.amazon.smithy.lifecycle.event.ProjectEvent;
import software.amazon.smithy.lifecycle.event.ProjectListener;
import software.amazon.smithy.lifecycle.event.ProjectUpdatedEvent;
import software.amazon.smithy.lifecycle.event.ProjectUpdatingCancelEvent;
import software.amazon.smithy.lifecycle.util.Futures;

/**
 * Records the names of the events it receives, and cancels the begin events
 * whose name was added to {@link #cancel}. Deactivations are recorded and
 * canceled as "Deactivation".
 */
public final class RecordingListener implements ProjectListener {
    public final List<String> events = new CopyOnWriteArrayList<>();
    public final List<ProjectErrorEvent> failures = new CopyOnWriteArrayList<>();
    public final List<ProjectUpdatedEvent> activated = new CopyOnWriteArrayList<>();
    public final Set<String> cancel = ConcurrentHashMap.newKeySet();

    public void clear() {
        events.clear();
        failures.clear();
        activated.clear();
    }

    private CompletableFuture<Void> record(String name) {
        events.add(name);
        return Futures.done();
    }

    private CompletableFuture<Void> begin(String name, ProjectCancelEvent event) {
        if (cancel.contains(name)) {
            event.cancel();
        }
        return record(name);
    }

    private CompletableFuture<Void> failed(String name, ProjectErrorEvent event) {
        failures.add(event);
        return record(name);
    }

    @Override
    public CompletableFuture<Void> onLoading(ProjectCancelEvent event) {
        return begin("Loading", event);
    }

    @Override
    public CompletableFuture<Void> onLoadingFailed(ProjectErrorEvent event) {
        return failed("LoadingFailed", event);
    }

    @Override
    public CompletableFuture<Void> onLoadingCanceled(ProjectEvent event) {
        return record("LoadingCanceled");
    }

    @Override
    public CompletableFuture<Void> onLoaded(ProjectEvent event) {
        return record("Loaded");
    }

    @Override
    public CompletableFuture<Void> onSaving(ProjectCancelEvent event) {
        return begin("Saving", event);
    }

    @Override
    public CompletableFuture<Void> onSavingFailed(ProjectErrorEvent event) {
        return failed("SavingFailed", event);
    }

    @Override
    public CompletableFuture<Void> onSavingCanceled(ProjectEvent event) {
        return record("SavingCanceled");
    }

    @Override
    public CompletableFuture<Void> onSaved(ProjectEvent event) {
        return record("Saved");
    }

    @Override
    public CompletableFuture<Void> onClosing(ProjectCancelEvent event) {
        return begin("Closing", event);
    }

    @Override
    public CompletableFuture<Void> onClosingCanceled(ProjectEvent event) {
        return record("ClosingCanceled");
    }

    @Override
    public CompletableFuture<Void> onClosed(ProjectEvent event) {
        return record("Closed");
    }

    @Override
    public CompletableFuture<Void> onRefreshing(ProjectCancelEvent event) {
        return begin("Refreshing", event);
    }

    @Override
    public CompletableFuture<Void> onRefreshingFailed(ProjectErrorEvent event) {
        return failed("RefreshingFailed", event);
    }

    @Override
    public CompletableFuture<Void> onRefreshingCanceled(ProjectEvent event) {
        return record("RefreshingCanceled");
    }

    @Override
    public CompletableFuture<Void> onRefreshed(ProjectEvent event) {
        return record("Refreshed");
    }

    @Override
    public CompletableFuture<Void> onRefreshRequired(ProjectEvent event) {
        return record("RefreshRequired");
    }

    @Override
    public CompletableFuture<Void> onActivation(ProjectUpdatingCancelEvent event) {
        String name = event.isDeactivation() ? "Deactivation" : "Activation";
        if (cancel.contains(name)) {
            event.cancel();
        }
        return record(name);
    }

    @Override
    public CompletableFuture<Void> onActivationFailed(ProjectErrorEvent event) {
        return failed("ActivationFailed", event);
    }

    @Override
    public CompletableFuture<Void> onActivationCanceled(ProjectEvent event) {
        return record("ActivationCanceled");
    }

    @Override
    public CompletableFuture<Void> onActivated(ProjectUpdatedEvent event) {
        activated.add(event);
        return record(event.isDeactivation() ? "Deactivated" : "Activated");
    }
}
