/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.event;

import java.util.concurrent.CompletableFuture;
import software.amazon.smithy.lifecycle.util.Futures;

/**
 * Observes the transitions of a {@link software.amazon.smithy.lifecycle.project.ProjectManager}.
 *
 * <p>Each transition has a begin method, which receives a cancellable event, and
 * one method per outcome. Exactly one outcome follows a begin notification.
 * Implementations override the methods they care about; the returned future is
 * awaited before the transition proceeds, so a listener can do asynchronous work
 * before deciding whether to cancel.
 */
public interface ProjectListener {
    default CompletableFuture<Void> onLoading(ProjectCancelEvent event) {
        return Futures.done();
    }

    default CompletableFuture<Void> onLoadingFailed(ProjectErrorEvent event) {
        return Futures.done();
    }

    default CompletableFuture<Void> onLoadingCanceled(ProjectEvent event) {
        return Futures.done();
    }

    default CompletableFuture<Void> onLoaded(ProjectEvent event) {
        return Futures.done();
    }

    default CompletableFuture<Void> onSaving(ProjectCancelEvent event) {
        return Futures.done();
    }

    default CompletableFuture<Void> onSavingFailed(ProjectErrorEvent event) {
        return Futures.done();
    }

    default CompletableFuture<Void> onSavingCanceled(ProjectEvent event) {
        return Futures.done();
    }

    default CompletableFuture<Void> onSaved(ProjectEvent event) {
        return Futures.done();
    }

    default CompletableFuture<Void> onClosing(ProjectCancelEvent event) {
        return Futures.done();
    }

    default CompletableFuture<Void> onClosingCanceled(ProjectEvent event) {
        return Futures.done();
    }

    default CompletableFuture<Void> onClosed(ProjectEvent event) {
        return Futures.done();
    }

    default CompletableFuture<Void> onRefreshing(ProjectCancelEvent event) {
        return Futures.done();
    }

    default CompletableFuture<Void> onRefreshingFailed(ProjectErrorEvent event) {
        return Futures.done();
    }

    default CompletableFuture<Void> onRefreshingCanceled(ProjectEvent event) {
        return Futures.done();
    }

    default CompletableFuture<Void> onRefreshed(ProjectEvent event) {
        return Futures.done();
    }

    /**
     * Called when a refresher reported that a registered project's location was
     * modified outside the manager, before the manager refreshes it.
     *
     * @param event The event of the modified project
     * @return A future completing when the listener is done
     */
    default CompletableFuture<Void> onRefreshRequired(ProjectEvent event) {
        return Futures.done();
    }

    /**
     * @param event The pending change, with a null new project for deactivation
     * @return A future completing when the listener is done
     */
    default CompletableFuture<Void> onActivation(ProjectUpdatingCancelEvent event) {
        return Futures.done();
    }

    default CompletableFuture<Void> onActivationFailed(ProjectErrorEvent event) {
        return Futures.done();
    }

    default CompletableFuture<Void> onActivationCanceled(ProjectEvent event) {
        return Futures.done();
    }

    default CompletableFuture<Void> onActivated(ProjectUpdatedEvent event) {
        return Futures.done();
    }
}
