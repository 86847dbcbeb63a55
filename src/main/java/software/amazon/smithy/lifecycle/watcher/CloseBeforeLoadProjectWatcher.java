/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.watcher;

import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;
import software.amazon.smithy.lifecycle.event.ProjectCancelEvent;
import software.amazon.smithy.lifecycle.project.Project;
import software.amazon.smithy.lifecycle.project.ProjectManager;
import software.amazon.smithy.lifecycle.util.Futures;

/**
 * Closes the active project before another one is loaded, so only one project
 * is open at a time. If the active project doesn't close, the load is canceled.
 */
public final class CloseBeforeLoadProjectWatcher extends ProjectWatcherBase {
    private static final Logger LOGGER = Logger.getLogger(CloseBeforeLoadProjectWatcher.class.getName());

    public CloseBeforeLoadProjectWatcher(ProjectManager projectManager) {
        super(projectManager);
    }

    @Override
    public CompletableFuture<Void> onLoading(ProjectCancelEvent event) {
        if (event.isCanceled()) {
            return Futures.done();
        }

        Project active = projectManager().activeProject();
        if (active == null) {
            return Futures.done();
        }

        LOGGER.fine(() -> "Closing '" + active.location() + "' before loading '" + event.location() + "'");
        return projectManager().close(active).thenAccept(closed -> {
            if (!closed) {
                LOGGER.info(() -> "Project '" + active.location() + "' was not closed, canceling loading of '"
                        + event.location() + "'");
            }
            event.setCanceled(!closed);
        });
    }
}
