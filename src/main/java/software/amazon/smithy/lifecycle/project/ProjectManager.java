/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import software.amazon.smithy.lifecycle.event.ProjectCancelEvent;
import software.amazon.smithy.lifecycle.event.ProjectErrorEvent;
import software.amazon.smithy.lifecycle.event.ProjectEvent;
import software.amazon.smithy.lifecycle.event.ProjectEventDispatcher;
import software.amazon.smithy.lifecycle.event.ProjectListener;
import software.amazon.smithy.lifecycle.event.ProjectUpdatedEvent;
import software.amazon.smithy.lifecycle.event.ProjectUpdatingCancelEvent;
import software.amazon.smithy.lifecycle.refresh.ProjectRefresher;
import software.amazon.smithy.lifecycle.refresh.ProjectRefresherSelector;
import software.amazon.smithy.lifecycle.serialization.ProjectReader;
import software.amazon.smithy.lifecycle.serialization.ProjectSerializerSelector;
import software.amazon.smithy.lifecycle.serialization.ProjectWriter;
import software.amazon.smithy.lifecycle.util.AsyncLock;
import software.amazon.smithy.lifecycle.util.Futures;
import software.amazon.smithy.lifecycle.validation.ProjectValidator;
import software.amazon.smithy.lifecycle.validation.ValidationResult;
import software.amazon.smithy.model.validation.ValidationEvent;

/**
 * Manages the projects loaded by the application, and which one of them is active.
 *
 * <p>Every operation returns a future completing with whether the transition
 * happened. Failures of collaborators are reported to {@link ProjectListener}s
 * through the failed event of the transition, and the future completes with
 * {@code false}. The only failures that complete futures exceptionally are
 * {@link ProjectConfigurationException}s, for missing readers or writers, and
 * exceptions thrown by listeners.
 *
 * <p>Loads are serialized by a load lock, and changes of the active project by an
 * activate lock. Saving, closing and refreshing don't take either lock.
 */
public final class ProjectManager {
    private static final Logger LOGGER = Logger.getLogger(ProjectManager.class.getName());

    private final ProjectValidator validator;
    private final ProjectUpgrader upgrader;
    private final ProjectSerializerSelector serializerSelector;
    private final ProjectRefresherSelector refresherSelector;
    private final ProjectInitializer initializer;
    private final ManagementMode mode;
    private final boolean refreshOnExternalChange;

    private final ProjectRegistry registry = new ProjectRegistry();
    private final ProjectStateTracker stateTracker = new ProjectStateTracker();
    private final ProjectEventDispatcher dispatcher = new ProjectEventDispatcher();
    private final Map<String, ProjectRefresher> refreshers = new ConcurrentHashMap<>();
    private final Consumer<String> refresherListener = this::onRefresherUpdated;

    private final AsyncLock loadLock = new AsyncLock();
    private final AsyncLock activateLock = new AsyncLock();
    private final AtomicInteger savingCounter = new AtomicInteger();
    private volatile boolean loading;

    private ProjectManager(Builder builder) {
        this.validator = builder.validator;
        this.upgrader = builder.upgrader;
        this.serializerSelector = Objects.requireNonNull(builder.serializerSelector, "serializerSelector");
        this.refresherSelector = builder.refresherSelector;
        this.initializer = builder.initializer;
        this.mode = builder.mode;
        this.refreshOnExternalChange = builder.refreshOnExternalChange;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return The registered projects, in the order they were registered
     */
    public List<Project> projects() {
        return registry.snapshot();
    }

    /**
     * @return The active project, or null if there is none
     */
    public Project activeProject() {
        return registry.active();
    }

    /**
     * @param location The location to get the state of
     * @return A copy of the current state of {@code location}
     */
    public ProjectState getState(String location) {
        return stateTracker.getState(Locations.requireLocation(location));
    }

    /**
     * @return The tracker of each location's state, to listen for state updates
     */
    public ProjectStateTracker stateTracker() {
        return stateTracker;
    }

    /**
     * @return Whether a project is being loaded
     */
    public boolean isLoading() {
        return loading;
    }

    /**
     * @return Whether any project is being saved
     */
    public boolean isSaving() {
        return savingCounter.get() > 0;
    }

    public ManagementMode mode() {
        return mode;
    }

    public void addListener(ProjectListener listener) {
        dispatcher.addListener(listener);
    }

    public boolean removeListener(ProjectListener listener) {
        return dispatcher.removeListener(listener);
    }

    /**
     * Loads every location of the {@link ProjectInitializer}, one after the other.
     * Blank locations are skipped, and a location that fails to load doesn't stop
     * the others from loading.
     *
     * @return A future completing once every location was attempted
     */
    public CompletableFuture<Void> initialize() {
        CompletableFuture<Void> result = Futures.done();
        for (String location : initializer.initialLocations()) {
            if (location == null || location.isBlank()) {
                continue;
            }
            result = result.thenCompose(unused -> loadInitial(location));
        }
        return result;
    }

    private CompletableFuture<Void> loadInitial(String location) {
        LOGGER.fine(() -> "Loading initial project from '" + location + "'");
        return Futures.call(() -> load(location)).handle((loaded, error) -> {
            if (error != null) {
                LOGGER.log(Level.SEVERE, Futures.unwrap(error),
                        () -> "Failed to load initial project from '" + location + "'");
            } else if (!loaded) {
                LOGGER.warning(() -> "Initial project from '" + location + "' was not loaded");
            }
            return null;
        });
    }

    /**
     * Loads the project at {@code location} and makes it the active project.
     *
     * @param location The location to load
     * @return A future completing with whether a project is registered at the location
     */
    public CompletableFuture<Boolean> load(String location) {
        Locations.requireLocation(location);
        return loadProject(location).thenCompose(project -> {
            if (project == null) {
                return CompletableFuture.completedFuture(false);
            }
            return setActiveProject(project).thenApply(activated -> true);
        });
    }

    /**
     * Loads the project at {@code location} without changing the active project.
     *
     * @param location The location to load
     * @return A future completing with whether a project is registered at the location
     */
    public CompletableFuture<Boolean> loadInactive(String location) {
        Locations.requireLocation(location);
        return loadProject(location).thenApply(Objects::nonNull);
    }

    private CompletableFuture<Project> loadProject(String location) {
        Project registered = registry.get(location);
        if (registered != null) {
            LOGGER.finest(() -> "Project at '" + location + "' is already loaded");
            return CompletableFuture.completedFuture(registered);
        }

        return loadLock.withLock(() -> {
            Project existing = registry.get(location);
            if (existing != null) {
                LOGGER.finest(() -> "Project at '" + location + "' was loaded while waiting");
                return CompletableFuture.completedFuture(existing);
            }

            Attempt attempt = new Attempt(location);
            loading = true;
            stateTracker.updateState(location, state -> state.setLoading(true));

            return upgradeIfRequired(attempt)
                    .thenCompose(upgraded -> upgraded
                            ? loadUnderLock(attempt)
                            : CompletableFuture.<Project>completedFuture(null))
                    .whenComplete((project, error) -> {
                        stateTracker.updateState(location, state -> state.setLoading(false));
                        if (!Locations.same(location, attempt.location)) {
                            stateTracker.updateState(attempt.location, state -> state.setLoading(false));
                        }
                        loading = false;
                    });
        });
    }

    // Completes with false when the upgrade failed, in which case nothing else happens for the load.
    private CompletableFuture<Boolean> upgradeIfRequired(Attempt attempt) {
        String location = attempt.location;
        LOGGER.finest(() -> "Going to load project from '" + location + "', checking if an upgrade is required");

        return Futures.call(() -> upgrader.requiresUpgrade(location))
                .thenCompose(required -> {
                    if (!Boolean.TRUE.equals(required)) {
                        return CompletableFuture.completedFuture(location);
                    }
                    LOGGER.fine(() -> "Upgrade is required for '" + location + "', upgrading");
                    return Futures.call(() -> upgrader.upgrade(location));
                })
                .handle((upgradedLocation, error) -> {
                    if (error != null) {
                        LOGGER.log(Level.SEVERE, Futures.unwrap(error),
                                () -> "Failed to upgrade project at '" + location + "'");
                        return false;
                    }
                    if (upgradedLocation != null && !Locations.same(location, upgradedLocation)) {
                        LOGGER.fine(() -> "Upgraded project, final location is '" + upgradedLocation + "'");
                        attempt.location = upgradedLocation;
                        stateTracker.updateState(upgradedLocation, state -> state.setLoading(true));
                    }
                    return true;
                });
    }

    private CompletableFuture<Project> loadUnderLock(Attempt attempt) {
        String location = attempt.location;
        Project upgraded = registry.get(location);
        if (upgraded != null) {
            return CompletableFuture.completedFuture(upgraded);
        }

        LOGGER.fine(() -> "Loading project from '" + location + "'");
        ProjectCancelEvent loadingEvent = new ProjectCancelEvent(location);
        return dispatcher.dispatch(ProjectListener::onLoading, loadingEvent).thenCompose(unused -> {
            if (loadingEvent.isCanceled()) {
                LOGGER.fine(() -> "Canceled loading of project from '" + location + "'");
                return dispatcher.dispatch(ProjectListener::onLoadingCanceled, new ProjectEvent(location))
                        .thenApply(ignored -> (Project) null);
            }

            return checkManagementMode(location)
                    .thenCompose(ignored -> readProject(attempt, true))
                    .thenApply(this::registerProject)
                    .handle((project, error) -> loadOutcome(attempt, project, error))
                    .thenCompose(Function.identity());
        });
    }

    private CompletableFuture<Void> checkManagementMode(String location) {
        if (mode == ManagementMode.SINGLE_DOCUMENT && !registry.isEmpty()) {
            return CompletableFuture.failedFuture(new SingleDocumentModeException(location));
        }
        return Futures.done();
    }

    private CompletableFuture<Project> loadOutcome(Attempt attempt, Project project, Throwable error) {
        if (error == null) {
            return dispatcher.dispatch(ProjectListener::onLoaded, new ProjectEvent(project)).thenApply(unused -> {
                LOGGER.info(() -> "Loaded project from '" + project.location() + "'");
                return project;
            });
        }

        Throwable cause = Futures.unwrap(error);
        LOGGER.log(Level.SEVERE, cause, () -> "Failed to load project from '" + attempt.location + "'");
        ProjectErrorEvent failedEvent = new ProjectErrorEvent(attempt.location, null, cause, attempt.validationResult);
        CompletableFuture<Void> notified = dispatcher.dispatch(ProjectListener::onLoadingFailed, failedEvent);
        if (cause instanceof ProjectConfigurationException) {
            return notified.thenCompose(unused -> CompletableFuture.<Project>failedFuture(cause));
        }
        return notified.thenApply(unused -> null);
    }

    // Validates and reads the project at the attempt's location, accumulating the validation results.
    private CompletableFuture<Project> readProject(Attempt attempt, boolean checkCanStartLoading) {
        String location = attempt.location;

        CompletableFuture<Void> canStart = Futures.done();
        if (checkCanStartLoading) {
            LOGGER.finest(() -> "Validating to see if we can load the project from '" + location + "'");
            canStart = Futures.call(() -> validator.canStartLoading(location)).thenAccept(allowed -> {
                if (!Boolean.TRUE.equals(allowed)) {
                    attempt.validationResult = ValidationResult.error(
                            "Project validator informed that project could not be loaded");
                    throw new ProjectException(location, "Cannot load project from '" + location + "'");
                }
            });
        }

        return canStart
                .thenCompose(unused -> Futures.call(() -> validator.validateBeforeLoading(location)))
                .thenCompose(before -> {
                    ValidationResult result = attempt.record(before);
                    if (result.hasErrors()) {
                        throw new ProjectValidationException(location, "Project could not be loaded from '"
                                + location + "', the validator returned errors: " + errorMessages(result), result);
                    }

                    ProjectReader reader = serializerSelector.getReader(location);
                    if (reader == null) {
                        throw new ProjectConfigurationException("No project reader is found for location '"
                                + location + "'");
                    }
                    LOGGER.finest(() -> "Using project reader '" + reader.getClass().getName() + "'");
                    return Futures.call(() -> reader.read(location));
                })
                .thenCompose(project -> {
                    if (project == null) {
                        throw new ProjectException(location, "Project could not be loaded from '" + location + "'");
                    }
                    return Futures.call(() -> validator.validateLoaded(project)).thenApply(loaded -> {
                        ValidationResult result = attempt.record(loaded);
                        if (result.hasErrors()) {
                            throw new ProjectValidationException(location, "Project data was loaded from '"
                                    + location + "', but the validator returned errors: " + errorMessages(result),
                                    result);
                        }
                        return project;
                    });
                });
    }

    private static String errorMessages(ValidationResult result) {
        return result.errors().stream()
                .map(ValidationEvent::getMessage)
                .collect(Collectors.joining("; "));
    }

    /**
     * Saves the active project to its own location.
     *
     * @return A future completing with whether the project was saved
     */
    public CompletableFuture<Boolean> save() {
        return save(null, null);
    }

    /**
     * @param project The project to save to its own location, or null for the active project
     * @return A future completing with whether the project was saved
     */
    public CompletableFuture<Boolean> save(Project project) {
        return save(project, null);
    }

    /**
     * @param project The project to save, or null for the active project
     * @param location The location to save to, or null for the project's location
     * @return A future completing with whether the project was saved
     */
    public CompletableFuture<Boolean> save(Project project, String location) {
        Project target = project != null ? project : registry.active();
        if (target == null) {
            LOGGER.severe("Cannot save, there is no active project");
            return CompletableFuture.completedFuture(false);
        }

        String saveLocation = location == null || location.isBlank() ? target.location() : location;
        savingCounter.incrementAndGet();
        stateTracker.updateState(target.location(), state -> state.setSaving(true));

        return Futures.call(() -> doSave(target, saveLocation)).whenComplete((saved, error) -> {
            stateTracker.updateState(target.location(), state -> state.setSaving(false));
            savingCounter.decrementAndGet();
        });
    }

    private CompletableFuture<Boolean> doSave(Project project, String location) {
        LOGGER.fine(() -> "Saving project '" + project.location() + "' to '" + location + "'");

        ProjectCancelEvent savingEvent = new ProjectCancelEvent(project);
        return dispatcher.dispatch(ProjectListener::onSaving, savingEvent).thenCompose(unused -> {
            if (savingEvent.isCanceled()) {
                LOGGER.fine(() -> "Canceled saving of project to '" + location + "'");
                return dispatcher.dispatch(ProjectListener::onSavingCanceled, new ProjectEvent(project))
                        .thenApply(ignored -> false);
            }

            return Futures.call(() -> {
                ProjectWriter writer = serializerSelector.getWriter(location);
                if (writer == null) {
                    throw new ProjectConfigurationException("No project writer is found for location '"
                            + location + "'");
                }
                LOGGER.finest(() -> "Using project writer '" + writer.getClass().getName() + "'");
                return writer.write(project, location);
            })
                    .handle((written, error) -> saveOutcome(project, location, written, error))
                    .thenCompose(Function.identity());
        });
    }

    private CompletableFuture<Boolean> saveOutcome(Project project, String location, Boolean written, Throwable error) {
        if (error != null) {
            Throwable cause = Futures.unwrap(error);
            LOGGER.log(Level.SEVERE, cause,
                    () -> "Failed to save project '" + project.location() + "' to '" + location + "'");
            ProjectErrorEvent failedEvent = new ProjectErrorEvent(project.location(), project, cause, null);
            CompletableFuture<Void> notified = dispatcher.dispatch(ProjectListener::onSavingFailed, failedEvent);
            if (cause instanceof ProjectConfigurationException) {
                return notified.thenCompose(unused -> CompletableFuture.<Boolean>failedFuture(cause));
            }
            return notified.thenApply(unused -> false);
        }

        if (!Boolean.TRUE.equals(written)) {
            LOGGER.severe(() -> "Writer rejected saving project '" + project.location() + "' to '" + location + "'");
            ProjectErrorEvent failedEvent = new ProjectErrorEvent(project.location(), project, null, null);
            return dispatcher.dispatch(ProjectListener::onSavingFailed, failedEvent).thenApply(unused -> false);
        }

        return dispatcher.dispatch(ProjectListener::onSaved, new ProjectEvent(project)).thenApply(unused -> {
            LOGGER.info(() -> "Saved project '" + project.location() + "' to '" + location + "'");
            return true;
        });
    }

    /**
     * Closes the active project.
     *
     * @return A future completing with whether the project was closed
     */
    public CompletableFuture<Boolean> close() {
        return close(null);
    }

    /**
     * Closes {@code project}, deactivating it first if it is the active project.
     * If the deactivation is canceled, the close is canceled too.
     *
     * <p>Closing a project instance that isn't registered, for example one that
     * was already replaced by a refresh, does nothing.
     *
     * @param project The project to close, or null for the active project
     * @return A future completing with whether the project was closed
     */
    public CompletableFuture<Boolean> close(Project project) {
        Project target = project != null ? project : registry.active();
        if (target == null) {
            return CompletableFuture.completedFuture(false);
        }
        if (!registry.contains(target)) {
            LOGGER.warning(() -> "Unable to close project '" + target.location()
                    + "' because it does not exist in the list of known projects");
            return CompletableFuture.completedFuture(false);
        }

        String location = target.location();
        stateTracker.updateState(location, state -> state.setClosing(true));
        return Futures.call(() -> doClose(target))
                .whenComplete((closed, error) -> stateTracker.updateState(location, state -> state.setClosing(false)));
    }

    private CompletableFuture<Boolean> doClose(Project project) {
        LOGGER.fine(() -> "Closing project '" + project.location() + "'");

        ProjectCancelEvent closingEvent = new ProjectCancelEvent(project);
        return dispatcher.dispatch(ProjectListener::onClosing, closingEvent).thenCompose(unused -> {
            if (closingEvent.isCanceled()) {
                LOGGER.fine(() -> "Canceled closing project '" + project.location() + "'");
                return closingCanceled(project);
            }

            return deactivateIfActive(project).thenCompose(deactivated -> {
                if (!deactivated) {
                    LOGGER.fine(() -> "Deactivation of '" + project.location() + "' was canceled, not closing it");
                    return closingCanceled(project);
                }

                unregisterProject(project);
                return dispatcher.dispatch(ProjectListener::onClosed, new ProjectEvent(project)).thenApply(ignored -> {
                    LOGGER.info(() -> "Closed project '" + project.location() + "'");
                    return true;
                });
            });
        });
    }

    private CompletableFuture<Boolean> closingCanceled(Project project) {
        return dispatcher.dispatch(ProjectListener::onClosingCanceled, new ProjectEvent(project))
                .thenApply(unused -> false);
    }

    /**
     * Refreshes the active project.
     *
     * @return A future completing with whether the project was refreshed
     */
    public CompletableFuture<Boolean> refresh() {
        return refresh(null);
    }

    /**
     * Reads {@code project} again from its location, replacing it in the registry.
     * If it was the active project, the new instance becomes the active project.
     *
     * <p>The old instance is unregistered before reading. If reading or
     * validation fails, no project is registered at the location afterwards.
     * Refreshing a project instance that isn't registered does nothing.
     *
     * @param project The project to refresh, or null for the active project
     * @return A future completing with whether the project was refreshed
     */
    public CompletableFuture<Boolean> refresh(Project project) {
        Project target = project != null ? project : registry.active();
        if (target == null) {
            return CompletableFuture.completedFuture(false);
        }
        if (!registry.contains(target)) {
            LOGGER.warning(() -> "Unable to refresh project '" + target.location()
                    + "' because it does not exist in the list of known projects");
            return CompletableFuture.completedFuture(false);
        }

        Attempt attempt = new Attempt(target.location());
        stateTracker.updateState(attempt.location, state -> state.setRefreshing(true));
        return Futures.call(() -> doRefresh(target, attempt)).whenComplete((refreshed, error) -> {
            stateTracker.updateState(attempt.location, state -> state.setRefreshing(false));
            if (attempt.wasActive) {
                stateTracker.setRefreshingActiveProject(false);
            }
        });
    }

    private CompletableFuture<Boolean> doRefresh(Project project, Attempt attempt) {
        String location = attempt.location;
        LOGGER.fine(() -> "Refreshing project from '" + location + "'");

        ProjectCancelEvent refreshingEvent = new ProjectCancelEvent(project);
        return dispatcher.dispatch(ProjectListener::onRefreshing, refreshingEvent).thenCompose(unused -> {
            if (refreshingEvent.isCanceled()) {
                LOGGER.fine(() -> "Canceled refreshing project from '" + location + "'");
                return refreshingCanceled(project);
            }

            attempt.wasActive = isActive(project);
            if (attempt.wasActive) {
                stateTracker.setRefreshingActiveProject(true);
            }

            return deactivateIfActive(project).thenCompose(deactivated -> {
                if (!deactivated) {
                    LOGGER.fine(() -> "Deactivation of '" + location + "' was canceled, not refreshing it");
                    return refreshingCanceled(project);
                }

                unregisterProject(project);
                return readProject(attempt, false)
                        .thenApply(this::registerProject)
                        .handle((reloaded, error) -> refreshOutcome(project, attempt, reloaded, error))
                        .thenCompose(Function.identity());
            });
        });
    }

    private CompletableFuture<Boolean> refreshingCanceled(Project project) {
        return dispatcher.dispatch(ProjectListener::onRefreshingCanceled, new ProjectEvent(project))
                .thenApply(unused -> false);
    }

    private CompletableFuture<Boolean> refreshOutcome(Project old, Attempt attempt, Project reloaded, Throwable error) {
        String location = attempt.location;
        if (error != null) {
            Throwable cause = Futures.unwrap(error);
            LOGGER.log(Level.SEVERE, cause, () -> "Failed to refresh project from '" + location + "'");
            ProjectException wrapped = new ProjectException(location,
                    "Failed to load project from location '" + location + "' while refreshing.", cause);
            ProjectErrorEvent failedEvent = new ProjectErrorEvent(location, old, wrapped, attempt.validationResult);
            CompletableFuture<Void> notified = dispatcher.dispatch(ProjectListener::onRefreshingFailed, failedEvent);
            if (cause instanceof ProjectConfigurationException) {
                return notified.thenCompose(unused -> CompletableFuture.<Boolean>failedFuture(cause));
            }
            return notified.thenApply(unused -> false);
        }

        return dispatcher.dispatch(ProjectListener::onRefreshed, new ProjectEvent(reloaded))
                .thenCompose(unused -> {
                    if (attempt.wasActive) {
                        return setActiveProject(reloaded);
                    }
                    return CompletableFuture.completedFuture(true);
                })
                .thenApply(unused -> {
                    LOGGER.info(() -> "Refreshed project from '" + location + "'");
                    return true;
                });
    }

    /**
     * Changes the active project.
     *
     * <p>Activating a project that isn't registered, or that is already active,
     * does nothing. Passing null deactivates the active project, if there is one.
     *
     * @param project The project to activate, or null to deactivate
     * @return A future completing with whether the active project changed
     */
    public CompletableFuture<Boolean> setActiveProject(Project project) {
        return activateLock.withLock(() -> project == null ? deactivate() : activate(project));
    }

    private CompletableFuture<Boolean> activate(Project project) {
        String location = project.location();
        if (!registry.contains(project)) {
            LOGGER.warning(() -> "Unable to activate project '" + location
                    + "' because it does not exist in the list of known projects");
            return CompletableFuture.completedFuture(false);
        }

        Project active = registry.active();
        if (active != null && Locations.same(active.location(), location)) {
            LOGGER.fine(() -> "The project '" + location + "' is already active, no need to activate it again");
            return CompletableFuture.completedFuture(false);
        }

        LOGGER.info(() -> "Activating project '" + location + "'");
        stateTracker.updateState(location, state -> state.setActivating(true));

        ProjectUpdatingCancelEvent activationEvent = new ProjectUpdatingCancelEvent(active, project);
        return dispatcher.dispatch(ProjectListener::onActivation, activationEvent).thenCompose(unused -> {
            if (activationEvent.isCanceled()) {
                LOGGER.info(() -> "Activating project '" + location + "' was canceled");
                return dispatcher.dispatch(ProjectListener::onActivationCanceled, new ProjectEvent(project))
                        .thenApply(ignored -> false);
            }

            try {
                registry.setActive(project);
            } catch (IllegalStateException e) {
                LOGGER.log(Level.SEVERE, e, () -> "Failed to activate project '" + location + "'");
                ProjectErrorEvent failedEvent = new ProjectErrorEvent(location, project, e, null);
                return dispatcher.dispatch(ProjectListener::onActivationFailed, failedEvent)
                        .thenApply(ignored -> false);
            }

            return dispatcher.dispatch(ProjectListener::onActivated, new ProjectUpdatedEvent(active, project))
                    .thenApply(ignored -> true);
        }).whenComplete((activated, error) -> stateTracker.updateState(location, state -> state.setActivating(false)));
    }

    private CompletableFuture<Boolean> deactivate() {
        Project active = registry.active();
        if (active == null) {
            return CompletableFuture.completedFuture(false);
        }

        String location = active.location();
        LOGGER.info(() -> "Deactivating project '" + location + "'");
        stateTracker.updateState(location, state -> state.setDeactivating(true));

        ProjectUpdatingCancelEvent activationEvent = new ProjectUpdatingCancelEvent(active, null);
        return dispatcher.dispatch(ProjectListener::onActivation, activationEvent).thenCompose(unused -> {
            if (activationEvent.isCanceled()) {
                LOGGER.info(() -> "Deactivating project '" + location + "' was canceled");
                return dispatcher.dispatch(ProjectListener::onActivationCanceled, new ProjectEvent(active))
                        .thenApply(ignored -> false);
            }

            registry.setActive(null);
            return dispatcher.dispatch(ProjectListener::onActivated, new ProjectUpdatedEvent(active, null))
                    .thenApply(ignored -> true);
        }).whenComplete((deactivated, error) -> stateTracker.updateState(location,
                state -> state.setDeactivating(false)));
    }

    // Completes with whether the project is no longer active.
    private CompletableFuture<Boolean> deactivateIfActive(Project project) {
        if (!isActive(project)) {
            return CompletableFuture.completedFuture(true);
        }
        return setActiveProject(null).thenApply(deactivated -> deactivated || !isActive(project));
    }

    private boolean isActive(Project project) {
        Project active = registry.active();
        return active != null && Locations.same(active.location(), project.location());
    }

    private Project registerProject(Project project) {
        boolean bound = initializeRefresher(project.location());
        try {
            if (mode == ManagementMode.SINGLE_DOCUMENT) {
                registry.registerOnly(project);
            } else {
                registry.register(project);
            }
        } catch (SingleDocumentModeException e) {
            if (bound) {
                releaseRefresher(project.location());
            }
            throw e;
        }
        LOGGER.finest(() -> "Registered project '" + project.location() + "'");
        return project;
    }

    private void unregisterProject(Project project) {
        registry.unregister(project.location());
        releaseRefresher(project.location());
        LOGGER.finest(() -> "Unregistered project '" + project.location() + "'");
    }

    private boolean initializeRefresher(String location) {
        String key = Locations.normalize(location);
        if (refreshers.containsKey(key)) {
            return false;
        }

        ProjectRefresher refresher = refresherSelector.getRefresher(location);
        if (refresher == null) {
            return false;
        }

        LOGGER.finest(() -> "Subscribing to project refresher '" + refresher.getClass().getName() + "'");
        refresher.addUpdateListener(refresherListener);
        try {
            refresher.subscribe();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, e, () -> "Failed to subscribe to project refresher for '" + location + "'");
            refresher.removeUpdateListener(refresherListener);
            throw e;
        }
        refreshers.put(key, refresher);
        return true;
    }

    private void releaseRefresher(String location) {
        ProjectRefresher refresher = refreshers.remove(Locations.normalize(location));
        if (refresher == null) {
            return;
        }

        LOGGER.finest(() -> "Unsubscribing from project refresher '" + refresher.getClass().getName() + "'");
        try {
            refresher.unsubscribe();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, e, () -> "Failed to unsubscribe from project refresher for '" + location + "'");
        }
        refresher.removeUpdateListener(refresherListener);
    }

    private void onRefresherUpdated(String location) {
        // The manager itself is the source of changes made while loading or saving
        if (loading || savingCounter.get() > 0) {
            LOGGER.fine(() -> "Ignoring update of '" + location + "' while a project is being loaded or saved");
            return;
        }

        Project project = registry.get(location);
        if (project == null) {
            return;
        }

        LOGGER.fine(() -> "Project at '" + location + "' was modified externally");
        dispatcher.dispatch(ProjectListener::onRefreshRequired, new ProjectEvent(project))
                .thenCompose(unused -> refreshOnExternalChange
                        ? refresh(project)
                        : CompletableFuture.<Boolean>completedFuture(false))
                .whenComplete((refreshed, error) -> {
                    if (error != null) {
                        LOGGER.log(Level.SEVERE, Futures.unwrap(error),
                                () -> "Failed to refresh project at '" + location + "' after an external change");
                    }
                });
    }

    // Mutable details of a single load or refresh, filled in as it progresses.
    private static final class Attempt {
        private volatile String location;
        private volatile ValidationResult validationResult;
        private volatile boolean wasActive;

        private Attempt(String location) {
            this.location = location;
        }

        private synchronized ValidationResult record(ValidationResult result) {
            if (result != null) {
                validationResult = validationResult == null ? result : validationResult.merge(result);
            }
            return validationResult == null ? ValidationResult.empty() : validationResult;
        }
    }

    /**
     * Builds a {@link ProjectManager}. Only the serializer selector is required.
     */
    public static final class Builder {
        private ProjectValidator validator = ProjectValidator.acceptAll();
        private ProjectUpgrader upgrader = ProjectUpgrader.none();
        private ProjectSerializerSelector serializerSelector;
        private ProjectRefresherSelector refresherSelector = ProjectRefresherSelector.none();
        private ProjectInitializer initializer = ProjectInitializer.empty();
        private ManagementMode mode = ManagementMode.MULTIPLE_DOCUMENTS;
        private boolean refreshOnExternalChange = true;

        private Builder() {
        }

        public Builder setValidator(ProjectValidator validator) {
            this.validator = Objects.requireNonNull(validator);
            return this;
        }

        public Builder setUpgrader(ProjectUpgrader upgrader) {
            this.upgrader = Objects.requireNonNull(upgrader);
            return this;
        }

        public Builder setSerializerSelector(ProjectSerializerSelector serializerSelector) {
            this.serializerSelector = Objects.requireNonNull(serializerSelector);
            return this;
        }

        public Builder setRefresherSelector(ProjectRefresherSelector refresherSelector) {
            this.refresherSelector = Objects.requireNonNull(refresherSelector);
            return this;
        }

        public Builder setInitializer(ProjectInitializer initializer) {
            this.initializer = Objects.requireNonNull(initializer);
            return this;
        }

        public Builder setMode(ManagementMode mode) {
            this.mode = Objects.requireNonNull(mode);
            return this;
        }

        public Builder setRefreshOnExternalChange(boolean refreshOnExternalChange) {
            this.refreshOnExternalChange = refreshOnExternalChange;
            return this;
        }

        /**
         * Applies the mode, initial locations and refresh behavior of {@code config}.
         *
         * @param config The config to apply
         * @return The builder
         */
        public Builder setConfig(ProjectManagementConfig config) {
            this.mode = config.mode();
            this.initializer = config;
            this.refreshOnExternalChange = config.refreshOnExternalChange();
            return this;
        }

        public ProjectManager build() {
            return new ProjectManager(this);
        }
    }
}
