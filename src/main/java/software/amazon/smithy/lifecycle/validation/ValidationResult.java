/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import software.amazon.smithy.model.validation.Severity;
import software.amazon.smithy.model.validation.ValidationEvent;

/**
 * The outcome of validating a project location or a loaded project.
 *
 * <p>Events with a severity of {@link Severity#ERROR} or {@link Severity#DANGER}
 * make the result fail.
 */
public final class ValidationResult {
    private static final String EVENT_ID = "ProjectValidation";
    private static final ValidationResult EMPTY = new ValidationResult(List.of());

    private final List<ValidationEvent> events;

    private ValidationResult(List<ValidationEvent> events) {
        this.events = events;
    }

    /**
     * @return A result without any events
     */
    public static ValidationResult empty() {
        return EMPTY;
    }

    /**
     * @param events The events of the result
     * @return A result containing {@code events}
     */
    public static ValidationResult of(List<ValidationEvent> events) {
        return events.isEmpty() ? EMPTY : new ValidationResult(List.copyOf(events));
    }

    /**
     * @param message The error message
     * @return A failed result with a single error event
     */
    public static ValidationResult error(String message) {
        return of(List.of(event(Severity.ERROR, message)));
    }

    /**
     * @param other The result to combine with
     * @return A result with the events of both results
     */
    public ValidationResult merge(ValidationResult other) {
        if (other.events.isEmpty()) {
            return this;
        }
        List<ValidationEvent> merged = new ArrayList<>(events);
        merged.addAll(other.events);
        return of(merged);
    }

    /**
     * @return All events of the result
     */
    public List<ValidationEvent> events() {
        return events;
    }

    /**
     * @return The events that make the result fail
     */
    public List<ValidationEvent> errors() {
        return events.stream()
                .filter(ValidationResult::isError)
                .toList();
    }

    /**
     * @return Whether any event makes the result fail
     */
    public boolean hasErrors() {
        return events.stream().anyMatch(ValidationResult::isError);
    }

    @Override
    public String toString() {
        return events.stream()
                .map(ValidationEvent::toString)
                .collect(Collectors.joining(System.lineSeparator()));
    }

    private static boolean isError(ValidationEvent event) {
        return event.getSeverity() == Severity.ERROR || event.getSeverity() == Severity.DANGER;
    }

    private static ValidationEvent event(Severity severity, String message) {
        return ValidationEvent.builder()
                .id(EVENT_ID)
                .severity(severity)
                .message(message)
                .build();
    }
}
