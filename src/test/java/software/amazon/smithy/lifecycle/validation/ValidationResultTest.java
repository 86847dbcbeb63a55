/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.validation;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

import java.util.List;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.model.validation.Severity;
import software.amazon.smithy.model.validation.ValidationEvent;

public class ValidationResultTest {
    private static ValidationEvent warning(String message) {
        return ValidationEvent.builder()
                .id("Custom")
                .severity(Severity.WARNING)
                .message(message)
                .build();
    }

    @Test
    public void warningsDoNotFail() {
        ValidationResult result = ValidationResult.of(List.of(warning("Deprecated format")));

        assertThat(result.hasErrors(), is(false));
        assertThat(result.errors(), empty());
        assertThat(result.events(), hasSize(1));
    }

    @Test
    public void dangerEventsFail() {
        ValidationEvent danger = ValidationEvent.builder()
                .id("Custom")
                .severity(Severity.DANGER)
                .message("Risky")
                .build();

        assertThat(ValidationResult.of(List.of(danger)).hasErrors(), is(true));
    }

    @Test
    public void mergesEvents() {
        ValidationResult merged = ValidationResult.of(List.of(warning("First")))
                .merge(ValidationResult.error("Second"))
                .merge(ValidationResult.empty());

        assertThat(merged.events(), hasSize(2));
        assertThat(merged.errors(), hasSize(1));
        assertThat(merged.hasErrors(), is(true));
        assertThat(merged.toString(), containsString("Second"));
    }

    @Test
    public void emptyResultsAreShared() {
        assertThat(ValidationResult.of(List.of()), sameInstance(ValidationResult.empty()));
        assertThat(ValidationResult.empty().merge(ValidationResult.empty()), sameInstance(ValidationResult.empty()));
    }
}
