/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ProjectStateTrackerTest {
    @Test
    public void returnsCopies() {
        ProjectStateTracker tracker = new ProjectStateTracker();
        tracker.updateState("a.proj", state -> state.setSaving(true));

        ProjectState state = tracker.getState("A.PROJ");
        state.setSaving(false);

        assertThat(tracker.getState("a.proj").isSaving(), is(true));
        assertThat(tracker.getState("b.proj").isIdle(), is(true));
    }

    @Test
    public void notifiesListenersOfUpdates() {
        ProjectStateTracker tracker = new ProjectStateTracker();
        List<ProjectState> updates = new ArrayList<>();
        List<Boolean> refreshing = new ArrayList<>();
        ProjectStateListener listener = new ProjectStateListener() {
            @Override
            public void onStateUpdated(ProjectState state) {
                updates.add(state);
            }

            @Override
            public void onRefreshingActiveProjectUpdated(boolean refreshingActiveProject) {
                refreshing.add(refreshingActiveProject);
            }
        };
        tracker.addListener(listener);

        tracker.updateState("a.proj", state -> state.setLoading(true));
        tracker.updateState("a.proj", state -> state.setLoading(false));
        tracker.setRefreshingActiveProject(true);
        tracker.setRefreshingActiveProject(true);
        tracker.setRefreshingActiveProject(false);
        tracker.removeListener(listener);
        tracker.updateState("a.proj", state -> state.setClosing(true));

        assertThat(updates, hasSize(2));
        assertThat(updates.get(0).isLoading(), is(true));
        assertThat(updates.get(1).isIdle(), is(true));
        assertThat(refreshing, contains(true, false));
    }
}
