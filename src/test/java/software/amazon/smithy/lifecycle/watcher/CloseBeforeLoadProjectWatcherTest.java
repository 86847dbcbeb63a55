/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.watcher;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.lifecycle.project.Project;
import software.amazon.smithy.lifecycle.project.ProjectManager;
import software.amazon.smithy.lifecycle.project.RecordingListener;
import software.amazon.smithy.lifecycle.project.StubSerializer;
import software.amazon.smithy.lifecycle.serialization.ProjectSerializerSelector;

public class CloseBeforeLoadProjectWatcherTest {
    private ProjectManager manager;
    private RecordingListener recorder;

    @BeforeEach
    public void setup() {
        StubSerializer serializer = new StubSerializer();
        manager = ProjectManager.builder()
                .setSerializerSelector(ProjectSerializerSelector.of(serializer, serializer))
                .build();
        new CloseBeforeLoadProjectWatcher(manager);
        recorder = new RecordingListener();
        manager.addListener(recorder);
    }

    private List<String> locations() {
        return manager.projects().stream().map(Project::location).toList();
    }

    @Test
    public void closesActiveProjectBeforeLoading() {
        manager.load("a.proj").join();
        recorder.clear();

        assertThat(manager.load("b.proj").join(), is(true));

        assertThat(locations(), contains("b.proj"));
        assertThat(manager.activeProject().location(), equalTo("b.proj"));
        assertThat(recorder.events, contains(
                "Closing", "Deactivation", "Deactivated", "Closed", "Loading", "Loaded", "Activation", "Activated"));
    }

    @Test
    public void cancelsLoadingWhenActiveProjectStaysOpen() {
        manager.load("a.proj").join();
        recorder.clear();
        recorder.cancel.add("Closing");

        assertThat(manager.load("b.proj").join(), is(false));

        assertThat(locations(), contains("a.proj"));
        assertThat(manager.activeProject().location(), equalTo("a.proj"));
        assertThat(recorder.events, contains("Closing", "ClosingCanceled", "Loading", "LoadingCanceled"));
    }

    @Test
    public void keepsInactiveProjects() {
        manager.loadInactive("a.proj").join();

        assertThat(manager.loadInactive("b.proj").join(), is(true));

        assertThat(locations(), contains("a.proj", "b.proj"));
    }

    @Test
    public void stopsClosingOnceDetached() {
        ProjectManager other = ProjectManager.builder().setSerializerSelector(new StubSerializer()).build();
        CloseBeforeLoadProjectWatcher watcher = new CloseBeforeLoadProjectWatcher(other);
        other.load("a.proj").join();

        watcher.detach();
        other.load("b.proj").join();

        assertThat(other.projects().stream().map(Project::location).toList(), contains("a.proj", "b.proj"));
    }
}
