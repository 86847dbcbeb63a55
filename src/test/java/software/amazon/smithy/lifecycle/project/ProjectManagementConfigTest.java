/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.URISyntaxException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.model.node.ExpectationNotMetException;
import software.amazon.smithy.model.node.Node;

public class ProjectManagementConfigTest {
    @Test
    public void loadsAllMembers() {
        ProjectManagementConfig config = ProjectManagementConfig.load(resource("full-config.json"));

        assertThat(config.mode(), is(ManagementMode.SINGLE_DOCUMENT));
        assertThat(config.initialLocations(), contains("a.proj", "b.proj"));
        assertThat(config.refreshOnExternalChange(), is(false));
    }

    @Test
    public void defaultsMissingMembers() {
        ProjectManagementConfig config = ProjectManagementConfig.load(resource("empty-config.json"));

        assertThat(config, is(ProjectManagementConfig.defaults()));
        assertThat(config.initialLocations(), empty());
    }

    @Test
    public void rejectsUnknownMode() {
        ExpectationNotMetException e = assertThrows(ExpectationNotMetException.class,
                () -> ProjectManagementConfig.load(resource("invalid-mode-config.json")));

        assertThat(e.getMessage(), containsString("manyDocuments"));
    }

    @Test
    public void rejectsUnknownMembers() {
        assertThrows(ExpectationNotMetException.class,
                () -> ProjectManagementConfig.load(resource("unknown-member-config.json")));
    }

    @Test
    public void rejectsWrongTypes() {
        Node node = Node.parse("{\"initialLocations\": \"a.proj\"}");

        assertThrows(ExpectationNotMetException.class, () -> ProjectManagementConfig.fromNode(node));
    }

    @Test
    public void modeIsCaseInsensitive() {
        ProjectManagementConfig config = ProjectManagementConfig.fromNode(Node.parse("{\"mode\": \"SingleDocument\"}"));

        assertThat(config.mode(), is(ManagementMode.SINGLE_DOCUMENT));
    }

    private Path resource(String name) {
        try {
            return Path.of(getClass().getResource(name).toURI());
        } catch (URISyntaxException e) {
            throw new RuntimeException(e);
        }
    }
}
