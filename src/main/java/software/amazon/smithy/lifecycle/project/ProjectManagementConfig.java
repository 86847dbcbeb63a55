/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.lifecycle.project;

import java.nio.file.Path;
import java.util.List;
import software.amazon.smithy.model.node.ExpectationNotMetException;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.node.StringNode;
import software.amazon.smithy.utils.IoUtils;

/**
 * Configuration of a {@link ProjectManager}, typically loaded from a JSON file like:
 *
 * <pre>{@code
 * {
 *     "mode": "multipleDocuments",
 *     "initialLocations": ["a.proj", "b.proj"],
 *     "refreshOnExternalChange": true
 * }
 * }</pre>
 *
 * @param mode The management mode
 * @param initialLocations The locations to load when initializing
 * @param refreshOnExternalChange Whether projects modified externally are refreshed automatically
 */
public record ProjectManagementConfig(
        ManagementMode mode,
        List<String> initialLocations,
        boolean refreshOnExternalChange
) implements ProjectInitializer {
    private static final List<String> PROPERTIES = List.of("mode", "initialLocations", "refreshOnExternalChange");

    public ProjectManagementConfig {
        initialLocations = List.copyOf(initialLocations);
    }

    /**
     * @return The config used when nothing is configured
     */
    public static ProjectManagementConfig defaults() {
        return new ProjectManagementConfig(ManagementMode.MULTIPLE_DOCUMENTS, List.of(), true);
    }

    /**
     * @param path The path of the JSON config file
     * @return The loaded config
     * @throws ExpectationNotMetException If the file isn't a valid config
     */
    public static ProjectManagementConfig load(Path path) {
        return fromNode(Node.parse(IoUtils.readUtf8File(path), path.toString()));
    }

    /**
     * @param node The node to read the config from
     * @return The read config, with defaults for missing members
     * @throws ExpectationNotMetException If the node isn't a valid config
     */
    public static ProjectManagementConfig fromNode(Node node) {
        ObjectNode objectNode = node.expectObjectNode();
        objectNode.expectNoAdditionalProperties(PROPERTIES);

        ManagementMode mode = ManagementMode.MULTIPLE_DOCUMENTS;
        StringNode modeNode = objectNode.getStringMember("mode").orElse(null);
        if (modeNode != null) {
            mode = ManagementMode.fromValue(modeNode.getValue())
                    .orElseThrow(() -> new ExpectationNotMetException("Expected mode to be one of "
                            + ManagementMode.ALL_VALUES + ", but found '" + modeNode.getValue() + "'", modeNode));
        }

        List<String> initialLocations = objectNode.getArrayMember("initialLocations")
                .map(arrayNode -> arrayNode.getElementsAs(StringNode.class).stream()
                        .map(StringNode::getValue)
                        .toList())
                .orElse(List.of());

        boolean refreshOnExternalChange = objectNode.getBooleanMemberOrDefault("refreshOnExternalChange", true);

        return new ProjectManagementConfig(mode, initialLocations, refreshOnExternalChange);
    }
}
