/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * The project manager, its registry of loaded projects and the per-location state.
 */
@SmithyInternalApi
package software.amazon.smithy.lifecycle.project;

import software.amazon.smithy.utils.SmithyInternalApi;
