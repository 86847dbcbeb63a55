/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * Listeners applying policies to the project manager they listen to.
 */
@SmithyInternalApi
package software.amazon.smithy.lifecycle.watcher;

import software.amazon.smithy.utils.SmithyInternalApi;
