/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * Notifications of projects modified outside of the project manager.
 */
@SmithyInternalApi
package software.amazon.smithy.lifecycle.refresh;

import software.amazon.smithy.utils.SmithyInternalApi;
