/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * Events emitted by the project manager, and the listeners receiving them.
 */
@SmithyInternalApi
package software.amazon.smithy.lifecycle.event;

import software.amazon.smithy.utils.SmithyInternalApi;
