/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * Future utilities.
 */
@SmithyInternalApi
package software.amazon.smithy.lifecycle.util;

import software.amazon.smithy.utils.SmithyInternalApi;
