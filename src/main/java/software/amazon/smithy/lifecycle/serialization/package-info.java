/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * Reading and writing of projects.
 */
@SmithyInternalApi
package software.amazon.smithy.lifecycle.serialization;

import software.amazon.smithy.utils.SmithyInternalApi;
