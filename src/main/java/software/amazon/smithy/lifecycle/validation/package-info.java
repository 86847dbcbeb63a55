/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * Validation of project locations and loaded projects.
 */
@SmithyInternalApi
package software.amazon.smithy.lifecycle.validation;

import software.amazon.smithy.utils.SmithyInternalApi;
