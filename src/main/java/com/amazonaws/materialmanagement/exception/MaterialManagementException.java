/*
 * Copyright 2019 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"). You may not use this file except
 * in compliance with the License. A copy of the License is located at
 *
 * http://aws.amazon.com/apache2.0
 *
 * or in the "license" file accompanying this file. This file is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations under the License.
 */

package com.amazonaws.materialmanagement.exception;

/**
 * Base class for all exceptions raised by keyrings and the materials they operate on.
 */
public class MaterialManagementException extends RuntimeException {

    private static final long serialVersionUID = -1L;

    public MaterialManagementException() {
        super();
    }

    public MaterialManagementException(final String message) {
        super(message);
    }

    public MaterialManagementException(final Throwable cause) {
        super(cause);
    }

    public MaterialManagementException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
