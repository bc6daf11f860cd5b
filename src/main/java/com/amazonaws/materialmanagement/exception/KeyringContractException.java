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
 * This exception is thrown when a keyring violates the keyring contract, for example by returning a new
 * materials instance instead of the one it was given.
 */
public class KeyringContractException extends MaterialManagementException {

    private static final long serialVersionUID = -1L;

    public KeyringContractException() {
        super();
    }

    public KeyringContractException(final String message) {
        super(message);
    }

    public KeyringContractException(final Throwable cause) {
        super(cause);
    }

    public KeyringContractException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
