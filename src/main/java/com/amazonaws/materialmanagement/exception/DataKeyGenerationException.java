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
 * This exception is thrown when encryption materials leave a keyring without the plaintext data key that
 * the following keyrings require.
 */
public class DataKeyGenerationException extends MaterialManagementException {

    private static final long serialVersionUID = -1L;

    public DataKeyGenerationException() {
        super();
    }

    public DataKeyGenerationException(final String message) {
        super(message);
    }

    public DataKeyGenerationException(final Throwable cause) {
        super(cause);
    }

    public DataKeyGenerationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
