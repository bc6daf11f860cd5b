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

package com.amazonaws.materialmanagement;

/**
 * Describes the data key requirements of an algorithm suite. Every keyring family is bound to one
 * implementation of this interface, and materials carry exactly one suite for their lifetime.
 */
public interface AlgorithmSuite {

    /**
     * The name of the algorithm suite.
     */
    String name();

    /**
     * The length, in bytes, of the plaintext data key required by this suite.
     */
    int getDataKeyLength();

    /**
     * The JCA algorithm name of the plaintext data key, e.g. {@code AES}.
     */
    String getDataKeyAlgo();

    /**
     * The JCA signature algorithm used for trailing signatures, or {@code null} if the suite is unsigned.
     */
    String getTrailingSignatureAlgo();
}
