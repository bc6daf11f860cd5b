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
 * Algorithm suites of the JCE keyring family. Only the data key and signature descriptors are
 * carried here; the content encryption itself happens outside of material management.
 */
public enum CryptoAlgorithm implements AlgorithmSuite {
    ALG_AES_128_GCM_IV12_TAG16_NO_KDF(16, "AES", null),
    ALG_AES_256_GCM_IV12_TAG16_HKDF_SHA256(32, "AES", null),
    ALG_AES_256_GCM_IV12_TAG16_HKDF_SHA384_ECDSA_P384(32, "AES", "SHA384withECDSA");

    private final int dataKeyLength;
    private final String dataKeyAlgo;
    private final String trailingSignatureAlgo;

    CryptoAlgorithm(final int dataKeyLength, final String dataKeyAlgo, final String trailingSignatureAlgo) {
        this.dataKeyLength = dataKeyLength;
        this.dataKeyAlgo = dataKeyAlgo;
        this.trailingSignatureAlgo = trailingSignatureAlgo;
    }

    @Override
    public int getDataKeyLength() {
        return dataKeyLength;
    }

    @Override
    public String getDataKeyAlgo() {
        return dataKeyAlgo;
    }

    @Override
    public String getTrailingSignatureAlgo() {
        return trailingSignatureAlgo;
    }
}
