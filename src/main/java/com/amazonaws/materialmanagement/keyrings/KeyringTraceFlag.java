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

package com.amazonaws.materialmanagement.keyrings;

/**
 * What a keyring did to the data key held by a set of materials. Every change a keyring makes
 * to {@code EncryptionMaterials} or {@code DecryptionMaterials} is recorded in their
 * {@link KeyringTrace} with one of these flags.
 */
public enum KeyringTraceFlag {

    /**
     * The keyring populated the plaintext data key of encryption materials that had none.
     */
    GENERATED_DATA_KEY,

    /**
     * The keyring appended an encrypted data key wrapping the plaintext data key.
     */
    ENCRYPTED_DATA_KEY,

    /**
     * The keyring unwrapped one of the encrypted data keys into the plaintext data key of
     * decryption materials.
     */
    DECRYPTED_DATA_KEY
}
