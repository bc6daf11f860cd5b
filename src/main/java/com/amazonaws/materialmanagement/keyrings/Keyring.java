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

import com.amazonaws.materialmanagement.AlgorithmSuite;
import com.amazonaws.materialmanagement.EncryptedDataKey;
import com.amazonaws.materialmanagement.model.DecryptionMaterials;
import com.amazonaws.materialmanagement.model.EncryptionMaterials;

import java.util.List;

/**
 * Keyrings are responsible for the generation, encryption, and decryption of data keys.
 * <p>
 * A keyring modifies the materials it is given in place and returns that same instance.
 * It must never return a new materials instance, remove encrypted data keys, or replace
 * a plaintext data key that is already present. Any encryption context a keyring needs
 * is read from the materials.
 *
 * @param <S> The algorithm suite type shared by every keyring of the same {@link KeyringFamily}.
 */
public interface Keyring<S extends AlgorithmSuite> {

    /**
     * The capability family this keyring belongs to. Keyrings can only be combined with
     * keyrings of the same family.
     */
    KeyringFamily<S> getFamily();

    /**
     * Attempt to encrypt either the given data key (if present) or one that may be generated
     *
     * @param encryptionMaterials Materials needed for encryption that the keyring may modify.
     * @return The same materials instance.
     */
    EncryptionMaterials<S> onEncrypt(EncryptionMaterials<S> encryptionMaterials);

    /**
     * Attempt to decrypt the encrypted data keys
     *
     * @param decryptionMaterials Materials needed for decryption that the keyring may modify.
     * @param encryptedDataKeys   List of encrypted data keys.
     * @return The same materials instance.
     */
    DecryptionMaterials<S> onDecrypt(DecryptionMaterials<S> decryptionMaterials, List<? extends EncryptedDataKey> encryptedDataKeys);

}
