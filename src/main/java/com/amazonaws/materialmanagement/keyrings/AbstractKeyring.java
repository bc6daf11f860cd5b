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
import com.amazonaws.materialmanagement.exception.KeyringContractException;
import com.amazonaws.materialmanagement.model.DecryptionMaterials;
import com.amazonaws.materialmanagement.model.EncryptionMaterials;

import java.util.List;

import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.Validate.isTrue;
import static org.apache.commons.lang3.Validate.noNullElements;

/**
 * Base class for keyrings that enforces the keyring contract around the keyring specific
 * {@link #doEncrypt} and {@link #doDecrypt} implementations: the materials must belong to
 * this keyring's family and the instance passed in is the instance handed back.
 *
 * @param <S> The algorithm suite type of the keyring family.
 */
public abstract class AbstractKeyring<S extends AlgorithmSuite> implements Keyring<S> {

    private final KeyringFamily<S> family;

    protected AbstractKeyring(final KeyringFamily<S> family) {
        this.family = requireNonNull(family, "family is required");
    }

    @Override
    public final KeyringFamily<S> getFamily() {
        return family;
    }

    @Override
    public final EncryptionMaterials<S> onEncrypt(EncryptionMaterials<S> encryptionMaterials) {
        requireNonNull(encryptionMaterials, "encryptionMaterials are required");
        requireSupportedSuite(encryptionMaterials.getAlgorithmSuite());

        return requireSameInstance(encryptionMaterials, doEncrypt(encryptionMaterials), "EncryptionMaterials");
    }

    @Override
    public final DecryptionMaterials<S> onDecrypt(DecryptionMaterials<S> decryptionMaterials,
                                                  List<? extends EncryptedDataKey> encryptedDataKeys) {
        requireNonNull(decryptionMaterials, "decryptionMaterials are required");
        requireNonNull(encryptedDataKeys, "encryptedDataKeys are required");
        noNullElements(encryptedDataKeys, "encryptedDataKeys must not contain null");
        requireSupportedSuite(decryptionMaterials.getAlgorithmSuite());

        return requireSameInstance(decryptionMaterials, doDecrypt(decryptionMaterials, encryptedDataKeys), "DecryptionMaterials");
    }

    /**
     * Adds a plaintext data key and/or encrypted data keys to the given materials.
     *
     * @param encryptionMaterials Materials to modify in place.
     * @return The given materials instance.
     */
    protected abstract EncryptionMaterials<S> doEncrypt(EncryptionMaterials<S> encryptionMaterials);

    /**
     * Attempts to populate the plaintext data key of the given materials from one of the encrypted data keys.
     *
     * @param decryptionMaterials Materials to modify in place.
     * @param encryptedDataKeys   The encrypted data keys of the message, never null.
     * @return The given materials instance.
     */
    protected abstract DecryptionMaterials<S> doDecrypt(DecryptionMaterials<S> decryptionMaterials,
                                                       List<? extends EncryptedDataKey> encryptedDataKeys);

    /**
     * Returns {@code expected} if {@code actual} is the very same instance.
     *
     * @throws KeyringContractException if a keyring handed back a different materials instance.
     */
    static <T> T requireSameInstance(T expected, T actual, String materialsType) {
        if (expected != actual) {
            throw new KeyringContractException("New " + materialsType + " instances can not be created.");
        }
        return expected;
    }

    private void requireSupportedSuite(AlgorithmSuite algorithmSuite) {
        isTrue(family.supports(algorithmSuite),
                "Algorithm suite %s is not supported by keyring family %s", algorithmSuite, family.getName());
    }
}
