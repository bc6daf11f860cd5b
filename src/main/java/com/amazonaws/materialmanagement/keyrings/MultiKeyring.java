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
import com.amazonaws.materialmanagement.exception.DataKeyGenerationException;
import com.amazonaws.materialmanagement.exception.KeyringConfigurationException;
import com.amazonaws.materialmanagement.model.DecryptionMaterials;
import com.amazonaws.materialmanagement.model.EncryptionMaterials;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;

/**
 * A keyring which combines other keyrings, allowing one OnEncrypt or OnDecrypt call to
 * modify the encryption or decryption materials using more than one keyring.
 * <p>
 * On encrypt the generator keyring (if any) supplies the plaintext data key, then every child
 * keyring adds its encrypted data keys. Children run one after another in the order given, so a
 * child observes exactly the encrypted data keys added before it.
 * <p>
 * On decrypt the generator keyring and then the child keyrings are tried in order until the
 * materials hold a valid key. A keyring that throws an {@link Exception} is skipped and the
 * exception is not rethrown. An {@link Error} thrown by a keyring propagates and ends the search.
 * Callers detect an unsuccessful decrypt through {@link DecryptionMaterials#hasValidKey()}.
 * <p>
 * Instantiate by using {@link StandardKeyrings#multi} or {@link MultiKeyringBuilder}.
 */
@ThreadSafe
public final class MultiKeyring<S extends AlgorithmSuite> extends AbstractKeyring<S> {

    private static final Logger LOGGER = Logger.getLogger(MultiKeyring.class.getName());

    private final Keyring<S> generatorKeyring;
    private final List<Keyring<S>> childKeyrings;

    MultiKeyring(KeyringFamily<S> family, Keyring<S> generatorKeyring, List<? extends Keyring<S>> childKeyrings) {
        super(family);
        final List<Keyring<S>> children = childKeyrings == null ? emptyList() : new ArrayList<>(childKeyrings);

        if (generatorKeyring == null && children.isEmpty()) {
            throw new KeyringConfigurationException("Noop MultiKeyring is not supported. " +
                    "At least a generator keyring or child keyrings must be defined");
        }
        if (generatorKeyring != null && !family.isMember(generatorKeyring)) {
            throw new KeyringConfigurationException("Generator must be a Keyring of family " + family.getName());
        }
        for (int i = 0; i < children.size(); i++) {
            if (!family.isMember(children.get(i))) {
                throw new KeyringConfigurationException(
                        "Child keyring at index " + i + " must be a Keyring of family " + family.getName());
            }
        }

        this.generatorKeyring = generatorKeyring;
        this.childKeyrings = unmodifiableList(children);
    }

    /**
     * @return The generator keyring, or {@code null} if this multi keyring has none.
     */
    public Keyring<S> getGeneratorKeyring() {
        return generatorKeyring;
    }

    /**
     * @return An unmodifiable list of the child keyrings in the order they are invoked.
     */
    public List<Keyring<S>> getChildKeyrings() {
        return childKeyrings;
    }

    @Override
    protected EncryptionMaterials<S> doEncrypt(EncryptionMaterials<S> encryptionMaterials) {
        if (generatorKeyring != null) {
            requireSameInstance(encryptionMaterials, generatorKeyring.onEncrypt(encryptionMaterials), "EncryptionMaterials");

            if (!encryptionMaterials.hasPlaintextDataKey()) {
                throw new DataKeyGenerationException("Generator keyring did not generate a plaintext data key.");
            }
        } else if (!encryptionMaterials.hasPlaintextDataKey()) {
            throw new DataKeyGenerationException("Only keyrings explicitly designated as generators can generate material. " +
                    "Either a generator keyring must be supplied or a plaintext data key must already be present " +
                    "in the encryption materials.");
        }

        // One at a time, in order. Each child sees the encrypted data keys added before it.
        for (Keyring<S> keyring : childKeyrings) {
            requireSameInstance(encryptionMaterials, keyring.onEncrypt(encryptionMaterials), "EncryptionMaterials");
        }

        return encryptionMaterials;
    }

    @Override
    protected DecryptionMaterials<S> doDecrypt(DecryptionMaterials<S> decryptionMaterials,
                                              List<? extends EncryptedDataKey> encryptedDataKeys) {
        for (Keyring<S> keyring : keyringsToDecryptWith()) {
            if (decryptionMaterials.hasValidKey()) {
                return decryptionMaterials;
            }

            final DecryptAttempt attempt = attemptDecrypt(keyring, decryptionMaterials, encryptedDataKeys);
            if (attempt.isFailure() && LOGGER.isLoggable(Level.FINE)) {
                LOGGER.log(Level.FINE, "Skipping failed decrypt attempt " + attempt, attempt.getFailure());
            }
        }

        return decryptionMaterials;
    }

    private List<Keyring<S>> keyringsToDecryptWith() {
        final List<Keyring<S>> keyrings = new ArrayList<>(childKeyrings.size() + 1);

        if (generatorKeyring != null) {
            keyrings.add(generatorKeyring);
        }
        keyrings.addAll(childKeyrings);

        return keyrings;
    }

    private static <S extends AlgorithmSuite> DecryptAttempt attemptDecrypt(Keyring<S> keyring,
                                                                           DecryptionMaterials<S> decryptionMaterials,
                                                                           List<? extends EncryptedDataKey> encryptedDataKeys) {
        try {
            requireSameInstance(decryptionMaterials, keyring.onDecrypt(decryptionMaterials, encryptedDataKeys),
                    "DecryptionMaterials");
            return DecryptAttempt.completed(keyring);
        } catch (Exception e) {
            // A keyring without access must not stop the others from trying.
            return DecryptAttempt.failed(keyring, e);
        }
    }
}
