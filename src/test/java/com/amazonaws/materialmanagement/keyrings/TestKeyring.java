/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
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

import com.amazonaws.materialmanagement.CryptoAlgorithm;
import com.amazonaws.materialmanagement.EncryptedDataKey;
import com.amazonaws.materialmanagement.model.DecryptionMaterials;
import com.amazonaws.materialmanagement.model.EncryptionMaterials;
import com.amazonaws.materialmanagement.model.KeyBlob;

import javax.annotation.concurrent.NotThreadSafe;
import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.amazonaws.materialmanagement.EncryptedDataKey.PROVIDER_ENCODING;
import static java.util.Objects.requireNonNull;

/**
 * Implementation of the {@link Keyring} interface that should only
 * used for unit-tests.
 * <p>
 * Wraps data keys with a randomly generated AES key using the JCE {@code AESWrap} cipher and
 * records every call it receives, so tests can observe ordering and early termination.
 */
@NotThreadSafe
class TestKeyring extends AbstractKeyring<CryptoAlgorithm> {
    static final String PROVIDER_ID = "test_provider";

    private static final String WRAPPING_ALGORITHM = "AESWrap";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final String keyName;
    private final boolean canGenerate;
    private final RuntimeException failure;
    private final SecretKey wrappingKey;

    private final List<Integer> observedEncryptedDataKeyCounts = new ArrayList<>();
    private int encryptCalls;
    private int decryptCalls;

    private TestKeyring(String keyName, boolean canGenerate, RuntimeException failure) {
        super(KeyringFamily.JCE);
        this.keyName = requireNonNull(keyName);
        this.canGenerate = canGenerate;
        this.failure = failure;

        try {
            KeyGenerator keyGenerator = KeyGenerator.getInstance("AES");
            keyGenerator.init(256);
            this.wrappingKey = keyGenerator.generateKey();
        } catch (GeneralSecurityException ex) {
            throw new RuntimeException(ex);
        }
    }

    /**
     * A keyring that generates a data key when none is present.
     */
    static TestKeyring generator(String keyName) {
        return new TestKeyring(keyName, true, null);
    }

    /**
     * A keyring that only wraps an existing data key and leaves materials without one untouched.
     */
    static TestKeyring child(String keyName) {
        return new TestKeyring(keyName, false, null);
    }

    /**
     * A keyring that throws the given exception on every call.
     */
    static TestKeyring failing(String keyName, RuntimeException failure) {
        return new TestKeyring(keyName, false, requireNonNull(failure));
    }

    String getKeyName() {
        return keyName;
    }

    int getEncryptCalls() {
        return encryptCalls;
    }

    int getDecryptCalls() {
        return decryptCalls;
    }

    /**
     * The number of encrypted data keys the materials held when each encrypt call started.
     */
    List<Integer> getObservedEncryptedDataKeyCounts() {
        return Collections.unmodifiableList(observedEncryptedDataKeyCounts);
    }

    @Override
    protected EncryptionMaterials<CryptoAlgorithm> doEncrypt(EncryptionMaterials<CryptoAlgorithm> encryptionMaterials) {
        encryptCalls++;
        observedEncryptedDataKeyCounts.add(encryptionMaterials.getEncryptedDataKeys().size());
        if (failure != null) {
            throw failure;
        }

        if (!encryptionMaterials.hasPlaintextDataKey()) {
            if (!canGenerate) {
                return encryptionMaterials;
            }
            final byte[] rawKey = new byte[encryptionMaterials.getAlgorithmSuite().getDataKeyLength()];
            RANDOM.nextBytes(rawKey);
            encryptionMaterials.setPlaintextDataKey(
                    new SecretKeySpec(rawKey, encryptionMaterials.getAlgorithmSuite().getDataKeyAlgo()),
                    KeyringTraceEntry.generated(PROVIDER_ID, keyName));
        }

        try {
            final Cipher cipher = Cipher.getInstance(WRAPPING_ALGORITHM);
            cipher.init(Cipher.WRAP_MODE, wrappingKey);
            final byte[] wrappedKey = cipher.wrap(encryptionMaterials.getPlaintextDataKey());

            encryptionMaterials.addEncryptedDataKey(
                    new KeyBlob(PROVIDER_ID, keyName.getBytes(PROVIDER_ENCODING), wrappedKey),
                    KeyringTraceEntry.encrypted(PROVIDER_ID, keyName));
        } catch (GeneralSecurityException ex) {
            throw new RuntimeException(ex);
        }

        return encryptionMaterials;
    }

    @Override
    protected DecryptionMaterials<CryptoAlgorithm> doDecrypt(DecryptionMaterials<CryptoAlgorithm> decryptionMaterials,
                                                             List<? extends EncryptedDataKey> encryptedDataKeys) {
        decryptCalls++;
        if (failure != null) {
            throw failure;
        }
        if (decryptionMaterials.hasPlaintextDataKey()) {
            return decryptionMaterials;
        }

        final byte[] keyNameBytes = keyName.getBytes(PROVIDER_ENCODING);
        for (EncryptedDataKey edk : encryptedDataKeys) {
            if (PROVIDER_ID.equals(edk.getProviderId()) && Arrays.equals(keyNameBytes, edk.getProviderInformation())) {
                try {
                    final Cipher cipher = Cipher.getInstance(WRAPPING_ALGORITHM);
                    cipher.init(Cipher.UNWRAP_MODE, wrappingKey);
                    final SecretKey key = (SecretKey) cipher.unwrap(edk.getEncryptedDataKey(),
                            decryptionMaterials.getAlgorithmSuite().getDataKeyAlgo(), Cipher.SECRET_KEY);

                    decryptionMaterials.setPlaintextDataKey(key,
                            KeyringTraceEntry.decrypted(PROVIDER_ID, keyName));
                    return decryptionMaterials;
                } catch (GeneralSecurityException ex) {
                    throw new RuntimeException(ex);
                }
            }
        }

        return decryptionMaterials;
    }

    @Override
    public String toString() {
        return "TestKeyring(" + keyName + ")";
    }
}
