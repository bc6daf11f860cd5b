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

package com.amazonaws.materialmanagement.model;

import com.amazonaws.materialmanagement.AlgorithmSuite;
import com.amazonaws.materialmanagement.EncryptedDataKey;
import com.amazonaws.materialmanagement.keyrings.KeyringTrace;
import com.amazonaws.materialmanagement.keyrings.KeyringTraceEntry;

import javax.annotation.concurrent.NotThreadSafe;
import javax.crypto.SecretKey;
import java.security.PrivateKey;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.Validate.isTrue;
import static org.apache.commons.lang3.Validate.noNullElements;

/**
 * Contains the cryptographic materials needed for an encryption operation with Keyrings.
 * <p>
 * The plaintext data key may be set at most once and is never replaced. Encrypted data keys
 * are only ever appended, in the order the keyrings produced them.
 *
 * @param <S> The algorithm suite type of the keyring family these materials belong to.
 */
@NotThreadSafe
public final class EncryptionMaterials<S extends AlgorithmSuite> {
    private final S algorithmSuite;
    private final Map<String, String> encryptionContext;
    private final List<EncryptedDataKey> encryptedDataKeys;
    private SecretKey plaintextDataKey;
    private final PrivateKey signingKey;
    private final KeyringTrace keyringTrace;

    private EncryptionMaterials(Builder<S> b) {
        requireNonNull(b.algorithmSuite, "algorithmSuite is required");
        requireNonNull(b.keyringTrace, "keyringTrace is required");
        requireNonNull(b.encryptionContext, "encryptionContext is required");
        validatePlaintextDataKey(b.algorithmSuite, b.plaintextDataKey);
        validateSigningKey(b.algorithmSuite, b.signingKey);
        isTrue(b.encryptedDataKeys.isEmpty() || b.plaintextDataKey != null,
                "encryptedDataKeys require a plaintextDataKey");
        this.algorithmSuite = b.algorithmSuite;
        this.encryptionContext = b.encryptionContext;
        this.encryptedDataKeys = b.encryptedDataKeys;
        this.plaintextDataKey = b.plaintextDataKey;
        this.signingKey = b.signingKey;
        this.keyringTrace = b.keyringTrace;
    }

    public Builder<S> toBuilder() {
        return new Builder<>(this);
    }

    public static <S extends AlgorithmSuite> Builder<S> newBuilder(S algorithmSuite) {
        return new Builder<>(algorithmSuite);
    }

    /**
     * The algorithm suite to be used for encryption.
     */
    public S getAlgorithmSuite() {
        return algorithmSuite;
    }

    /**
     * The encryption context associated with this encryption.
     */
    public Map<String, String> getEncryptionContext() {
        return encryptionContext;
    }

    /**
     * An unmodifiable list of the encrypted data keys that correspond to the plaintext data key.
     */
    public List<EncryptedDataKey> getEncryptedDataKeys() {
        return Collections.unmodifiableList(encryptedDataKeys);
    }

    /**
     * Add an encrypted data key to the end of the list of encrypted data keys.
     *
     * @param encryptedDataKey  The encrypted data key to add.
     * @param keyringTraceEntry The keyring trace entry recording this action.
     * @throws IllegalStateException if the plaintext data key has not been populated.
     */
    public void addEncryptedDataKey(EncryptedDataKey encryptedDataKey, KeyringTraceEntry keyringTraceEntry) {
        requireNonNull(encryptedDataKey, "encryptedDataKey is required");
        requireNonNull(keyringTraceEntry, "keyringTraceEntry is required");
        if (!hasPlaintextDataKey()) {
            throw new IllegalStateException("plaintextDataKey must be populated before adding an encryptedDataKey");
        }
        encryptedDataKeys.add(encryptedDataKey);
        keyringTrace.add(keyringTraceEntry);
    }

    /**
     * Returns true if a plaintext data key has been populated.
     *
     * @return True if plaintext data key is populated, false otherwise.
     */
    public boolean hasPlaintextDataKey() {
        return this.plaintextDataKey != null;
    }

    /**
     * A data key to be used as input for encryption.
     *
     * @return The plaintext data key.
     * @throws IllegalStateException if plain text data key has not been populated.
     */
    public SecretKey getPlaintextDataKey() throws IllegalStateException {
        if (!hasPlaintextDataKey()) {
            throw new IllegalStateException("plaintextDataKey has not been populated");
        }
        return plaintextDataKey;
    }

    /**
     * Sets the plaintext data key. The plaintext data key must not already be populated.
     *
     * @param plaintextDataKey  The plaintext data key.
     * @param keyringTraceEntry The keyring trace entry recording this action.
     */
    public void setPlaintextDataKey(SecretKey plaintextDataKey, KeyringTraceEntry keyringTraceEntry) {
        if (hasPlaintextDataKey()) {
            throw new IllegalStateException("plaintextDataKey was already populated");
        }
        requireNonNull(plaintextDataKey, "plaintextDataKey is required");
        requireNonNull(keyringTraceEntry, "keyringTraceEntry is required");
        validatePlaintextDataKey(algorithmSuite, plaintextDataKey);
        this.plaintextDataKey = plaintextDataKey;
        keyringTrace.add(keyringTraceEntry);
    }

    /**
     * Returns true if a signing key has been populated.
     *
     * @return True if signing key is populated, false otherwise.
     */
    public boolean hasSigningKey() {
        return this.signingKey != null;
    }

    /**
     * The key to be used as the signing key for trailing signatures.
     *
     * @return The signing key.
     * @throws IllegalStateException if signing key has not been populated.
     */
    public PrivateKey getSigningKey() throws IllegalStateException {
        if (!hasSigningKey()) {
            throw new IllegalStateException(String.format(
                    "Signing is not supported by AlgorithmSuite %s", algorithmSuite.name()));
        }
        return signingKey;
    }

    /**
     * A keyring trace containing all of the actions that keyrings have taken on this set of encryption materials.
     */
    public KeyringTrace getKeyringTrace() {
        return keyringTrace;
    }

    private static void validatePlaintextDataKey(AlgorithmSuite algorithmSuite, SecretKey plaintextDataKey) throws IllegalArgumentException {
        if (plaintextDataKey != null) {
            isTrue(algorithmSuite.getDataKeyLength() == plaintextDataKey.getEncoded().length,
                    String.format("Incorrect data key length. Expected %s but got %s",
                            algorithmSuite.getDataKeyLength(), plaintextDataKey.getEncoded().length));
            isTrue(algorithmSuite.getDataKeyAlgo().equalsIgnoreCase(plaintextDataKey.getAlgorithm()),
                    String.format("Incorrect data key algorithm. Expected %s but got %s",
                            algorithmSuite.getDataKeyAlgo(), plaintextDataKey.getAlgorithm()));
        }
    }

    /**
     * Validates that a signing key is specified if and only if
     * the given algorithm suite supports trailing signatures.
     */
    private static void validateSigningKey(AlgorithmSuite algorithmSuite, PrivateKey signingKey) throws IllegalArgumentException {
        if (algorithmSuite.getTrailingSignatureAlgo() == null && signingKey != null) {
            throw new IllegalArgumentException(
                    String.format("Algorithm Suite %s does not support signing", algorithmSuite.name()));
        } else if (algorithmSuite.getTrailingSignatureAlgo() != null && signingKey == null) {
            throw new IllegalArgumentException(
                    String.format("Algorithm Suite %s requires a signing key for signing", algorithmSuite.name()));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EncryptionMaterials<?> that = (EncryptionMaterials<?>) o;
        return Objects.equals(algorithmSuite, that.algorithmSuite) &&
                Objects.equals(encryptionContext, that.encryptionContext) &&
                Objects.equals(encryptedDataKeys, that.encryptedDataKeys) &&
                Objects.equals(plaintextDataKey, that.plaintextDataKey) &&
                Objects.equals(signingKey, that.signingKey) &&
                Objects.equals(keyringTrace, that.keyringTrace);
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithmSuite, encryptionContext, encryptedDataKeys, plaintextDataKey, signingKey, keyringTrace);
    }

    public static final class Builder<S extends AlgorithmSuite> {
        private S algorithmSuite;
        private Map<String, String> encryptionContext = Collections.emptyMap();
        private List<EncryptedDataKey> encryptedDataKeys = new ArrayList<>();
        private SecretKey plaintextDataKey;
        private PrivateKey signingKey;
        private KeyringTrace keyringTrace = new KeyringTrace();

        private Builder(S algorithmSuite) {
            this.algorithmSuite = algorithmSuite;
        }

        private Builder(EncryptionMaterials<S> r) {
            algorithmSuite = r.algorithmSuite;
            encryptionContext = r.encryptionContext;
            encryptedDataKeys = new ArrayList<>(r.encryptedDataKeys);
            plaintextDataKey = r.plaintextDataKey;
            signingKey = r.signingKey;
            keyringTrace = new KeyringTrace(r.keyringTrace.getEntries());
        }

        public EncryptionMaterials<S> build() {
            return new EncryptionMaterials<>(this);
        }

        public Builder<S> algorithmSuite(S algorithmSuite) {
            this.algorithmSuite = algorithmSuite;
            return this;
        }

        public Builder<S> encryptionContext(Map<String, String> encryptionContext) {
            requireNonNull(encryptionContext, "encryptionContext is required");
            this.encryptionContext = Collections.unmodifiableMap(new HashMap<>(encryptionContext));
            return this;
        }

        public Builder<S> encryptedDataKeys(List<? extends EncryptedDataKey> encryptedDataKeys) {
            requireNonNull(encryptedDataKeys, "encryptedDataKeys are required");
            noNullElements(encryptedDataKeys, "encryptedDataKeys must not contain null");
            this.encryptedDataKeys = new ArrayList<>(encryptedDataKeys);
            return this;
        }

        public Builder<S> plaintextDataKey(SecretKey plaintextDataKey) {
            this.plaintextDataKey = plaintextDataKey;
            return this;
        }

        public Builder<S> signingKey(PrivateKey signingKey) {
            this.signingKey = signingKey;
            return this;
        }

        public Builder<S> keyringTrace(KeyringTrace keyringTrace) {
            this.keyringTrace = keyringTrace;
            return this;
        }
    }
}
