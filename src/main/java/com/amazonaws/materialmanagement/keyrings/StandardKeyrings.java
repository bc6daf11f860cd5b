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
import com.amazonaws.materialmanagement.CryptoAlgorithm;

import java.util.Arrays;
import java.util.List;

/**
 * Factory methods for instantiating the standard {@code Keyring}s provided by this library.
 */
public class StandardKeyrings {

    private StandardKeyrings() {
    }

    /**
     * Constructs a {@code Keyring} which combines other keyrings, allowing one OnEncrypt or OnDecrypt call
     * to modify the encryption or decryption materials using more than one keyring.
     *
     * @param generatorKeyring A keyring that can generate data keys. Required if childKeyrings is empty.
     * @param childKeyrings    A list of keyrings to be used to modify the encryption or decryption materials.
     *                         At least one is required if generatorKeyring is null.
     * @return The {@link Keyring}
     */
    public static Keyring<CryptoAlgorithm> multi(Keyring<CryptoAlgorithm> generatorKeyring,
                                                 List<? extends Keyring<CryptoAlgorithm>> childKeyrings) {
        return new MultiKeyring<>(KeyringFamily.JCE, generatorKeyring, childKeyrings);
    }

    /**
     * Constructs a {@code Keyring} which combines other keyrings, allowing one OnEncrypt or OnDecrypt call
     * to modify the encryption or decryption materials using more than one keyring.
     *
     * @param generatorKeyring A keyring that can generate data keys. Required if childKeyrings is empty.
     * @param childKeyrings    Keyrings to be used to modify the encryption or decryption materials.
     *                         At least one is required if generatorKeyring is null.
     * @return The {@link Keyring}
     */
    @SafeVarargs
    public static Keyring<CryptoAlgorithm> multi(Keyring<CryptoAlgorithm> generatorKeyring,
                                                 Keyring<CryptoAlgorithm>... childKeyrings) {
        return new MultiKeyring<>(KeyringFamily.JCE, generatorKeyring, Arrays.asList(childKeyrings));
    }

    /**
     * Constructs a {@code Keyring} of the given family which combines other keyrings of that family.
     *
     * @param family           The family every member keyring must belong to.
     * @param generatorKeyring A keyring that can generate data keys. Required if childKeyrings is empty.
     * @param childKeyrings    A list of keyrings to be used to modify the encryption or decryption materials.
     * @return The {@link Keyring}
     */
    public static <S extends AlgorithmSuite> Keyring<S> multi(KeyringFamily<S> family, Keyring<S> generatorKeyring,
                                                              List<? extends Keyring<S>> childKeyrings) {
        return new MultiKeyring<>(family, generatorKeyring, childKeyrings);
    }

    /**
     * Returns a {@link MultiKeyringBuilder} for use in constructing a multi keyring of the JCE family.
     *
     * @return The {@link MultiKeyringBuilder}
     */
    public static MultiKeyringBuilder<CryptoAlgorithm> multiBuilder() {
        return MultiKeyringBuilder.standard();
    }
}
