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

import com.amazonaws.materialmanagement.AlgorithmSuite;
import com.amazonaws.materialmanagement.CryptoAlgorithm;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

public class MultiKeyringBuilder<S extends AlgorithmSuite> {
    private final KeyringFamily<S> family;
    private Keyring<S> generatorKeyring;
    private final List<Keyring<S>> childKeyrings = new ArrayList<>();

    private MultiKeyringBuilder(KeyringFamily<S> family) {
        // Use MultiKeyringBuilder.standard() or StandardKeyrings.multiBuilder() to instantiate
        this.family = requireNonNull(family, "family is required");
    }

    /**
     * Constructs a new instance of {@code MultiKeyringBuilder} for keyrings of the {@link KeyringFamily#JCE} family.
     *
     * @return The {@code MultiKeyringBuilder}
     */
    public static MultiKeyringBuilder<CryptoAlgorithm> standard() {
        return new MultiKeyringBuilder<>(KeyringFamily.JCE);
    }

    /**
     * Constructs a new instance of {@code MultiKeyringBuilder} for keyrings of the given family.
     *
     * @param family The family every member keyring must belong to
     * @return The {@code MultiKeyringBuilder}
     */
    public static <S extends AlgorithmSuite> MultiKeyringBuilder<S> standard(KeyringFamily<S> family) {
        return new MultiKeyringBuilder<>(family);
    }

    /**
     * A keyring that generates the plaintext data key on encrypt and is tried first on decrypt.
     * Required if no child keyrings are added.
     *
     * @param generatorKeyring The generator keyring
     * @return The MultiKeyringBuilder, for method chaining
     */
    public MultiKeyringBuilder<S> generator(Keyring<S> generatorKeyring) {
        this.generatorKeyring = generatorKeyring;
        return this;
    }

    /**
     * Replaces the child keyrings with the given list. The list is copied.
     *
     * @param childKeyrings The child keyrings, in the order they are invoked
     * @return The MultiKeyringBuilder, for method chaining
     */
    public MultiKeyringBuilder<S> children(List<? extends Keyring<S>> childKeyrings) {
        this.childKeyrings.clear();
        if (childKeyrings != null) {
            this.childKeyrings.addAll(childKeyrings);
        }
        return this;
    }

    /**
     * Appends a child keyring after the ones already added.
     *
     * @param childKeyring The child keyring
     * @return The MultiKeyringBuilder, for method chaining
     */
    public MultiKeyringBuilder<S> addChild(Keyring<S> childKeyring) {
        this.childKeyrings.add(childKeyring);
        return this;
    }

    /**
     * Constructs the {@link MultiKeyring} instance.
     *
     * @return The {@link MultiKeyring} instance
     * @throws com.amazonaws.materialmanagement.exception.KeyringConfigurationException if no keyrings were
     *         configured or a keyring belongs to another family
     */
    public MultiKeyring<S> build() {
        return new MultiKeyring<>(family, generatorKeyring, childKeyrings);
    }
}
