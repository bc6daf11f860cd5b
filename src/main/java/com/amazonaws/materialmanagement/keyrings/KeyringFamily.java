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
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

import javax.annotation.concurrent.Immutable;
import java.util.Objects;

import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.Validate.notBlank;

/**
 * Identifies a family of interchangeable keyrings: all keyrings that operate on the same
 * algorithm suite type. Generic type arguments are erased at runtime, so keyrings carry
 * their family explicitly and composites check it when they are built.
 *
 * @param <S> The algorithm suite type of the family.
 */
@Immutable
public final class KeyringFamily<S extends AlgorithmSuite> {

    /**
     * Keyrings operating on {@link CryptoAlgorithm} suites with JCE providers.
     */
    public static final KeyringFamily<CryptoAlgorithm> JCE = new KeyringFamily<>("JCE", CryptoAlgorithm.class);

    private final String name;
    private final Class<S> algorithmSuiteType;

    private KeyringFamily(final String name, final Class<S> algorithmSuiteType) {
        this.name = notBlank(name, "name is required");
        this.algorithmSuiteType = requireNonNull(algorithmSuiteType, "algorithmSuiteType is required");
    }

    /**
     * Defines a keyring family.
     *
     * @param name               A name identifying the family.
     * @param algorithmSuiteType The algorithm suite type keyrings of this family operate on.
     * @return The keyring family
     */
    public static <S extends AlgorithmSuite> KeyringFamily<S> of(final String name, final Class<S> algorithmSuiteType) {
        return new KeyringFamily<>(name, algorithmSuiteType);
    }

    public String getName() {
        return name;
    }

    public Class<S> getAlgorithmSuiteType() {
        return algorithmSuiteType;
    }

    /**
     * Returns true if the given keyring is non-null and belongs to this family.
     */
    public boolean isMember(final Keyring<?> keyring) {
        return keyring != null && this.equals(keyring.getFamily());
    }

    /**
     * Returns true if the given algorithm suite can be used by keyrings of this family.
     */
    public boolean supports(final AlgorithmSuite algorithmSuite) {
        return algorithmSuiteType.isInstance(algorithmSuite);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KeyringFamily<?> that = (KeyringFamily<?>) o;
        return name.equals(that.name) && algorithmSuiteType.equals(that.algorithmSuiteType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, algorithmSuiteType);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
                .append("name", name)
                .append("algorithmSuiteType", algorithmSuiteType.getName())
                .toString();
    }
}
