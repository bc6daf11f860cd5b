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

import com.amazonaws.materialmanagement.EncryptedDataKey;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

import javax.annotation.concurrent.Immutable;
import java.util.Arrays;
import java.util.Objects;

import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.Validate.notBlank;

/**
 * Immutable {@link EncryptedDataKey} value produced by a keyring during encryption.
 */
@Immutable
public final class KeyBlob implements EncryptedDataKey {
    private final String providerId;
    private final byte[] providerInformation;
    private final byte[] encryptedDataKey;

    public KeyBlob(final String providerId, final byte[] providerInformation, final byte[] encryptedDataKey) {
        notBlank(providerId, "providerId is required");
        requireNonNull(providerInformation, "providerInformation is required");
        requireNonNull(encryptedDataKey, "encryptedDataKey is required");

        this.providerId = providerId;
        this.providerInformation = providerInformation.clone();
        this.encryptedDataKey = encryptedDataKey.clone();
    }

    /**
     * Copies an arbitrary {@link EncryptedDataKey} into a {@code KeyBlob}.
     */
    public KeyBlob(final EncryptedDataKey edk) {
        this(requireNonNull(edk, "edk is required").getProviderId(),
                edk.getProviderInformation(), edk.getEncryptedDataKey());
    }

    @Override
    public String getProviderId() {
        return providerId;
    }

    @Override
    public byte[] getProviderInformation() {
        return providerInformation.clone();
    }

    @Override
    public byte[] getEncryptedDataKey() {
        return encryptedDataKey.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KeyBlob that = (KeyBlob) o;
        return providerId.equals(that.providerId) &&
                Arrays.equals(providerInformation, that.providerInformation) &&
                Arrays.equals(encryptedDataKey, that.encryptedDataKey);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(providerId);
        result = 31 * result + Arrays.hashCode(providerInformation);
        result = 31 * result + Arrays.hashCode(encryptedDataKey);
        return result;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
                .append("providerId", providerId)
                .append("providerInformation", new String(providerInformation, PROVIDER_ENCODING))
                .append("encryptedDataKeyLength", encryptedDataKey.length)
                .toString();
    }
}
