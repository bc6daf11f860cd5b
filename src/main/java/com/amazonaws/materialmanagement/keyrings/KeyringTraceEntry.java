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

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

import javax.annotation.concurrent.Immutable;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import static org.apache.commons.lang3.Validate.noNullElements;
import static org.apache.commons.lang3.Validate.notBlank;
import static org.apache.commons.lang3.Validate.notEmpty;

/**
 * One line of a {@link KeyringTrace}: the wrapping key a keyring used, identified by its
 * namespace (usually the provider id written into the encrypted data key) and name, and the
 * actions taken with it on the data key.
 */
@Immutable
public final class KeyringTraceEntry {

    private final String keyNamespace;
    private final String keyName;
    private final Set<KeyringTraceFlag> flags;

    /**
     * @param keyNamespace The namespace of the wrapping key, not blank.
     * @param keyName      The name of the wrapping key, not blank.
     * @param flags        At least one action taken with the wrapping key.
     */
    public KeyringTraceEntry(final String keyNamespace, final String keyName, final KeyringTraceFlag... flags) {
        this.keyNamespace = notBlank(keyNamespace, "keyNamespace is required");
        this.keyName = notBlank(keyName, "keyName is required");
        noNullElements(notEmpty(flags, "At least one flag is required"), "flags must not contain null");
        this.flags = Collections.unmodifiableSet(EnumSet.copyOf(Arrays.asList(flags)));
    }

    /**
     * Records that the named wrapping key's keyring generated the plaintext data key.
     */
    public static KeyringTraceEntry generated(final String keyNamespace, final String keyName) {
        return new KeyringTraceEntry(keyNamespace, keyName, KeyringTraceFlag.GENERATED_DATA_KEY);
    }

    /**
     * Records that the plaintext data key was wrapped under the named key.
     */
    public static KeyringTraceEntry encrypted(final String keyNamespace, final String keyName) {
        return new KeyringTraceEntry(keyNamespace, keyName, KeyringTraceFlag.ENCRYPTED_DATA_KEY);
    }

    /**
     * Records that the plaintext data key was unwrapped with the named key.
     */
    public static KeyringTraceEntry decrypted(final String keyNamespace, final String keyName) {
        return new KeyringTraceEntry(keyNamespace, keyName, KeyringTraceFlag.DECRYPTED_DATA_KEY);
    }

    public String getKeyNamespace() {
        return keyNamespace;
    }

    public String getKeyName() {
        return keyName;
    }

    /**
     * @return An unmodifiable set of the actions taken with the wrapping key.
     */
    public Set<KeyringTraceFlag> getFlags() {
        return flags;
    }

    public boolean hasFlag(final KeyringTraceFlag flag) {
        return flags.contains(flag);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KeyringTraceEntry that = (KeyringTraceEntry) o;
        return keyNamespace.equals(that.keyNamespace) && keyName.equals(that.keyName) && flags.equals(that.flags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyNamespace, keyName, flags);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
                .append("keyNamespace", keyNamespace)
                .append("keyName", keyName)
                .append("flags", flags)
                .toString();
    }
}
