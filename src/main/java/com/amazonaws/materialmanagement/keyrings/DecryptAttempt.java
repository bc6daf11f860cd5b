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

import static java.util.Objects.requireNonNull;

/**
 * The outcome of asking one member keyring of a {@link MultiKeyring} to decrypt.
 * A completed attempt did not necessarily produce a plaintext data key.
 */
final class DecryptAttempt {

    private final Keyring<?> keyring;
    private final Exception failure;

    private DecryptAttempt(final Keyring<?> keyring, final Exception failure) {
        this.keyring = requireNonNull(keyring, "keyring is required");
        this.failure = failure;
    }

    static DecryptAttempt completed(final Keyring<?> keyring) {
        return new DecryptAttempt(keyring, null);
    }

    static DecryptAttempt failed(final Keyring<?> keyring, final Exception failure) {
        return new DecryptAttempt(keyring, requireNonNull(failure, "failure is required"));
    }

    Keyring<?> getKeyring() {
        return keyring;
    }

    boolean isFailure() {
        return failure != null;
    }

    /**
     * @return The exception raised by the keyring, or {@code null} if the attempt completed.
     */
    Exception getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
                .append("keyring", keyring)
                .append("failure", failure)
                .toString();
    }
}
