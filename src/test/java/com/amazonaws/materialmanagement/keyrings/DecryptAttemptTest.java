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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecryptAttemptTest {

    private final TestKeyring keyring = TestKeyring.child("child");

    @Test
    void testCompleted() {
        DecryptAttempt attempt = DecryptAttempt.completed(keyring);

        assertFalse(attempt.isFailure());
        assertNull(attempt.getFailure());
        assertSame(keyring, attempt.getKeyring());
    }

    @Test
    void testFailed() {
        IllegalStateException failure = new IllegalStateException("access denied");
        DecryptAttempt attempt = DecryptAttempt.failed(keyring, failure);

        assertTrue(attempt.isFailure());
        assertSame(failure, attempt.getFailure());
        assertTrue(attempt.toString().contains("TestKeyring(child)"));
        assertTrue(attempt.toString().contains("access denied"));
    }

    @Test
    void testRequiredArguments() {
        assertThrows(NullPointerException.class, () -> DecryptAttempt.completed(null));
        assertThrows(NullPointerException.class, () -> DecryptAttempt.failed(keyring, null));
    }
}
