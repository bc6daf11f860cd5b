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

package com.amazonaws.materialmanagement;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * A data key wrapped by one keyring, together with the metadata that identifies which keyring can unwrap it.
 */
public interface EncryptedDataKey {

    Charset PROVIDER_ENCODING = StandardCharsets.UTF_8;

    String getProviderId();

    byte[] getProviderInformation();

    byte[] getEncryptedDataKey();
}
