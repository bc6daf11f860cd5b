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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A keyring trace containing all of the actions that keyrings have taken on a set of materials.
 * Entries can only be appended.
 */
@NotThreadSafe
public final class KeyringTrace {

    private final List<KeyringTraceEntry> entries;

    public KeyringTrace() {
        this.entries = new ArrayList<>();
    }

    public KeyringTrace(final List<KeyringTraceEntry> entries) {
        requireNonNull(entries, "entries are required");
        this.entries = new ArrayList<>(entries);
    }

    /**
     * Appends an entry to the end of this trace.
     *
     * @param entry The entry recording a keyring action.
     */
    public void add(KeyringTraceEntry entry) {
        requireNonNull(entry, "entry is required");
        entries.add(entry);
    }

    /**
     * Gets an unmodifiable list of `KeyringTraceEntry`s ordered sequentially
     * according to the order the actions were taken, with the earliest action
     * corresponding to the first `KeyringTraceEntry` in the list.
     *
     * @return An unmodifiable list of `KeyringTraceEntry`s
     */
    public List<KeyringTraceEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
                .append("entries", entries)
                .toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KeyringTrace that = (KeyringTrace) o;
        return Objects.equals(entries, that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries);
    }
}
