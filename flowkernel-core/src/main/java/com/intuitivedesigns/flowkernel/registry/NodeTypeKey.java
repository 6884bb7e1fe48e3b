/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.registry;

import java.util.Objects;

/**
 * Registry key. Both parts are matched exactly after trimming.
 */
public record NodeTypeKey(String type, String version) {

    public NodeTypeKey {
        type = Objects.requireNonNull(type, "type").trim();
        version = Objects.requireNonNull(version, "version").trim();
        if (type.isEmpty()) throw new IllegalArgumentException("Node type must not be blank");
        if (version.isEmpty()) throw new IllegalArgumentException("Node version must not be blank");
    }

    @Override
    public String toString() {
        return type + "@" + version;
    }
}
