/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.model;

/**
 * Endpoint version, exposed as the {@code v<major>/<minor>} route prefix.
 */
public record ApiVersion(int major, int minor) {

    public static final ApiVersion DEFAULT = new ApiVersion(0, 0);

    public ApiVersion {
        if (major < 0 || minor < 0) {
            throw new IllegalArgumentException("Version numbers must be non-negative: " + major + "." + minor);
        }
    }

    /**
     * Parses {@code "major.minor"}. A bare {@code "major"} means {@code major.0}.
     *
     * @throws IllegalArgumentException on anything else
     */
    public static ApiVersion parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT;
        }
        final String s = raw.trim();
        final String[] parts = s.split("\\.", -1);
        if (parts.length > 2) {
            throw new IllegalArgumentException("Version must be 'major.minor', got '" + s + "'");
        }
        try {
            int major = Integer.parseInt(parts[0]);
            int minor = parts.length == 2 ? Integer.parseInt(parts[1]) : 0;
            return new ApiVersion(major, minor);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Version must be 'major.minor', got '" + s + "'", e);
        }
    }

    public String pathPrefix() {
        return "v" + major + "/" + minor;
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
