/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.route;

import java.util.Locale;
import java.util.Objects;

public record RouteKey(int major, int minor, String route, String method) {

    public RouteKey {
        route = trimSlashes(Objects.requireNonNull(route, "route"));
        method = Objects.requireNonNull(method, "method").toUpperCase(Locale.ROOT);
    }

    /** {@code v<major>/<minor>/<route>} */
    public String path() {
        return "v" + major + "/" + minor + "/" + route;
    }

    static String trimSlashes(String raw) {
        int from = 0;
        int to = raw.length();
        while (from < to && raw.charAt(from) == '/') from++;
        while (to > from && raw.charAt(to - 1) == '/') to--;
        return raw.substring(from, to);
    }

    @Override
    public String toString() {
        return method + " /" + path();
    }
}
