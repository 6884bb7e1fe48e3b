/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Directed dependency between two nodes of a pipeline: {@code source} runs before {@code target}.
 */
public record Edge(String source, String target) {

    private static final String ARROW = "->";

    public Edge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }

    /**
     * Parses a digraph line. {@code "A -> B"} yields one edge, {@code "A -> B -> C"} yields two.
     *
     * @throws IllegalArgumentException if the line has fewer than two names or an empty name
     */
    public static List<Edge> parse(String line) {
        if (line == null || !line.contains(ARROW)) {
            throw new IllegalArgumentException("Edge must look like 'A -> B', got '" + line + "'");
        }
        final String[] names = line.split(ARROW, -1);
        final List<Edge> edges = new ArrayList<>(names.length - 1);
        for (int i = 0; i + 1 < names.length; i++) {
            final String from = names[i].trim();
            final String to = names[i + 1].trim();
            if (from.isEmpty() || to.isEmpty()) {
                throw new IllegalArgumentException("Edge has an empty node name: '" + line + "'");
            }
            edges.add(new Edge(from, to));
        }
        return edges;
    }

    @Override
    public String toString() {
        return source + " -> " + target;
    }
}
