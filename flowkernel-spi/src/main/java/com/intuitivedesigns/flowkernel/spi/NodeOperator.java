/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.spi;

import java.util.Map;

/**
 * The executable form of one pipeline node, already bound to that node's configuration.
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li><b>Ownership:</b> {@code data} and {@code state} belong to the current request only.
 * An operator may mutate them in place and return them, or return new maps.</li>
 * <li><b>Sharing:</b> one instance serves every concurrent request of its pipeline, so the
 * operator itself must not keep per-request fields.</li>
 * <li><b>Failure:</b> throwing aborts the pipeline walk. Nodes after this one never run.</li>
 * </ul>
 */
@FunctionalInterface
public interface NodeOperator {

    /**
     * @param data  the evolving payload
     * @param state the evolving accumulator
     * @return the payload and accumulator handed to the next node
     * @throws Exception if the node fails; use {@link NodeExecutionException} for domain errors
     */
    NodeResult apply(Map<String, Object> data, Map<String, Object> state) throws Exception;
}
