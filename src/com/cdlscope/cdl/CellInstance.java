/*
 * Copyright (c) 2026, CDLScope Authors.
 * All rights reserved.
 *
 * This file is part of CDLScope.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.cdlscope.cdl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * An X-prefixed instance line resolved against its cell type: the instance
 * name, the cell type and the port-to-net connections in port order.
 * Immutable; the connection map is copied on construction.
 */
public final class CellInstance {

    private final String name;

    private final String cellType;

    private final Map<String, String> connections;

    private final PortMapping portMapping;

    public CellInstance(String name, String cellType, Map<String, String> connections) {
        this(name, cellType, connections, PortMapping.defined(new ArrayList<>(connections.keySet())));
    }

    /**
     * @param name Instance name, must start with X (either case)
     * @param cellType Name of the instantiated cell type, non-empty
     * @param connections Port name to net name, in port order
     * @param portMapping Origin of the port names
     * @throws IllegalArgumentException if the name or cell type is invalid
     */
    public CellInstance(String name, String cellType, Map<String, String> connections, PortMapping portMapping) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Instance name cannot be empty");
        }
        if (Character.toUpperCase(name.charAt(0)) != CdlLineType.INSTANCE_PREFIX) {
            throw new IllegalArgumentException("Instance name must start with 'X', got '" + name + "'");
        }
        if (cellType == null || cellType.isEmpty()) {
            throw new IllegalArgumentException("Cell type cannot be empty for instance '" + name + "'");
        }
        this.name = name;
        this.cellType = cellType;
        this.connections = Collections.unmodifiableMap(new LinkedHashMap<>(connections));
        this.portMapping = Objects.requireNonNull(portMapping);
    }

    public String getName() {
        return name;
    }

    public String getCellType() {
        return cellType;
    }

    /**
     * @return Port name to net name, in port order (unmodifiable)
     */
    public Map<String, String> getConnections() {
        return connections;
    }

    public PortMapping getPortMapping() {
        return portMapping;
    }

    /**
     * @param port A port name
     * @return The net on that port, or null if the port is unconnected
     */
    @Nullable
    public String getNet(String port) {
        return connections.get(port);
    }

    /**
     * @return The distinct net names of this instance, in port order
     */
    public List<String> getNetNames() {
        return new ArrayList<>(new LinkedHashSet<>(connections.values()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellInstance)) return false;
        CellInstance that = (CellInstance) o;
        return name.equals(that.name) && cellType.equals(that.cellType)
                && connections.equals(that.connections) && portMapping.equals(that.portMapping);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, cellType, connections);
    }

    @Override
    public String toString() {
        return name + " (" + cellType + ") " + connections;
    }
}
