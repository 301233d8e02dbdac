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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named cell type and its ordered port names, as declared by a .SUBCKT line.
 * Immutable.
 */
public final class SubcircuitDefinition {

    private final String name;

    private final List<String> ports;

    /**
     * @param name The cell type name, case-sensitive
     * @param ports Ordered port names, at least one, all distinct
     * @throws IllegalArgumentException if the name is empty, there are no ports,
     *         a port name is empty or a port name repeats
     */
    public SubcircuitDefinition(String name, List<String> ports) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Subcircuit name cannot be empty");
        }
        if (ports == null || ports.isEmpty()) {
            throw new IllegalArgumentException("Subcircuit " + name + " must have at least one port");
        }
        Set<String> seen = new LinkedHashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String port : ports) {
            if (port == null || port.isEmpty()) {
                throw new IllegalArgumentException("Subcircuit " + name + " has an empty port name");
            }
            if (!seen.add(port)) {
                duplicates.add(port);
            }
        }
        if (!duplicates.isEmpty()) {
            throw new IllegalArgumentException("Subcircuit " + name + " has duplicate port names: "
                    + String.join(", ", duplicates));
        }
        this.name = name;
        this.ports = Collections.unmodifiableList(new ArrayList<>(ports));
    }

    public String getName() {
        return name;
    }

    /**
     * @return The ports in declaration order (unmodifiable)
     */
    public List<String> getPorts() {
        return ports;
    }

    public int getPortCount() {
        return ports.size();
    }

    public boolean hasPort(String port) {
        return ports.contains(port);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubcircuitDefinition)) return false;
        SubcircuitDefinition that = (SubcircuitDefinition) o;
        return name.equals(that.name) && ports.equals(that.ports);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, ports);
    }

    @Override
    public String toString() {
        return ".SUBCKT " + name + " " + String.join(" ", ports);
    }
}
