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
import java.util.List;

/**
 * Where the port names of a parsed instance came from: the .SUBCKT definition
 * of its cell type, or generated as port0, port1, ... because the cell type is
 * unknown.
 */
public final class PortMapping {

    public enum Kind {
        DEFINED,
        SYNTHESIZED
    }

    public static final String SYNTHESIZED_PORT_PREFIX = "port";

    private final Kind kind;

    private final List<String> portNames;

    private PortMapping(Kind kind, List<String> portNames) {
        this.kind = kind;
        this.portNames = Collections.unmodifiableList(portNames);
    }

    /**
     * @param ports Port names of the cell type definition, in order
     * @return A mapping backed by a copy of ports
     */
    public static PortMapping defined(List<String> ports) {
        return new PortMapping(Kind.DEFINED, new ArrayList<>(ports));
    }

    /**
     * @param count Number of positional nets on the instance line
     * @return A mapping with the generic names port0 to port(count-1)
     */
    public static PortMapping synthesized(int count) {
        List<String> names = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            names.add(SYNTHESIZED_PORT_PREFIX + i);
        }
        return new PortMapping(Kind.SYNTHESIZED, names);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isSynthesized() {
        return kind == Kind.SYNTHESIZED;
    }

    public List<String> getPortNames() {
        return portNames;
    }

    public int getPortCount() {
        return portNames.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PortMapping)) return false;
        PortMapping that = (PortMapping) o;
        return kind == that.kind && portNames.equals(that.portNames);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + portNames.hashCode();
    }

    @Override
    public String toString() {
        return kind + portNames.toString();
    }
}
