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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.cdlscope.util.NamePool;

/**
 * Resolves instance lines against the known subcircuit definitions. Positional
 * nets are bound to the definition's ports in order. Unknown cell types get
 * generic port names and a connection count that differs from the port count is
 * truncated to the common prefix; both cases only add a warning.
 */
public class InstanceParser {

    private final NamePool names;

    private final List<String> warnings = new ArrayList<>();

    public InstanceParser() {
        this(new NamePool());
    }

    /**
     * @param names Pool used to share net name strings between instances
     */
    public InstanceParser(NamePool names) {
        this.names = names;
    }

    /**
     * Parses one instance line of the form {@code X<name> [nets...] cell_type}.
     * @param token A token of type {@link CdlLineType#INSTANCE}
     * @param definitions Known cell types by name
     * @return The resolved instance
     * @throws CdlParseException if the line is empty, has no cell type or the
     *         instance name is invalid
     */
    public CellInstance parseInstanceLine(CdlToken token, Map<String, SubcircuitDefinition> definitions) {
        int line = token.getLineNumber();
        String[] parts = SubcircuitParser.splitFields(token.getContent());
        if (parts.length == 0) {
            throw new CdlParseException(line, "Empty instance line");
        }
        if (parts.length < 2) {
            throw new CdlParseException(line, "Invalid instance format: expected 'X<name> [nets...] cell_type', got '"
                    + token.getContent() + "'");
        }
        String instName = parts[0];
        String cellType = parts[parts.length - 1];
        int netCount = parts.length - 2;

        SubcircuitDefinition def = definitions.get(cellType);
        PortMapping mapping;
        if (def == null) {
            warnings.add("Line " + line + ": Unknown cell type '" + cellType + "' for instance '" + instName + "'");
            mapping = PortMapping.synthesized(netCount);
        } else {
            mapping = PortMapping.defined(def.getPorts());
            int portCount = def.getPortCount();
            if (netCount < portCount) {
                warnings.add("Line " + line + ": Instance '" + instName + "' has too few connections: expected "
                        + portCount + ", got " + netCount);
            } else if (netCount > portCount) {
                warnings.add("Line " + line + ": Instance '" + instName + "' has too many connections: expected "
                        + portCount + ", got " + netCount);
            }
        }

        List<String> ports = mapping.getPortNames();
        int mapped = Math.min(netCount, ports.size());
        Map<String, String> connections = new LinkedHashMap<>();
        for (int i = 0; i < mapped; i++) {
            connections.put(ports.get(i), names.intern(parts[i + 1]));
        }
        try {
            return new CellInstance(instName, cellType, connections, mapping);
        } catch (IllegalArgumentException e) {
            throw new CdlParseException(line, e.getMessage(), e);
        }
    }

    /**
     * @return A copy of the warnings collected so far
     */
    public List<String> getWarnings() {
        return new ArrayList<>(warnings);
    }

    public void clearWarnings() {
        warnings.clear();
    }
}
