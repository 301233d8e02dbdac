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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.Nullable;

/**
 * Matches .SUBCKT/.ENDS blocks with a stack of open subcircuit names and keeps
 * the definitions it has seen. Redefining a name replaces the earlier
 * definition.
 */
public class SubcircuitParser {

    private final Deque<String> openBlocks = new ArrayDeque<>();

    private final Map<String, SubcircuitDefinition> definitions = new LinkedHashMap<>();

    /**
     * Parses a .SUBCKT line, stores its definition and opens its block.
     * @param token A token of type {@link CdlLineType#SUBCKT}
     * @return The parsed definition
     * @throws CdlParseException if the name or ports are missing or a port repeats
     */
    public SubcircuitDefinition parseSubcktLine(CdlToken token) {
        int line = token.getLineNumber();
        String[] parts = splitFields(token.getContent());
        if (parts.length < 2) {
            throw new CdlParseException(line, "Invalid .SUBCKT format: expected '.SUBCKT name ports...', got '"
                    + token.getContent() + "'");
        }
        String name = parts[1];
        List<String> ports = Arrays.asList(parts).subList(2, parts.length);
        if (ports.isEmpty()) {
            throw new CdlParseException(line, "Subcircuit " + name + " must have at least one port");
        }
        SubcircuitDefinition def;
        try {
            def = new SubcircuitDefinition(name, ports);
        } catch (IllegalArgumentException e) {
            throw new CdlParseException(line, e.getMessage(), e);
        }
        // re-inserting keeps definitions in the order they were last declared
        definitions.remove(name);
        definitions.put(name, def);
        openBlocks.push(name);
        return def;
    }

    /**
     * Parses an .ENDS line and closes the innermost open block.
     * @param token A token of type {@link CdlLineType#ENDS}
     * @return The name of the closed subcircuit
     * @throws CdlParseException if no block is open or the given name does not
     *         match the innermost open block
     */
    public String parseEndsLine(CdlToken token) {
        int line = token.getLineNumber();
        if (openBlocks.isEmpty()) {
            throw new CdlParseException(line, ".ENDS without matching .SUBCKT");
        }
        String expected = openBlocks.pop();
        String[] parts = splitFields(token.getContent());
        if (parts.length > 1 && !parts[1].equals(expected)) {
            throw new CdlParseException(line, ".ENDS name mismatch: expected '"
                    + expected + "', got '" + parts[1] + "'");
        }
        return expected;
    }

    /**
     * Checks that every opened block was closed.
     * @throws CdlParseException listing the open blocks, outermost first
     */
    public void validateComplete() {
        if (openBlocks.isEmpty()) return;
        List<String> open = new ArrayList<>(openBlocks.size());
        for (Iterator<String> it = openBlocks.descendingIterator(); it.hasNext();) {
            open.add(it.next());
        }
        throw new CdlParseException("Unclosed .SUBCKT blocks: " + String.join(", ", open));
    }

    /**
     * @return Name of the innermost open block, or null when none is open
     */
    @Nullable
    public String currentSubcircuit() {
        return openBlocks.peek();
    }

    @Nullable
    public SubcircuitDefinition getDefinition(String name) {
        return definitions.get(name);
    }

    /**
     * @return A copy of all definitions keyed by name
     */
    public Map<String, SubcircuitDefinition> getAllDefinitions() {
        return new LinkedHashMap<>(definitions);
    }

    static String[] splitFields(String content) {
        String stripped = content.strip();
        if (stripped.isEmpty()) return new String[0];
        return stripped.split("\\s+");
    }
}
