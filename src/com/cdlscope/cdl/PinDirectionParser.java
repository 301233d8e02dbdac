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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.cdlscope.netlist.PinDirection;
import com.cdlscope.util.FileTools;
import com.cdlscope.util.MessageGenerator;
import com.cdlscope.util.Params;
import com.cdlscope.util.function.InputStreamSupplier;

/**
 * Reads pin direction files: one {@code PIN_NAME DIRECTION} pair per line,
 * DIRECTION being INPUT, OUTPUT or INOUT in any case. Blank lines and lines
 * starting with '*' are skipped. A pin listed twice keeps its last direction.
 */
public class PinDirectionParser {

    private final List<String> warnings = new ArrayList<>();

    public PinDirectionMap parse(Path fileName) {
        FileTools.errorIfFileDoesNotExist(fileName);
        return parse(InputStreamSupplier.fromPath(fileName));
    }

    public PinDirectionMap parseString(String text) {
        return parse(InputStreamSupplier.fromString(text));
    }

    /**
     * @param source Supplier of the file contents
     * @return The parsed directions
     * @throws CdlParseException on the first malformed line
     */
    public PinDirectionMap parse(InputStreamSupplier source) {
        Map<String, PinDirection> directions = new LinkedHashMap<>();
        try (BufferedReader br = new BufferedReader(new InputStreamReader(source.get(), StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                String stripped = line.strip();
                if (stripped.isEmpty() || stripped.startsWith("*")) continue;
                String[] parts = stripped.split("\\s+");
                if (parts.length != 2) {
                    throw new CdlParseException(lineNumber,
                            "Expected format 'PIN_NAME DIRECTION', got: " + stripped);
                }
                PinDirection dir = parseDirection(parts[1], lineNumber);
                if (directions.put(parts[0], dir) != null) {
                    String msg = "Duplicate pin definition '" + parts[0] + "' at line " + lineNumber
                            + ". Overwriting previous definition.";
                    warnings.add(msg);
                    if (Params.CDL_VERBOSE) {
                        MessageGenerator.warning(msg);
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Problem reading pin direction file", e);
        }
        return new PinDirectionMap(directions);
    }

    private static PinDirection parseDirection(String s, int lineNumber) {
        try {
            return PinDirection.getEnum(s);
        } catch (IllegalArgumentException e) {
            throw new CdlParseException(lineNumber, "Invalid direction '" + s
                    + "'. Valid values: INPUT, OUTPUT, INOUT", e);
        }
    }

    /**
     * @return A copy of the duplicate-pin warnings from all parses so far
     */
    public List<String> getWarnings() {
        return new ArrayList<>(warnings);
    }
}
