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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.cdlscope.netlist.PinDirection;
import com.cdlscope.support.CdlTestFiles;
import com.cdlscope.util.Params;

public class TestPinDirectionParser {

    @Test
    public void testParseFile() {
        PinDirectionMap map = new PinDirectionParser().parse(CdlTestFiles.getPath("inverter_chain.pindir"));
        Assertions.assertEquals(7, map.size());
        Assertions.assertEquals(PinDirection.INPUT, map.getDirection("A"));
        Assertions.assertEquals(PinDirection.OUTPUT, map.getDirection("Y"));
        Assertions.assertEquals(PinDirection.INPUT, map.getDirection("IN"));
        Assertions.assertEquals(Arrays.asList("Y", "Q", "OUT"), map.getPinsByDirection(PinDirection.OUTPUT));
    }

    @Test
    public void testUnlistedPinDefaultsToInout() {
        PinDirectionMap map = new PinDirectionParser().parseString("A INPUT\n");
        Assertions.assertFalse(map.hasPin("EN"));
        Assertions.assertEquals(PinDirection.INOUT, map.getDirection("EN"));
    }

    @ParameterizedTest
    @CsvSource({
        "'A input',   INPUT",
        "'A Output',  OUTPUT",
        "'A INOUT',   INOUT",
        "'  A\tINPUT  ', INPUT",
    })
    public void testDirectionCaseInsensitive(String line, PinDirection expected) {
        Assertions.assertEquals(expected, new PinDirectionParser().parseString(line).getDirection("A"));
    }

    @Test
    public void testWrongColumnCount() {
        CdlParseException e = Assertions.assertThrows(CdlParseException.class,
                () -> new PinDirectionParser().parseString("* header\nA INPUT extra\n"));
        Assertions.assertEquals(2, e.getLineNumber());
        Assertions.assertEquals("Line 2: Expected format 'PIN_NAME DIRECTION', got: A INPUT extra", e.getMessage());
    }

    @Test
    public void testInvalidDirection() {
        CdlParseException e = Assertions.assertThrows(CdlParseException.class,
                () -> new PinDirectionParser().parseString("A INPUT\n\nB SIDEWAYS\n"));
        Assertions.assertEquals("Line 3: Invalid direction 'SIDEWAYS'. Valid values: INPUT, OUTPUT, INOUT",
                e.getMessage());
    }

    @Test
    public void testDuplicateOverwrites() {
        PinDirectionParser parser = new PinDirectionParser();
        PinDirectionMap map = parser.parseString("A INPUT\nA OUTPUT\n");
        Assertions.assertEquals(PinDirection.OUTPUT, map.getDirection("A"));
        Assertions.assertEquals(1, parser.getWarnings().size());
        Assertions.assertTrue(parser.getWarnings().get(0).contains("'A' at line 2"));
    }

    @Test
    public void testDuplicatePrintedOnlyWhenVerbose() {
        PrintStream err = System.err;
        boolean verbose = Params.CDL_VERBOSE;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(captured, true, StandardCharsets.UTF_8));
            Params.CDL_VERBOSE = false;
            new PinDirectionParser().parseString("A INPUT\nA OUTPUT\n");
            Assertions.assertEquals("", captured.toString(StandardCharsets.UTF_8));

            Params.CDL_VERBOSE = true;
            new PinDirectionParser().parseString("A INPUT\nA OUTPUT\n");
            Assertions.assertTrue(captured.toString(StandardCharsets.UTF_8).contains("Duplicate pin definition 'A'"));
        } finally {
            System.setErr(err);
            Params.CDL_VERBOSE = verbose;
        }
    }

    @Test
    public void testMapIsACopy() {
        PinDirectionMap map = new PinDirectionParser().parseString("A INPUT\n");
        map.getAll().clear();
        Assertions.assertEquals(1, map.size());
    }

    @Test
    public void testMissingFile(@TempDir Path tmpDir) {
        Assertions.assertThrows(UncheckedIOException.class,
                () -> new PinDirectionParser().parse(tmpDir.resolve("none.pindir")));
    }
}
