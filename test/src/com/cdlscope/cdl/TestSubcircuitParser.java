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

import java.util.Arrays;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class TestSubcircuitParser {

    private static CdlToken subckt(int line, String content) {
        return new CdlToken(line, CdlLineType.SUBCKT, content, content);
    }

    private static CdlToken ends(int line, String content) {
        return new CdlToken(line, CdlLineType.ENDS, content, content);
    }

    @Test
    public void testParseDefinition() {
        SubcircuitParser p = new SubcircuitParser();
        SubcircuitDefinition def = p.parseSubcktLine(subckt(3, ".SUBCKT NAND2 A B Y"));
        Assertions.assertEquals("NAND2", def.getName());
        Assertions.assertEquals(Arrays.asList("A", "B", "Y"), def.getPorts());
        Assertions.assertEquals("NAND2", p.currentSubcircuit());
        Assertions.assertSame(def, p.getDefinition("NAND2"));
        Assertions.assertEquals("NAND2", p.parseEndsLine(ends(4, ".ENDS NAND2")));
        Assertions.assertNull(p.currentSubcircuit());
        p.validateComplete();
    }

    @Test
    public void testMissingName() {
        CdlParseException e = Assertions.assertThrows(CdlParseException.class,
                () -> new SubcircuitParser().parseSubcktLine(subckt(7, ".SUBCKT")));
        Assertions.assertEquals(7, e.getLineNumber());
        Assertions.assertTrue(e.getMessage().startsWith("Line 7: Invalid .SUBCKT format: expected"));
    }

    @Test
    public void testMissingPorts() {
        CdlParseException e = Assertions.assertThrows(CdlParseException.class,
                () -> new SubcircuitParser().parseSubcktLine(subckt(2, ".SUBCKT LONELY")));
        Assertions.assertEquals("Line 2: Subcircuit LONELY must have at least one port", e.getMessage());
    }

    @Test
    public void testDuplicatePorts() {
        CdlParseException e = Assertions.assertThrows(CdlParseException.class,
                () -> new SubcircuitParser().parseSubcktLine(subckt(5, ".SUBCKT BAD A B A B C")));
        Assertions.assertEquals("Line 5: Subcircuit BAD has duplicate port names: A, B", e.getMessage());
    }

    @Test
    public void testNestedBlocks() {
        SubcircuitParser p = new SubcircuitParser();
        p.parseSubcktLine(subckt(1, ".SUBCKT OUTER a"));
        p.parseSubcktLine(subckt(2, ".SUBCKT INNER b"));
        Assertions.assertEquals("INNER", p.currentSubcircuit());
        // a bare .ENDS closes the innermost block
        Assertions.assertEquals("INNER", p.parseEndsLine(ends(3, ".ENDS")));
        Assertions.assertEquals("OUTER", p.parseEndsLine(ends(4, ".ends OUTER")));
        p.validateComplete();
    }

    @Test
    public void testEndsNameMismatch() {
        SubcircuitParser p = new SubcircuitParser();
        p.parseSubcktLine(subckt(1, ".SUBCKT INV A Y"));
        CdlParseException e = Assertions.assertThrows(CdlParseException.class,
                () -> p.parseEndsLine(ends(2, ".ENDS BUF")));
        Assertions.assertEquals("Line 2: .ENDS name mismatch: expected 'INV', got 'BUF'", e.getMessage());
    }

    @Test
    public void testEndsWithoutSubckt() {
        CdlParseException e = Assertions.assertThrows(CdlParseException.class,
                () -> new SubcircuitParser().parseEndsLine(ends(9, ".ENDS")));
        Assertions.assertEquals("Line 9: .ENDS without matching .SUBCKT", e.getMessage());
        Assertions.assertEquals(".ENDS without matching .SUBCKT", e.getDetail());
        Assertions.assertEquals(9, e.getLineNumber());
    }

    @Test
    public void testUnclosedBlocks() {
        SubcircuitParser p = new SubcircuitParser();
        p.parseSubcktLine(subckt(1, ".SUBCKT A x"));
        p.parseSubcktLine(subckt(2, ".SUBCKT B y"));
        CdlParseException e = Assertions.assertThrows(CdlParseException.class, p::validateComplete);
        Assertions.assertEquals("Unclosed .SUBCKT blocks: A, B", e.getMessage());
        Assertions.assertEquals(CdlParseException.NO_LINE, e.getLineNumber());
    }

    @Test
    public void testRedefinitionReplaces() {
        SubcircuitParser p = new SubcircuitParser();
        p.parseSubcktLine(subckt(1, ".SUBCKT INV A Y"));
        p.parseEndsLine(ends(2, ".ENDS"));
        p.parseSubcktLine(subckt(3, ".SUBCKT INV IN OUT EN"));
        p.parseEndsLine(ends(4, ".ENDS"));
        Assertions.assertEquals(Arrays.asList("IN", "OUT", "EN"), p.getDefinition("INV").getPorts());
        Assertions.assertEquals(1, p.getAllDefinitions().size());
    }

    @Test
    public void testNamesAreCaseSensitive() {
        SubcircuitParser p = new SubcircuitParser();
        p.parseSubcktLine(subckt(1, ".SUBCKT inv A Y"));
        Assertions.assertNull(p.getDefinition("INV"));
        Assertions.assertThrows(CdlParseException.class, () -> p.parseEndsLine(ends(2, ".ENDS INV")));
    }

    @Test
    public void testAllDefinitionsIsACopy() {
        SubcircuitParser p = new SubcircuitParser();
        p.parseSubcktLine(subckt(1, ".SUBCKT INV A Y"));
        Map<String, SubcircuitDefinition> defs = p.getAllDefinitions();
        defs.clear();
        Assertions.assertNotNull(p.getDefinition("INV"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " "})
    public void testDefinitionRejectsEmptyName(String name) {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new SubcircuitDefinition(name.trim(), Arrays.asList("A")));
    }

    @Test
    public void testDefinitionPortsImmutable() {
        SubcircuitDefinition def = new SubcircuitDefinition("INV", Arrays.asList("A", "Y"));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> def.getPorts().add("Z"));
        Assertions.assertTrue(def.hasPort("Y"));
        Assertions.assertEquals(2, def.getPortCount());
    }
}
