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

package com.cdlscope.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.cdlscope.cdl.CdlParser;
import com.cdlscope.cdl.PinDirectionMap;
import com.cdlscope.cdl.PinDirectionParser;
import com.cdlscope.netlist.Cell;
import com.cdlscope.netlist.CellId;
import com.cdlscope.netlist.NetId;
import com.cdlscope.netlist.Netlist;
import com.cdlscope.netlist.NetlistBuilder;
import com.cdlscope.netlist.Pin;
import com.cdlscope.netlist.PinDirection;
import com.cdlscope.netlist.PinId;
import com.cdlscope.support.CdlTestFiles;
import com.cdlscope.support.NetlistFixtures;

public class TestConnectivityTraverser {

    private static GraphTraverser traverser(Netlist netlist) {
        return new ConnectivityTraverser(new ConnectivityGraphBuilder().build(netlist));
    }

    private static List<String> names(List<Cell> cells) {
        List<String> names = new ArrayList<>();
        for (Cell c : cells) {
            names.add(c.getName());
        }
        return names;
    }

    @Test
    public void testChainFanout() {
        GraphTraverser t = traverser(NetlistFixtures.inverterChain());
        Assertions.assertEquals(Arrays.asList("XI2"), names(t.getFanoutCells(new CellId("XI1"), 1, false)));
        Assertions.assertEquals(Arrays.asList("XI2", "XI3"), names(t.getFanoutCells(new CellId("XI1"), 2, false)));
        Assertions.assertEquals(Arrays.asList("XI2", "XI3"), names(t.getFanoutCells(new CellId("XI1"), 50, false)));
        Assertions.assertTrue(t.getFanoutCells(new CellId("XI3"), 3, false).isEmpty());
    }

    @Test
    public void testChainFanin() {
        GraphTraverser t = traverser(NetlistFixtures.inverterChain());
        Assertions.assertEquals(Arrays.asList("XI2"), names(t.getFaninCells(new CellId("XI3"), 1, false)));
        Assertions.assertEquals(Arrays.asList("XI2", "XI1"), names(t.getFaninCells(new CellId("XI3"), 2, false)));
        Assertions.assertTrue(t.getFaninCells(new CellId("XI1"), 5, false).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, -100})
    public void testNonPositiveHops(int hops) {
        GraphTraverser t = traverser(NetlistFixtures.inverterChain());
        Assertions.assertTrue(t.getFanoutCells(new CellId("XI1"), hops, false).isEmpty());
        Assertions.assertTrue(t.getFaninCells(new CellId("XI3"), hops, true).isEmpty());
    }

    @Test
    public void testStopAtSequential() {
        GraphTraverser t = traverser(NetlistFixtures.registerStage());
        Assertions.assertEquals(Arrays.asList("XFF"), names(t.getFanoutCells(new CellId("XI1"), 3, true)));
        Assertions.assertEquals(Arrays.asList("XFF", "XI2"), names(t.getFanoutCells(new CellId("XI1"), 3, false)));
        Assertions.assertEquals(Arrays.asList("XFF"), names(t.getFaninCells(new CellId("XI2"), 3, true)));
    }

    @Test
    public void testSequentialStartIsExpanded() {
        GraphTraverser t = traverser(NetlistFixtures.registerStage());
        Assertions.assertEquals(Arrays.asList("XI2"), names(t.getFanoutCells(new CellId("XFF"), 2, true)));
    }

    @Test
    public void testFeedbackLoopTerminates() {
        Netlist loop = new NetlistFixtures("loop")
                .inv("XI1", "b", "a")
                .inv("XI2", "a", "c")
                .inv("XI3", "c", "b")
                .build();
        GraphTraverser t = traverser(loop);
        List<String> fanout = names(t.getFanoutCells(new CellId("XI1"), Integer.MAX_VALUE, false));
        Assertions.assertEquals(Arrays.asList("XI2", "XI3"), fanout);
        List<String> fanin = names(t.getFaninCells(new CellId("XI1"), 1000, false));
        Assertions.assertFalse(fanin.contains("XI1"));
        Assertions.assertEquals(2, fanin.size());
    }

    @Test
    public void testFanoutSpansAllReceivers() {
        Netlist netlist = new NetlistFixtures("fan")
                .inv("XD", "in", "n")
                .inv("XR1", "n", "o1")
                .inv("XR2", "n", "o2")
                .cell("XT", "TIE", false, "T:INOUT:n")
                .build();
        GraphTraverser t = traverser(netlist);
        Assertions.assertEquals(Arrays.asList("XR1", "XR2", "XT"), names(t.getFanoutCells(new CellId("XD"), 1, false)));
        // the INOUT pin expands in both directions
        Assertions.assertEquals(Arrays.asList("XD", "XR1", "XR2"), names(t.getFanoutCells(new CellId("XT"), 1, false)));
        Assertions.assertEquals(Arrays.asList("XD", "XR1", "XR2"), names(t.getFaninCells(new CellId("XT"), 1, false)));
    }

    @Test
    public void testConnectedCells() {
        GraphTraverser t = traverser(NetlistFixtures.inverterChain());
        Assertions.assertEquals(Arrays.asList("XI1", "XI2"), names(t.getConnectedCells(new NetId("net_1"))));
        // ports are not cells
        Assertions.assertEquals(Arrays.asList("XI1"), names(t.getConnectedCells(new NetId("IN"))));
        Assertions.assertTrue(t.getConnectedCells(new NetId("unknown")).isEmpty());
    }

    @Test
    public void testConnectedCellsDeduplicated() {
        Netlist netlist = new NetlistFixtures("dup")
                .cell("XG", "AND2", false, "A:INPUT:n", "B:INPUT:n", "Y:OUTPUT:o")
                .build();
        GraphTraverser t = traverser(netlist);
        Assertions.assertEquals(Arrays.asList("XG"), names(t.getConnectedCells(new NetId("n"))));
    }

    @Test
    public void testCellPinsAndPinNet() {
        Netlist netlist = new NetlistFixtures("pins")
                .cell("XI1", "INV", false, "A:INPUT", "Y:OUTPUT:n1")
                .build();
        GraphTraverser t = traverser(netlist);
        List<Pin> pins = t.getCellPins(new CellId("XI1"));
        Assertions.assertEquals(2, pins.size());
        Assertions.assertEquals("A", pins.get(0).getName());
        Assertions.assertNull(t.getPinNet(new PinId("XI1.A")));
        Assertions.assertEquals("n1", t.getPinNet(new PinId("XI1.Y")).getName());
        Assertions.assertNull(t.getPinNet(new PinId("XI9.Q")));
        Assertions.assertTrue(t.getCellPins(new CellId("XI9")).isEmpty());
    }

    @Test
    public void testPinLevelQueries() {
        GraphTraverser t = traverser(NetlistFixtures.inverterChain());
        Assertions.assertEquals(Arrays.asList("XI3"), names(t.getFanoutFromPin(new PinId("XI2.A"), 1, false)));
        Assertions.assertEquals(Arrays.asList("XI1"), names(t.getFaninToPin(new PinId("XI2.Y"), 1, false)));
        Assertions.assertTrue(t.getFanoutFromPin(new PinId("nope.A"), 1, false).isEmpty());
        Assertions.assertTrue(t.getFaninToPin(new PinId("nope.A"), 1, false).isEmpty());
    }

    @Test
    public void testUnknownCell() {
        GraphTraverser t = traverser(NetlistFixtures.inverterChain());
        Assertions.assertTrue(t.getFanoutCells(new CellId("XZ"), 2, false).isEmpty());
        Assertions.assertNull(t.findPath(new CellId("XZ"), new CellId("XI1"), 5));
        Assertions.assertNull(t.findPath(new CellId("XI1"), new CellId("XZ"), 5));
    }

    static Stream<Arguments> chainPaths() {
        return Stream.of(
            Arguments.of("XI1", "XI3", 1, null),
            Arguments.of("XI1", "XI3", 2, Arrays.asList("XI1", "XI2", "XI3")),
            Arguments.of("XI3", "XI1", 2, Arrays.asList("XI3", "XI2", "XI1")),
            Arguments.of("XI1", "XI2", 1, Arrays.asList("XI1", "XI2")),
            Arguments.of("XI2", "XI2", 0, Arrays.asList("XI2"))
        );
    }

    @ParameterizedTest
    @MethodSource("chainPaths")
    public void testFindPath(String from, String to, int maxHops, List<String> expected) {
        GraphTraverser t = traverser(NetlistFixtures.inverterChain());
        List<Cell> path = t.findPath(new CellId(from), new CellId(to), maxHops);
        if (expected == null) {
            Assertions.assertNull(path);
        } else {
            Assertions.assertEquals(expected, names(path));
        }
    }

    @Test
    public void testFindPathDefaultHops() {
        GraphTraverser t = traverser(NetlistFixtures.inverterChain());
        Assertions.assertEquals(Arrays.asList("XI1", "XI2", "XI3"), names(t.findPath(new CellId("XI1"), new CellId("XI3"))));
    }

    @Test
    public void testFindPathDisconnected() {
        Netlist netlist = new NetlistFixtures("islands")
                .inv("XA", "a", "b")
                .inv("XB", "c", "d")
                .build();
        GraphTraverser t = traverser(netlist);
        Assertions.assertNull(t.findPath(new CellId("XA"), new CellId("XB"), 10));
        Assertions.assertNull(t.findPath(new CellId("XA"), new CellId("XA"), -1));
    }

    @Test
    public void testFindPathAgainstSignalFlow() {
        // XA and XB both drive n; only an undirected view connects them
        Netlist netlist = new NetlistFixtures("contention")
                .inv("XA", "a", "n")
                .inv("XB", "b", "n")
                .build();
        GraphTraverser t = traverser(netlist);
        Assertions.assertEquals(Arrays.asList("XA", "XB"), names(t.findPath(new CellId("XA"), new CellId("XB"), 1)));
    }

    @Test
    public void testRegisterStageFromFiles() {
        PinDirectionMap dirs = new PinDirectionParser().parse(CdlTestFiles.getPath("inverter_chain.pindir"));
        Netlist netlist = new NetlistBuilder()
                .setPinDirections(dirs)
                .build(new CdlParser().parse(CdlTestFiles.getPath("register_stage.ckt")));
        GraphTraverser t = traverser(netlist);

        Assertions.assertEquals(PinDirection.OUTPUT, netlist.getPin(new PinId("XFF.Q")).getDirection());
        List<String> bounded = names(t.getFanoutCells(new CellId("XI1"), 3, true));
        Assertions.assertTrue(bounded.contains("XFF"));
        Assertions.assertFalse(bounded.contains("XI2"));
        List<String> unbounded = names(t.getFanoutCells(new CellId("XI1"), 3, false));
        Assertions.assertTrue(unbounded.contains("XFF"));
        Assertions.assertTrue(unbounded.contains("XI2"));
        Assertions.assertEquals(Arrays.asList("XI1", "XFF", "XI2"),
                names(t.findPath(new CellId("XI1"), new CellId("XI2"), 2)));
    }
}
