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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jetbrains.annotations.Nullable;
import org.jgrapht.graph.AsUndirectedGraph;
import org.jgrapht.traverse.BreadthFirstIterator;

import com.cdlscope.netlist.Cell;
import com.cdlscope.netlist.CellId;
import com.cdlscope.netlist.Net;
import com.cdlscope.netlist.NetId;
import com.cdlscope.netlist.Netlist;
import com.cdlscope.netlist.NetlistId;
import com.cdlscope.netlist.Pin;
import com.cdlscope.netlist.PinId;

/**
 * {@link GraphTraverser} over a {@link ConnectivityGraph}. Cost of every query
 * is bounded by the part of the graph it visits.
 */
public class ConnectivityTraverser implements GraphTraverser {

    /** Edges between two consecutive cells of a path: cell, pin, net, pin, cell */
    private static final int EDGES_PER_CELL_HOP = 4;

    private final ConnectivityGraph graph;

    private final Netlist netlist;

    public ConnectivityTraverser(ConnectivityGraph graph) {
        this(graph, graph.getNetlist());
    }

    public ConnectivityTraverser(ConnectivityGraph graph, Netlist netlist) {
        this.graph = graph;
        this.netlist = netlist;
    }

    @Override
    public List<Cell> getConnectedCells(NetId netId) {
        if (!graph.containsVertex(netId)) return Collections.emptyList();
        Map<CellId, Cell> cells = new LinkedHashMap<>();
        List<NetlistId> neighbors = graph.getPredecessors(netId, EdgeType.DRIVES);
        neighbors.addAll(graph.getSuccessors(netId, EdgeType.DRIVES));
        for (NetlistId node : neighbors) {
            if (!(node instanceof PinId)) continue;
            for (CellId cellId : getParentCells((PinId) node)) {
                Cell cell = netlist.getCell(cellId);
                if (cell != null) cells.putIfAbsent(cellId, cell);
            }
        }
        return new ArrayList<>(cells.values());
    }

    @Override
    public List<Pin> getCellPins(CellId cellId) {
        List<Pin> pins = new ArrayList<>();
        for (NetlistId node : graph.getSuccessors(cellId, EdgeType.CONTAINS_PIN)) {
            Pin pin = netlist.getPin((PinId) node);
            if (pin != null) pins.add(pin);
        }
        return pins;
    }

    @Nullable
    @Override
    public Net getPinNet(PinId pinId) {
        for (NetlistId node : graph.getSuccessors(pinId, EdgeType.DRIVES)) {
            if (node instanceof NetId) return netlist.getNet((NetId) node);
        }
        for (NetlistId node : graph.getPredecessors(pinId, EdgeType.DRIVES)) {
            if (node instanceof NetId) return netlist.getNet((NetId) node);
        }
        return null;
    }

    private List<CellId> getParentCells(PinId pinId) {
        List<CellId> parents = new ArrayList<>(1);
        for (NetlistId node : graph.getPredecessors(pinId, EdgeType.CONTAINS_PIN)) {
            parents.add((CellId) node);
        }
        return parents;
    }

    @Override
    public List<Cell> getFanoutCells(CellId cellId, int hops, boolean stopAtSequential) {
        return traverse(cellId, hops, stopAtSequential, true);
    }

    @Override
    public List<Cell> getFaninCells(CellId cellId, int hops, boolean stopAtSequential) {
        return traverse(cellId, hops, stopAtSequential, false);
    }

    @Override
    public List<Cell> getFanoutFromPin(PinId pinId, int hops, boolean stopAtSequential) {
        List<CellId> parents = getParentCells(pinId);
        if (parents.isEmpty()) return Collections.emptyList();
        return getFanoutCells(parents.get(0), hops, stopAtSequential);
    }

    @Override
    public List<Cell> getFaninToPin(PinId pinId, int hops, boolean stopAtSequential) {
        List<CellId> parents = getParentCells(pinId);
        if (parents.isEmpty()) return Collections.emptyList();
        return getFaninCells(parents.get(0), hops, stopAtSequential);
    }

    /**
     * Level by level breadth-first expansion. A cell is reported the first time
     * it is reached and never expanded twice, which bounds the work on cyclic
     * netlists.
     */
    private List<Cell> traverse(CellId start, int hops, boolean stopAtSequential, boolean fanout) {
        if (hops <= 0 || !graph.containsVertex(start)) return Collections.emptyList();
        Set<CellId> visited = new LinkedHashSet<>();
        visited.add(start);
        List<Cell> result = new ArrayList<>();
        List<CellId> level = Collections.singletonList(start);
        for (int hop = 0; hop < hops && !level.isEmpty(); hop++) {
            List<CellId> next = new ArrayList<>();
            for (CellId current : level) {
                for (Pin pin : getCellPins(current)) {
                    boolean follow = fanout ? pin.getDirection().isOutput() : pin.getDirection().isInput();
                    if (!follow || pin.getNetId() == null) continue;
                    for (Cell cell : getConnectedCells(pin.getNetId())) {
                        if (!visited.add(cell.getId())) continue;
                        result.add(cell);
                        if (stopAtSequential && cell.isSequential()) continue;
                        next.add(cell.getId());
                    }
                }
            }
            level = next;
        }
        return result;
    }

    @Nullable
    @Override
    public List<Cell> findPath(CellId from, CellId to, int maxHops) {
        Cell fromCell = netlist.getCell(from);
        Cell toCell = netlist.getCell(to);
        if (fromCell == null || toCell == null || maxHops < 0
                || !graph.containsVertex(from) || !graph.containsVertex(to)) {
            return null;
        }
        if (from.equals(to)) {
            return Collections.singletonList(fromCell);
        }
        long maxDepth = (long) maxHops * EDGES_PER_CELL_HOP;
        BreadthFirstIterator<NetlistId, ConnectivityEdge> it =
                new BreadthFirstIterator<>(new AsUndirectedGraph<>(graph), from);
        boolean found = false;
        while (it.hasNext()) {
            NetlistId node = it.next();
            if (it.getDepth(node) > maxDepth) break;
            if (node.equals(to)) {
                found = true;
                break;
            }
        }
        if (!found) return null;

        List<Cell> path = new ArrayList<>();
        for (NetlistId node = to; node != null; node = it.getParent(node)) {
            if (node instanceof CellId) {
                path.add(netlist.getCell((CellId) node));
            }
        }
        Collections.reverse(path);
        if (path.size() - 1 > maxHops) return null;
        return path;
    }
}
